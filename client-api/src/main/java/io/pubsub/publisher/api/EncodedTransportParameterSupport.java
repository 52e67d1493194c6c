/*
 * Copyright © 2022-2024 StreamNative Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.pubsub.publisher.api;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Implemented by {@link Transport} plugins that are loaded by class name and configured from an
 * encoded parameter string.
 */
public interface EncodedTransportParameterSupport {

    /**
     * Configures the transport after it has been instantiated.
     *
     * @param encodedTransportParams the plugin specific parameter string, may be empty.
     * @param credentialsFile the service account key file, if one was configured. When absent the
     *     transport is expected to discover default credentials.
     */
    void configure(String encodedTransportParams, Optional<Path> credentialsFile);
}
