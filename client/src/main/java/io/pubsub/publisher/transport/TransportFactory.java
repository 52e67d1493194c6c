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
package io.pubsub.publisher.transport;

import com.google.common.base.Strings;
import io.pubsub.publisher.api.EncodedTransportParameterSupport;
import io.pubsub.publisher.api.Transport;
import io.pubsub.publisher.api.exceptions.UnsupportedTransportException;
import java.lang.reflect.Constructor;
import java.nio.file.Path;
import java.util.Optional;
import lombok.NonNull;

public class TransportFactory {

    /**
     * Instantiates a transport plugin through its no-arg constructor.
     *
     * @param transportClassName the fully qualified class name of the plugin.
     * @param transportParams handed to plugins implementing {@link EncodedTransportParameterSupport}.
     * @param credentialsFile handed to plugins implementing {@link EncodedTransportParameterSupport}.
     * @return the configured transport.
     * @throws UnsupportedTransportException if the class cannot be loaded, instantiated or
     *     configured, or is not a {@link Transport}.
     */
    public static @NonNull Transport create(
            String transportClassName,
            String transportParams,
            @NonNull Optional<Path> credentialsFile)
            throws UnsupportedTransportException {
        if (Strings.isNullOrEmpty(transportClassName)) {
            throw new UnsupportedTransportException("Transport class name must not be empty");
        }
        Object instance;
        try {
            Class<?> transportClass = Class.forName(transportClassName);
            Constructor<?> declaredConstructor = transportClass.getDeclaredConstructor();
            declaredConstructor.setAccessible(true);
            instance = declaredConstructor.newInstance();
        } catch (Throwable t) {
            throw new UnsupportedTransportException(
                    "Failed to create transport " + transportClassName, t);
        }
        if (!(instance instanceof Transport transport)) {
            throw new UnsupportedTransportException(
                    transportClassName + " does not implement " + Transport.class.getName());
        }
        if (transport instanceof EncodedTransportParameterSupport support) {
            try {
                support.configure(Strings.nullToEmpty(transportParams), credentialsFile);
            } catch (Throwable t) {
                throw new UnsupportedTransportException(
                        "Failed to configure transport " + transportClassName, t);
            }
        }
        return transport;
    }
}
