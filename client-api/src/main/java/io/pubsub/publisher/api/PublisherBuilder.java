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

import io.opentelemetry.api.OpenTelemetry;
import io.pubsub.publisher.api.exceptions.PublisherException;
import io.pubsub.publisher.internal.DefaultImplementation;
import java.io.File;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;

public interface PublisherBuilder {

    static PublisherBuilder create(String projectId, String topic) {
        return DefaultImplementation.getDefaultImplementation(projectId, topic);
    }

    /**
     * Validates the static attributes, creates the transport and starts the publisher.
     *
     * @return a running publisher.
     * @throws PublisherException if the static attributes are not string:string pairs or the
     *     transport cannot be created.
     */
    Publisher start() throws PublisherException;

    /** Send the batch once it reaches this many bytes, including attributes. */
    PublisherBuilder maxBytes(long maxBytes);

    /** Send the batch once this delay has passed since its first message. */
    PublisherBuilder maxDelay(Duration maxDelay);

    /** Send the batch once it holds this many messages. */
    PublisherBuilder maxCount(int maxCount);

    /** Attributes added to every message. Keys and values must be strings. */
    PublisherBuilder attributes(Map<?, ?> attributes);

    PublisherBuilder maxRetries(int maxRetries);

    PublisherBuilder initialRetryBackoff(Duration initialRetryBackoff);

    PublisherBuilder maxRetryBackoff(Duration maxRetryBackoff);

    PublisherBuilder requestTimeout(Duration requestTimeout);

    /** Service account key file handed to the transport. */
    PublisherBuilder credentialsFile(String credentialsFile);

    PublisherBuilder transport(Transport transport);

    PublisherBuilder transport(String transportClassName, String transportParams);

    PublisherBuilder failureListener(Consumer<BatchFailure> failureListener);

    PublisherBuilder openTelemetry(OpenTelemetry openTelemetry);

    /**
     * Configure the builder from a properties file.
     *
     * @param configPath the path of the file.
     * @return this builder.
     */
    PublisherBuilder loadConfig(String configPath);

    PublisherBuilder loadConfig(File configFile);

    PublisherBuilder loadConfig(Properties properties);
}
