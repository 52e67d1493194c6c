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
package io.pubsub.publisher;

import static java.time.Duration.ZERO;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.pubsub.publisher.api.BatchFailure;
import io.pubsub.publisher.api.Publisher;
import io.pubsub.publisher.api.PublisherBuilder;
import io.pubsub.publisher.api.TopicName;
import io.pubsub.publisher.api.Transport;
import io.pubsub.publisher.api.exceptions.InvalidAttributeException;
import io.pubsub.publisher.api.exceptions.PublisherException;
import io.pubsub.publisher.batch.Thresholds;
import io.pubsub.publisher.dispatch.RetryPolicy;
import io.pubsub.publisher.message.MessageBuilder;
import io.pubsub.publisher.transport.TransportFactory;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PublisherBuilderImpl implements PublisherBuilder {

    public static final long DefaultMaxBytes = 1_000_000L;
    public static final Duration DefaultMaxDelay = Duration.ofSeconds(5);
    public static final int DefaultMaxCount = 100;
    public static final int MaxMessagesPerRequest = 1000;
    public static final int DefaultMaxRetries = 5;
    public static final Duration DefaultInitialRetryBackoff = Duration.ofMillis(100);
    public static final Duration DefaultMaxRetryBackoff = Duration.ofSeconds(5);
    public static final Duration DefaultRequestTimeout = Duration.ofSeconds(30);

    @NonNull protected String projectId;
    @NonNull protected String topic;
    protected long maxBytes = DefaultMaxBytes;
    @NonNull protected Duration maxDelay = DefaultMaxDelay;
    protected int maxCount = DefaultMaxCount;
    @NonNull protected Map<?, ?> attributes = Collections.emptyMap();
    protected int maxRetries = DefaultMaxRetries;
    @NonNull protected Duration initialRetryBackoff = DefaultInitialRetryBackoff;
    @NonNull protected Duration maxRetryBackoff = DefaultMaxRetryBackoff;
    @NonNull protected Duration requestTimeout = DefaultRequestTimeout;
    @Nullable protected String credentialsFile;
    @Nullable protected String transportClassName;
    @Nullable protected String transportParams;
    @Nullable protected Transport transport;
    @Nullable protected Consumer<BatchFailure> failureListener;
    @NonNull protected OpenTelemetry openTelemetry = GlobalOpenTelemetry.get();

    public PublisherBuilderImpl(@NonNull String projectId, @NonNull String topic) {
        // Fails fast on empty names
        TopicName.of(projectId, topic);
        this.projectId = projectId;
        this.topic = topic;
    }

    @Override
    public @NonNull PublisherBuilder maxBytes(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be greater than zero: " + maxBytes);
        }
        this.maxBytes = maxBytes;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder maxDelay(@NonNull Duration maxDelay) {
        if (maxDelay.isNegative() || maxDelay.equals(ZERO)) {
            throw new IllegalArgumentException("maxDelay must be greater than zero: " + maxDelay);
        }
        this.maxDelay = maxDelay;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder maxCount(int maxCount) {
        checkMaxCount(maxCount);
        this.maxCount = maxCount;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder attributes(@NonNull Map<?, ?> attributes) {
        this.attributes = attributes;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder initialRetryBackoff(@NonNull Duration initialRetryBackoff) {
        if (initialRetryBackoff.isNegative() || initialRetryBackoff.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "initialRetryBackoff must be greater than zero: " + initialRetryBackoff);
        }
        this.initialRetryBackoff = initialRetryBackoff;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder maxRetryBackoff(@NonNull Duration maxRetryBackoff) {
        if (maxRetryBackoff.isNegative() || maxRetryBackoff.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "maxRetryBackoff must be greater than zero: " + maxRetryBackoff);
        }
        this.maxRetryBackoff = maxRetryBackoff;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder requestTimeout(@NonNull Duration requestTimeout) {
        if (requestTimeout.isNegative() || requestTimeout.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "requestTimeout must be greater than zero: " + requestTimeout);
        }
        this.requestTimeout = requestTimeout;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder credentialsFile(String credentialsFile) {
        this.credentialsFile = credentialsFile;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder transport(@NonNull Transport transport) {
        this.transport = transport;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder transport(String transportClassName, String transportParams) {
        if (Strings.isNullOrEmpty(transportClassName)) {
            throw new IllegalArgumentException("transportClassName must not be null or empty.");
        }
        this.transportClassName = transportClassName;
        this.transportParams = transportParams;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder failureListener(Consumer<BatchFailure> failureListener) {
        this.failureListener = failureListener;
        return this;
    }

    @Override
    public @NonNull PublisherBuilder openTelemetry(@NonNull OpenTelemetry openTelemetry) {
        this.openTelemetry = openTelemetry;
        return this;
    }

    @Override
    public PublisherBuilder loadConfig(String configPath) {
        try {
            File configFile = new File(configPath);
            return loadConfig(configFile);
        } catch (Throwable e) {
            throw new IllegalArgumentException(
                    "Failed to load configuration from file: " + configPath, e);
        }
    }

    @Override
    public PublisherBuilder loadConfig(File configFile) {
        Properties properties = new Properties();
        try (InputStream input = new FileInputStream(configFile)) {
            properties.load(input);
        } catch (IOException ex) {
            throw new IllegalArgumentException(
                    "Failed to load configuration from file: " + configFile, ex);
        }
        return loadConfig(properties);
    }

    @Override
    public PublisherBuilder loadConfig(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("Properties must not be null.");
        }
        // Fields are matched by name; only plain value types can be configured this way.
        for (String name : properties.stringPropertyNames()) {
            var value = properties.getProperty(name).trim();
            try {
                var field = PublisherBuilderImpl.class.getDeclaredField(name);
                field.setAccessible(true);
                var type = field.getType();
                if (type.equals(Duration.class)) {
                    field.set(this, Duration.ofMillis(Long.parseLong(value)));
                } else if (type.equals(int.class)) {
                    field.set(this, Integer.parseInt(value));
                } else if (type.equals(long.class)) {
                    field.set(this, Long.parseLong(value));
                } else if (type.equals(Map.class)) {
                    field.set(this, parseAttributes(value));
                } else if (type.equals(String.class)) {
                    field.set(this, value);
                } else {
                    throw new IllegalArgumentException("Invalid configuration property: " + name);
                }
            } catch (NoSuchFieldException | IllegalAccessException e) {
                throw new IllegalArgumentException("Invalid configuration property: " + name);
            }
        }
        return this;
    }

    @Override
    public @NonNull Publisher start() throws PublisherException {
        var topicName = TopicName.of(projectId, topic);
        checkMaxCount(maxCount);

        MessageBuilder messageBuilder;
        try {
            messageBuilder = MessageBuilder.create(attributes);
        } catch (InvalidAttributeException e) {
            log.error(
                    "Invalid attribute '{}' for {}. Make sure the attributes are string:string pairs.",
                    e.getKey(),
                    topicName);
            throw e;
        }

        var config =
                new PublisherConfig(
                        topicName,
                        new Thresholds(maxBytes, maxDelay, maxCount),
                        new RetryPolicy(maxRetries, initialRetryBackoff, maxRetryBackoff, requestTimeout),
                        failureListener,
                        openTelemetry);
        var publisherTransport = createTransport();
        log.info(
                "Starting publisher for {}, maxCount: {}, maxBytes: {}, maxDelay: {}",
                topicName,
                maxCount,
                maxBytes,
                maxDelay);
        return PublisherImpl.newInstance(config, messageBuilder, publisherTransport);
    }

    private Transport createTransport() throws PublisherException {
        if (transport != null) {
            return transport;
        }
        if (Strings.isNullOrEmpty(transportClassName)) {
            throw new IllegalStateException("No transport configured for " + projectId + "/" + topic);
        }
        Optional<Path> credentials =
                Strings.isNullOrEmpty(credentialsFile)
                        ? Optional.empty()
                        : Optional.of(Path.of(credentialsFile));
        return TransportFactory.create(transportClassName, transportParams, credentials);
    }

    private static void checkMaxCount(int maxCount) {
        if (maxCount < 1 || maxCount > MaxMessagesPerRequest) {
            throw new IllegalArgumentException(
                    "maxCount must be between 1 and " + MaxMessagesPerRequest + ": " + maxCount);
        }
    }

    private static Map<String, String> parseAttributes(String value) {
        return Splitter.on(',')
                .trimResults()
                .omitEmptyStrings()
                .withKeyValueSeparator(Splitter.on('=').limit(2).trimResults())
                .split(value);
    }
}
