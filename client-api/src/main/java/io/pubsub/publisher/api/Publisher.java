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

import io.pubsub.publisher.api.exceptions.InvalidAttributeException;
import io.pubsub.publisher.api.exceptions.PublishFailedException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.NonNull;

/**
 * Batches messages and publishes them to a single topic in the background.
 *
 * <p>A batch is sent as soon as it holds {@code maxCount} messages or {@code maxBytes} bytes, or
 * once {@code maxDelay} has passed since its first message, whichever comes first. Delivery
 * failures are never thrown from {@code publish}; they complete the returned future exceptionally
 * and are reported to the configured failure listener.
 */
public interface Publisher extends AutoCloseable {

    /** The destination of this publisher. */
    @NonNull
    TopicName topic();

    /**
     * Queues a message carrying only the configured static attributes.
     *
     * @param payload the message body.
     * @return a future that completes once the batch holding the message has been acknowledged,
     *     or fails with {@link PublishFailedException} if the batch was dropped.
     * @throws IllegalStateException if the publisher has been shut down.
     */
    @NonNull
    CompletableFuture<Void> publish(byte @NonNull [] payload);

    /**
     * Queues a message. The given attributes are merged over the configured static attributes.
     *
     * @param payload the message body.
     * @param attributes additional attributes; keys and values must be strings.
     * @return a future that completes once the batch holding the message has been acknowledged,
     *     or fails with {@link PublishFailedException} if the batch was dropped.
     * @throws InvalidAttributeException if an attribute key or value is not a string.
     * @throws IllegalStateException if the publisher has been shut down.
     */
    @NonNull
    CompletableFuture<Void> publish(byte @NonNull [] payload, @NonNull Map<?, ?> attributes)
            throws InvalidAttributeException;

    /**
     * Stops accepting messages, sends whatever is still batched and waits for every outstanding
     * batch to be acknowledged or dropped. The wait is bounded by the retry configuration.
     *
     * @return the number of messages dropped while draining.
     */
    @NonNull
    ShutdownResult shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
