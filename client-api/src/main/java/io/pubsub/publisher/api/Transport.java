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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.NonNull;

/**
 * Performs the network call that delivers a batch to the remote service.
 *
 * <p>Implementations must be thread-safe: several batches may be in flight at the same time. A
 * returned future that completes exceptionally is treated like a {@link SendResult.RetryableError}.
 */
public interface Transport extends AutoCloseable {

    /**
     * Sends one batch.
     *
     * @param topic the destination topic.
     * @param messages the messages of the batch, in publish order. Retries pass the same list.
     * @return a future completed with the classified result of the call.
     */
    @NonNull
    CompletableFuture<SendResult> send(@NonNull TopicName topic, @NonNull List<Message> messages);

    @Override
    default void close() throws Exception {}
}
