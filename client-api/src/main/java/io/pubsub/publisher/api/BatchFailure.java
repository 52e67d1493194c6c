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

import lombok.NonNull;

/**
 * Reported when a batch is dropped. The messages of a dropped batch are not recoverable.
 *
 * @param topic the destination topic.
 * @param messageCount the number of messages in the dropped batch.
 * @param byteSize the serialized size of the dropped batch.
 * @param attempts the number of send attempts that were made.
 * @param kind why the batch was dropped.
 * @param reason the last error reported for the batch.
 */
public record BatchFailure(
        @NonNull TopicName topic,
        int messageCount,
        long byteSize,
        int attempts,
        @NonNull Kind kind,
        @NonNull String reason) {

    public enum Kind {
        /** The service permanently rejected the batch. */
        REJECTED,
        /** Every attempt of the retry budget failed with a retryable error. */
        RETRIES_EXHAUSTED,
        /** The batch was still unresolved when the shutdown drain deadline passed. */
        ABANDONED
    }
}
