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
package io.pubsub.publisher.batch;

import static java.time.Duration.ZERO;

import java.time.Duration;
import lombok.NonNull;

/**
 * The limits that force a batch to be sent.
 *
 * @param maxBytes send once the batch reaches this serialized size.
 * @param maxDelay send once the first message of the batch is this old.
 * @param maxCount send once the batch holds this many messages.
 */
public record Thresholds(long maxBytes, @NonNull Duration maxDelay, int maxCount) {

    public Thresholds {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be greater than zero: " + maxBytes);
        }
        if (maxDelay.isNegative() || maxDelay.equals(ZERO)) {
            throw new IllegalArgumentException("maxDelay must be greater than zero: " + maxDelay);
        }
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be at least one: " + maxCount);
        }
    }

    boolean isReachedBy(@NonNull Batch batch) {
        return batch.size() >= maxCount || batch.getByteSize() >= maxBytes;
    }
}
