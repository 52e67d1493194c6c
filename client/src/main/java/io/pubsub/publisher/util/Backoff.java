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
package io.pubsub.publisher.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import lombok.NonNull;

/**
 * Exponential backoff between retries. Each delay doubles the previous one up to a ceiling, and is
 * stretched by up to 20% of random jitter. Not thread-safe.
 */
public class Backoff {
    public static final double MAX_JITTER = 0.2;

    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private long nextDelayMillis;

    public Backoff(@NonNull Duration initialDelay, @NonNull Duration maxDelay) {
        this.initialDelayMillis = initialDelay.toMillis();
        this.maxDelayMillis = maxDelay.toMillis();
        if (initialDelayMillis <= 0 || maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException(
                    "Invalid backoff, initial: " + initialDelay + ", max: " + maxDelay);
        }
        this.nextDelayMillis = initialDelayMillis;
    }

    public long nextDelayMillis() {
        long currentDelayMillis = this.nextDelayMillis;
        if (currentDelayMillis < maxDelayMillis) {
            this.nextDelayMillis = Math.min(currentDelayMillis * 2, maxDelayMillis);
        }
        long jitterBound = Math.max(1L, (long) (currentDelayMillis * MAX_JITTER));
        return currentDelayMillis + ThreadLocalRandom.current().nextLong(jitterBound);
    }

    public void reset() {
        this.nextDelayMillis = initialDelayMillis;
    }

    /** The longest delay {@link #nextDelayMillis()} can return for the given ceiling. */
    public static @NonNull Duration upperBound(@NonNull Duration maxDelay) {
        return Duration.ofMillis((long) Math.ceil(maxDelay.toMillis() * (1 + MAX_JITTER)));
    }
}
