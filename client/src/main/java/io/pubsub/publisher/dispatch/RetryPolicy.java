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
package io.pubsub.publisher.dispatch;

import static java.time.Duration.ZERO;

import io.pubsub.publisher.util.Backoff;
import java.time.Duration;
import lombok.NonNull;

/**
 * How a failed batch is retried.
 *
 * @param maxRetries the number of attempts after the first one.
 * @param initialBackoff the delay before the first retry.
 * @param maxBackoff the ceiling of the exponential backoff.
 * @param requestTimeout how long a single attempt may take.
 */
public record RetryPolicy(
        int maxRetries,
        @NonNull Duration initialBackoff,
        @NonNull Duration maxBackoff,
        @NonNull Duration requestTimeout) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (initialBackoff.isNegative() || initialBackoff.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "initialBackoff must be greater than zero: " + initialBackoff);
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException(
                    "maxBackoff must not be shorter than initialBackoff: " + maxBackoff);
        }
        if (requestTimeout.isNegative() || requestTimeout.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "requestTimeout must be greater than zero: " + requestTimeout);
        }
    }

    public @NonNull Backoff newBackoff() {
        return new Backoff(initialBackoff, maxBackoff);
    }

    /** The longest a batch can stay in flight: every attempt times out after the longest backoff. */
    public @NonNull Duration worstCaseDuration() {
        return requestTimeout
                .multipliedBy(maxRetries + 1L)
                .plus(Backoff.upperBound(maxBackoff).multipliedBy(maxRetries));
    }
}
