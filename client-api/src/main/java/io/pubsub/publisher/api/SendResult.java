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

import io.pubsub.publisher.api.SendResult.FatalError;
import io.pubsub.publisher.api.SendResult.Ok;
import io.pubsub.publisher.api.SendResult.RetryableError;
import lombok.NonNull;

/** The outcome of a single {@link Transport#send} call. */
public sealed interface SendResult permits Ok, RetryableError, FatalError {

    static @NonNull SendResult ok() {
        return Ok.INSTANCE;
    }

    static @NonNull SendResult retryable(@NonNull String reason) {
        return new RetryableError(reason);
    }

    static @NonNull SendResult fatal(@NonNull String reason) {
        return new FatalError(reason);
    }

    /** The batch was accepted by the service. */
    record Ok() implements SendResult {
        static final Ok INSTANCE = new Ok();
    }

    /** A transient failure, e.g. a network error or an unavailable service. */
    record RetryableError(@NonNull String reason) implements SendResult {}

    /** A permanent rejection. The batch is not retried. */
    record FatalError(@NonNull String reason) implements SendResult {}
}
