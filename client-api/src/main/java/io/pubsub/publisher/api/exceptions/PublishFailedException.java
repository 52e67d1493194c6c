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
package io.pubsub.publisher.api.exceptions;

import io.pubsub.publisher.api.BatchFailure;
import lombok.Getter;
import lombok.NonNull;

/** Completes the future of every message of a dropped batch. */
@Getter
public class PublishFailedException extends PublisherException {
    private final BatchFailure failure;

    public PublishFailedException(@NonNull BatchFailure failure) {
        super(
                String.format(
                        "Failed to publish batch of %d messages to %s after %d attempts (%s): %s",
                        failure.messageCount(),
                        failure.topic(),
                        failure.attempts(),
                        failure.kind(),
                        failure.reason()));
        this.failure = failure;
    }
}
