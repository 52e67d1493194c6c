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

import io.opentelemetry.api.OpenTelemetry;
import io.pubsub.publisher.api.BatchFailure;
import io.pubsub.publisher.api.TopicName;
import io.pubsub.publisher.batch.Thresholds;
import io.pubsub.publisher.dispatch.RetryPolicy;
import java.time.Duration;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import lombok.NonNull;

public record PublisherConfig(
        @NonNull TopicName topic,
        @NonNull Thresholds thresholds,
        @NonNull RetryPolicy retryPolicy,
        @Nullable Consumer<BatchFailure> failureListener,
        @NonNull OpenTelemetry openTelemetry) {

    /** How long {@code shutdown()} waits for in-flight batches before abandoning them. */
    public @NonNull Duration drainTimeout() {
        return retryPolicy.worstCaseDuration();
    }
}
