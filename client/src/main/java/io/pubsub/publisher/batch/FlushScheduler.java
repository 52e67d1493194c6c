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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import io.pubsub.publisher.util.Runs;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Arms the timer that sends a batch once its first message has waited {@code maxDelay}. */
@Slf4j
@RequiredArgsConstructor
public class FlushScheduler {
    @NonNull private final ScheduledExecutorService executor;
    @NonNull private final Duration maxDelay;

    void arm(@NonNull Batch batch, @NonNull Consumer<Batch> onDeadline) {
        long remainingNanos =
                Math.max(0L, batch.getStartTimeNanos() + maxDelay.toNanos() - System.nanoTime());
        var timer =
                executor.schedule(
                        () -> Runs.safeRun(log, "batch delay timer", () -> onDeadline.accept(batch)),
                        remainingNanos,
                        NANOSECONDS);
        batch.setFlushTimer(timer);
    }
}
