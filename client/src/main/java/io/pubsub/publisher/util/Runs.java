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

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;

@UtilityClass
public final class Runs {

    /** Runs {@code task}, logging instead of propagating anything it throws. */
    public static void safeRun(
            @NonNull Logger logger, @NonNull String description, @NonNull Runnable task) {
        try {
            task.run();
        } catch (Throwable ex) {
            logger.warn("Unexpected failure in {}", description, ex);
        }
    }

    /**
     * Submits {@code task} to the executor. When the executor refuses it, typically because it is
     * shutting down, the task runs on the calling thread instead.
     */
    public static void safeExecute(
            @NonNull Logger logger,
            @NonNull Executor executor,
            @NonNull String description,
            @NonNull Runnable task) {
        try {
            executor.execute(() -> safeRun(logger, description, task));
        } catch (RejectedExecutionException ex) {
            logger.debug("Executor rejected {}, running it on the calling thread", description);
            safeRun(logger, description, task);
        }
    }

    /** Shuts the executor down, waiting up to {@code timeout} before interrupting its tasks. */
    public static void shutdownExecutor(
            @NonNull ExecutorService executor, long timeout, @NonNull TimeUnit unit) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout, unit)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
