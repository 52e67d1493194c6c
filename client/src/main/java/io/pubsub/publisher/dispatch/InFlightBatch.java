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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import io.pubsub.publisher.api.BatchFailure;
import io.pubsub.publisher.api.SendResult;
import io.pubsub.publisher.api.exceptions.PublishFailedException;
import io.pubsub.publisher.batch.Batch;
import io.pubsub.publisher.batch.PendingMessage;
import io.pubsub.publisher.util.Backoff;
import io.pubsub.publisher.util.CompletableFutures;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A sealed batch owned by the {@link Dispatcher} until it is acknowledged or dropped. Attempts are
 * never concurrent: the next one is only scheduled once the previous one has completed.
 */
@Slf4j
final class InFlightBatch {

    enum State {
        FLUSHING,
        ACKNOWLEDGED,
        DROPPED
    }

    private final Dispatcher dispatcher;
    @Getter private final Batch batch;
    private final Backoff backoff;
    private final AtomicReference<State> state = new AtomicReference<>(State.FLUSHING);
    private final AtomicInteger attempts = new AtomicInteger();
    private final CompletableFuture<Void> resolution = new CompletableFuture<>();

    InFlightBatch(@NonNull Dispatcher dispatcher, @NonNull Batch batch) {
        this.dispatcher = dispatcher;
        this.batch = batch;
        this.backoff = dispatcher.getRetryPolicy().newBackoff();
    }

    /** Completes normally once the batch is acknowledged or dropped. */
    @NonNull
    CompletableFuture<Void> resolution() {
        return resolution;
    }

    void attempt() {
        if (state.get() != State.FLUSHING) {
            return;
        }
        int attempt = attempts.incrementAndGet();
        long startTime = System.nanoTime();
        CompletableFuture<SendResult> future;
        try {
            future = dispatcher.getTransport().send(dispatcher.getTopic(), batch.messages());
            if (future == null) {
                future =
                        CompletableFuture.failedFuture(
                                new IllegalStateException("Transport returned no result"));
            }
        } catch (Throwable t) {
            future = CompletableFuture.failedFuture(t);
        }
        long timeoutMillis = dispatcher.getRetryPolicy().requestTimeout().toMillis();
        future
                .copy()
                .orTimeout(timeoutMillis, MILLISECONDS)
                .whenComplete((result, ex) -> onComplete(attempt, startTime, result, ex));
    }

    private void onComplete(int attempt, long startTime, SendResult result, Throwable ex) {
        long latency = System.nanoTime() - startTime;
        if (ex != null) {
            var cause = CompletableFutures.unwrap(ex);
            var reason =
                    cause instanceof TimeoutException
                            ? "Request timed out after " + dispatcher.getRetryPolicy().requestTimeout()
                            : CompletableFutures.describe(cause);
            dispatcher.recordAttempt(false, latency);
            retryOrDrop(attempt, reason);
        } else if (result instanceof SendResult.Ok) {
            dispatcher.recordAttempt(true, latency);
            acknowledge();
        } else if (result instanceof SendResult.RetryableError retryable) {
            dispatcher.recordAttempt(false, latency);
            retryOrDrop(attempt, retryable.reason());
        } else if (result instanceof SendResult.FatalError fatal) {
            dispatcher.recordAttempt(false, latency);
            drop(BatchFailure.Kind.REJECTED, fatal.reason());
        } else {
            dispatcher.recordAttempt(false, latency);
            drop(BatchFailure.Kind.REJECTED, "Transport completed without a result");
        }
    }

    private void retryOrDrop(int attempt, String reason) {
        int maxRetries = dispatcher.getRetryPolicy().maxRetries();
        if (attempt > maxRetries) {
            drop(BatchFailure.Kind.RETRIES_EXHAUSTED, reason);
            return;
        }
        if (state.get() != State.FLUSHING) {
            return;
        }
        long delayMillis = backoff.nextDelayMillis();
        log.warn(
                "Failed to send batch of {} messages to {}, retrying in {} ms (retry {}/{}): {}",
                batch.size(),
                dispatcher.getTopic(),
                delayMillis,
                attempt,
                maxRetries,
                reason);
        dispatcher.retryLater(this, delayMillis);
    }

    private void acknowledge() {
        if (!state.compareAndSet(State.FLUSHING, State.ACKNOWLEDGED)) {
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug(
                    "Batch of {} messages to {} acknowledged after {} attempts",
                    batch.size(),
                    dispatcher.getTopic(),
                    attempts.get());
        }
        dispatcher.onAcknowledged(this);
        batch.pending().forEach(PendingMessage::complete);
        resolution.complete(null);
    }

    /** Drops the batch if it has not been resolved yet. */
    void abandon(@NonNull String reason) {
        drop(BatchFailure.Kind.ABANDONED, reason);
    }

    private void drop(BatchFailure.Kind kind, String reason) {
        if (!state.compareAndSet(State.FLUSHING, State.DROPPED)) {
            return;
        }
        var failure =
                new BatchFailure(
                        dispatcher.getTopic(),
                        batch.size(),
                        batch.getByteSize(),
                        attempts.get(),
                        kind,
                        reason);
        var exception = new PublishFailedException(failure);
        dispatcher.onDropped(failure);
        batch.pending().forEach(p -> p.fail(exception));
        resolution.complete(null);
    }
}
