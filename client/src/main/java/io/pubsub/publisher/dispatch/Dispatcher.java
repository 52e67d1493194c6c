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

import static io.opentelemetry.api.common.AttributeKey.stringKey;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.pubsub.publisher.api.BatchFailure;
import io.pubsub.publisher.api.TopicName;
import io.pubsub.publisher.api.Transport;
import io.pubsub.publisher.batch.Batch;
import io.pubsub.publisher.batch.FlushHandler;
import io.pubsub.publisher.batch.FlushTrigger;
import io.pubsub.publisher.metrics.Counter;
import io.pubsub.publisher.metrics.InstrumentProvider;
import io.pubsub.publisher.metrics.LatencyHistogram;
import io.pubsub.publisher.metrics.Unit;
import io.pubsub.publisher.metrics.UpDownCounter;
import io.pubsub.publisher.util.Runs;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends sealed batches through the {@link Transport}. Any number of batches may be in flight at
 * once; each one is retried on its own until it is acknowledged or dropped.
 */
@Slf4j
public class Dispatcher implements FlushHandler {

    static final AttributeKey<String> RESULT = stringKey("pubsub.result");
    static final AttributeKey<String> TRIGGER = stringKey("pubsub.trigger");

    @Getter(AccessLevel.PACKAGE)
    private final TopicName topic;

    @Getter(AccessLevel.PACKAGE)
    private final Transport transport;

    @Getter(AccessLevel.PACKAGE)
    private final RetryPolicy retryPolicy;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService sendExecutor;
    @Nullable private final Consumer<BatchFailure> failureListener;

    private final Set<InFlightBatch> inFlight = ConcurrentHashMap.newKeySet();
    private final LongAdder droppedMessages = new LongAdder();

    private final Map<FlushTrigger, Counter> counterBatches = new EnumMap<>(FlushTrigger.class);
    private final UpDownCounter gaugeInFlightBatches;
    private final Counter counterAcknowledgedMessages;
    private final Counter counterDroppedMessages;
    private final Counter counterRetries;
    private final LatencyHistogram histogramSendLatency;

    public Dispatcher(
            @NonNull TopicName topic,
            @NonNull Transport transport,
            @NonNull RetryPolicy retryPolicy,
            @NonNull ScheduledExecutorService scheduler,
            @NonNull ExecutorService sendExecutor,
            @Nullable Consumer<BatchFailure> failureListener,
            @NonNull InstrumentProvider instrumentProvider) {
        this.topic = topic;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
        this.sendExecutor = sendExecutor;
        this.failureListener = failureListener;

        for (var trigger : FlushTrigger.values()) {
            counterBatches.put(
                    trigger,
                    instrumentProvider.newCounter(
                            "pubsub.publisher.batches",
                            Unit.Events,
                            "The number of batches flushed",
                            Attributes.of(TRIGGER, trigger.name().toLowerCase(Locale.ROOT))));
        }
        this.gaugeInFlightBatches =
                instrumentProvider.newUpDownCounter(
                        "pubsub.publisher.batches.inflight",
                        Unit.Events,
                        "The number of batches waiting to be acknowledged",
                        Attributes.empty());
        this.counterAcknowledgedMessages =
                instrumentProvider.newCounter(
                        "pubsub.publisher.messages",
                        Unit.Events,
                        "The number of messages",
                        Attributes.of(RESULT, "acknowledged"));
        this.counterDroppedMessages =
                instrumentProvider.newCounter(
                        "pubsub.publisher.messages",
                        Unit.Events,
                        "The number of messages",
                        Attributes.of(RESULT, "dropped"));
        this.counterRetries =
                instrumentProvider.newCounter(
                        "pubsub.publisher.retries",
                        Unit.Events,
                        "The number of send attempts that were retried",
                        Attributes.empty());
        this.histogramSendLatency =
                instrumentProvider.newLatencyHistogram(
                        "pubsub.publisher.send.latency",
                        "The duration of a single send attempt",
                        Attributes.empty());
    }

    @Override
    public void flush(@NonNull Batch batch, @NonNull FlushTrigger trigger) {
        if (batch.isEmpty()) {
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug(
                    "Flushing batch of {} messages ({} bytes) to {}, trigger: {}",
                    batch.size(),
                    batch.getByteSize(),
                    topic,
                    trigger);
        }
        counterBatches.get(trigger).increment();
        var dispatch = new InFlightBatch(this, batch);
        inFlight.add(dispatch);
        gaugeInFlightBatches.increment();
        dispatch
                .resolution()
                .whenComplete(
                        (ignore, ex) -> {
                            inFlight.remove(dispatch);
                            gaugeInFlightBatches.decrement();
                        });
        send(dispatch);
    }

    /**
     * Waits until every in-flight batch is resolved. Batches still unresolved after {@code timeout}
     * are abandoned.
     */
    public void drain(@NonNull Duration timeout) {
        var pending = List.copyOf(inFlight);
        if (pending.isEmpty()) {
            return;
        }
        log.info("Waiting up to {} for {} in-flight batches to {}", timeout, pending.size(), topic);
        var all =
                CompletableFuture.allOf(
                        pending.stream()
                                .map(InFlightBatch::resolution)
                                .toArray(CompletableFuture[]::new));
        try {
            all.get(timeout.toMillis(), MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out after {} waiting for in-flight batches to {}", timeout, topic);
            pending.forEach(b -> b.abandon("Shutdown drain timed out after " + timeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight batches to {}", topic);
            pending.forEach(b -> b.abandon("Interrupted during shutdown"));
        } catch (ExecutionException e) {
            log.warn("Failed waiting for in-flight batches to {}", topic, e.getCause());
            pending.forEach(b -> b.abandon("Shutdown drain failed"));
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /** The total number of messages dropped since the dispatcher was created. */
    public long droppedMessages() {
        return droppedMessages.sum();
    }

    void retryLater(@NonNull InFlightBatch dispatch, long delayMillis) {
        counterRetries.increment();
        try {
            scheduler.schedule(() -> send(dispatch), delayMillis, MILLISECONDS);
        } catch (RejectedExecutionException e) {
            dispatch.abandon("Publisher stopped before the batch could be retried");
        }
    }

    void recordAttempt(boolean success, long latencyNanos) {
        if (success) {
            histogramSendLatency.recordSuccess(latencyNanos);
        } else {
            histogramSendLatency.recordFailure(latencyNanos);
        }
    }

    void onAcknowledged(@NonNull InFlightBatch dispatch) {
        counterAcknowledgedMessages.add(dispatch.getBatch().size());
    }

    void onDropped(@NonNull BatchFailure failure) {
        droppedMessages.add(failure.messageCount());
        counterDroppedMessages.add(failure.messageCount());
        log.error(
                "Dropped batch of {} messages ({} bytes) to {} after {} attempts ({}): {}",
                failure.messageCount(),
                failure.byteSize(),
                failure.topic(),
                failure.attempts(),
                failure.kind(),
                failure.reason());
        if (failureListener != null) {
            Runs.safeRun(log, "failure listener", () -> failureListener.accept(failure));
        }
    }

    private void send(InFlightBatch dispatch) {
        Runs.safeExecute(log, sendExecutor, "send attempt", dispatch::attempt);
    }
}
