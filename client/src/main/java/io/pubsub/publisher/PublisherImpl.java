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

import static io.opentelemetry.api.common.AttributeKey.stringKey;
import static java.util.concurrent.TimeUnit.SECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.opentelemetry.api.common.Attributes;
import io.pubsub.publisher.api.Message;
import io.pubsub.publisher.api.Publisher;
import io.pubsub.publisher.api.ShutdownResult;
import io.pubsub.publisher.api.TopicName;
import io.pubsub.publisher.api.Transport;
import io.pubsub.publisher.api.exceptions.InvalidAttributeException;
import io.pubsub.publisher.batch.BatchAccumulator;
import io.pubsub.publisher.batch.FlushScheduler;
import io.pubsub.publisher.batch.PendingMessage;
import io.pubsub.publisher.dispatch.Dispatcher;
import io.pubsub.publisher.message.MessageBuilder;
import io.pubsub.publisher.metrics.Counter;
import io.pubsub.publisher.metrics.InstrumentProvider;
import io.pubsub.publisher.metrics.Unit;
import io.pubsub.publisher.util.Runs;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class PublisherImpl implements Publisher {

    private static final long EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 5;

    static @NonNull PublisherImpl newInstance(
            @NonNull PublisherConfig config,
            @NonNull MessageBuilder messageBuilder,
            @NonNull Transport transport) {
        var scheduler =
                new ScheduledThreadPoolExecutor(
                        1,
                        new ThreadFactoryBuilder()
                                .setNameFormat("pubsub-publisher-scheduler-%d")
                                .setDaemon(true)
                                .build());
        // Retries and delay timers still queued once the drain has ended are not run.
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler.setRemoveOnCancelPolicy(true);
        var sendExecutor =
                Executors.newCachedThreadPool(
                        new ThreadFactoryBuilder()
                                .setNameFormat("pubsub-publisher-send-%d")
                                .setDaemon(true)
                                .build());
        var instrumentProvider =
                new InstrumentProvider(config.openTelemetry(), config.topic().toString());
        var dispatcher =
                new Dispatcher(
                        config.topic(),
                        transport,
                        config.retryPolicy(),
                        scheduler,
                        sendExecutor,
                        config.failureListener(),
                        instrumentProvider);
        var accumulator =
                new BatchAccumulator(
                        config.thresholds(),
                        new FlushScheduler(scheduler, config.thresholds().maxDelay()),
                        dispatcher);
        return new PublisherImpl(
                config,
                messageBuilder,
                accumulator,
                dispatcher,
                transport,
                scheduler,
                sendExecutor,
                instrumentProvider);
    }

    private final PublisherConfig config;
    private final MessageBuilder messageBuilder;
    private final BatchAccumulator accumulator;
    private final Dispatcher dispatcher;
    private final Transport transport;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService sendExecutor;

    private final Counter counterPublishedMessages;
    private final Counter counterPublishedBytes;

    private final AtomicBoolean shuttingDown = new AtomicBoolean();
    private final CompletableFuture<ShutdownResult> shutdownResult = new CompletableFuture<>();

    PublisherImpl(
            @NonNull PublisherConfig config,
            @NonNull MessageBuilder messageBuilder,
            @NonNull BatchAccumulator accumulator,
            @NonNull Dispatcher dispatcher,
            @NonNull Transport transport,
            @NonNull ScheduledExecutorService scheduler,
            @NonNull ExecutorService sendExecutor,
            @NonNull InstrumentProvider instrumentProvider) {
        this.config = config;
        this.messageBuilder = messageBuilder;
        this.accumulator = accumulator;
        this.dispatcher = dispatcher;
        this.transport = transport;
        this.scheduler = scheduler;
        this.sendExecutor = sendExecutor;

        this.counterPublishedMessages =
                instrumentProvider.newCounter(
                        "pubsub.publisher.messages",
                        Unit.Events,
                        "The number of messages",
                        Attributes.of(stringKey("pubsub.result"), "published"));
        this.counterPublishedBytes =
                instrumentProvider.newCounter(
                        "pubsub.publisher.bytes",
                        Unit.Bytes,
                        "The serialized size of the published messages",
                        Attributes.empty());
    }

    @Override
    public @NonNull TopicName topic() {
        return config.topic();
    }

    @Override
    public @NonNull CompletableFuture<Void> publish(byte @NonNull [] payload) {
        return enqueue(messageBuilder.build(payload));
    }

    @Override
    public @NonNull CompletableFuture<Void> publish(
            byte @NonNull [] payload, @NonNull Map<?, ?> attributes)
            throws InvalidAttributeException {
        return enqueue(messageBuilder.build(payload, attributes));
    }

    private CompletableFuture<Void> enqueue(Message message) {
        var callback = new CompletableFuture<Void>();
        accumulator.append(new PendingMessage(message, callback));
        counterPublishedMessages.increment();
        counterPublishedBytes.add(message.serializedSize());
        return callback;
    }

    @Override
    public @NonNull ShutdownResult shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return shutdownResult.join();
        }
        try {
            var result = doShutdown();
            shutdownResult.complete(result);
            return result;
        } catch (Throwable t) {
            shutdownResult.completeExceptionally(t);
            throw t;
        }
    }

    private ShutdownResult doShutdown() {
        log.info("Shutting down publisher for {}", config.topic());
        long droppedBefore = dispatcher.droppedMessages();

        accumulator.close();
        dispatcher.drain(config.drainTimeout());

        Runs.shutdownExecutor(scheduler, EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, SECONDS);
        Runs.shutdownExecutor(sendExecutor, EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, SECONDS);
        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Failed to close the transport of {}", config.topic(), e);
        }

        var result = new ShutdownResult(dispatcher.droppedMessages() - droppedBefore);
        if (result.isSuccess()) {
            log.info("Publisher for {} shut down", config.topic());
        } else {
            log.warn(
                    "Publisher for {} shut down, {} messages were dropped",
                    config.topic(),
                    result.droppedMessages());
        }
        return result;
    }

    @VisibleForTesting
    BatchAccumulator accumulator() {
        return accumulator;
    }

    @VisibleForTesting
    Dispatcher dispatcher() {
        return dispatcher;
    }

    @VisibleForTesting
    ScheduledExecutorService scheduler() {
        return scheduler;
    }

    @VisibleForTesting
    Transport transport() {
        return transport;
    }
}
