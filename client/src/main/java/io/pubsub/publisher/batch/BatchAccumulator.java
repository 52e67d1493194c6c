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

import com.google.common.annotations.VisibleForTesting;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the batch currently being filled. A batch leaves the accumulator exactly once, either
 * because an append reached a threshold, because its delay timer fired or because the accumulator
 * was closed. In every case it is sealed, replaced by an empty batch and passed to the {@link
 * FlushHandler} before the lock is released.
 */
@Slf4j
public class BatchAccumulator {

    private final ReentrantLock lock = new ReentrantLock();
    @NonNull private final Thresholds thresholds;
    @NonNull private final FlushScheduler flushScheduler;
    @NonNull private final FlushHandler flushHandler;

    private Batch current = new Batch();
    private boolean closed;

    public BatchAccumulator(
            @NonNull Thresholds thresholds,
            @NonNull FlushScheduler flushScheduler,
            @NonNull FlushHandler flushHandler) {
        this.thresholds = thresholds;
        this.flushScheduler = flushScheduler;
        this.flushHandler = flushHandler;
    }

    /**
     * Appends a message to the current batch, flushing it if a threshold is reached.
     *
     * @throws IllegalStateException if the accumulator has been closed.
     */
    public @NonNull AppendResult append(@NonNull PendingMessage message) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Publisher is closed");
            }
            boolean first = current.isEmpty();
            current.add(message);
            if (thresholds.isReachedBy(current)) {
                var full = swap();
                flushHandler.flush(full, FlushTrigger.THRESHOLD);
                return new AppendResult.Full(full);
            }
            if (first) {
                flushScheduler.arm(current, this::onDeadline);
            }
            return AppendResult.Accepted.INSTANCE;
        } finally {
            lock.unlock();
        }
    }

    @VisibleForTesting
    void onDeadline(@NonNull Batch batch) {
        lock.lock();
        try {
            // A threshold flush may have taken the batch since the timer fired
            if (closed || batch != current || batch.isEmpty()) {
                return;
            }
            log.debug("Batch of {} messages reached its delay", batch.size());
            flushHandler.flush(swap(), FlushTrigger.DELAY);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects further appends and flushes the current batch, if any. Only the first call has an
     * effect.
     *
     * @return the batch that was flushed.
     */
    public @NonNull Optional<Batch> close() {
        lock.lock();
        try {
            if (closed) {
                return Optional.empty();
            }
            closed = true;
            if (current.isEmpty()) {
                return Optional.empty();
            }
            var last = swap();
            flushHandler.flush(last, FlushTrigger.SHUTDOWN);
            return Optional.of(last);
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @VisibleForTesting
    Batch current() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    private Batch swap() {
        var sealed = current;
        sealed.seal();
        current = new Batch();
        return sealed;
    }
}
