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

import com.google.common.base.Preconditions;
import io.pubsub.publisher.api.Message;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.NonNull;

/**
 * An ordered group of messages sent in one request. Mutated only under the accumulator lock until
 * it is sealed; a sealed batch never changes again.
 */
public final class Batch {

    private final List<PendingMessage> pending = new ArrayList<>();
    @Getter private long byteSize;
    @Getter private long startTimeNanos = -1L;
    @Getter private boolean sealed;
    @Nullable private ScheduledFuture<?> flushTimer;
    @Nullable private List<Message> messages;

    void add(@NonNull PendingMessage message) {
        Preconditions.checkState(!sealed, "Cannot add to a sealed batch");
        if (pending.isEmpty()) {
            startTimeNanos = System.nanoTime();
        }
        pending.add(message);
        byteSize += message.message().serializedSize();
    }

    void setFlushTimer(@NonNull ScheduledFuture<?> flushTimer) {
        this.flushTimer = flushTimer;
    }

    /** Freezes the batch and cancels its delay timer. */
    void seal() {
        Preconditions.checkState(!sealed, "Batch is already sealed");
        sealed = true;
        if (flushTimer != null) {
            flushTimer.cancel(false);
            flushTimer = null;
        }
        var snapshot = new ArrayList<Message>(pending.size());
        pending.forEach(p -> snapshot.add(p.message()));
        messages = Collections.unmodifiableList(snapshot);
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    /** The messages in append order. Only available once sealed. */
    public @NonNull List<Message> messages() {
        Preconditions.checkState(sealed, "Batch is not sealed");
        return messages;
    }

    public @NonNull List<PendingMessage> pending() {
        return Collections.unmodifiableList(pending);
    }
}
