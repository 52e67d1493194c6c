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

import static io.pubsub.publisher.batch.TestBatches.pending;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchTest {

    @Mock ScheduledFuture<?> flushTimer;

    Batch batch = new Batch();

    @Test
    void empty() {
        assertThat(batch.isEmpty()).isTrue();
        assertThat(batch.size()).isZero();
        assertThat(batch.getByteSize()).isZero();
        assertThat(batch.getStartTimeNanos()).isEqualTo(-1L);
        assertThat(batch.isSealed()).isFalse();
    }

    @Test
    void addTracksCountAndSerializedSize() {
        var before = System.nanoTime();
        batch.add(pending(10));
        batch.add(pending("abc".getBytes(StandardCharsets.UTF_8), Map.of("key", "value")));

        assertThat(batch.size()).isEqualTo(2);
        assertThat(batch.getByteSize()).isEqualTo(10 + 3 + 3 + 5);
        assertThat(batch.getStartTimeNanos()).isGreaterThanOrEqualTo(before);
    }

    @Test
    void startTimeIsTheFirstAppend() {
        batch.add(pending(1));
        var start = batch.getStartTimeNanos();
        batch.add(pending(1));
        assertThat(batch.getStartTimeNanos()).isEqualTo(start);
    }

    @Test
    void sealKeepsAppendOrder() {
        var first = pending(new byte[] {1}, Map.of());
        var second = pending(new byte[] {2}, Map.of());
        var third = pending(new byte[] {3}, Map.of());
        batch.add(first);
        batch.add(second);
        batch.add(third);
        batch.seal();

        assertThat(batch.isSealed()).isTrue();
        assertThat(batch.messages())
                .containsExactly(first.message(), second.message(), third.message());
        assertThat(batch.pending()).containsExactly(first, second, third);
    }

    @Test
    void sealCancelsTheFlushTimer() {
        batch.add(pending(1));
        batch.setFlushTimer(flushTimer);
        batch.seal();
        verify(flushTimer).cancel(false);
    }

    @Test
    void sealedBatchIsFrozen() {
        batch.add(pending(1));
        batch.seal();
        assertThatThrownBy(() -> batch.add(pending(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Cannot add to a sealed batch");
        assertThatThrownBy(() -> batch.seal()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> batch.messages().add(null))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void messagesRequireSeal() {
        batch.add(pending(1));
        assertThatThrownBy(() -> batch.messages()).isInstanceOf(IllegalStateException.class);
    }
}
