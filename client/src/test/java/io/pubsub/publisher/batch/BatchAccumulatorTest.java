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
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchAccumulatorTest {

    static final Duration maxDelay = Duration.ofSeconds(5);

    @Mock ScheduledExecutorService executor;
    @Mock ScheduledFuture<?> flushTimer;
    @Mock FlushHandler flushHandler;

    BatchAccumulator accumulator;

    @BeforeEach
    void setup() {
        accumulator =
                new BatchAccumulator(
                        new Thresholds(25, maxDelay, 3), new FlushScheduler(executor, maxDelay), flushHandler);
    }

    void timerIsArmed() {
        doReturn(flushTimer).when(executor).schedule(any(Runnable.class), anyLong(), eq(NANOSECONDS));
    }

    Runnable capturedTimer() {
        var captor = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).schedule(captor.capture(), anyLong(), eq(NANOSECONDS));
        return captor.getValue();
    }

    @Test
    void belowThresholds() {
        timerIsArmed();
        assertThat(accumulator.append(pending(5))).isInstanceOf(AppendResult.Accepted.class);
        assertThat(accumulator.append(pending(5))).isInstanceOf(AppendResult.Accepted.class);

        var delay = ArgumentCaptor.forClass(Long.class);
        verify(executor, times(1)).schedule(any(Runnable.class), delay.capture(), eq(NANOSECONDS));
        assertThat(delay.getValue()).isBetween(0L, maxDelay.toNanos());
        verifyNoInteractions(flushHandler);
        assertThat(accumulator.current().size()).isEqualTo(2);
    }

    @Test
    void countThresholdFlushesFromAppend() {
        timerIsArmed();
        var first = pending(1);
        var second = pending(1);
        var third = pending(1);
        accumulator.append(first);
        accumulator.append(second);
        var result = accumulator.append(third);

        assertThat(result).isInstanceOf(AppendResult.Full.class);
        var batch = ((AppendResult.Full) result).batch();
        assertThat(batch.isSealed()).isTrue();
        assertThat(batch.pending()).containsExactly(first, second, third);
        verify(flushHandler).flush(batch, FlushTrigger.THRESHOLD);
        verify(flushTimer).cancel(false);
        assertThat(accumulator.current()).isNotSameAs(batch);
        assertThat(accumulator.current().isEmpty()).isTrue();
    }

    @Test
    void byteThresholdFlushesFromAppend() {
        timerIsArmed();
        accumulator.append(pending(10));
        verifyNoInteractions(flushHandler);

        var result = accumulator.append(pending(20));
        assertThat(result).isInstanceOf(AppendResult.Full.class);
        var batch = ((AppendResult.Full) result).batch();
        assertThat(batch.size()).isEqualTo(2);
        assertThat(batch.getByteSize()).isEqualTo(30);
        verify(flushHandler).flush(batch, FlushTrigger.THRESHOLD);
    }

    @Test
    void oversizeMessageFormsItsOwnBatch() {
        var result = accumulator.append(pending(1_000));

        assertThat(result).isInstanceOf(AppendResult.Full.class);
        var batch = ((AppendResult.Full) result).batch();
        assertThat(batch.size()).isEqualTo(1);
        assertThat(batch.messages().get(0).payloadSize()).isEqualTo(1_000);
        verify(flushHandler).flush(batch, FlushTrigger.THRESHOLD);
        verifyNoInteractions(executor);
    }

    @Test
    void deadlineFlushesCurrentBatch() {
        timerIsArmed();
        accumulator.append(pending(1));
        var batch = accumulator.current();

        capturedTimer().run();

        verify(flushHandler).flush(batch, FlushTrigger.DELAY);
        assertThat(batch.isSealed()).isTrue();
        assertThat(accumulator.current().isEmpty()).isTrue();
    }

    @Test
    void deadlineAfterThresholdFlushIsIgnored() {
        timerIsArmed();
        accumulator.append(pending(1));
        var timer = capturedTimer();
        accumulator.append(pending(1));
        var result = accumulator.append(pending(1));
        var batch = ((AppendResult.Full) result).batch();

        timer.run();

        verify(flushHandler).flush(batch, FlushTrigger.THRESHOLD);
        verifyNoMoreInteractions(flushHandler);
    }

    @Test
    void nextBatchArmsANewTimer() {
        timerIsArmed();
        accumulator.append(pending(1));
        accumulator.append(pending(1));
        accumulator.append(pending(1));
        accumulator.append(pending(1));

        verify(executor, times(2)).schedule(any(Runnable.class), anyLong(), eq(NANOSECONDS));
        assertThat(accumulator.current().size()).isEqualTo(1);
    }

    @Test
    void closeFlushesPendingMessages() {
        timerIsArmed();
        accumulator.append(pending(1));
        accumulator.append(pending(1));
        var batch = accumulator.current();

        assertThat(accumulator.close()).containsSame(batch);
        verify(flushHandler).flush(batch, FlushTrigger.SHUTDOWN);
        assertThat(batch.size()).isEqualTo(2);
        assertThat(accumulator.isClosed()).isTrue();
    }

    @Test
    void closeWithoutPendingMessages() {
        assertThat(accumulator.close()).isEmpty();
        verifyNoInteractions(flushHandler);
    }

    @Test
    void closeIsIdempotent() {
        timerIsArmed();
        accumulator.append(pending(1));
        assertThat(accumulator.close()).isPresent();
        assertThat(accumulator.close()).isEmpty();
        verify(flushHandler, times(1)).flush(any(), eq(FlushTrigger.SHUTDOWN));
    }

    @Test
    void appendAfterClose() {
        accumulator.close();
        assertThatThrownBy(() -> accumulator.append(pending(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Publisher is closed");
        verify(flushHandler, never()).flush(any(), any());
    }

    @Test
    void deadlineAfterCloseIsIgnored() {
        timerIsArmed();
        accumulator.append(pending(1));
        var timer = capturedTimer();
        var batch = accumulator.close().orElseThrow();

        timer.run();

        verify(flushHandler).flush(batch, FlushTrigger.SHUTDOWN);
        verifyNoMoreInteractions(flushHandler);
    }
}
