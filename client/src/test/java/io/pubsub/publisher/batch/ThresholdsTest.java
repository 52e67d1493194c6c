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

import java.time.Duration;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ThresholdsTest {

    @ParameterizedTest
    @CsvSource({"0,1000,1", "-1,1000,1", "1,0,1", "1,-5,1", "1,1000,0", "1,1000,-1"})
    void invalid(long maxBytes, long maxDelayMillis, int maxCount) {
        assertThatThrownBy(
                        () -> new Thresholds(maxBytes, Duration.ofMillis(maxDelayMillis), maxCount))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
        // count, payload size, reached
        "1,1,false",
        "2,1,false",
        "3,1,true",
        "1,99,false",
        "1,100,true",
        "2,50,true",
        "1,5000,true"
    })
    void reached(int count, int payloadSize, boolean reached) {
        var thresholds = new Thresholds(100, Duration.ofSeconds(5), 3);
        var batch = new Batch();
        for (int i = 0; i < count; i++) {
            batch.add(pending(payloadSize));
        }
        assertThat(thresholds.isReachedBy(batch)).isEqualTo(reached);
    }
}
