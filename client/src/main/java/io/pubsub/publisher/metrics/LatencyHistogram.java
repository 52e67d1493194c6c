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
package io.pubsub.publisher.metrics;

import static io.opentelemetry.api.common.AttributeKey.stringKey;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Records durations in milliseconds, split by outcome. */
public class LatencyHistogram {

    static final AttributeKey<String> RESULT = stringKey("pubsub.result");

    private static final List<Double> BUCKETS =
            List.of(
                    1.0, 2.0, 5.0, 10.0, 20.0, 50.0, 100.0, 200.0, 500.0, 1_000.0, 2_000.0, 5_000.0,
                    10_000.0, 30_000.0, 60_000.0);

    private final DoubleHistogram histogram;
    private final Attributes successAttributes;
    private final Attributes failureAttributes;

    LatencyHistogram(
            Meter meter, String name, String description, String topic, Attributes attributes) {
        this.histogram =
                meter
                        .histogramBuilder(name)
                        .setDescription(description)
                        .setUnit(Unit.Milliseconds.toString())
                        .setExplicitBucketBoundariesAdvice(BUCKETS)
                        .build();

        var builder = attributes.toBuilder();
        if (topic != null) {
            builder.put(InstrumentProvider.TOPIC_ATTRIBUTE, topic);
        }
        var base = builder.build();
        this.successAttributes = base.toBuilder().put(RESULT, "success").build();
        this.failureAttributes = base.toBuilder().put(RESULT, "failure").build();
    }

    public void recordSuccess(long latencyNanos) {
        histogram.record(toMillis(latencyNanos), successAttributes);
    }

    public void recordFailure(long latencyNanos) {
        histogram.record(toMillis(latencyNanos), failureAttributes);
    }

    private static double toMillis(long nanos) {
        return nanos / (double) TimeUnit.MILLISECONDS.toNanos(1);
    }
}
