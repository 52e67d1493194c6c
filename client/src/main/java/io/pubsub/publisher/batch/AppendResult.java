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

import io.pubsub.publisher.batch.AppendResult.Accepted;
import io.pubsub.publisher.batch.AppendResult.Full;
import lombok.NonNull;

public sealed interface AppendResult permits Accepted, Full {

    /** The message joined the current batch, which is still below its thresholds. */
    record Accepted() implements AppendResult {
        static final Accepted INSTANCE = new Accepted();
    }

    /** The message filled the batch, which has already been handed to the dispatcher. */
    record Full(@NonNull Batch batch) implements AppendResult {}
}
