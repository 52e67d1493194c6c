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

import io.pubsub.publisher.api.Message;
import java.util.concurrent.CompletableFuture;
import lombok.NonNull;

/** A message waiting in a batch, with the future handed back to the publisher. */
public record PendingMessage(@NonNull Message message, @NonNull CompletableFuture<Void> callback) {

    public void complete() {
        callback.complete(null);
    }

    public void fail(@NonNull Throwable t) {
        callback.completeExceptionally(t);
    }
}
