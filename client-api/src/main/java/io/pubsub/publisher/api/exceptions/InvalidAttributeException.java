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
package io.pubsub.publisher.api.exceptions;

import lombok.Getter;

/** An attribute key or value is not a string. */
public class InvalidAttributeException extends PublisherException {

    /** The offending key, rendered with {@link String#valueOf(Object)}. */
    @Getter private final String key;

    public InvalidAttributeException(String key, String message) {
        super(message);
        this.key = key;
    }
}
