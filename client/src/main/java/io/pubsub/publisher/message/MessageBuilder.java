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
package io.pubsub.publisher.message;

import io.pubsub.publisher.api.Message;
import io.pubsub.publisher.api.exceptions.InvalidAttributeException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.NonNull;

/**
 * Builds outbound messages, applying the static attributes configured for the publisher. Attribute
 * keys and values must be strings.
 */
public final class MessageBuilder {

    private static final byte[] EMPTY_PAYLOAD = new byte[0];

    @Getter private final Map<String, String> staticAttributes;

    private MessageBuilder(Map<String, String> staticAttributes) {
        this.staticAttributes = staticAttributes;
    }

    /**
     * Creates a builder for the given static attributes. Building an empty message with them must
     * succeed, so a misconfiguration is reported here rather than on the first publish.
     *
     * @param staticAttributes the attributes added to every message.
     * @return the builder.
     * @throws InvalidAttributeException if a static attribute key or value is not a string.
     */
    public static @NonNull MessageBuilder create(@NonNull Map<?, ?> staticAttributes)
            throws InvalidAttributeException {
        var builder = new MessageBuilder(Collections.emptyMap());
        var selfTest = builder.build(EMPTY_PAYLOAD, staticAttributes);
        return new MessageBuilder(selfTest.attributes());
    }

    public @NonNull Message build(byte @NonNull [] payload) {
        return new Message(payload, staticAttributes);
    }

    /**
     * Builds a message whose attributes are the static attributes overlaid with {@code attributes}.
     *
     * @throws InvalidAttributeException naming the first key whose key or value is not a string.
     */
    public @NonNull Message build(byte @NonNull [] payload, @NonNull Map<?, ?> attributes)
            throws InvalidAttributeException {
        if (attributes.isEmpty()) {
            return build(payload);
        }
        var merged = new LinkedHashMap<>(staticAttributes);
        for (var e : attributes.entrySet()) {
            var key = e.getKey();
            var value = e.getValue();
            if (!(key instanceof String k)) {
                throw new InvalidAttributeException(
                        String.valueOf(key),
                        "Attribute key must be a string, got " + typeOf(key) + ": " + key);
            }
            if (!(value instanceof String v)) {
                throw new InvalidAttributeException(
                        k, "Attribute '" + k + "' must have a string value, got " + typeOf(value));
            }
            merged.put(k, v);
        }
        return new Message(payload, merged);
    }

    private static String typeOf(Object o) {
        return o == null ? "null" : o.getClass().getSimpleName();
    }
}
