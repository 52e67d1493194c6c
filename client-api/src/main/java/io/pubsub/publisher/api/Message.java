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
package io.pubsub.publisher.api;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.NonNull;

/**
 * An outbound message.
 *
 * @param payload the message body.
 * @param attributes the message attributes, in insertion order.
 */
public record Message(byte @NonNull [] payload, @NonNull Map<String, String> attributes) {

    public Message {
        payload = payload.clone();
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Returns a copy of the payload. */
    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadSize() {
        return payload.length;
    }

    /**
     * The number of bytes this message contributes to a publish request: the payload plus the
     * UTF-8 encoded attribute keys and values.
     */
    public long serializedSize() {
        long size = payload.length;
        for (var e : attributes.entrySet()) {
            size += e.getKey().getBytes(UTF_8).length;
            size += e.getValue().getBytes(UTF_8).length;
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message other)) {
            return false;
        }
        return Arrays.equals(payload, other.payload) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(payload) + attributes.hashCode();
    }

    @Override
    public String toString() {
        return "Message{payloadSize=" + payload.length + ", attributes=" + attributes + "}";
    }
}
