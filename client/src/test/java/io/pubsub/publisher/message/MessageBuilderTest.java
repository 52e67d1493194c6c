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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pubsub.publisher.api.exceptions.InvalidAttributeException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageBuilderTest {

    static final byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);

    @Test
    void staticAttributesOnly() throws Exception {
        var builder = MessageBuilder.create(Map.of("env", "prod"));
        var message = builder.build(payload);
        assertThat(message.payload()).isEqualTo(payload);
        assertThat(message.attributes()).containsExactly(Map.entry("env", "prod"));
    }

    @Test
    void perCallAttributesOverrideStaticOnes() throws Exception {
        var staticAttributes = new LinkedHashMap<String, String>();
        staticAttributes.put("env", "prod");
        staticAttributes.put("host", "a");
        var builder = MessageBuilder.create(staticAttributes);

        var message = builder.build(payload, Map.of("host", "b", "trace", "123"));

        assertThat(message.attributes())
                .containsOnly(Map.entry("env", "prod"), Map.entry("host", "b"), Map.entry("trace", "123"));
        assertThat(builder.getStaticAttributes()).containsEntry("host", "a");
    }

    @Test
    void nonStringStaticValueFailsTheSelfTest() {
        assertThatThrownBy(() -> MessageBuilder.create(Map.of("k", 123)))
                .isInstanceOf(InvalidAttributeException.class)
                .hasMessageContaining("'k'")
                .extracting(e -> ((InvalidAttributeException) e).getKey())
                .isEqualTo("k");
    }

    @Test
    void nonStringKey() throws Exception {
        var builder = MessageBuilder.create(Map.of());
        assertThatThrownBy(() -> builder.build(payload, Map.of(42, "v")))
                .isInstanceOf(InvalidAttributeException.class)
                .extracting(e -> ((InvalidAttributeException) e).getKey())
                .isEqualTo("42");
    }

    @Test
    void nullValue() throws Exception {
        var builder = MessageBuilder.create(Map.of());
        var attributes = new HashMap<String, String>();
        attributes.put("k", null);
        assertThatThrownBy(() -> builder.build(payload, attributes))
                .isInstanceOf(InvalidAttributeException.class)
                .hasMessageContaining("null");
    }

    @Test
    void nullKey() throws Exception {
        var builder = MessageBuilder.create(Map.of());
        var attributes = new HashMap<String, String>();
        attributes.put(null, "v");
        assertThatThrownBy(() -> builder.build(payload, attributes))
                .isInstanceOf(InvalidAttributeException.class)
                .extracting(e -> ((InvalidAttributeException) e).getKey())
                .isEqualTo("null");
    }

    @Test
    void emptyPayload() throws Exception {
        var message = MessageBuilder.create(Map.of()).build(new byte[0]);
        assertThat(message.payloadSize()).isZero();
        assertThat(message.serializedSize()).isZero();
    }
}
