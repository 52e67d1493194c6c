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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TopicNameTest {

    @Test
    void fullName() {
        var name = TopicName.of("my-project", "my-topic");
        assertThat(name.toString()).isEqualTo("projects/my-project/topics/my-topic");
        assertThat(TopicName.parse(name.toString())).isEqualTo(name);
    }

    @Test
    void emptyParts() {
        assertThatThrownBy(() -> TopicName.of("", "t")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopicName.of("p", "")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopicName.of(null, "t")).isInstanceOf(NullPointerException.class);
    }

    @Test
    void parseInvalid() {
        assertThatThrownBy(() -> TopicName.parse("my-topic"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopicName.parse("projects/p/subscriptions/s"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopicName.parse("projects//topics/t"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
