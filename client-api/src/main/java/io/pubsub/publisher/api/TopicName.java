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

import lombok.NonNull;

/**
 * The destination of a publisher.
 *
 * @param projectId the project that owns the topic (name, not number).
 * @param topic the topic name. The topic must already exist.
 */
public record TopicName(@NonNull String projectId, @NonNull String topic) {

    private static final String PREFIX = "projects/";
    private static final String TOPICS = "/topics/";

    public TopicName {
        if (projectId.isEmpty()) {
            throw new IllegalArgumentException("projectId must not be empty");
        }
        if (topic.isEmpty()) {
            throw new IllegalArgumentException("topic must not be empty");
        }
    }

    public static @NonNull TopicName of(@NonNull String projectId, @NonNull String topic) {
        return new TopicName(projectId, topic);
    }

    /**
     * Parses a fully qualified topic name of the form {@code projects/<project>/topics/<topic>}.
     *
     * @param fullName the fully qualified name.
     * @return the parsed topic name.
     */
    public static @NonNull TopicName parse(@NonNull String fullName) {
        int topicsIndex = fullName.indexOf(TOPICS);
        if (!fullName.startsWith(PREFIX) || topicsIndex < 0) {
            throw new IllegalArgumentException("Invalid topic name: " + fullName);
        }
        return new TopicName(
                fullName.substring(PREFIX.length(), topicsIndex),
                fullName.substring(topicsIndex + TOPICS.length()));
    }

    @Override
    public String toString() {
        return PREFIX + projectId + TOPICS + topic;
    }
}
