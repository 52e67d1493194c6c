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
package io.pubsub.publisher.internal;

import io.pubsub.publisher.api.PublisherBuilder;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

public class DefaultImplementation {
    private static final Constructor<?> CONSTRUCTOR;

    private static final String IMPL_CLASS_NAME = "io.pubsub.publisher.PublisherBuilderImpl";

    static {
        Constructor<?> impl;
        try {
            impl =
                    Class.forName(IMPL_CLASS_NAME, true, DefaultImplementation.class.getClassLoader())
                            .getConstructor(String.class, String.class);
        } catch (Throwable error) {
            throw new RuntimeException("Cannot load Publisher Implementation: " + error, error);
        }
        CONSTRUCTOR = impl;
    }

    /**
     * Access the actual implementation of the Publisher API.
     *
     * @return the loaded implementation.
     */
    public static PublisherBuilder getDefaultImplementation(String projectId, String topic) {
        try {
            return (PublisherBuilder) CONSTRUCTOR.newInstance(projectId, topic);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException(e.getCause());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
