/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/WorkerConfig.java
 description: Construction settings for a Worker: thread name, queue capacity and daemon flag.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/

/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

package tech.robd.jsignals;

import java.util.Objects;

/**
 * Settings for {@link Worker}.
 *
 * @param name          name of the worker thread
 * @param queueCapacity maximum number of tasks waiting to run; {@code send} refuses beyond it
 * @param daemon        whether the worker thread is a daemon thread
 */
public record WorkerConfig(String name, int queueCapacity, boolean daemon) {

    public static final String DEFAULT_NAME = "jsignals-worker";
    public static final int DEFAULT_QUEUE_CAPACITY = 256;

    public WorkerConfig {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) throw new IllegalArgumentException("name cannot be blank");
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be positive, was " + queueCapacity);
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig(DEFAULT_NAME, DEFAULT_QUEUE_CAPACITY, true);
    }

    public static WorkerConfig named(String name) {
        return new WorkerConfig(name, DEFAULT_QUEUE_CAPACITY, true);
    }

    public WorkerConfig withName(String name) {
        return new WorkerConfig(name, queueCapacity, daemon);
    }

    public WorkerConfig withQueueCapacity(int queueCapacity) {
        return new WorkerConfig(name, queueCapacity, daemon);
    }

    public WorkerConfig withDaemon(boolean daemon) {
        return new WorkerConfig(name, queueCapacity, daemon);
    }
}
