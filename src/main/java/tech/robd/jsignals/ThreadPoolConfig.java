/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ThreadPoolConfig.java
 description: Construction settings for a ThreadPool, including the system-property backed defaults used by
              the global pool.
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

import tech.robd.jsignals.diagnostics.Diagnostics;

import java.util.Objects;

/**
 * Settings for {@link ThreadPool}.
 *
 * <p>{@link #fromSystemProperties()} reads:
 * <ul>
 *   <li>{@code jsignals.pool.threads}: worker thread count (default: available processors)</li>
 *   <li>{@code jsignals.pool.name}: thread name prefix (default {@code jsignals-pool})</li>
 * </ul>
 * Invalid values are logged and replaced by the default.</p>
 *
 * @param numThreads fixed number of pool threads
 * @param threadName prefix for pool thread names; threads are named {@code prefix-N}
 * @param daemon     whether pool threads are daemon threads
 */
public record ThreadPoolConfig(int numThreads, String threadName, boolean daemon) {

    private static final Diagnostics DIAG = Diagnostics.of(ThreadPoolConfig.class);

    public static final String THREADS_PROPERTY_NAME = "jsignals.pool.threads";
    public static final String NAME_PROPERTY_NAME = "jsignals.pool.name";
    public static final String DEFAULT_THREAD_NAME = "jsignals-pool";

    public ThreadPoolConfig {
        Objects.requireNonNull(threadName, "threadName cannot be null");
        if (numThreads <= 0) throw new IllegalArgumentException("numThreads must be positive, was " + numThreads);
        if (threadName.isBlank()) throw new IllegalArgumentException("threadName cannot be blank");
    }

    public static ThreadPoolConfig defaults() {
        return new ThreadPoolConfig(defaultThreadCount(), DEFAULT_THREAD_NAME, true);
    }

    public static ThreadPoolConfig withThreads(int numThreads) {
        return new ThreadPoolConfig(numThreads, DEFAULT_THREAD_NAME, true);
    }

    public ThreadPoolConfig withName(String threadName) {
        return new ThreadPoolConfig(numThreads, threadName, daemon);
    }

    public ThreadPoolConfig withDaemon(boolean daemon) {
        return new ThreadPoolConfig(numThreads, threadName, daemon);
    }

    public static ThreadPoolConfig fromSystemProperties() {
        int threads = defaultThreadCount();
        String raw = System.getProperty(THREADS_PROPERTY_NAME);
        if (raw != null) {
            try {
                int parsed = Integer.parseInt(raw.trim());
                if (parsed > 0) {
                    threads = parsed;
                } else {
                    DIAG.warn("{}={} is not positive, using {}", THREADS_PROPERTY_NAME, raw, threads);
                }
            } catch (NumberFormatException e) {
                DIAG.warn("{}={} is not a number, using {}", THREADS_PROPERTY_NAME, raw, threads);
            }
        }
        String name = System.getProperty(NAME_PROPERTY_NAME, DEFAULT_THREAD_NAME);
        if (name.isBlank()) name = DEFAULT_THREAD_NAME;
        return new ThreadPoolConfig(threads, name, true);
    }

    private static int defaultThreadCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
