/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/fn/TaskHandle.java
 description: Completion cell of a spawned task. Yields Optional.of(result) on normal completion, empty on
              failure, rejection or abandonment.
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

package tech.robd.jsignals.fn;

import tech.robd.jsignals.CancellationToken;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a task submitted to a {@code ThreadPool}.
 *
 * <p>The handle is populated exactly once. {@link #await()} returns:
 * <ul>
 *   <li>{@code Optional.of(value)} when the task returned a non-null value,</li>
 *   <li>{@code Optional.empty()} when it threw, was rejected by a shut-down pool,
 *       or returned {@code null}.</li>
 * </ul>
 * There is no implicit timeout; use {@link #await(Duration)} for one.
 *
 * @param <T> result type
 */
public interface TaskHandle<T> {

    /**
     * @return process-unique id of the task
     */
    long id();

    /**
     * @return {@code true} once the task has completed in any way
     */
    boolean isFinished();

    /**
     * Non-blocking read.
     *
     * @return the result if the task already completed normally, otherwise empty
     */
    Optional<T> tryGet();

    /**
     * Block until the task completes.
     *
     * <p>If the waiting thread is interrupted, the interrupt flag is restored and empty is returned.</p>
     */
    Optional<T> await();

    /**
     * Block up to {@code timeout}.
     *
     * @return the result, or empty on timeout, failure or interrupt
     */
    Optional<T> await(Duration timeout);

    /**
     * Ask the task to stop through its token. Advisory only.
     *
     * @return {@code true} if this call performed the cancellation
     */
    boolean cancel();

    CancellationToken cancellationToken();

    /**
     * @return the exception the task ended with, if it failed
     */
    Optional<Throwable> failure();

    /**
     * @return the underlying future; completes exceptionally when the task failed
     */
    CompletableFuture<T> result();
}
