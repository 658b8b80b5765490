/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/CancellationToken.java
 description: Cooperative cancellation flag shared between a task and whoever may ask it to stop. Write-once,
              idempotent, with callbacks and child tokens.
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

import tech.robd.jsignals.internal.CancellationTokenImpl;

/**
 * A shared "please stop" flag.
 *
 * <p>Tasks poll {@link #isCancelled()} and return early; nothing is ever interrupted or
 * preempted. The flag only moves from not-cancelled to cancelled, and repeated
 * {@link #cancel()} calls are harmless, including after the task has finished.</p>
 *
 * <p>Tokens form a tree: cancelling a parent cancels every {@link #child()}, while a
 * child may be cancelled alone.</p>
 */
public interface CancellationToken {

    /**
     * @return {@code true} once cancelled. A single volatile read; cheap enough for hot loops.
     */
    boolean isCancelled();

    /**
     * Request cancellation, running registered callbacks and cancelling children.
     *
     * @return {@code true} only for the call that performed the transition
     */
    boolean cancel();

    /**
     * Register a callback for cancellation. If already cancelled, it runs immediately on
     * the calling thread. Callbacks should be short and must not block.
     *
     * @return a registration whose {@code close()} removes the callback
     */
    AutoCloseable onCancel(Runnable callback);

    /**
     * @return a new token cancelled together with this one
     */
    CancellationToken child();

    /**
     * @return a fresh, not-cancelled token
     */
    static CancellationToken create() {
        return new CancellationTokenImpl();
    }

    /**
     * @return a token that is never cancelled
     */
    static CancellationToken none() {
        return NeverCancelledToken.INSTANCE;
    }

    /**
     * @return a token that is already cancelled
     */
    static CancellationToken cancelled() {
        return PreCancelledToken.INSTANCE;
    }
}
