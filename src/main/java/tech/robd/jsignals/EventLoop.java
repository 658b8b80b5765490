/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/EventLoop.java
 description: Public entry point for run loops: drains the calling thread's deferred deliveries, posts work to
              the owner or any thread, and shuts a thread's queue.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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

import org.jspecify.annotations.Nullable;
import tech.robd.jsignals.diagnostics.Diagnostics;
import tech.robd.jsignals.internal.InvocationQueue;
import tech.robd.jsignals.internal.InvocationQueues;
import tech.robd.jsignals.internal.QueuedInvocation;

import java.time.Duration;
import java.util.Objects;

/**
 * Static access to per-thread deferred delivery queues.
 *
 * <p>A run loop on the owner thread calls {@link #processPendingEvents()} on every
 * iteration. Any other thread that subscribes with {@link ConnectionType#QUEUED} or
 * {@link ConnectionType#AUTO} does the same for its own queue. Queued items are run
 * in the order they were posted to that thread.</p>
 *
 * <pre>{@code
 * ThreadRoles.designateOwnerThread();
 * EventLoop.onEventsPosted(platform::wake);
 * while (running) {
 *     platform.pollInput();
 *     EventLoop.processPendingEvents();
 *     platform.repaint();
 * }
 * }</pre>
 */
public final class EventLoop {

    private static final Diagnostics DIAG = Diagnostics.of(EventLoop.class);

    private EventLoop() {
    }

    // 🧩 Section: draining

    /**
     * Run every deferred delivery queued for the calling thread when the call began.
     *
     * @return number of deliveries executed
     */
    public static int processPendingEvents() {
        return InvocationQueues.forCurrentThread().drain();
    }

    /**
     * Wait up to {@code maxWait} for the first deferred delivery, then drain.
     *
     * @param maxWait upper bound on the wait; zero or negative means do not wait
     * @return number of deliveries executed, 0 if nothing arrived in time
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public static int processPendingEvents(Duration maxWait) throws InterruptedException {
        Objects.requireNonNull(maxWait, "maxWait cannot be null");
        return InvocationQueues.forCurrentThread().drain(maxWait);
    }

    /**
     * @return how many deliveries wait in the calling thread's queue
     */
    public static int pendingEvents() {
        InvocationQueue queue = InvocationQueues.lookup(Thread.currentThread().getId());
        return queue == null ? 0 : queue.pending();
    }

    /**
     * Register a hook run (on the posting thread) whenever something is queued for the
     * calling thread. Pass {@code null} to remove it.
     */
    public static void onEventsPosted(@Nullable Runnable hook) {
        InvocationQueues.forCurrentThread().setWakeup(hook);
    }
    // [/🧩 Section: draining]

    // 🧩 Section: posting

    /**
     * Queue {@code action} for the owner thread. Before any owner is designated the
     * action runs immediately on the calling thread.
     *
     * @return {@code false} if the owner thread no longer accepts deliveries
     */
    public static boolean post(Runnable action) {
        Objects.requireNonNull(action, "action cannot be null");
        Thread owner = ThreadRoles.ownerThread();
        if (owner == null) {
            DIAG.warn("no owner thread designated; running posted action inline");
            action.run();
            return true;
        }
        return postTo(owner, action);
    }

    /**
     * Queue {@code action} for {@code thread}. It runs when that thread next drains.
     *
     * @return {@code false} if the thread shut its queue or has terminated
     */
    public static boolean postTo(Thread thread, Runnable action) {
        Objects.requireNonNull(thread, "thread cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        return InvocationQueues.forThread(thread).post(QueuedInvocation.of(action));
    }
    // [/🧩 Section: posting]

    // 🧩 Section: lifecycle

    /**
     * Stop accepting deliveries for the calling thread. Pending deliveries are dropped,
     * emitters blocked on them fail with {@link DeliveryException}, and later posts are refused.
     *
     * @return number of pending deliveries dropped
     */
    public static int shutdownCurrentThread() {
        int dropped = InvocationQueues.forCurrentThread().close();
        DIAG.debug("thread '{}' shut its queue, dropped {}", Thread.currentThread().getName(), dropped);
        return dropped;
    }

    /**
     * @return {@code true} if {@code thread} still accepts queued deliveries
     */
    public static boolean isAccepting(Thread thread) {
        InvocationQueue queue = InvocationQueues.lookup(thread.getId());
        if (queue == null) return thread.getState() != Thread.State.TERMINATED;
        return queue.isDestinationAlive();
    }
    // [/🧩 Section: lifecycle]
}
