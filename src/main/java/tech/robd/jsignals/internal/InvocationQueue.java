/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/internal/InvocationQueue.java
 description: Per-thread FIFO of deferred invocations. Drained only by its own thread; closing it abandons
              pending items and refuses new ones.
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

package tech.robd.jsignals.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.jsignals.diagnostics.Diagnostics;

import java.lang.ref.WeakReference;
import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deferred delivery queue belonging to exactly one thread.
 *
 * <p>Any thread may {@link #post(QueuedInvocation)}; only the owning thread drains.
 * Items run in the order they were posted. A drain pass only runs the items present
 * when it started, so a slot that re-posts to its own thread cannot starve the caller.</p>
 */
public final class InvocationQueue {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(InvocationQueue.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final long threadId;
    private final String threadName;
    private final WeakReference<Thread> thread;
    private final LinkedBlockingQueue<QueuedInvocation> items = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile @Nullable Runnable wakeup;
    // [/🧩 Section: state]

    InvocationQueue(Thread owner) {
        this.threadId = owner.getId();
        this.threadName = owner.getName();
        this.thread = new WeakReference<>(owner);
    }

    // 🧩 Section: posting

    /**
     * Append an invocation.
     *
     * @return {@code false} if the queue is closed or its thread has terminated
     */
    public boolean post(QueuedInvocation invocation) {
        if (!isDestinationAlive()) {
            DIAG.debug("queue[{}] refused {}: destination gone", threadName, invocation);
            return false;
        }
        items.offer(invocation);
        // 🧩 Point: posting/close-race
        if (closed.get() && items.remove(invocation)) {
            return false;
        }
        Runnable hook = wakeup;
        if (hook != null) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                DIAG.error("queue[{}] wakeup hook failed: {}", threadName, e.toString(), e);
            }
        }
        return true;
    }

    /**
     * Install a hook that runs after every successful post, on the posting thread.
     * Run loops use it to wake up; the hook must be fast and must not block.
     */
    public void setWakeup(@Nullable Runnable hook) {
        this.wakeup = hook;
    }

    /**
     * Remove an invocation that has not started yet.
     */
    public boolean withdraw(QueuedInvocation invocation) {
        return items.remove(invocation);
    }
    // [/🧩 Section: posting]

    // 🧩 Section: draining

    /**
     * Run every invocation present when the call began, in FIFO order.
     *
     * @return how many invocations ran
     */
    public int drain() {
        int budget = items.size();
        int ran = 0;
        QueuedInvocation next;
        while (ran < budget && (next = items.poll()) != null) {
            next.execute();
            ran++;
        }
        if (ran > 0) DIAG.debug("queue[{}] drained {}", threadName, ran);
        return ran;
    }

    /**
     * Wait up to {@code maxWait} for the first invocation, then drain.
     *
     * @return how many invocations ran; 0 on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public int drain(Duration maxWait) throws InterruptedException {
        QueuedInvocation first = items.poll(maxWait.toNanos(), TimeUnit.NANOSECONDS);
        if (first == null) return 0;
        first.execute();
        return 1 + drain();
    }

    public int pending() {
        return items.size();
    }
    // [/🧩 Section: draining]

    // 🧩 Section: lifecycle

    /**
     * Close the queue: new posts are refused and pending invocations are abandoned,
     * which releases any emitter blocked on one of them.
     *
     * @return how many pending invocations were abandoned
     */
    public int close() {
        if (!closed.compareAndSet(false, true)) return 0;
        int dropped = 0;
        QueuedInvocation next;
        while ((next = items.poll()) != null) {
            if (next.abandon("queue of thread '" + threadName + "' closed")) dropped++;
        }
        DIAG.debug("queue[{}] closed, abandoned {}", threadName, dropped);
        return dropped;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return {@code true} while the queue is open and its thread has not terminated
     */
    public boolean isDestinationAlive() {
        return !closed.get() && threadAlive();
    }

    /**
     * @return {@code true} unless the owning thread has terminated or been collected
     */
    public boolean threadAlive() {
        Thread t = thread.get();
        return t != null && t.getState() != Thread.State.TERMINATED;
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: info
    public long threadId() {
        return threadId;
    }

    public String threadName() {
        return threadName;
    }

    @Override
    public String toString() {
        return "InvocationQueue[" + threadName + " id=" + threadId + ", pending=" + items.size()
                + (closed.get() ? ", CLOSED" : "") + "]";
    }
    // [/🧩 Section: info]
}
