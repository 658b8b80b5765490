/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/Signal.java
 description: Typed many-subscriber emission point. Routes each emitted value to live connections as direct,
              queued, blocking-queued or auto deliveries.
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
import tech.robd.jsignals.internal.ConnectionRegistry;
import tech.robd.jsignals.internal.ConnectionRegistry.Entry;
import tech.robd.jsignals.internal.InvocationQueue;
import tech.robd.jsignals.internal.InvocationQueues;
import tech.robd.jsignals.internal.QueuedInvocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A typed publish/subscribe point.
 *
 * <p>Subscribers {@link #connect(Slot) connect} a {@link Slot} with a {@link ConnectionType}
 * and a {@link ThreadAffinity}; {@link #emit(Object)} hands the value to every connection
 * alive when the emit starts:
 * <ul>
 *   <li>{@link ConnectionType#DIRECT}: called on the emitting thread, in connection order.</li>
 *   <li>{@link ConnectionType#AUTO}: direct if the emitting thread satisfies the affinity, else queued.</li>
 *   <li>{@link ConnectionType#QUEUED}: posted to the destination thread's queue.</li>
 *   <li>{@link ConnectionType#BLOCKING_QUEUED}: posted, then the emitter waits for it to run.
 *       Runs inline if the destination is the emitting thread.</li>
 * </ul>
 *
 * <p>The destination of a queued delivery is the affinity's thread; for
 * {@link ThreadAffinity#none()} and {@link ThreadAffinity#ownerThread()} it is the owner thread
 * from {@link ThreadRoles}. With no destination at all, the slot runs inline and a warning is logged.</p>
 *
 * <p>Connect, disconnect and emit may race freely from any threads. A slot that
 * disconnects (itself or another connection) during an emit is never called after the
 * disconnect returns; connections made during an emit first see the next emit.</p>
 *
 * <p>Re-entrant emission from inside a slot is allowed and not bounded here.</p>
 *
 * @param <T> the value type
 */
public final class Signal<T> {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(Signal.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state

    /**
     * Interval at which a blocked emitter re-checks that its destination is still alive.
     */
    static final long LIVENESS_POLL_MILLIS = 50;

    private final ConnectionRegistry<T> registry = new ConnectionRegistry<>();
    private final AtomicBoolean blocked = new AtomicBoolean(false);
    private final String name;
    // [/🧩 Section: state]

    public Signal() {
        this(null);
    }

    /**
     * @param name label used in diagnostics only
     */
    public Signal(@Nullable String name) {
        this.name = name == null ? "signal#" + registry.registryId() : name;
    }

    // 🧩 Section: connect

    /**
     * Connect with {@link ConnectionType#AUTO}, bound to the calling thread.
     */
    public ConnectionId connect(Slot<T> slot) {
        return connect(slot, ConnectionType.AUTO);
    }

    /**
     * Connect with the given type, bound to the calling thread.
     */
    public ConnectionId connect(Slot<T> slot, ConnectionType type) {
        return connect(slot, type, ThreadAffinity.current());
    }

    /**
     * Connect with an explicit affinity.
     *
     * @param slot     the subscriber
     * @param type     delivery semantics
     * @param affinity the thread the slot must run on for non-direct deliveries
     * @return a fresh id, unique within this signal
     */
    public ConnectionId connect(Slot<T> slot, ConnectionType type, ThreadAffinity affinity) {
        Objects.requireNonNull(slot, "slot cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(affinity, "affinity cannot be null");
        ConnectionId id = registry.add(slot, type, affinity);
        DIAG.debug("{} connect {} type={} affinity={}", name, id, type, affinity);
        return id;
    }

    /**
     * Connect with {@link ConnectionType#AUTO} and return a guard that disconnects when closed.
     */
    public ConnectionGuard connectScoped(Slot<T> slot) {
        return connectScoped(slot, ConnectionType.AUTO);
    }

    public ConnectionGuard connectScoped(Slot<T> slot, ConnectionType type) {
        return new ConnectionGuard(this, connect(slot, type));
    }

    /**
     * @return {@code true} if the connection was alive and is now disconnected;
     * {@code false} for unknown, foreign or already-disconnected ids
     */
    public boolean disconnect(ConnectionId id) {
        boolean removed = registry.remove(id);
        DIAG.debug("{} disconnect {} -> {}", name, id, removed);
        return removed;
    }

    public void disconnectAll() {
        int removed = registry.clear();
        DIAG.debug("{} disconnectAll removed={}", name, removed);
    }

    public int connectionCount() {
        return registry.size();
    }

    public boolean isConnected(ConnectionId id) {
        return registry.contains(id);
    }
    // [/🧩 Section: connect]

    // 🧩 Section: blocking
    public void setBlocked(boolean blocked) {
        this.blocked.set(blocked);
    }

    public boolean isBlocked() {
        return blocked.get();
    }
    // [/🧩 Section: blocking]

    // 🧩 Section: emit

    /**
     * Deliver {@code value} to every connection alive right now. Does nothing while blocked.
     *
     * <p>A {@link RuntimeException} thrown by one slot does not stop delivery to the others;
     * once every connection has been served the first failure is rethrown with the rest
     * attached as suppressed exceptions.</p>
     *
     * @throws DeliveryException if a blocking delivery's destination stopped accepting
     *                           deliveries, or the emitter was interrupted while waiting
     */
    public void emit(T value) {
        if (blocked.get()) {
            DIAG.debug("{} blocked, skipping emit", name);
            return;
        }

        List<Entry<T>> snapshot = registry.snapshot();
        DIAG.debug("{} emit to {} connection(s)", name, snapshot.size());

        List<PendingDelivery> waiting = null;
        RuntimeException failure = null;

        for (Entry<T> entry : snapshot) {
            if (!entry.isAlive()) continue;
            try {
                switch (entry.type()) {
                    case DIRECT -> entry.invokeIfAlive(value);
                    case AUTO -> {
                        if (entry.affinity().isSameThread()) {
                            entry.invokeIfAlive(value);
                        } else {
                            enqueue(entry, value);
                        }
                    }
                    case QUEUED -> enqueue(entry, value);
                    case BLOCKING_QUEUED -> {
                        PendingDelivery pending = enqueueBlocking(entry, value);
                        if (pending != null) {
                            if (waiting == null) waiting = new ArrayList<>();
                            waiting.add(pending);
                        }
                    }
                }
            } catch (RuntimeException e) {
                failure = accumulate(failure, e);
            }
        }

        // 🧩 Point: emit/await-blocking
        if (waiting != null) {
            for (PendingDelivery pending : waiting) {
                try {
                    pending.await();
                } catch (RuntimeException e) {
                    failure = accumulate(failure, e);
                }
            }
        }

        if (failure != null) throw failure;
    }

    /**
     * Post {@code value} to every live connection's destination queue, whatever its type.
     * Never invokes a slot inline and never waits.
     *
     * @return number of deliveries posted; 0 while blocked
     */
    public int emitQueued(T value) {
        if (blocked.get()) return 0;
        int count = 0;
        for (Entry<T> entry : registry.snapshot()) {
            if (entry.isAlive() && enqueue(entry, value)) count++;
        }
        return count;
    }

    private static RuntimeException accumulate(@Nullable RuntimeException first, RuntimeException next) {
        if (first == null) return next;
        if (first != next) first.addSuppressed(next);
        return first;
    }
    // [/🧩 Section: emit]

    // 🧩 Section: routing

    /**
     * @return {@code true} if the delivery was posted or run inline
     */
    private boolean enqueue(Entry<T> entry, T value) {
        Thread destination = destinationOf(entry);
        if (destination == null) {
            if (entry.affinity().isNone() || entry.affinity().isOwnerThreadAffinity()) {
                DIAG.warn("{} no owner thread for queued {}, running inline", name, entry.id());
                entry.invokeIfAlive(value);
                return true;
            }
            DIAG.warn("{} destination of {} is gone, dropping delivery", name, entry.id());
            return false;
        }
        boolean posted = InvocationQueues.forThread(destination)
                .post(QueuedInvocation.of(() -> entry.invokeIfAlive(value)));
        if (!posted) {
            DIAG.warn("{} thread '{}' refused delivery for {}", name, destination.getName(), entry.id());
        }
        return posted;
    }

    /**
     * @return a delivery to wait for, or {@code null} if it already ran inline
     */
    private @Nullable PendingDelivery enqueueBlocking(Entry<T> entry, T value) {
        Thread destination = destinationOf(entry);
        if (destination == null) {
            if (entry.affinity().isNone() || entry.affinity().isOwnerThreadAffinity()) {
                DIAG.warn("{} no owner thread for blocking {}, running inline", name, entry.id());
                entry.invokeIfAlive(value);
                return null;
            }
            throw new DeliveryException("Destination thread of " + entry.id() + " on " + name + " is gone");
        }
        // 🧩 Point: routing/self-deadlock-avoidance
        if (destination == Thread.currentThread()) {
            entry.invokeIfAlive(value);
            return null;
        }
        InvocationQueue queue = InvocationQueues.forThread(destination);
        QueuedInvocation invocation = QueuedInvocation.withCompletion(() -> entry.invokeIfAlive(value));
        if (!queue.post(invocation)) {
            throw DeliveryException.destinationGone(destination.getName());
        }
        return new PendingDelivery(queue, invocation);
    }

    private static @Nullable Thread destinationOf(Entry<?> entry) {
        ThreadAffinity affinity = entry.affinity();
        if (affinity.isNone()) return ThreadRoles.ownerThread();
        return affinity.thread();
    }
    // [/🧩 Section: routing]

    // 🧩 Section: pending-delivery

    /**
     * A posted blocking delivery the emitter still has to wait for.
     */
    private record PendingDelivery(InvocationQueue queue, QueuedInvocation invocation) {

        void await() {
            CompletableFuture<Void> done = Objects.requireNonNull(invocation.completion());
            while (true) {
                try {
                    done.get(LIVENESS_POLL_MILLIS, TimeUnit.MILLISECONDS);
                    return;
                } catch (TimeoutException te) {
                    // 🧩 Point: pending-delivery/liveness
                    if (!queue.isDestinationAlive()) {
                        if (queue.withdraw(invocation)) {
                            invocation.abandon("destination thread '" + queue.threadName() + "' gone");
                        } else if (!queue.threadAlive() && !done.isDone()) {
                            throw DeliveryException.destinationGone(queue.threadName());
                        }
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new DeliveryException("Interrupted while waiting for delivery to '"
                            + queue.threadName() + "'", ie);
                } catch (ExecutionException ee) {
                    Throwable cause = ee.getCause();
                    if (cause instanceof RuntimeException re) throw re;
                    if (cause instanceof Error err) throw err;
                    throw new DeliveryException("Blocking delivery failed", cause);
                }
            }
        }
    }
    // [/🧩 Section: pending-delivery]

    @Override
    public String toString() {
        return "Signal[" + name + ", connections=" + registry.size() + (blocked.get() ? ", BLOCKED" : "") + "]";
    }
}
