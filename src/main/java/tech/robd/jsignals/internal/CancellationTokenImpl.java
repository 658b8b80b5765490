/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/internal/CancellationTokenImpl.java
 description: Default CancellationToken: atomic flag, at-most-once callbacks, and weakly-held children that
              are cancelled with their parent.
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

import tech.robd.jsignals.CancellationToken;
import tech.robd.jsignals.diagnostics.Diagnostics;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default {@link CancellationToken}.
 *
 * <p>The flag is one {@link AtomicBoolean}. Callbacks are wrapped so each runs at most
 * once even when registration races with {@link #cancel()}. Children are tracked through
 * weak references so a long-lived parent (a worker's or pool's token) does not pin every
 * task token it ever handed out.</p>
 */
public final class CancellationTokenImpl implements CancellationToken {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(CancellationTokenImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private static final int MIN_PRUNE_INTERVAL = 64;

    private final int tokId = System.identityHashCode(this);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final ConcurrentLinkedQueue<Callback> callbacks = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<WeakReference<CancellationTokenImpl>> children = new ConcurrentLinkedQueue<>();
    private final AtomicInteger childrenSincePrune = new AtomicInteger();
    private volatile int pruneInterval = MIN_PRUNE_INTERVAL;
    // [/🧩 Section: state]

    // 🧩 Section: callback

    /**
     * At-most-once holder for a registered callback.
     */
    private static final class Callback {
        private final AtomicReference<Runnable> action;

        Callback(Runnable action) {
            this.action = new AtomicReference<>(action);
        }

        void fire() {
            Runnable r = action.getAndSet(null);
            if (r != null) r.run();
        }

        void clear() {
            action.set(null);
        }
    }
    // [/🧩 Section: callback]

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    // 🧩 Section: registration
    @Override
    public AutoCloseable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback cannot be null");
        Callback cb = new Callback(callback);

        if (cancelled.get()) {
            safeFire(cb, "onCancel-immediate");
            return () -> {
            };
        }

        callbacks.offer(cb);

        // 🧩 Point: registration/race-with-cancel
        if (cancelled.get() && callbacks.remove(cb)) {
            safeFire(cb, "onCancel-race");
        }

        return () -> {
            if (callbacks.remove(cb)) cb.clear();
        };
    }
    // [/🧩 Section: registration]

    // 🧩 Section: child
    @Override
    public CancellationToken child() {
        CancellationTokenImpl child = new CancellationTokenImpl();
        children.offer(new WeakReference<>(child));
        if (cancelled.get()) {
            child.cancel();
        } else if (childrenSincePrune.incrementAndGet() >= pruneInterval) {
            pruneChildren();
        }
        DIAG.debug("tok#{} child tok#{}", tokId, child.tokId);
        return child;
    }

    /**
     * Drop references to collected children. The interval grows with the surviving set,
     * so each {@link #child()} costs amortised O(1) however many children stay alive.
     */
    private void pruneChildren() {
        childrenSincePrune.set(0);
        children.removeIf(ref -> ref.get() == null);
        pruneInterval = Math.max(MIN_PRUNE_INTERVAL, children.size());
    }
    // [/🧩 Section: child]

    // 🧩 Section: cancel
    @Override
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        DIAG.debug("tok#{} cancel: callbacks={} children={}", tokId, callbacks.size(), children.size());

        Callback cb;
        while ((cb = callbacks.poll()) != null) {
            safeFire(cb, "cancel-callback");
        }

        WeakReference<CancellationTokenImpl> ref;
        while ((ref = children.poll()) != null) {
            CancellationTokenImpl child = ref.get();
            if (child != null) child.cancel();
        }
        return true;
    }

    private void safeFire(Callback cb, String where) {
        try {
            cb.fire();
        } catch (RuntimeException e) {
            DIAG.error("tok#{} callback error @{}: {}", tokId, where, e.toString(), e);
        }
    }
    // [/🧩 Section: cancel]

    // 🧩 Section: introspection
    int pendingCallbackCount() {
        return callbacks.size();
    }

    int trackedChildCount() {
        return children.size();
    }

    int liveChildCount() {
        int n = 0;
        for (WeakReference<CancellationTokenImpl> r : children) {
            if (r.get() != null) n++;
        }
        return n;
    }

    @Override
    public String toString() {
        return cancelled.get()
                ? "CancellationToken[CANCELLED]"
                : "CancellationToken[ACTIVE, callbacks=" + callbacks.size() + "]";
    }
    // [/🧩 Section: introspection]
}
