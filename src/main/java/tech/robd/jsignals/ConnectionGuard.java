/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ConnectionGuard.java
 description: Scoped connection: disconnects exactly once on close()/dispose(), holding its signal weakly.
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

import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection tied to a scope. Use it with try-with-resources:
 *
 * <pre>{@code
 * try (ConnectionGuard guard = signal.connectScoped(v -> render(v))) {
 *     ...
 * } // disconnected here
 * }</pre>
 *
 * <p>The first {@link #dispose()} or {@link #close()} disconnects; later calls do nothing.
 * The guard does not keep its signal reachable. If the signal has already been
 * collected, disposal is a no-op.</p>
 *
 * <p>A guard that is never disposed leaves its connection in place for the lifetime
 * of the signal.</p>
 */
public final class ConnectionGuard implements AutoCloseable {

    private static final Diagnostics DIAG = Diagnostics.of(ConnectionGuard.class);

    private final WeakReference<Signal<?>> signal;
    private final ConnectionId id;
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    ConnectionGuard(Signal<?> signal, ConnectionId id) {
        this.signal = new WeakReference<>(signal);
        this.id = id;
    }

    /**
     * Disconnect now.
     *
     * @return {@code true} if this call removed a live connection
     */
    public boolean dispose() {
        if (!disposed.compareAndSet(false, true)) return false;
        Signal<?> target = signal.get();
        if (target == null) {
            DIAG.debug("guard {} disposed after its signal was collected", id);
            return false;
        }
        return target.disconnect(id);
    }

    @Override
    public void close() {
        dispose();
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public ConnectionId id() {
        return id;
    }

    @Override
    public String toString() {
        return "ConnectionGuard[" + id + (disposed.get() ? ", disposed" : "") + "]";
    }
}
