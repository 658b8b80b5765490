/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/internal/ConnectionRegistry.java
 description: Lock-guarded, insertion-ordered table of a signal's connections with O(1) disconnect and point-
              in-time snapshots for dispatch.
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

import tech.robd.jsignals.ConnectionId;
import tech.robd.jsignals.ConnectionType;
import tech.robd.jsignals.Slot;
import tech.robd.jsignals.ThreadAffinity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Subscriber table owned by one {@code Signal}.
 *
 * <p>Entries live in a map keyed by sequence number, so removal never shifts other
 * entries and iteration order stays connection order. Dispatch works on
 * {@link #snapshot()} copies taken under the lock; each {@link Entry} carries its own
 * liveness flag so a disconnect that happens mid-dispatch is seen before the entry runs.</p>
 *
 * @param <T> value type of the owning signal
 */
public final class ConnectionRegistry<T> {

    private static final AtomicLong NEXT_REGISTRY_ID = new AtomicLong(1);

    // 🧩 Section: entry

    /**
     * One connection. Only {@code alive} changes after construction.
     */
    public static final class Entry<T> {
        private final ConnectionId id;
        private final Slot<T> slot;
        private final ConnectionType type;
        private final ThreadAffinity affinity;
        private volatile boolean alive = true;

        Entry(ConnectionId id, Slot<T> slot, ConnectionType type, ThreadAffinity affinity) {
            this.id = id;
            this.slot = slot;
            this.type = type;
            this.affinity = affinity;
        }

        public ConnectionId id() {
            return id;
        }

        public Slot<T> slot() {
            return slot;
        }

        public ConnectionType type() {
            return type;
        }

        public ThreadAffinity affinity() {
            return affinity;
        }

        public boolean isAlive() {
            return alive;
        }

        /**
         * Invoke the slot unless the entry has been disconnected in the meantime.
         */
        public void invokeIfAlive(T value) {
            if (alive) slot.invoke(value);
        }
    }
    // [/🧩 Section: entry]

    // 🧩 Section: state
    private final long registryId = NEXT_REGISTRY_ID.getAndIncrement();
    private final Object lock = new Object();
    private final Map<Long, Entry<T>> entries = new LinkedHashMap<>();
    private long nextSequence = 1;
    // [/🧩 Section: state]

    // 🧩 Section: mutation
    public ConnectionId add(Slot<T> slot, ConnectionType type, ThreadAffinity affinity) {
        synchronized (lock) {
            ConnectionId id = new ConnectionId(registryId, nextSequence++);
            entries.put(id.sequence(), new Entry<>(id, slot, type, affinity));
            return id;
        }
    }

    /**
     * @return {@code true} if the entry existed and was alive
     */
    public boolean remove(ConnectionId id) {
        if (id == null || id.signalId() != registryId) return false;
        Entry<T> removed;
        synchronized (lock) {
            removed = entries.remove(id.sequence());
        }
        if (removed == null) return false;
        removed.alive = false;
        return true;
    }

    /**
     * @return how many entries were removed
     */
    public int clear() {
        List<Entry<T>> removed;
        synchronized (lock) {
            removed = new ArrayList<>(entries.values());
            entries.clear();
        }
        for (Entry<T> e : removed) {
            e.alive = false;
        }
        return removed.size();
    }
    // [/🧩 Section: mutation]

    // 🧩 Section: queries

    /**
     * Copy of the live entries in connection order.
     */
    public List<Entry<T>> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(entries.values());
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public boolean contains(ConnectionId id) {
        if (id == null || id.signalId() != registryId) return false;
        synchronized (lock) {
            return entries.containsKey(id.sequence());
        }
    }

    public long registryId() {
        return registryId;
    }
    // [/🧩 Section: queries]
}
