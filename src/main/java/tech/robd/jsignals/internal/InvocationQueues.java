/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/internal/InvocationQueues.java
 description: Process-wide registry of per-thread invocation queues, keyed by thread id and created on first
              use.
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

package tech.robd.jsignals.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.jsignals.diagnostics.Diagnostics;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps thread ids to their {@link InvocationQueue}.
 *
 * <p>Closed queues stay registered while their thread lives so that a thread which
 * shut its queue keeps refusing deliveries. Entries for terminated threads are pruned
 * every {@value #PRUNE_INTERVAL} queue creations.</p>
 */
public final class InvocationQueues {

    private static final Diagnostics DIAG = Diagnostics.of(InvocationQueues.class);

    static final int PRUNE_INTERVAL = 64;

    private static final ConcurrentMap<Long, InvocationQueue> QUEUES = new ConcurrentHashMap<>();
    private static final AtomicInteger CREATED = new AtomicInteger();

    private InvocationQueues() {
    }

    public static InvocationQueue forCurrentThread() {
        return forThread(Thread.currentThread());
    }

    public static InvocationQueue forThread(Thread thread) {
        InvocationQueue existing = QUEUES.get(thread.getId());
        if (existing != null) return existing;
        InvocationQueue fresh = new InvocationQueue(thread);
        InvocationQueue raced = QUEUES.putIfAbsent(thread.getId(), fresh);
        if (raced != null) return raced;
        DIAG.debug("queue created for thread '{}' id={}", thread.getName(), thread.getId());
        // pruning mutates the map, so it must stay outside any compute call
        if (CREATED.incrementAndGet() % PRUNE_INTERVAL == 0) pruneTerminated();
        return fresh;
    }

    public static @Nullable InvocationQueue lookup(long threadId) {
        return QUEUES.get(threadId);
    }

    /**
     * Close and unregister the queue of a thread that is finishing for good.
     * The thread must not post to itself afterwards.
     */
    public static void retire(Thread thread) {
        InvocationQueue queue = QUEUES.remove(thread.getId());
        if (queue != null) queue.close();
    }

    static void pruneTerminated() {
        QUEUES.values().removeIf(q -> {
            if (q.threadAlive()) return false;
            q.close();
            return true;
        });
    }

    static int size() {
        return QUEUES.size();
    }
}
