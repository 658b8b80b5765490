/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ThreadAffinity.java
 description: Declares which thread a connection's slot must run on: a specific thread, whichever thread is
              the owner, or none.
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

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * The thread a subscriber requires its slot to run on.
 *
 * <p>Three forms exist:
 * <ul>
 *   <li>{@link #of(Thread)} / {@link #current()}: a specific thread, held weakly so an
 *       affinity never keeps a finished thread reachable.</li>
 *   <li>{@link #ownerThread()}: the thread designated through
 *       {@link ThreadRoles#designateOwnerThread()}, resolved at delivery time.</li>
 *   <li>{@link #none()}: no requirement; {@link ConnectionType#AUTO} connections with this
 *       affinity always run directly.</li>
 * </ul>
 */
public final class ThreadAffinity {

    private enum Kind { NONE, OWNER, THREAD }

    private static final ThreadAffinity NONE = new ThreadAffinity(Kind.NONE, -1L, null, null);
    private static final ThreadAffinity OWNER = new ThreadAffinity(Kind.OWNER, -1L, null, null);

    private final Kind kind;
    private final long threadId;
    private final @Nullable String threadName;
    private final @Nullable WeakReference<Thread> thread;

    private ThreadAffinity(Kind kind, long threadId, @Nullable String threadName,
                           @Nullable WeakReference<Thread> thread) {
        this.kind = kind;
        this.threadId = threadId;
        this.threadName = threadName;
        this.thread = thread;
    }

    // 🧩 Section: factories
    public static ThreadAffinity current() {
        return of(Thread.currentThread());
    }

    public static ThreadAffinity of(Thread thread) {
        Objects.requireNonNull(thread, "thread cannot be null");
        return new ThreadAffinity(Kind.THREAD, thread.getId(), thread.getName(), new WeakReference<>(thread));
    }

    public static ThreadAffinity ownerThread() {
        return OWNER;
    }

    public static ThreadAffinity none() {
        return NONE;
    }
    // [/🧩 Section: factories]

    // 🧩 Section: queries

    /**
     * @return {@code true} when no thread is required
     */
    public boolean isNone() {
        return kind == Kind.NONE;
    }

    /**
     * @return {@code true} when this affinity follows the designated owner thread
     */
    public boolean isOwnerThreadAffinity() {
        return kind == Kind.OWNER;
    }

    /**
     * Thread id this affinity resolves to right now. Owner affinities are empty until an
     * owner is designated; {@link #none()} is always empty.
     */
    public OptionalLong threadId() {
        return switch (kind) {
            case NONE -> OptionalLong.empty();
            case OWNER -> ThreadRoles.ownerThreadId();
            case THREAD -> OptionalLong.of(threadId);
        };
    }

    /**
     * The destination thread, or {@code null} if there is none, no owner has been
     * designated, or the thread object has been collected.
     */
    public @Nullable Thread thread() {
        return switch (kind) {
            case NONE -> null;
            case OWNER -> ThreadRoles.ownerThread();
            case THREAD -> thread == null ? null : thread.get();
        };
    }

    /**
     * @return {@code true} when the calling thread satisfies this affinity
     */
    public boolean isSameThread() {
        return switch (kind) {
            case NONE -> true;
            case OWNER -> ThreadRoles.isOwnerThread();
            case THREAD -> Thread.currentThread().getId() == threadId;
        };
    }

    /**
     * @throws WrongThreadException if the calling thread does not satisfy this affinity
     */
    public void assertSameThread(String message) {
        if (!isSameThread()) {
            throw new WrongThreadException(message, Thread.currentThread(), threadId().orElse(-1L));
        }
    }
    // [/🧩 Section: queries]

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "ThreadAffinity[none]";
            case OWNER -> "ThreadAffinity[owner]";
            case THREAD -> "ThreadAffinity[" + threadName + " id=" + threadId + "]";
        };
    }
}
