/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ThreadRoles.java
 description: Process-wide thread role registry. Records the single owner thread that drains deferred
              deliveries, plus optional runtime thread checks.
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

import java.lang.ref.WeakReference;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records which thread is the <em>owner</em> thread: the one whose run loop drains
 * queued signal deliveries that have no more specific destination.
 *
 * <p>The owner is designated exactly once, by the application bootstrap, before any
 * cross-thread signal use. Every query here is a read of that record.</p>
 *
 * <p>Thread checks ({@link #assertOwnerThread(String)}) are off unless
 * {@code -Djsignals.threadchecks=true} is set or {@link #setThreadChecksEnabled(boolean)}
 * turns them on.</p>
 */
public final class ThreadRoles {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ThreadRoles.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    public static final String THREAD_CHECKS_PROPERTY_NAME = "jsignals.threadchecks";

    private static final AtomicReference<Owner> OWNER = new AtomicReference<>();

    private static volatile boolean threadChecksEnabled =
            Boolean.parseBoolean(System.getProperty(THREAD_CHECKS_PROPERTY_NAME, "false").trim());

    private record Owner(long id, String name, WeakReference<Thread> thread) {
    }
    // [/🧩 Section: state]

    private ThreadRoles() {
    }

    // 🧩 Section: designation

    /**
     * Designate the calling thread as the owner thread.
     *
     * <p>Repeating the call from the same thread is harmless.</p>
     *
     * @throws IllegalStateException if a different thread was already designated
     */
    public static void designateOwnerThread() {
        Thread current = Thread.currentThread();
        Owner candidate = new Owner(current.getId(), current.getName(), new WeakReference<>(current));
        if (OWNER.compareAndSet(null, candidate)) {
            DIAG.info("owner thread designated: {} (id={})", candidate.name(), candidate.id());
            return;
        }
        Owner existing = OWNER.get();
        if (existing != null && existing.id() != candidate.id()) {
            throw new IllegalStateException("Owner thread already designated as '" + existing.name()
                    + "' (id=" + existing.id() + "); cannot re-designate from '" + current.getName() + "'");
        }
    }

    /**
     * Forget the designated owner. Intended for test harnesses that run several
     * bootstraps in one JVM.
     */
    public static void clearOwnerThread() {
        Owner previous = OWNER.getAndSet(null);
        if (previous != null) {
            DIAG.debug("owner thread cleared (was id={})", previous.id());
        }
    }
    // [/🧩 Section: designation]

    // 🧩 Section: queries

    /**
     * @return the owner thread id, or empty before designation
     */
    public static OptionalLong ownerThreadId() {
        Owner owner = OWNER.get();
        return owner == null ? OptionalLong.empty() : OptionalLong.of(owner.id());
    }

    /**
     * @return the owner thread, or {@code null} if none was designated or it has been collected
     */
    public static @Nullable Thread ownerThread() {
        Owner owner = OWNER.get();
        return owner == null ? null : owner.thread().get();
    }

    /**
     * @return {@code true} on the owner thread, and also before any owner was designated
     */
    public static boolean isOwnerThread() {
        Owner owner = OWNER.get();
        return owner == null || owner.id() == Thread.currentThread().getId();
    }
    // [/🧩 Section: queries]

    // 🧩 Section: checks
    public static void setThreadChecksEnabled(boolean enabled) {
        threadChecksEnabled = enabled;
    }

    public static boolean areThreadChecksEnabled() {
        return threadChecksEnabled;
    }

    /**
     * Fail if checks are enabled and the caller is not the owner thread.
     *
     * @param message describes the operation that needs the owner thread
     * @throws WrongThreadException when the check fails
     */
    public static void assertOwnerThread(String message) {
        if (threadChecksEnabled && !isOwnerThread()) {
            Owner owner = OWNER.get();
            throw new WrongThreadException(message, Thread.currentThread(),
                    owner == null ? -1L : owner.id());
        }
    }
    // [/🧩 Section: checks]
}
