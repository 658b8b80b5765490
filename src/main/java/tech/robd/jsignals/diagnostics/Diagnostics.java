/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/diagnostics/Diagnostics.java
 description: Lightweight diagnostics facade bound to an owning class. Forwards to DiagnosticsBackend;
              factories return active or no-op instances.
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

package tech.robd.jsignals.diagnostics;

/**
 * Minimal logging facade bound to an owning {@link Class}.
 * <p>
 * Every signal, queue, worker and pool class holds one of these as a static
 * {@code DIAG} field. Calls forward to an SLF4J-backed sink that is switched off
 * unless {@code -Djsignals.diag=true} is set or {@link #enable()} is called, so the
 * hot dispatch paths pay nothing when tracing is not wanted.
 * {@link #of(Class)} resolves to a shared no-op when the switch is off at creation time,
 * which for a static field means class initialisation.
 */
@FunctionalInterface
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * @return the class whose logger receives this instance's output
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding

    /**
     * Emit a debug message.
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}
     */
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    default void info(String msg, Object... args) {
        DiagnosticsBackend.info(owner(), msg, args);
    }

    default void warn(String msg, Object... args) {
        DiagnosticsBackend.warn(owner(), msg, args);
    }

    /**
     * Emit an error message. A trailing {@link Throwable} argument is logged with its stack trace.
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}
     */
    default void error(String msg, Object... args) {
        DiagnosticsBackend.error(owner(), msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    /**
     * Create a diagnostics instance for {@code owner}. If the backend is disabled right now,
     * a no-op is returned and later enablement has no effect on it.
     *
     * @param owner the owning class
     * @return active or no-op diagnostics depending on backend state
     */
    static Diagnostics of(Class<?> owner) {
        return DiagnosticsBackend.isEnabled() ? new ActiveD(owner) : NoOpD.INSTANCE;
    }
    // [/🧩 Section: factories]

    // 🧩 Section: switch

    /**
     * Turn diagnostics on. Affects {@link #of(Class)} instances created afterwards; active
     * instances also stop logging while the switch is off.
     */
    static void enable() {
        DiagnosticsBackend.enable();
    }

    static void disable() {
        DiagnosticsBackend.disable();
    }

    static boolean isEnabled() {
        return DiagnosticsBackend.isEnabled();
    }
    // [/🧩 Section: switch]
}
