/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/diagnostics/DiagnosticsBackend.java
 description: Internal diagnostics sink forwarding to SLF4J (LocationAwareLogger when available). Global
              switch via system property `jsignals.diag` and enable()/disable().
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Package-private sink behind {@link Diagnostics}.
 *
 * <p>Keeps one SLF4J {@link Logger} per owner class and uses {@link LocationAwareLogger}
 * where the binding offers it, so log lines point at the caller rather than at this class.
 * Every emitter returns immediately while the global flag is off.</p>
 */
final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    private static final String FQCN = DiagnosticsBackend.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * System property to enable diagnostics: {@code -Djsignals.diag=true}.
     */
    static final String DIAGNOSTICS_PROPERTY_NAME = "jsignals.diag";

    private static volatile boolean enabled =
            Boolean.parseBoolean(System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
    }

    // 🧩 Section: enablement
    static void enable() {
        enabled = true;
    }

    static void disable() {
        enabled = false;
    }

    static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: enablement]

    private static Logger logger(Class<?> owner) {
        return LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
    }

    // 🧩 Section: emitters
    static void debug(Class<?> owner, String msg, Object... args) {
        log(owner, LocationAwareLogger.DEBUG_INT, msg, args);
    }

    static void info(Class<?> owner, String msg, Object... args) {
        log(owner, LocationAwareLogger.INFO_INT, msg, args);
    }

    static void warn(Class<?> owner, String msg, Object... args) {
        log(owner, LocationAwareLogger.WARN_INT, msg, args);
    }

    static void error(Class<?> owner, String msg, Object... args) {
        log(owner, LocationAwareLogger.ERROR_INT, msg, args);
    }

    private static void log(Class<?> owner, int level, String msg, Object[] args) {
        if (!enabled) return; // fast path
        Logger log = logger(owner);
        // 🧩 Point: emitters/location-aware
        if (log instanceof LocationAwareLogger law) {
            Throwable t = trailingThrowable(args);
            law.log(null, FQCN, level, msg, args, t);
            return;
        }
        switch (level) {
            case LocationAwareLogger.DEBUG_INT -> {
                if (log.isDebugEnabled()) log.debug(msg, args);
            }
            case LocationAwareLogger.INFO_INT -> {
                if (log.isInfoEnabled()) log.info(msg, args);
            }
            case LocationAwareLogger.WARN_INT -> {
                if (log.isWarnEnabled()) log.warn(msg, args);
            }
            default -> {
                if (log.isErrorEnabled()) log.error(msg, args);
            }
        }
    }

    private static Throwable trailingThrowable(Object[] args) {
        if (args != null && args.length > 0 && args[args.length - 1] instanceof Throwable t) {
            return t;
        }
        return null;
    }
    // [/🧩 Section: emitters]
}
