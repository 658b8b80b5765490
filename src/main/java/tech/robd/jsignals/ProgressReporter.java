/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ProgressReporter.java
 description: Thread-safe progress cell. Clamps values to [0,1] and emits change signals only when the stored
              state actually changes.
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

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Progress shared between a task and whoever watches it.
 *
 * <p>The state is a single {@link ProgressUpdate} swapped atomically, so a reader never
 * sees a message from one update paired with the progress of another. Signals are emitted
 * on the updating thread after the swap; subscribers on other threads connect with
 * {@link ConnectionType#AUTO} or {@link ConnectionType#QUEUED} to receive them at home.</p>
 */
public final class ProgressReporter {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ProgressReporter.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final AtomicReference<ProgressUpdate> state = new AtomicReference<>(ProgressUpdate.INITIAL);
    private final Signal<Float> progressChanged = new Signal<>("progressChanged");
    private final Signal<String> messageChanged = new Signal<>("messageChanged");
    private final Signal<ProgressUpdate> updated = new Signal<>("progressUpdated");
    // [/🧩 Section: state]

    // 🧩 Section: signals
    public Signal<Float> onProgressChanged() {
        return progressChanged;
    }

    public Signal<String> onMessageChanged() {
        return messageChanged;
    }

    /**
     * Emitted once per effective change, with the full new snapshot.
     */
    public Signal<ProgressUpdate> onUpdated() {
        return updated;
    }
    // [/🧩 Section: signals]

    // 🧩 Section: mutation

    /**
     * Store {@code progress}, clamped to {@code [0, 1]}.
     *
     * @throws IllegalArgumentException if {@code progress} is NaN
     */
    public void setProgress(float progress) {
        float value = clamp(progress);
        ProgressUpdate prev;
        ProgressUpdate next;
        do {
            prev = state.get();
            if (Float.compare(prev.progress(), value) == 0) return;
            next = new ProgressUpdate(value, prev.message());
        } while (!state.compareAndSet(prev, next));

        DIAG.debug("progress {} -> {}", prev.progress(), value);
        progressChanged.emit(value);
        updated.emit(next);
    }

    public void setMessage(String message) {
        Objects.requireNonNull(message, "message cannot be null");
        ProgressUpdate prev;
        ProgressUpdate next;
        do {
            prev = state.get();
            if (message.equals(prev.message())) return;
            next = new ProgressUpdate(prev.progress(), message);
        } while (!state.compareAndSet(prev, next));

        messageChanged.emit(message);
        updated.emit(next);
    }

    /**
     * Set progress and message together.
     */
    public void update(float progress, String message) {
        Objects.requireNonNull(message, "message cannot be null");
        float value = clamp(progress);
        ProgressUpdate prev;
        ProgressUpdate next = new ProgressUpdate(value, message);
        do {
            prev = state.get();
            if (prev.equals(next)) return;
        } while (!state.compareAndSet(prev, next));

        if (Float.compare(prev.progress(), value) != 0) progressChanged.emit(value);
        if (!message.equals(prev.message())) messageChanged.emit(message);
        updated.emit(next);
    }

    /**
     * Back to zero with no message. Emits {@code onProgressChanged} if progress was
     * non-zero and {@code onUpdated} if anything was set.
     */
    public void reset() {
        ProgressUpdate prev = state.getAndSet(ProgressUpdate.INITIAL);
        if (prev.equals(ProgressUpdate.INITIAL)) return;
        if (Float.compare(prev.progress(), 0f) != 0) progressChanged.emit(0f);
        updated.emit(ProgressUpdate.INITIAL);
    }

    private static float clamp(float progress) {
        if (Float.isNaN(progress)) {
            throw new IllegalArgumentException("progress cannot be NaN");
        }
        return Math.max(0f, Math.min(1f, progress));
    }
    // [/🧩 Section: mutation]

    // 🧩 Section: queries
    public float progress() {
        return state.get().progress();
    }

    public @Nullable String message() {
        return state.get().message();
    }

    public ProgressUpdate snapshot() {
        return state.get();
    }
    // [/🧩 Section: queries]

    @Override
    public String toString() {
        ProgressUpdate s = state.get();
        return "ProgressReporter[" + s.progress() + (s.message() == null ? "" : ", '" + s.message() + "'") + "]";
    }
}
