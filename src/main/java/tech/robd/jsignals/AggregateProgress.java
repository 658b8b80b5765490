/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/AggregateProgress.java
 description: Weighted combination of sub-task progress reporters, re-emitted whenever any sub-task moves.
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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Combines several {@link ProgressReporter}s into one weighted fraction:
 * {@code sum(weight * progress) / sum(weight)}.
 *
 * <pre>{@code
 * AggregateProgress total = new AggregateProgress();
 * ProgressReporter download = total.addTask("download", 3f);
 * ProgressReporter unpack = total.addTask("unpack", 1f);
 * download.setProgress(1f);   // total.progress() == 0.75
 * }</pre>
 *
 * <p>Sub-reporters are watched with {@link ConnectionType#DIRECT} connections, so the
 * aggregate is recomputed and emitted on whichever thread moved a sub-task.</p>
 */
public final class AggregateProgress implements AutoCloseable {

    private static final Diagnostics DIAG = Diagnostics.of(AggregateProgress.class);

    private record SubTask(String name, float weight, ProgressReporter reporter, ConnectionId connection) {
    }

    private final List<SubTask> tasks = new CopyOnWriteArrayList<>();
    private final Signal<Float> progressChanged = new Signal<>("aggregateProgressChanged");

    /**
     * Register a sub-task.
     *
     * @param name   label for diagnostics
     * @param weight relative share of the total; must be positive and finite
     * @return the reporter the sub-task should update
     */
    public ProgressReporter addTask(String name, float weight) {
        Objects.requireNonNull(name, "name cannot be null");
        if (!(weight > 0f) || Float.isInfinite(weight)) {
            throw new IllegalArgumentException("weight must be positive and finite, was " + weight);
        }
        ProgressReporter reporter = new ProgressReporter();
        ConnectionId connection = reporter.onProgressChanged()
                .connect(p -> emitProgress(), ConnectionType.DIRECT, ThreadAffinity.none());
        tasks.add(new SubTask(name, weight, reporter, connection));
        DIAG.debug("added sub-task '{}' weight={}", name, weight);
        return reporter;
    }

    /**
     * @return weighted progress, 0 when there are no sub-tasks
     */
    public float progress() {
        double total = 0;
        double done = 0;
        for (SubTask t : tasks) {
            total += t.weight();
            done += (double) t.weight() * t.reporter().progress();
        }
        if (total == 0) return 0f;
        return (float) Math.max(0d, Math.min(1d, done / total));
    }

    public Signal<Float> onProgressChanged() {
        return progressChanged;
    }

    public int taskCount() {
        return tasks.size();
    }

    /**
     * Emit the current aggregate now.
     */
    public void emitProgress() {
        progressChanged.emit(progress());
    }

    /**
     * Reset every sub-task to zero, then emit the aggregate.
     */
    public void reset() {
        for (SubTask t : tasks) {
            t.reporter().reset();
        }
        emitProgress();
    }

    /**
     * Stop following the sub-reporters. They stay usable but no longer drive this aggregate.
     */
    @Override
    public void close() {
        for (SubTask t : tasks) {
            t.reporter().onProgressChanged().disconnect(t.connection());
        }
        DIAG.debug("closed aggregate of {} sub-task(s)", tasks.size());
    }

    @Override
    public String toString() {
        return "AggregateProgress[tasks=" + tasks.size() + ", progress=" + progress() + "]";
    }
}
