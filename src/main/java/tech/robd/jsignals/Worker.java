/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/Worker.java
 description: Dedicated background thread that runs submitted tasks one at a time in submission order and
              publishes results through a signal.
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
import tech.robd.jsignals.internal.InvocationQueue;
import tech.robd.jsignals.internal.InvocationQueues;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * A single named platform thread with its own FIFO task queue.
 *
 * <pre>{@code
 * try (Worker<String> worker = new Worker<>(WorkerConfig.named("loader"))) {
 *     worker.onResult().connect(text -> label.setText(text));   // AUTO: arrives on this thread
 *     worker.send(() -> Files.readString(path));
 * }
 * }</pre>
 *
 * <p>Tasks run strictly one at a time. Between tasks the worker also drains deliveries
 * addressed to its own thread, so slots connected from inside a task with
 * {@link ConnectionType#AUTO} or {@link ConnectionType#QUEUED} do run.</p>
 *
 * <p>A task that throws is logged and skipped; the worker keeps going. An interrupt
 * left set by a task is cleared before the next one runs.</p>
 *
 * @param <T> result type of submitted tasks
 */
public final class Worker<T> implements AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(Worker.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state

    /**
     * Marker telling the loop to exit once everything ahead of it has run.
     */
    private static final Runnable SHUTDOWN = () -> {
    };

    /**
     * Marker telling the loop that deliveries for the worker thread are waiting.
     */
    private static final Runnable DRAIN = () -> {
    };

    private final WorkerConfig config;
    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private final Object submitLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final AtomicInteger pending = new AtomicInteger();
    private final CancellationToken token = CancellationToken.create();
    private final Signal<T> resultSignal;
    private final Thread thread;
    // [/🧩 Section: state]

    public Worker() {
        this(WorkerConfig.defaults());
    }

    public Worker(WorkerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.resultSignal = new Signal<>(config.name() + ".result");
        this.thread = new Thread(this::runLoop, config.name());
        this.thread.setDaemon(config.daemon());
        this.thread.start();
        DIAG.debug("worker '{}' started (capacity={})", config.name(), config.queueCapacity());
    }

    // 🧩 Section: submission

    /**
     * Queue {@code task}. Its result is emitted through {@link #onResult()} on the worker thread.
     *
     * @return {@code false} if the worker is stopped or its queue is full
     */
    public boolean send(ThrowingSupplier<? extends T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        return submit(() -> {
            T result = task.get();
            resultSignal.emit(result);
        });
    }

    /**
     * Queue {@code task}; when it completes, {@code callback} is posted to the thread calling
     * this method and runs the next time that thread processes its pending events.
     * The result is not emitted through {@link #onResult()}.
     *
     * @return {@code false} if the worker is stopped or its queue is full
     */
    public boolean sendWithCallback(ThrowingSupplier<? extends T> task, Consumer<? super T> callback) {
        Objects.requireNonNull(task, "task cannot be null");
        Objects.requireNonNull(callback, "callback cannot be null");
        Thread caller = Thread.currentThread();
        return submit(() -> {
            T result = task.get();
            // 🧩 Point: submission/callback-to-caller
            if (!EventLoop.postTo(caller, () -> callback.accept(result))) {
                DIAG.warn("worker '{}' could not deliver callback to '{}'", config.name(), caller.getName());
            }
        });
    }

    /**
     * Queue {@code task} and wait for its result.
     *
     * <p>Called from the worker thread itself, the task runs inline instead of queueing
     * behind the caller.</p>
     *
     * @return the result, or empty if the task threw, returned {@code null},
     * the worker refused it, or the caller was interrupted
     */
    public Optional<T> sendSync(ThrowingSupplier<? extends T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        // 🧩 Point: submission/inline-on-worker
        if (Thread.currentThread() == thread) {
            try {
                return Optional.ofNullable(task.get());
            } catch (Exception e) {
                DIAG.error("worker '{}' inline task failed: {}", config.name(), e.toString(), e);
                return Optional.empty();
            }
        }

        CompletableFuture<T> cf = new CompletableFuture<>();
        boolean accepted = submit(() -> {
            try {
                cf.complete(task.get());
            } catch (Exception e) {
                cf.completeExceptionally(e);
                throw e;
            }
        });
        if (!accepted) return Optional.empty();

        try {
            return Optional.ofNullable(cf.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            return Optional.empty();
        }
    }

    /**
     * Queue a task that reports progress. The result is emitted through {@link #onResult()}.
     *
     * @return the reporter shared with the task, or {@code null} if the worker refused it
     */
    public @Nullable ProgressReporter sendWithProgress(ThrowingFunction<ProgressReporter, ? extends T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        ProgressReporter reporter = new ProgressReporter();
        boolean accepted = submit(() -> {
            T result = task.apply(reporter);
            resultSignal.emit(result);
        });
        return accepted ? reporter : null;
    }

    @FunctionalInterface
    private interface Job {
        void run() throws Exception;
    }

    private boolean submit(Job job) {
        synchronized (submitLock) {
            if (!running.get()) {
                DIAG.debug("worker '{}' stopped, refusing task", config.name());
                return false;
            }
            if (pending.incrementAndGet() > config.queueCapacity()) {
                pending.decrementAndGet();
                DIAG.warn("worker '{}' queue full ({}), refusing task", config.name(), config.queueCapacity());
                return false;
            }
            queue.add(() -> runJob(job));
            return true;
        }
    }
    // [/🧩 Section: submission]

    // 🧩 Section: loop
    private void runLoop() {
        InvocationQueue inbox = InvocationQueues.forCurrentThread();
        inbox.setWakeup(this::scheduleDrain);
        inbox.drain();
        try {
            while (true) {
                Runnable next;
                try {
                    next = queue.take();
                } catch (InterruptedException e) {
                    // 🧩 Point: loop/interrupt
                    if (!running.get()) {
                        DIAG.warn("worker '{}' interrupted while stopping, finishing {} queued task(s)",
                                config.name(), pending.get());
                        break;
                    }
                    DIAG.debug("worker '{}' interrupted while idle, still running", config.name());
                    continue;
                }
                if (next == SHUTDOWN) break;
                if (next == DRAIN) {
                    drainScheduled.set(false);
                    inbox.drain();
                    Thread.interrupted();
                    continue;
                }
                next.run();
                inbox.drain();
                Thread.interrupted();
            }
        } finally {
            synchronized (submitLock) {
                running.set(false);
            }
            Runnable leftover;
            while ((leftover = queue.poll()) != null) {
                if (leftover != SHUTDOWN && leftover != DRAIN) leftover.run();
            }
            inbox.setWakeup(null);
            inbox.drain();
            InvocationQueues.retire(thread);
            DIAG.debug("worker '{}' exited", config.name());
        }
    }

    private void runJob(Job job) {
        try {
            job.run();
        } catch (Throwable t) {
            // 🧩 Point: loop/task-failure
            DIAG.error("worker '{}' task failed: {}", config.name(), t.toString(), t);
        } finally {
            // an interrupt set by the task belongs to the task, not to the loop
            Thread.interrupted();
            pending.decrementAndGet();
        }
    }

    private void scheduleDrain() {
        if (drainScheduled.compareAndSet(false, true)) {
            queue.add(DRAIN);
        }
    }
    // [/🧩 Section: loop]

    // 🧩 Section: lifecycle

    /**
     * Refuse further tasks and cancel {@link #cancellationToken()}. Tasks already queued
     * still run, then the thread exits. Safe to call repeatedly and from any thread.
     */
    public void stop() {
        synchronized (submitLock) {
            if (!running.compareAndSet(true, false)) return;
            queue.add(SHUTDOWN);
        }
        token.cancel();
        DIAG.debug("worker '{}' stop requested, {} task(s) left", config.name(), pending.get());
    }

    /**
     * Wait for the worker thread to exit. Does not stop it.
     *
     * @return {@code true} once the thread has exited; {@code false} if called on the worker
     * thread itself or interrupted
     */
    public boolean join() {
        if (Thread.currentThread() == thread) {
            DIAG.warn("worker '{}' cannot join itself", config.name());
            return false;
        }
        try {
            thread.join();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean stopAndJoin() {
        stop();
        return join();
    }

    /**
     * @return {@code true} if the thread exited within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) {
        try {
            thread.join(Math.max(1, timeout.toMillis()));
            return !thread.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stop, then wait for the thread unless called from the worker thread itself.
     */
    @Override
    public void close() {
        stop();
        if (Thread.currentThread() != thread) join();
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: info

    /**
     * Results of {@link #send} and {@link #sendWithProgress}, emitted on the worker thread.
     */
    public Signal<T> onResult() {
        return resultSignal;
    }

    /**
     * @return {@code true} until {@link #stop()} is called or the thread exits
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return tasks accepted but not yet finished, including the one running now
     */
    public int pendingTasks() {
        return pending.get();
    }

    /**
     * Cancelled when the worker is stopped. Long tasks can poll it to finish early.
     */
    public CancellationToken cancellationToken() {
        return token;
    }

    public String name() {
        return config.name();
    }

    public Thread thread() {
        return thread;
    }

    @Override
    public String toString() {
        return "Worker[" + config.name() + (running.get() ? ", running" : ", stopped")
                + ", pending=" + pending.get() + "]";
    }
    // [/🧩 Section: info]
}
