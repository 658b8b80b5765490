/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ThreadPool.java
 description: Fixed-size pool of platform threads for short background tasks, with cancellable and progress-
              reporting variants and a lazily built process-wide instance.
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
import tech.robd.jsignals.fn.TaskHandle;
import tech.robd.jsignals.internal.TaskHandleImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * A fixed pool of worker threads sharing one FIFO queue.
 *
 * <p>Each spawned task gets a {@link TaskHandle}. A task that throws completes its handle
 * empty and leaves the pool thread running. Cancellation is cooperative: the task body
 * sees its {@link CancellationToken} only in the {@code spawnCancellable} and
 * {@code spawnWithProgress} variants.</p>
 *
 * <p>{@link #global()} returns a process-wide pool built on first use from
 * {@link ThreadPoolConfig#fromSystemProperties()}. A JVM shutdown hook tears it down.</p>
 */
public final class ThreadPool implements AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ThreadPool.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: global-state
    private static final Object GLOBAL_LOCK = new Object();
    private static final AtomicLong NEXT_TASK_ID = new AtomicLong(1);
    private static final long SHUTDOWN_HOOK_WAIT_SECONDS = 5;
    private static volatile @Nullable ThreadPool global;
    private static boolean hookInstalled;
    // [/🧩 Section: global-state]

    // 🧩 Section: state
    private final ThreadPoolConfig config;
    private final ThreadPoolExecutor executor;
    private final AtomicInteger activeTasks = new AtomicInteger();
    private final Set<Thread> threads = ConcurrentHashMap.newKeySet();
    private volatile CancellationToken poolToken = CancellationToken.create();
    // [/🧩 Section: state]

    public ThreadPool(ThreadPoolConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.executor = new ThreadPoolExecutor(
                config.numThreads(), config.numThreads(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory());
        DIAG.debug("pool '{}' created with {} thread(s)", config.threadName(), config.numThreads());
    }

    private ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, config.threadName() + "-" + counter.incrementAndGet());
            t.setDaemon(config.daemon());
            threads.add(t);
            return t;
        };
    }

    // 🧩 Section: global

    /**
     * @return the process-wide pool, building it on first use
     */
    public static ThreadPool global() {
        ThreadPool pool = global;
        if (pool != null) return pool;
        synchronized (GLOBAL_LOCK) {
            if (global == null) {
                global = install(ThreadPoolConfig.fromSystemProperties());
            }
            return global;
        }
    }

    /**
     * Build the process-wide pool with explicit settings.
     *
     * @throws IllegalStateException if the global pool already exists
     */
    public static ThreadPool initGlobal(ThreadPoolConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        synchronized (GLOBAL_LOCK) {
            if (global != null) {
                throw new IllegalStateException("Global thread pool already initialized");
            }
            ThreadPool pool = install(config);
            global = pool;
            return pool;
        }
    }

    /**
     * Shut down the process-wide pool, waiting for its queued tasks unless called from
     * one of its own threads. A later {@link #global()} builds a fresh one.
     */
    public static void shutdownGlobal() {
        ThreadPool pool;
        synchronized (GLOBAL_LOCK) {
            pool = global;
            global = null;
        }
        if (pool != null) pool.close();
    }

    private static ThreadPool install(ThreadPoolConfig config) {
        ThreadPool pool = new ThreadPool(config);
        if (!hookInstalled) {
            Runtime.getRuntime().addShutdownHook(new Thread(ThreadPool::shutdownGlobalOnExit, "jsignals-pool-shutdown"));
            hookInstalled = true;
        }
        return pool;
    }

    private static void shutdownGlobalOnExit() {
        ThreadPool pool;
        synchronized (GLOBAL_LOCK) {
            pool = global;
            global = null;
        }
        if (pool == null) return;
        pool.shutdown();
        if (!pool.awaitTermination(Duration.ofSeconds(SHUTDOWN_HOOK_WAIT_SECONDS))) {
            DIAG.warn("pool '{}' still busy at JVM exit, {} task(s) unfinished",
                    pool.config.threadName(), pool.activeTasks());
        }
    }
    // [/🧩 Section: global]

    // 🧩 Section: spawning

    /**
     * Run {@code task} on a pool thread.
     */
    public <T> TaskHandle<T> spawn(ThrowingSupplier<T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        return submit(token -> task.get(), poolToken.child(), null);
    }

    /**
     * Run a task that polls a cancellation token.
     *
     * <pre>{@code
     * CancellableTask<Integer> t = pool.spawnCancellable(token -> {
     *     int n = 0;
     *     while (!token.isCancelled()) n++;
     *     return n;
     * });
     * t.cancel();
     * }</pre>
     */
    public <T> CancellableTask<T> spawnCancellable(ThrowingFunction<CancellationToken, T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        CancellationToken token = poolToken.child();
        return new CancellableTask<>(submit(task, token, null), token);
    }

    /**
     * Run a task under a token the caller already owns, so one token can stop several
     * tasks or be shared with work outside the pool. {@link #cancelAll()} does not reach
     * such a token; cancelling the returned task cancels the caller's token.
     */
    public <T> CancellableTask<T> spawnCancellable(CancellationToken token, ThrowingFunction<CancellationToken, T> task) {
        Objects.requireNonNull(token, "token cannot be null");
        Objects.requireNonNull(task, "task cannot be null");
        return new CancellableTask<>(submit(task, token, null), token);
    }

    /**
     * Run {@code task}; its result is posted to the spawning thread's queue and handed to
     * {@code callback} when that thread processes pending events. Failed tasks skip the callback.
     */
    public <T> TaskHandle<T> spawnWithCallback(ThrowingSupplier<T> task, Consumer<? super T> callback) {
        Objects.requireNonNull(task, "task cannot be null");
        Objects.requireNonNull(callback, "callback cannot be null");
        Thread caller = Thread.currentThread();
        return submit(token -> task.get(), poolToken.child(), result -> {
            if (!EventLoop.postTo(caller, () -> callback.accept(result))) {
                DIAG.warn("pool '{}' could not deliver callback to '{}'", config.threadName(), caller.getName());
            }
        });
    }

    /**
     * Run a task that receives a token and a {@link ProgressReporter}.
     */
    public <T> ProgressTask<T> spawnWithProgress(ThrowingBiFunction<CancellationToken, ProgressReporter, T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        CancellationToken token = poolToken.child();
        ProgressReporter reporter = new ProgressReporter();
        TaskHandle<T> handle = submit(t -> task.apply(t, reporter), token, null);
        return new ProgressTask<>(handle, token, reporter);
    }

    /**
     * Spawn and wait. Called from one of this pool's own threads the task runs inline,
     * so a saturated pool cannot deadlock on itself.
     */
    public <T> Optional<T> execute(ThrowingSupplier<T> task) {
        Objects.requireNonNull(task, "task cannot be null");
        if (isPoolThread(Thread.currentThread())) {
            try {
                return Optional.ofNullable(task.get());
            } catch (Exception e) {
                DIAG.error("pool '{}' inline task failed: {}", config.threadName(), e.toString(), e);
                return Optional.empty();
            }
        }
        return spawn(task).await();
    }

    private <T> TaskHandle<T> submit(ThrowingFunction<CancellationToken, T> body,
                                     CancellationToken token,
                                     @Nullable Consumer<T> onSuccess) {
        long id = NEXT_TASK_ID.getAndIncrement();
        CompletableFuture<T> cf = new CompletableFuture<>();
        TaskHandleImpl<T> handle = new TaskHandleImpl<>(id, cf, token);

        // 🧩 Point: spawning/construct-task
        Runnable runnable = () -> {
            try {
                T result = body.apply(token);
                cf.complete(result);
                if (onSuccess != null) onSuccess.accept(result);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                cf.completeExceptionally(new CancellationException("Interrupted"));
            } catch (Throwable t) {
                DIAG.debug("pool '{}' task#{} failed: {}", config.threadName(), id, t.toString());
                if (!cf.completeExceptionally(t)) {
                    DIAG.error("pool '{}' task#{} callback failed: {}", config.threadName(), id, t.toString(), t);
                }
            } finally {
                activeTasks.decrementAndGet();
            }
        };

        // 🧩 Point: spawning/submit-task
        activeTasks.incrementAndGet();
        try {
            executor.execute(runnable);
        } catch (RejectedExecutionException rex) {
            activeTasks.decrementAndGet();
            cf.completeExceptionally(new CancellationException(
                    "ThreadPool '" + config.threadName() + "' rejected task (shut down)"));
        }
        return handle;
    }

    private boolean isPoolThread(Thread thread) {
        return threads.contains(thread);
    }
    // [/🧩 Section: spawning]

    // 🧩 Section: lifecycle

    /**
     * Stop accepting tasks. Tasks already queued still run.
     */
    public void shutdown() {
        executor.shutdown();
        DIAG.debug("pool '{}' shutdown, {} task(s) outstanding", config.threadName(), activeTasks.get());
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * @return {@code true} if every queued task finished within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) {
        try {
            return executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Cancel the tokens of every task spawned so far. Tasks that do not poll their token
     * are unaffected.
     */
    public void cancelAll() {
        CancellationToken previous = poolToken;
        poolToken = CancellationToken.create();
        previous.cancel();
    }

    /**
     * Shut down and wait until every queued task has run. Called from one of this pool's
     * own threads it only shuts down, since the calling task could never finish otherwise.
     */
    @Override
    public void close() {
        shutdown();
        if (isPoolThread(Thread.currentThread())) {
            DIAG.debug("pool '{}' closed from its own thread, not waiting", config.threadName());
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                if (executor.awaitTermination(1, TimeUnit.SECONDS)) break;
                DIAG.debug("pool '{}' still draining {} task(s)", config.threadName(), activeTasks.get());
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: info
    public int numThreads() {
        return config.numThreads();
    }

    /**
     * @return tasks spawned and not yet finished, queued ones included
     */
    public int activeTasks() {
        return activeTasks.get();
    }

    public ThreadPoolConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "ThreadPool(" + config.threadName() + ", threads=" + config.numThreads()
                + ", active=" + activeTasks.get() + (executor.isShutdown() ? ", shut down" : "") + ")";
    }
    // [/🧩 Section: info]
}
