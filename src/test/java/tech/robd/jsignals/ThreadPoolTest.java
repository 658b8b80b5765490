/*
 [File Info]
 path: src/test/java/tech/robd/jsignals/ThreadPoolTest.java
 description: ThreadPool spawning variants, failure isolation, cooperative cancellation, shutdown draining and
              the global pool lifecycle.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jsignals.fn.TaskHandle;
import tech.robd.jsignals.tools.TestAwaitUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class ThreadPoolTest {

    private ThreadPool pool;

    @BeforeEach
    void setUp() {
        ThreadRoles.clearOwnerThread();
        EventLoop.processPendingEvents();
        pool = new ThreadPool(ThreadPoolConfig.withThreads(2).withName("test-pool"));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    @Timeout(5)
    void spawnDeliversResult() {
        TaskHandle<String> handle = pool.spawn(() -> Thread.currentThread().getName());

        String ranOn = TestAwaitUtils.awaitResult(handle, 2000);
        assertTrue(ranOn.startsWith("test-pool-"), ranOn);
        assertTrue(handle.isFinished());
        assertEquals(Optional.of(ranOn), handle.tryGet());
        assertTrue(handle.failure().isEmpty());
    }

    @Test
    @Timeout(5)
        // A throwing task yields an empty handle; the same pool threads keep serving later tasks.
    void failingTaskYieldsEmptyAndPoolSurvives() {
        TaskHandle<Integer> bad = pool.spawn(() -> {
            throw new IllegalStateException("panic");
        });
        assertEquals(Optional.empty(), bad.await());
        assertInstanceOf(IllegalStateException.class, bad.failure().orElseThrow());

        List<TaskHandle<Integer>> good = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            int n = i;
            good.add(pool.spawn(() -> n * n));
        }
        int sum = 0;
        for (TaskHandle<Integer> h : good) sum += TestAwaitUtils.awaitResult(h, 2000);
        assertEquals(285, sum);
    }

    @Test
    @Timeout(5)
    void nullResultIsReportedEmpty() {
        TaskHandle<String> handle = pool.spawn(() -> null);
        assertEquals(Optional.empty(), handle.await());
        assertTrue(handle.failure().isEmpty());
    }

    @Test
    @Timeout(5)
        // The task spins until its token is cancelled; cancel after a short delay must stop it early.
        // Race-avoidance: wait for the first iteration before cancelling.
    void cancellationStopsPollingLoopEarly() {
        CountDownLatch running = new CountDownLatch(1);
        CancellableTask<Long> task = pool.spawnCancellable(token -> {
            long iterations = 0;
            while (!token.isCancelled() && iterations < 1_000_000) {
                iterations++;
                running.countDown();
                Thread.sleep(1);
            }
            return iterations;
        });
        TestAwaitUtils.awaitLatch(running, 1000, "task never started");

        assertTrue(task.cancel());
        assertFalse(task.cancel(), "second cancel reports nothing new");

        long iterations = TestAwaitUtils.awaitResult(task.handle(), 2000);
        assertTrue(iterations < 1_000_000, "loop ran to completion: " + iterations);
        assertTrue(task.handle().cancellationToken().isCancelled());
    }

    @Test
    @Timeout(5)
    void callbackRunsOnSpawningThread() {
        AtomicReference<String> ranOn = new AtomicReference<>();
        AtomicInteger value = new AtomicInteger();

        pool.spawnWithCallback(() -> 21 * 2, v -> {
            value.set(v);
            ranOn.set(Thread.currentThread().getName());
        });

        TestAwaitUtils.pumpUntil(() -> ranOn.get() != null, 2000, "callback never delivered");
        assertEquals(42, value.get());
        assertEquals(Thread.currentThread().getName(), ranOn.get());
    }

    @Test
    @Timeout(5)
    void failedTaskSkipsCallback() {
        AtomicInteger calls = new AtomicInteger();
        TaskHandle<Integer> handle = pool.spawnWithCallback(() -> {
            throw new IllegalArgumentException("no");
        }, v -> calls.incrementAndGet());

        assertEquals(Optional.empty(), handle.await());
        EventLoop.processPendingEvents();
        assertEquals(0, calls.get());
    }

    @Test
    @Timeout(5)
    void progressTaskReportsThroughSharedReporter() {
        ProgressTask<String> task = pool.spawnWithProgress((token, progress) -> {
            progress.update(0.5f, "halfway");
            progress.setProgress(1f);
            return "finished";
        });

        assertEquals("finished", TestAwaitUtils.awaitResult(task.handle(), 2000));
        assertEquals(1f, task.progress().progress());
        assertEquals("halfway", task.progress().message());
        assertFalse(task.token().isCancelled());
    }

    @Test
    @Timeout(5)
    void executeWaitsForResult() {
        assertEquals(Optional.of(7), pool.execute(() -> 3 + 4));
        assertEquals(Optional.empty(), pool.execute(() -> {
            throw new Exception("checked");
        }));
    }

    @Test
    @Timeout(5)
        // Nested execute on a one-thread pool would starve if it queued instead of running inline.
    void nestedExecuteOnSaturatedPoolRunsInline() {
        try (ThreadPool single = new ThreadPool(ThreadPoolConfig.withThreads(1).withName("single"))) {
            Optional<Integer> result = single.execute(() -> single.execute(() -> 20).orElse(0) + 1);
            assertEquals(Optional.of(21), result);
        }
    }

    @Test
    @Timeout(5)
        // close() must let every queued task run, even those that had not started yet.
    void closeRunsAllQueuedTasks() {
        AtomicInteger ran = new AtomicInteger();
        ThreadPool single = new ThreadPool(ThreadPoolConfig.withThreads(1).withName("draining"));
        for (int i = 0; i < 5; i++) {
            single.spawn(() -> {
                Thread.sleep(10);
                return ran.incrementAndGet();
            });
        }
        single.close();

        assertEquals(5, ran.get());
        assertTrue(single.isShutdown());
        assertEquals(0, single.activeTasks());
    }

    @Test
    @Timeout(5)
    void spawnAfterShutdownReturnsFinishedEmptyHandle() {
        pool.shutdown();
        TaskHandle<String> handle = pool.spawn(() -> "never");

        assertTrue(handle.isFinished());
        assertEquals(Optional.empty(), handle.await());
        assertInstanceOf(CancellationException.class, handle.failure().orElseThrow());
        assertTrue(pool.awaitTermination(Duration.ofSeconds(1)));
    }

    @Test
    @Timeout(5)
    void activeTasksReturnsToZero() {
        CountDownLatch release = new CountDownLatch(1);
        TaskHandle<Boolean> handle = pool.spawn(() -> release.await(2, java.util.concurrent.TimeUnit.SECONDS));
        assertEquals(2, pool.numThreads());
        assertTrue(pool.activeTasks() >= 1);

        release.countDown();
        assertEquals(Optional.of(true), handle.await());
        TestAwaitUtils.awaitTrue(() -> pool.activeTasks() == 0, 1000, 5, "active count never settled");
    }

    @Test
    @Timeout(5)
    void cancelAllCancelsSpawnedTokensButNotLaterOnes() {
        CancellableTask<Integer> before = pool.spawnCancellable(token -> {
            while (!token.isCancelled()) Thread.sleep(1);
            return 1;
        });
        pool.cancelAll();
        CancellableTask<Integer> after = pool.spawnCancellable(token -> token.isCancelled() ? -1 : 2);

        assertEquals(1, TestAwaitUtils.awaitResult(before.handle(), 2000));
        assertEquals(2, TestAwaitUtils.awaitResult(after.handle(), 2000));
    }

    @Test
    @Timeout(5)
        // One caller-owned token stops two tasks; cancelAll leaves a token it did not hand out alone.
        // Race-avoidance: both tasks signal `started` before the token is cancelled.
    void callerSuppliedTokenIsSharedAndOutsideCancelAll() {
        CancellationToken shared = CancellationToken.create();
        CountDownLatch started = new CountDownLatch(2);
        ThrowingFunction<CancellationToken, Integer> body = token -> {
            started.countDown();
            while (!token.isCancelled()) Thread.sleep(1);
            return 7;
        };
        CancellableTask<Integer> a = pool.spawnCancellable(shared, body);
        CancellableTask<Integer> b = pool.spawnCancellable(shared, body);
        assertSame(shared, a.token());
        assertSame(shared, b.handle().cancellationToken());
        TestAwaitUtils.awaitLatch(started, 1000, "tasks never started");

        pool.cancelAll();
        assertFalse(shared.isCancelled());

        assertTrue(a.cancel());
        assertEquals(7, TestAwaitUtils.awaitResult(a.handle(), 2000));
        assertEquals(7, TestAwaitUtils.awaitResult(b.handle(), 2000));
        assertTrue(shared.isCancelled());
    }

    @Test
    @Timeout(5)
        // A task that closes its own pool must not wait for itself to finish.
    void closeFromPoolThreadOnlyShutsDown() {
        TaskHandle<String> handle = pool.spawn(() -> {
            pool.close();
            return "closed";
        });
        assertEquals("closed", TestAwaitUtils.awaitResult(handle, 2000));
        assertTrue(pool.isShutdown());
        assertTrue(pool.awaitTermination(Duration.ofSeconds(2)));
    }

    @Test
    @Timeout(10)
    void shutdownGlobalFromGlobalPoolTaskDoesNotHang() {
        ThreadPool.shutdownGlobal();
        ThreadPool global = ThreadPool.initGlobal(ThreadPoolConfig.withThreads(1).withName("global-self"));
        try {
            TaskHandle<String> handle = global.spawn(() -> {
                ThreadPool.shutdownGlobal();
                return "done";
            });
            assertEquals("done", TestAwaitUtils.awaitResult(handle, 2000));
            assertTrue(global.awaitTermination(Duration.ofSeconds(2)));
            assertNotSame(global, ThreadPool.global());
        } finally {
            ThreadPool.shutdownGlobal();
        }
    }

    @Test
    @Timeout(10)
    void globalPoolLifecycle() {
        ThreadPool.shutdownGlobal();
        try {
            ThreadPool explicit = ThreadPool.initGlobal(ThreadPoolConfig.withThreads(1).withName("global-test"));
            assertSame(explicit, ThreadPool.global());
            assertThrows(IllegalStateException.class,
                    () -> ThreadPool.initGlobal(ThreadPoolConfig.withThreads(1)));
            assertEquals(Optional.of("ok"), ThreadPool.global().execute(() -> "ok"));
        } finally {
            ThreadPool.shutdownGlobal();
        }

        ThreadPool rebuilt = ThreadPool.global();
        try {
            assertNotNull(rebuilt);
            assertSame(rebuilt, ThreadPool.global());
        } finally {
            ThreadPool.shutdownGlobal();
        }
    }

    @Test
    void configFromSystemPropertiesFallsBackOnBadValues() {
        String oldThreads = System.getProperty(ThreadPoolConfig.THREADS_PROPERTY_NAME);
        String oldName = System.getProperty(ThreadPoolConfig.NAME_PROPERTY_NAME);
        try {
            System.setProperty(ThreadPoolConfig.THREADS_PROPERTY_NAME, "3");
            System.setProperty(ThreadPoolConfig.NAME_PROPERTY_NAME, "props");
            ThreadPoolConfig cfg = ThreadPoolConfig.fromSystemProperties();
            assertEquals(3, cfg.numThreads());
            assertEquals("props", cfg.threadName());

            System.setProperty(ThreadPoolConfig.THREADS_PROPERTY_NAME, "lots");
            assertEquals(ThreadPoolConfig.defaults().numThreads(), ThreadPoolConfig.fromSystemProperties().numThreads());
        } finally {
            restore(ThreadPoolConfig.THREADS_PROPERTY_NAME, oldThreads);
            restore(ThreadPoolConfig.NAME_PROPERTY_NAME, oldName);
        }
        assertThrows(IllegalArgumentException.class, () -> ThreadPoolConfig.withThreads(0));
    }

    private static void restore(String key, String value) {
        if (value == null) System.clearProperty(key);
        else System.setProperty(key, value);
    }

    @Test
    @Timeout(5)
    void taskIdsAreDistinct() {
        AtomicLong last = new AtomicLong(-1);
        for (int i = 0; i < 5; i++) {
            TaskHandle<Integer> h = pool.spawn(() -> 1);
            assertNotEquals(last.get(), h.id());
            last.set(h.id());
        }
    }
}
