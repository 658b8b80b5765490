/*
 [File Info]
 path: src/test/java/tech/robd/jsignals/internal/InvocationQueueTest.java
 description: InvocationQueue and its registry: at-most-once execution, abandonment on close, withdrawal and
              pruning of terminated threads.
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
package tech.robd.jsignals.internal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jsignals.DeliveryException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class InvocationQueueTest {

    @Test
    void invocationRunsAtMostOnce() {
        AtomicInteger runs = new AtomicInteger();
        QueuedInvocation inv = QueuedInvocation.withCompletion(runs::incrementAndGet);

        inv.execute();
        inv.execute();
        assertFalse(inv.abandon("too late"), "abandon after start changes nothing");

        assertEquals(1, runs.get());
        assertTrue(inv.completion().isDone());
        assertFalse(inv.completion().isCompletedExceptionally());
    }

    @Test
    void failingInvocationCompletesExceptionally() {
        QueuedInvocation inv = QueuedInvocation.withCompletion(() -> {
            throw new IllegalStateException("slot failed");
        });

        assertDoesNotThrow(inv::execute);

        ExecutionException e = assertThrows(ExecutionException.class, () -> inv.completion().get());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void closeAbandonsPendingAndRefusesLaterPosts() {
        InvocationQueue queue = new InvocationQueue(Thread.currentThread());
        AtomicInteger runs = new AtomicInteger();
        QueuedInvocation waiting = QueuedInvocation.withCompletion(runs::incrementAndGet);
        assertTrue(queue.post(waiting));
        assertTrue(queue.post(QueuedInvocation.of(runs::incrementAndGet)));

        assertEquals(2, queue.close());
        assertEquals(0, queue.close());
        assertTrue(queue.isClosed());
        assertFalse(queue.isDestinationAlive());
        assertTrue(queue.threadAlive());
        assertFalse(queue.post(QueuedInvocation.of(runs::incrementAndGet)));

        CompletableFuture<Void> done = waiting.completion();
        ExecutionException e = assertThrows(ExecutionException.class, done::get);
        assertInstanceOf(DeliveryException.class, e.getCause());
        assertEquals(0, queue.drain());
        assertEquals(0, runs.get());
    }

    @Test
    void withdrawnInvocationNeverRuns() {
        InvocationQueue queue = new InvocationQueue(Thread.currentThread());
        AtomicInteger runs = new AtomicInteger();
        QueuedInvocation inv = QueuedInvocation.of(runs::incrementAndGet);
        queue.post(inv);

        assertTrue(queue.withdraw(inv));
        assertFalse(queue.withdraw(inv));
        assertEquals(0, queue.drain());
        assertEquals(0, runs.get());
    }

    @Test
    void wakeupFailureDoesNotLoseThePost() {
        InvocationQueue queue = new InvocationQueue(Thread.currentThread());
        queue.setWakeup(() -> {
            throw new IllegalStateException("bad hook");
        });

        assertTrue(queue.post(QueuedInvocation.of(() -> {
        })));
        assertEquals(1, queue.pending());
        assertEquals(1, queue.drain());
    }

    @Test
    @Timeout(5)
    void terminatedThreadsArePrunedFromRegistry() throws Exception {
        Thread shortLived = new Thread(() -> InvocationQueues.forCurrentThread());
        shortLived.start();
        shortLived.join();

        InvocationQueue queue = InvocationQueues.lookup(shortLived.getId());
        assertNotNull(queue, "queue is registered on first use");
        assertFalse(queue.threadAlive());

        InvocationQueues.pruneTerminated();

        assertNull(InvocationQueues.lookup(shortLived.getId()));
        assertTrue(queue.isClosed());
    }

    @Test
    void retireClosesAndForgetsTheQueue() {
        Thread self = Thread.currentThread();
        Thread other = new Thread(() -> {
        });
        InvocationQueue queue = InvocationQueues.forThread(other);
        assertSame(queue, InvocationQueues.forThread(other));

        InvocationQueues.retire(other);

        assertTrue(queue.isClosed());
        assertNull(InvocationQueues.lookup(other.getId()));
        assertNotNull(InvocationQueues.forThread(self));
    }
}
