/*
 [File Info]
 path: src/test/java/tech/robd/jsignals/CancellationTokenTest.java
 description: Cancellation token contract: first-cancel-wins, at-most-once callbacks, registration races,
              child propagation and the shared constant tokens.
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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class CancellationTokenTest {

    @Test
    void onlyFirstCancelReportsTrue() {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());
        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertTrue(token.isCancelled());
    }

    @Test
    void callbacksFireOnceInRegistrationOrder() throws Exception {
        CancellationToken token = CancellationToken.create();
        List<String> calls = new ArrayList<>();
        token.onCancel(() -> calls.add("a"));
        AutoCloseable removed = token.onCancel(() -> calls.add("removed"));
        token.onCancel(() -> calls.add("b"));
        removed.close();

        token.cancel();
        token.cancel();

        assertEquals(List.of("a", "b"), calls);
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void failingCallbackDoesNotBlockOthers() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("callback failure");
        });
        token.onCancel(calls::incrementAndGet);

        assertDoesNotThrow(token::cancel);
        assertEquals(1, calls.get());
    }

    @Test
    void childrenFollowTheirParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();
        CancellationToken grandChild = child.child();

        assertTrue(child.cancel());
        assertTrue(grandChild.isCancelled());
        assertFalse(parent.isCancelled(), "cancellation never flows upwards");

        CancellationToken sibling = parent.child();
        parent.cancel();
        assertTrue(sibling.isCancelled());
        assertTrue(parent.child().isCancelled(), "child of a cancelled parent starts cancelled");
    }

    @Test
    @Timeout(5)
        // Registration racing with cancel from many threads: every callback must fire exactly once.
        // Race-avoidance: a start gate releases all registrants together with the canceller.
    void registrationRacingCancelFiresEachCallbackOnce() throws Exception {
        for (int round = 0; round < 50; round++) {
            CancellationToken token = CancellationToken.create();
            AtomicInteger fired = new AtomicInteger();
            CountDownLatch gate = new CountDownLatch(1);
            List<Thread> threads = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                threads.add(new Thread(() -> {
                    try {
                        gate.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    token.onCancel(fired::incrementAndGet);
                }));
            }
            threads.add(new Thread(() -> {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                token.cancel();
            }));
            threads.forEach(Thread::start);
            gate.countDown();
            for (Thread t : threads) t.join();

            assertEquals(4, fired.get(), "round " + round);
        }
    }

    @Test
    void constantTokens() throws Exception {
        CancellationToken never = CancellationToken.none();
        assertFalse(never.cancel());
        assertFalse(never.isCancelled());
        AtomicInteger calls = new AtomicInteger();
        never.onCancel(calls::incrementAndGet).close();
        assertSame(never, never.child());

        CancellationToken done = CancellationToken.cancelled();
        assertTrue(done.isCancelled());
        assertFalse(done.cancel());
        done.onCancel(calls::incrementAndGet);
        assertTrue(done.child().isCancelled());

        assertEquals(1, calls.get());
    }
}
