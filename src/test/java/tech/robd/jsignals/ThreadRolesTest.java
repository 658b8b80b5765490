/*
 [File Info]
 path: src/test/java/tech/robd/jsignals/ThreadRolesTest.java
 description: Owner-thread designation, thread checks, and ThreadAffinity resolution against the owner.
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
import tech.robd.jsignals.tools.TestAwaitUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class ThreadRolesTest {

    @BeforeEach
    void setUp() {
        ThreadRoles.clearOwnerThread();
        ThreadRoles.setThreadChecksEnabled(false);
    }

    @AfterEach
    void tearDown() {
        ThreadRoles.clearOwnerThread();
        ThreadRoles.setThreadChecksEnabled(false);
        EventLoop.processPendingEvents();
    }

    @Test
    void everyThreadCountsAsOwnerBeforeDesignation() {
        assertEquals(OptionalLong.empty(), ThreadRoles.ownerThreadId());
        assertNull(ThreadRoles.ownerThread());
        assertTrue(ThreadRoles.isOwnerThread());
    }

    @Test
    @Timeout(5)
    void designationIsVisibleFromOtherThreads() throws Exception {
        ThreadRoles.designateOwnerThread();
        ThreadRoles.designateOwnerThread(); // same thread again: harmless

        assertEquals(OptionalLong.of(Thread.currentThread().getId()), ThreadRoles.ownerThreadId());
        assertSame(Thread.currentThread(), ThreadRoles.ownerThread());
        assertTrue(ThreadRoles.isOwnerThread());

        AtomicBoolean otherIsOwner = new AtomicBoolean(true);
        AtomicReference<Throwable> redesignate = new AtomicReference<>();
        Thread other = new Thread(() -> {
            otherIsOwner.set(ThreadRoles.isOwnerThread());
            try {
                ThreadRoles.designateOwnerThread();
            } catch (IllegalStateException e) {
                redesignate.set(e);
            }
        });
        other.start();
        other.join();

        assertFalse(otherIsOwner.get());
        assertInstanceOf(IllegalStateException.class, redesignate.get());
        assertSame(Thread.currentThread(), ThreadRoles.ownerThread(), "owner must not change");
    }

    @Test
    @Timeout(5)
    void assertOwnerThreadOnlyFailsWhenChecksAreEnabled() throws Exception {
        ThreadRoles.designateOwnerThread();
        long ownerId = Thread.currentThread().getId();

        AtomicReference<Throwable> disabled = new AtomicReference<>();
        AtomicReference<Throwable> enabled = new AtomicReference<>();
        Thread other = new Thread(() -> {
            try {
                ThreadRoles.assertOwnerThread("render");
            } catch (RuntimeException e) {
                disabled.set(e);
            }
            ThreadRoles.setThreadChecksEnabled(true);
            try {
                ThreadRoles.assertOwnerThread("render");
            } catch (RuntimeException e) {
                enabled.set(e);
            }
        });
        other.start();
        other.join();

        assertNull(disabled.get());
        WrongThreadException wte = assertInstanceOf(WrongThreadException.class, enabled.get());
        assertEquals(ownerId, wte.expectedThreadId());
        assertEquals(other.getId(), wte.actualThreadId());

        ThreadRoles.assertOwnerThread("on owner"); // owner passes even with checks on
    }

    @Test
    @Timeout(5)
    void affinityKindsResolveAsDocumented() throws Exception {
        ThreadAffinity none = ThreadAffinity.none();
        ThreadAffinity owner = ThreadAffinity.ownerThread();
        ThreadAffinity here = ThreadAffinity.current();

        assertTrue(none.isNone());
        assertTrue(none.isSameThread());
        assertTrue(none.threadId().isEmpty());
        assertTrue(owner.isOwnerThreadAffinity());
        assertTrue(owner.threadId().isEmpty(), "no owner yet");
        assertEquals(OptionalLong.of(Thread.currentThread().getId()), here.threadId());
        assertSame(Thread.currentThread(), here.thread());

        ThreadRoles.designateOwnerThread();
        assertEquals(ThreadRoles.ownerThreadId(), owner.threadId());

        AtomicBoolean ownerSame = new AtomicBoolean(true);
        AtomicBoolean hereSame = new AtomicBoolean(true);
        AtomicReference<Throwable> asserted = new AtomicReference<>();
        Thread other = new Thread(() -> {
            ownerSame.set(owner.isSameThread());
            hereSame.set(here.isSameThread());
            try {
                here.assertSameThread("touch widget");
            } catch (WrongThreadException e) {
                asserted.set(e);
            }
        });
        other.start();
        other.join();

        assertFalse(ownerSame.get());
        assertFalse(hereSame.get());
        assertNotNull(asserted.get());
    }

    @Test
    @Timeout(5)
        // Queued connection with owner affinity made and emitted on a helper thread still lands here.
    void ownerAffinityRoutesQueuedDeliveriesToOwner() throws Exception {
        ThreadRoles.designateOwnerThread();
        Signal<String> signal = new Signal<>();
        List<String> ranOn = new ArrayList<>();

        Thread helper = new Thread(() -> {
            signal.connect(v -> ranOn.add(Thread.currentThread().getName() + ":" + v),
                    ConnectionType.AUTO, ThreadAffinity.ownerThread());
            signal.emit("hello");
        }, "helper");
        helper.start();
        helper.join();

        TestAwaitUtils.pumpUntil(() -> !ranOn.isEmpty(), 1000, "owner never received the delivery");
        assertEquals(List.of(Thread.currentThread().getName() + ":hello"), ranOn);
    }
}
