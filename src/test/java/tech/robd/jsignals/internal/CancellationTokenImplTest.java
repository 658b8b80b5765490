/*
 [File Info]
 path: src/test/java/tech/robd/jsignals/internal/CancellationTokenImplTest.java
 description: CancellationTokenImpl bookkeeping: callback removal and weakly held children.
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
import tech.robd.jsignals.CancellationToken;
import tech.robd.jsignals.tools.GcAsserts;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CancellationTokenImplTest {

    @Test
    void closedRegistrationsAreForgotten() throws Exception {
        CancellationTokenImpl token = new CancellationTokenImpl();
        AutoCloseable a = token.onCancel(() -> {
        });
        token.onCancel(() -> {
        });
        assertEquals(2, token.pendingCallbackCount());

        a.close();
        a.close();
        assertEquals(1, token.pendingCallbackCount());

        token.cancel();
        assertEquals(0, token.pendingCallbackCount());
    }

    @Test
    void cancelReleasesChildren() {
        CancellationTokenImpl parent = new CancellationTokenImpl();
        CancellationToken child = parent.child();
        assertEquals(1, parent.liveChildCount());

        parent.cancel();

        assertTrue(child.isCancelled());
        assertEquals(0, parent.liveChildCount());
        assertTrue(parent.toString().contains("CANCELLED"));
    }

    @Test
    @Timeout(5)
        // Every pool spawn takes a child of the pool token while earlier tasks are still
        // outstanding. Scanning all children on each call made a burst quadratic.
    void manyLiveChildrenAreCheapToCreate() {
        CancellationTokenImpl parent = new CancellationTokenImpl();
        List<CancellationToken> held = new ArrayList<>();
        for (int i = 0; i < 200_000; i++) {
            held.add(parent.child());
        }
        assertEquals(200_000, parent.liveChildCount());

        parent.cancel();
        assertTrue(held.get(0).isCancelled());
        assertTrue(held.get(held.size() - 1).isCancelled());
    }

    @Test
    @Timeout(10)
        // GC note: only the sentinel is awaited; the assertion needs just one collected child.
    void collectedChildrenAreEventuallyPruned() {
        CancellationTokenImpl parent = new CancellationTokenImpl();
        ReferenceQueue<Object> q = new ReferenceQueue<>();
        WeakReference<CancellationToken> sentinel = dropChildren(parent, 1_000, q);
        GcAsserts.awaitGcCleared(sentinel, q, 5_000);

        int before = parent.trackedChildCount();
        List<CancellationToken> held = new ArrayList<>();
        while (parent.trackedChildCount() >= before + held.size() && held.size() < 4_000) {
            held.add(parent.child());
        }
        assertTrue(parent.trackedChildCount() < before + held.size(), "dead children never pruned");
        assertFalse(parent.isCancelled());
    }

    private static WeakReference<CancellationToken> dropChildren(CancellationTokenImpl parent, int n,
                                                                 ReferenceQueue<Object> q) {
        for (int i = 1; i < n; i++) {
            parent.child();
        }
        return new WeakReference<>(parent.child(), q);
    }
}
