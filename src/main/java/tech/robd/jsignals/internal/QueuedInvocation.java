/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/internal/QueuedInvocation.java
 description: One boxed deferred delivery sitting in a thread's invocation queue, optionally paired with a
              completion future a blocked emitter waits on.
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

package tech.robd.jsignals.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.jsignals.DeliveryException;
import tech.robd.jsignals.diagnostics.Diagnostics;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A deferred unit of work bound for a destination thread.
 *
 * <p>Runs at most once. Plain invocations log their own failures; invocations created
 * with {@link #withCompletion(Runnable)} hand success or failure to the waiting emitter
 * through {@link #completion()} instead.</p>
 */
public final class QueuedInvocation {

    private static final Diagnostics DIAG = Diagnostics.of(QueuedInvocation.class);
    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id = NEXT_ID.getAndIncrement();
    private final Runnable body;
    private final @Nullable CompletableFuture<Void> completion;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private QueuedInvocation(Runnable body, @Nullable CompletableFuture<Void> completion) {
        if (body == null) throw new IllegalArgumentException("body cannot be null");
        this.body = body;
        this.completion = completion;
    }

    public static QueuedInvocation of(Runnable body) {
        return new QueuedInvocation(body, null);
    }

    public static QueuedInvocation withCompletion(Runnable body) {
        return new QueuedInvocation(body, new CompletableFuture<>());
    }

    public long id() {
        return id;
    }

    /**
     * @return the completion future, or {@code null} for fire-and-forget invocations
     */
    public @Nullable CompletableFuture<Void> completion() {
        return completion;
    }

    /**
     * Run the body on the calling thread. A second call does nothing.
     */
    public void execute() {
        if (!started.compareAndSet(false, true)) return;
        try {
            body.run();
            if (completion != null) completion.complete(null);
        } catch (RuntimeException e) {
            if (completion != null) {
                completion.completeExceptionally(e);
            } else {
                DIAG.error("inv#{} queued slot failed: {}", id, e.toString(), e);
            }
        } catch (Error e) {
            if (completion != null) completion.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Mark this invocation as never going to run. Waiting emitters are released with a
     * {@link DeliveryException}.
     *
     * @param reason why it was dropped
     * @return {@code true} if this call prevented the body from running
     */
    public boolean abandon(String reason) {
        if (!started.compareAndSet(false, true)) return false;
        DIAG.debug("inv#{} abandoned: {}", id, reason);
        if (completion != null) completion.completeExceptionally(new DeliveryException(reason));
        return true;
    }

    @Override
    public String toString() {
        return "QueuedInvocation[" + id + (completion != null ? ", blocking" : "") + "]";
    }
}
