/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/internal/TaskHandleImpl.java
 description: Default TaskHandle wrapping a CompletableFuture and the task's CancellationToken.
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

package tech.robd.jsignals.internal;

import tech.robd.jsignals.CancellationToken;
import tech.robd.jsignals.diagnostics.Diagnostics;
import tech.robd.jsignals.fn.TaskHandle;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link TaskHandle}.
 *
 * <p>Unlike a coroutine handle, cancelling here never cancels the future: the token is
 * advisory and the future completes only when the task body returns or throws.</p>
 *
 * @param <T> result type
 */
public final class TaskHandleImpl<T> implements TaskHandle<T> {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(TaskHandleImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final long id;
    private final CompletableFuture<T> future;
    private final CancellationToken token;
    // [/🧩 Section: state]

    public TaskHandleImpl(long id, CompletableFuture<T> future, CancellationToken token) {
        if (future == null) throw new IllegalArgumentException("Future cannot be null");
        if (token == null) throw new IllegalArgumentException("CancellationToken cannot be null");
        this.id = id;
        this.future = future;
        this.token = token;
    }

    // 🧩 Section: API
    @Override
    public long id() {
        return id;
    }

    @Override
    public boolean isFinished() {
        return future.isDone();
    }

    @Override
    public Optional<T> tryGet() {
        if (!future.isDone() || future.isCompletedExceptionally()) return Optional.empty();
        return Optional.ofNullable(future.getNow(null));
    }

    @Override
    public Optional<T> await() {
        try {
            return Optional.ofNullable(future.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            DIAG.debug("task#{} await interrupted", id);
            return Optional.empty();
        } catch (ExecutionException | java.util.concurrent.CancellationException e) {
            return Optional.empty();
        }
    }

    @Override
    public Optional<T> await(Duration timeout) {
        try {
            return Optional.ofNullable(future.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (TimeoutException | ExecutionException | java.util.concurrent.CancellationException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean cancel() {
        boolean first = token.cancel();
        DIAG.debug("task#{} cancel requested (first={})", id, first);
        return first;
    }

    @Override
    public CancellationToken cancellationToken() {
        return token;
    }

    @Override
    public Optional<Throwable> failure() {
        if (!future.isCompletedExceptionally()) return Optional.empty();
        try {
            future.join();
            return Optional.empty();
        } catch (CompletionException e) {
            return Optional.ofNullable(e.getCause());
        } catch (java.util.concurrent.CancellationException e) {
            return Optional.of(e);
        }
    }

    @Override
    public CompletableFuture<T> result() {
        return future;
    }
    // [/🧩 Section: API]

    @Override
    public String toString() {
        String status;
        if (future.isDone()) {
            status = future.isCompletedExceptionally() ? "FAILED" : "COMPLETED";
        } else {
            status = token.isCancelled() ? "CANCELLING" : "ACTIVE";
        }
        return "TaskHandle[" + id + ", " + status + "]";
    }
}
