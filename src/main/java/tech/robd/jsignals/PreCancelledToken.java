/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/PreCancelledToken.java
 description: Singleton CancellationToken that is cancelled from the start.
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

import java.util.Objects;

/**
 * A {@link CancellationToken} that is already cancelled.
 *
 * <p>Callbacks run immediately on registration, {@link #cancel()} returns {@code false}
 * because the transition happened long ago, and {@link #child()} returns this instance.</p>
 */
public final class PreCancelledToken implements CancellationToken {

    static final PreCancelledToken INSTANCE = new PreCancelledToken();

    private PreCancelledToken() {
    }

    @Override
    public boolean isCancelled() {
        return true;
    }

    @Override
    public boolean cancel() {
        return false;
    }

    @Override
    public AutoCloseable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback cannot be null").run();
        return () -> {
        };
    }

    @Override
    public CancellationToken child() {
        return this;
    }

    @Override
    public String toString() {
        return "CancellationToken[CANCELLED]";
    }
}
