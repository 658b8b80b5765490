/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/WrongThreadException.java
 description: Thrown by thread-affinity checks when an operation runs on a thread other than the one it is
              bound to.
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

/**
 * Raised by {@link ThreadRoles#assertOwnerThread(String)} and
 * {@link ThreadAffinity#assertSameThread(String)} when the calling thread is not the
 * expected one.
 */
public final class WrongThreadException extends IllegalStateException {

    private final long expectedThreadId;
    private final long actualThreadId;

    public WrongThreadException(String message, Thread actual, long expectedThreadId) {
        super(message + " [expected thread id=" + expectedThreadId
                + ", actual='" + actual.getName() + "' id=" + actual.getId() + "]");
        this.expectedThreadId = expectedThreadId;
        this.actualThreadId = actual.getId();
    }

    public long expectedThreadId() {
        return expectedThreadId;
    }

    public long actualThreadId() {
        return actualThreadId;
    }
}
