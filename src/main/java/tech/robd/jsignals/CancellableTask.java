/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/CancellableTask.java
 description: Result of ThreadPool.spawnCancellable: the task handle paired with the token shared with the
              task.
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

import tech.robd.jsignals.fn.TaskHandle;

/**
 * @param handle completion handle of the spawned task
 * @param token  the token the task body polls
 * @param <T>    result type
 */
public record CancellableTask<T>(TaskHandle<T> handle, CancellationToken token) {

    /**
     * Shorthand for {@code token().cancel()}.
     */
    public boolean cancel() {
        return token.cancel();
    }
}
