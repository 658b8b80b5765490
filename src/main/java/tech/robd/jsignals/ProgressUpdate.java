/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ProgressUpdate.java
 description: Immutable snapshot of a progress reporter: a fraction in [0,1] and an optional message.
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

import org.jspecify.annotations.Nullable;

/**
 * One consistent view of a {@link ProgressReporter}.
 *
 * @param progress fraction complete, always within {@code [0, 1]}
 * @param message  latest status text, or {@code null} if none was set
 */
public record ProgressUpdate(float progress, @Nullable String message) {

    /**
     * Zero progress, no message.
     */
    public static final ProgressUpdate INITIAL = new ProgressUpdate(0f, null);

    public ProgressUpdate {
        if (Float.isNaN(progress) || progress < 0f || progress > 1f) {
            throw new IllegalArgumentException("progress must be within [0, 1], was " + progress);
        }
    }
}
