/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ConnectionId.java
 description: Identifier of one connection, scoped to the signal that issued it. Never reused.
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
 * Handle returned by {@link Signal#connect(Slot)} and accepted by {@link Signal#disconnect(ConnectionId)}.
 *
 * @param signalId identity of the issuing signal's registry
 * @param sequence per-signal sequence number, starting at 1
 */
public record ConnectionId(long signalId, long sequence) {

    @Override
    public String toString() {
        return "ConnectionId[" + signalId + ":" + sequence + "]";
    }
}
