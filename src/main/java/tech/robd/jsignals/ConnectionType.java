/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/ConnectionType.java
 description: Delivery semantics of a connection: direct, queued, blocking-queued, or chosen by thread
              affinity.
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
 * How a connected {@link Slot} is invoked when its {@link Signal} emits. Fixed at connect time.
 */
public enum ConnectionType {

    /**
     * Invoke synchronously on the emitting thread, in connection order. No affinity check.
     */
    DIRECT,

    /**
     * Post the value to the destination thread's queue and return at once.
     * Deliveries to one destination keep their posting order.
     */
    QUEUED,

    /**
     * Like {@link #QUEUED}, but the emitter waits until the destination has run the slot.
     * When the destination is the emitting thread the slot runs inline instead.
     */
    BLOCKING_QUEUED,

    /**
     * {@link #DIRECT} when the emitting thread satisfies the connection's affinity
     * (or there is none), {@link #QUEUED} otherwise. The default.
     */
    AUTO
}
