/*
 [File Info]
 path: src/main/java/tech/robd/jsignals/DeliveryException.java
 description: Unchecked failure of a cross-thread delivery: the destination thread has shut down its queue,
              terminated, or the waiting emitter was interrupted.
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
 * Thrown when a queued delivery cannot reach its destination thread.
 *
 * <p>The usual case is a {@link ConnectionType#BLOCKING_QUEUED} emit whose destination
 * thread has closed its queue through {@link EventLoop#shutdownCurrentThread()} or has
 * terminated. The emitter gets this exception rather than waiting forever.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Factory for the closed or terminated destination case.
     *
     * @param threadName name of the destination thread
     * @return a new exception naming the thread
     */
    public static DeliveryException destinationGone(String threadName) {
        return new DeliveryException("Destination thread '" + threadName
                + "' is no longer accepting queued deliveries");
    }
}
