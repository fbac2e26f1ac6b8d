/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.pulsar.ackrpc.contrib.common;

/**
 * Base class of the checked exceptions raised by the ack RPC client.
 */
public class AckRpcClientException extends Exception {

    /**
     * Constructs an {@code AckRpcClientException} with the specified detail message.
     *
     * @param message
     *        The detail message (which is saved for later retrieval
     *        by the {@link #getMessage()} method)
     */
    public AckRpcClientException(String message) {
        super(message);
    }

    /**
     * Constructs an {@code AckRpcClientException} with the specified detail message and cause.
     *
     * @param message
     *        The detail message
     * @param cause
     *        The cause (which is saved for later retrieval by the
     *        {@link #getCause()} method).  (A null value is permitted,
     *        and indicates that the cause is nonexistent or unknown.)
     */
    public AckRpcClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public AckRpcClientException(Throwable cause) {
        super(cause);
    }
}
