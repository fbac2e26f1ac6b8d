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
package org.apache.pulsar.ackrpc.contrib.transport;

import java.util.Map;
import org.apache.pulsar.ackrpc.contrib.common.TransportException;
import org.apache.pulsar.ackrpc.contrib.common.TransportUnavailableException;

/**
 * The broker connection the ack RPC client publishes requests and receives replies through. The
 * connection is shared across requests; its reconnect behaviour belongs to the implementation.
 *
 * <p>Implementations signal a reconnecting or unreachable broker with
 * {@link TransportUnavailableException}, which the client retries after its reconnect delay. Any other
 * {@link TransportException} fails the request immediately.
 */
public interface RpcTransport extends AutoCloseable {

    /**
     * Makes sure a usable connection exists, creating it if needed. Called before every request attempt.
     *
     * @throws TransportException if no connection can be established
     */
    void connect() throws TransportException;

    /**
     * Opens a new reply inbox for one request.
     *
     * @return the inbox
     * @throws TransportException if the subscription cannot be created
     */
    ReplyInbox openInbox() throws TransportException;

    /**
     * Publishes a request.
     *
     * @param subject the subject the request is addressed to
     * @param payload the request body
     * @param replyTo the address of the reply inbox
     * @param messageConfig transport specific message settings, unknown keys are ignored
     * @throws TransportException if the request could not be published
     */
    void publish(String subject, byte[] payload, String replyTo, Map<String, Object> messageConfig)
            throws TransportException;

    @Override
    void close() throws TransportException;
}
