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
package org.apache.pulsar.ackrpc.contrib.client;

import java.time.Duration;
import org.apache.pulsar.ackrpc.contrib.common.AckRpcClientException;
import org.apache.pulsar.ackrpc.contrib.common.RequestTimeoutException;
import org.apache.pulsar.ackrpc.contrib.common.TransportException;
import org.apache.pulsar.ackrpc.contrib.common.TransportUnavailableException;

/**
 * Calls one method of a remote service over a message broker. Every request is acknowledged by the
 * server before its response is sent, which lets the client tell a busy or absent server (no ACK) from
 * a slow one (ACK, response pending) and retry accordingly.
 *
 * <p>Failures are retried per category:
 * <ul>
 *   <li>no ACK or no response in time: up to three attempts, immediately;
 *   <li>NACK from the server: up to six attempts, sleeping through a fixed backoff table;
 *   <li>broker unavailable: up to three attempts, sleeping the reconnect delay before each retry.
 * </ul>
 */
public interface AckRpcClient extends AutoCloseable {

    /**
     * Creates a builder for configuring a new {@link AckRpcClient}.
     *
     * @return A new instance of {@link AckRpcClientBuilder}.
     */
    static AckRpcClientBuilder builder() {
        return new AckRpcClientBuilderImpl();
    }

    /**
     * Sends a request using the client's configured timeouts.
     *
     * @see #request(byte[], RequestOptions)
     */
    default byte[] request(byte[] requestData) throws AckRpcClientException {
        return request(requestData, RequestOptions.empty());
    }

    /**
     * Sends a request and waits for its response, retrying as described on this interface.
     *
     * @param requestData the serialized request
     * @param options overrides for this request
     * @return the raw response body
     * @throws RequestTimeoutException if ack-timeout or NACK retries were exhausted
     * @throws TransportUnavailableException the last error, as raised by the transport, once the broker
     *                                       stayed unavailable through all reconnect retries
     * @throws TransportException if the transport failed in any other way
     * @throws AckRpcClientException if interrupted while waiting
     */
    byte[] request(byte[] requestData, RequestOptions options) throws AckRpcClientException;

    /**
     * @return the process wide cached key of the service method this client calls
     */
    SubscriptionKey cachedSubscriptionKey();

    Duration ackTimeout();

    Duration reconnectDelay();

    Duration responseTimeout();

    /**
     * Closes the client, and the transport if the client created it.
     *
     * @throws AckRpcClientException if closing the transport fails
     */
    @Override
    void close() throws AckRpcClientException;
}
