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

import java.time.Duration;
import org.apache.pulsar.ackrpc.contrib.common.TransportException;

/**
 * An ephemeral reply destination owned by a single request.
 */
public interface ReplyInbox extends AutoCloseable {

    /**
     * @return the address servers reply to, passed along with the request as its reply-to
     */
    String address();

    /**
     * Waits for the next message delivered to this inbox.
     *
     * @param timeout the longest time to wait
     * @return the message body, or {@code null} if nothing arrived in time
     * @throws TransportException if the transport fails while receiving
     * @throws InterruptedException if interrupted while waiting
     */
    byte[] receive(Duration timeout) throws TransportException, InterruptedException;

    /**
     * Tears the inbox down. Messages that arrive afterwards are dropped.
     */
    @Override
    void close();
}
