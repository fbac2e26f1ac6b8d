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
import java.util.concurrent.TimeUnit;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.ackrpc.contrib.common.TransportException;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.PulsarClientException;

/**
 * A reply inbox backed by an exclusive subscription on a topic created for one request. Closing the
 * inbox unsubscribes, so replies arriving after the request completed are never delivered anywhere.
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
class PulsarReplyInbox implements ReplyInbox {
    private final String topic;
    private final Consumer<byte[]> consumer;

    @Override
    public String address() {
        return topic;
    }

    @Override
    public byte[] receive(Duration timeout) throws TransportException, InterruptedException {
        long millis = Math.max(1L, Math.min(timeout.toMillis(), Integer.MAX_VALUE));
        Message<byte[]> msg;
        try {
            msg = consumer.receive((int) millis, TimeUnit.MILLISECONDS);
        } catch (PulsarClientException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while receiving from " + topic);
            }
            throw PulsarRpcTransport.translate(e, "Receive from " + topic);
        }
        if (msg == null) {
            return null;
        }
        consumer.acknowledgeAsync(msg).exceptionally(ex -> {
            log.warn("[{}] Acknowledging reply {} failed", topic, msg.getMessageId(), ex);
            return null;
        });
        return msg.getValue();
    }

    @Override
    public void close() {
        consumer.unsubscribeAsync()
                .exceptionally(ex -> {
                    log.warn("[{}] Unsubscribing reply inbox failed, closing it instead", topic, ex);
                    consumer.closeAsync();
                    return null;
                });
    }
}
