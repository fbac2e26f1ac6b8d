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

import static org.apache.pulsar.ackrpc.contrib.common.Constants.INBOX_SUBSCRIPTION;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.ProducerAccessMode;
import org.apache.pulsar.client.api.ProducerBuilder;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.Schema;
import org.apache.pulsar.client.api.SubscriptionInitialPosition;
import org.apache.pulsar.client.api.SubscriptionType;

/**
 * Creates the producers and consumers the ack RPC client needs. Request and reply bodies are opaque
 * bytes, so everything uses {@link Schema#BYTES}.
 */
@RequiredArgsConstructor
public class MessageDispatcherFactory {
    private final PulsarClient client;

    /**
     * Creates a producer for sending requests to one subject topic.
     *
     * @param topic the topic requests are published to.
     * @param requestProducerConfig the configuration map for the request producer,
     *                              will call {@link ProducerBuilder#loadConf(Map)}
     * @return the created request message producer.
     * @throws IOException if there is an error creating the producer.
     */
    public Producer<byte[]> requestProducer(String topic, Map<String, Object> requestProducerConfig)
            throws IOException {
        ProducerBuilder<byte[]> builder = client.newProducer(Schema.BYTES);
        if (!requestProducerConfig.isEmpty()) {
            builder.loadConf(requestProducerConfig);
        }
        return builder
                .topic(topic)
                // many clients publish requests to the same subject
                .accessMode(ProducerAccessMode.Shared)
                .enableBatching(false)
                .create();
    }

    /**
     * Creates the consumer behind a call-scoped reply inbox.
     *
     * @param topic the inbox topic.
     * @return the created inbox consumer.
     * @throws IOException if there is an error creating the consumer.
     */
    public Consumer<byte[]> inboxConsumer(String topic) throws IOException {
        return client.newConsumer(Schema.BYTES)
                .topic(topic)
                .subscriptionName(INBOX_SUBSCRIPTION)
                .subscriptionInitialPosition(SubscriptionInitialPosition.Earliest)
                // allow only one client
                .subscriptionType(SubscriptionType.Exclusive)
                .subscribe();
    }
}
