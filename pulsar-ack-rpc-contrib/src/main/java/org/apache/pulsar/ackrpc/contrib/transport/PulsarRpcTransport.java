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

import static org.apache.pulsar.ackrpc.contrib.common.Constants.INBOX_TOPIC_PREFIX;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.REPLY_TO;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericKeyedObjectPool;
import org.apache.pulsar.ackrpc.contrib.common.MessageDispatcherFactory;
import org.apache.pulsar.ackrpc.contrib.common.TransportException;
import org.apache.pulsar.ackrpc.contrib.common.TransportUnavailableException;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.TypedMessageBuilder;

/**
 * {@link RpcTransport} on Apache Pulsar. Subjects map to topics under a common prefix, requests carry
 * the inbox topic in the {@code reply_to} property, and every inbox is a fresh topic with an exclusive
 * subscription.
 *
 * <p>The transport either owns its {@link PulsarClient}, created lazily from a service URL and
 * recreated by {@link #connect()} once closed, or wraps a client supplied by the caller which it never
 * closes.
 */
@Slf4j
public class PulsarRpcTransport implements RpcTransport {
    private static final Set<String> MESSAGE_CONFIG_KEYS = Set.of(
            TypedMessageBuilder.CONF_KEY,
            TypedMessageBuilder.CONF_PROPERTIES,
            TypedMessageBuilder.CONF_EVENT_TIME,
            TypedMessageBuilder.CONF_SEQUENCE_ID,
            TypedMessageBuilder.CONF_REPLICATION_CLUSTERS,
            TypedMessageBuilder.CONF_DISABLE_REPLICATION,
            TypedMessageBuilder.CONF_DELIVERY_AFTER_SECONDS,
            TypedMessageBuilder.CONF_DELIVERY_AT);

    private final String serviceUrl;
    @Getter
    private final String topicPrefix;
    private final Map<String, Object> requestProducerConfig;
    private PulsarClient client;
    private MessageDispatcherFactory dispatcherFactory;
    private GenericKeyedObjectPool<String, Producer<byte[]>> producerPool;

    /**
     * Creates a transport that owns a client connected to {@code serviceUrl}.
     *
     * @param serviceUrl the Pulsar service URL
     * @param topicPrefix prepended to subjects and inbox names, e.g. {@code persistent://public/default/}
     * @param requestProducerConfig configuration map for request producers
     */
    public PulsarRpcTransport(@NonNull String serviceUrl, @NonNull String topicPrefix,
                              @NonNull Map<String, Object> requestProducerConfig) {
        this.serviceUrl = serviceUrl;
        this.topicPrefix = topicPrefix;
        this.requestProducerConfig = Map.copyOf(requestProducerConfig);
    }

    /**
     * Creates a transport on top of an existing client. The client stays owned by the caller.
     *
     * @param client the client to use
     * @param topicPrefix prepended to subjects and inbox names
     * @param requestProducerConfig configuration map for request producers
     */
    public PulsarRpcTransport(@NonNull PulsarClient client, @NonNull String topicPrefix,
                              @NonNull Map<String, Object> requestProducerConfig) {
        this.serviceUrl = null;
        this.topicPrefix = topicPrefix;
        this.requestProducerConfig = Map.copyOf(requestProducerConfig);
        attach(client);
    }

    @Override
    public synchronized void connect() throws TransportException {
        if (client != null && !client.isClosed()) {
            return;
        }
        if (serviceUrl == null) {
            throw new TransportException("The supplied PulsarClient has been closed");
        }
        closeProducerPool();
        try {
            attach(PulsarClient.builder()
                    .serviceUrl(serviceUrl)
                    .operationTimeout(30, TimeUnit.SECONDS)
                    .connectionTimeout(30, TimeUnit.SECONDS)
                    .keepAliveInterval(30, TimeUnit.SECONDS)
                    .build());
            log.info("Created PulsarClient for {}", serviceUrl);
        } catch (PulsarClientException e) {
            throw translate(e, "Connect to " + serviceUrl);
        }
    }

    @Override
    public ReplyInbox openInbox() throws TransportException {
        String topic = topicPrefix + INBOX_TOPIC_PREFIX + UUID.randomUUID();
        try {
            Consumer<byte[]> consumer = dispatcher().inboxConsumer(topic);
            return new PulsarReplyInbox(topic, consumer);
        } catch (PulsarClientException e) {
            throw translate(e, "Subscribe to " + topic);
        } catch (IOException e) {
            throw new TransportException("Subscribe to " + topic + " failed", e);
        }
    }

    @Override
    public void publish(String subject, byte[] payload, String replyTo, Map<String, Object> messageConfig)
            throws TransportException {
        String topic = topicPrefix + subject;
        GenericKeyedObjectPool<String, Producer<byte[]>> pool = producerPool();
        Producer<byte[]> producer = borrow(pool, topic);
        try {
            TypedMessageBuilder<byte[]> message = producer.newMessage()
                    .value(payload)
                    .property(REPLY_TO, replyTo);
            Map<String, Object> config = supportedMessageConfig(messageConfig);
            if (!config.isEmpty()) {
                message.loadConf(config);
            }
            message.send();
        } catch (PulsarClientException e) {
            invalidate(pool, topic, producer);
            throw translate(e, "Publish to " + topic);
        } catch (RuntimeException e) {
            // rejected message config, the producer itself is still usable
            pool.returnObject(topic, producer);
            throw new TransportException("Publish to " + topic + " failed", e);
        }
        pool.returnObject(topic, producer);
    }

    @Override
    public synchronized void close() throws TransportException {
        closeProducerPool();
        if (serviceUrl != null && client != null) {
            try {
                client.close();
            } catch (PulsarClientException e) {
                throw new TransportException("Failed to close PulsarClient", e);
            } finally {
                client = null;
            }
        }
    }

    /**
     * Maps a Pulsar client failure to the transport error taxonomy. Connection level failures mean the
     * broker is unavailable for now and are worth retrying.
     */
    static TransportException translate(PulsarClientException e, String action) {
        if (e instanceof PulsarClientException.ConnectException
                || e instanceof PulsarClientException.NotConnectedException
                || e instanceof PulsarClientException.AlreadyClosedException
                || e instanceof PulsarClientException.TimeoutException
                || e instanceof PulsarClientException.LookupException) {
            return new TransportUnavailableException(action + " failed, broker unavailable", e);
        }
        return new TransportException(action + " failed", e);
    }

    private void attach(PulsarClient pulsarClient) {
        this.client = pulsarClient;
        this.dispatcherFactory = new MessageDispatcherFactory(pulsarClient);
        this.producerPool = new GenericKeyedObjectPool<>(
                new RequestProducerPoolFactory(dispatcherFactory, requestProducerConfig));
    }

    private synchronized MessageDispatcherFactory dispatcher() throws TransportUnavailableException {
        if (dispatcherFactory == null) {
            throw new TransportUnavailableException("Not connected");
        }
        return dispatcherFactory;
    }

    private synchronized GenericKeyedObjectPool<String, Producer<byte[]>> producerPool()
            throws TransportUnavailableException {
        if (producerPool == null) {
            throw new TransportUnavailableException("Not connected");
        }
        return producerPool;
    }

    private static Producer<byte[]> borrow(GenericKeyedObjectPool<String, Producer<byte[]>> pool, String topic)
            throws TransportException {
        try {
            return pool.borrowObject(topic);
        } catch (UncheckedIOException e) {
            if (e.getCause() instanceof PulsarClientException) {
                throw translate((PulsarClientException) e.getCause(), "Create producer for " + topic);
            }
            throw new TransportException("Create producer for " + topic + " failed", e.getCause());
        } catch (Exception e) {
            throw new TransportException("Borrow producer for " + topic + " failed", e);
        }
    }

    private static void invalidate(GenericKeyedObjectPool<String, Producer<byte[]>> pool, String topic,
                                   Producer<byte[]> producer) {
        try {
            pool.invalidateObject(topic, producer);
        } catch (Exception e) {
            log.warn("[{}] Failed to invalidate request producer", topic, e);
        }
    }

    private void closeProducerPool() {
        if (producerPool != null) {
            producerPool.close();
            producerPool = null;
            dispatcherFactory = null;
        }
    }

    private static Map<String, Object> supportedMessageConfig(Map<String, Object> messageConfig) {
        Map<String, Object> config = new HashMap<>();
        messageConfig.forEach((key, value) -> {
            if (MESSAGE_CONFIG_KEYS.contains(key)) {
                config.put(key, value);
            } else {
                log.debug("Ignoring unsupported message config {}", key);
            }
        });
        return config;
    }
}
