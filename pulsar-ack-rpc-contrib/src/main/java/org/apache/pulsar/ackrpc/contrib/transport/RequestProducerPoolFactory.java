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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.apache.commons.pool2.BaseKeyedPooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.pulsar.ackrpc.contrib.common.MessageDispatcherFactory;
import org.apache.pulsar.client.api.Producer;

/**
 * Creates pooled request {@link Producer}s keyed by topic, so that requests to the same subject share
 * producers instead of creating one per call.
 */
@RequiredArgsConstructor
class RequestProducerPoolFactory extends BaseKeyedPooledObjectFactory<String, Producer<byte[]>> {
    private final MessageDispatcherFactory dispatcherFactory;
    private final Map<String, Object> requestProducerConfig;

    /**
     * @throws UncheckedIOException if the producer cannot be created, wrapping the
     *                              {@link org.apache.pulsar.client.api.PulsarClientException}
     */
    @Override
    public Producer<byte[]> create(String topic) {
        try {
            return dispatcherFactory.requestProducer(topic, requestProducerConfig);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public PooledObject<Producer<byte[]>> wrap(Producer<byte[]> producer) {
        return new DefaultPooledObject<>(producer);
    }

    @Override
    public void destroyObject(String topic, PooledObject<Producer<byte[]>> pooledObject) throws Exception {
        pooledObject.getObject().close();
    }
}
