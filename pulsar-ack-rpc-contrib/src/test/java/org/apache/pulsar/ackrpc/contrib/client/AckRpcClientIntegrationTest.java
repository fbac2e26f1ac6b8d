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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.ACK_TIMEOUT_ENV;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.NACK_BACKOFF_SPLAY_LIMIT_ENV;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.REPLY_TO;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.ackrpc.contrib.common.ReplyMarkers;
import org.apache.pulsar.ackrpc.contrib.common.RequestTimeoutException;
import org.apache.pulsar.ackrpc.contrib.transport.PulsarRpcTransport;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.Schema;
import org.apache.pulsar.client.api.TypedMessageBuilder;
import org.testcontainers.DockerClientFactory;
import org.testng.Assert;
import org.testng.SkipException;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

@Slf4j
public class AckRpcClientIntegrationTest {
    private static final String PREFIX = "persistent://public/default/";

    private PulsarClient pulsarClient;
    private PulsarRpcTransport transport;
    private final List<Consumer<byte[]>> responders = new ArrayList<>();
    private final AtomicInteger busyRequests = new AtomicInteger();

    @BeforeClass(alwaysRun = true)
    public void setup() throws Exception {
        if (!DockerClientFactory.instance().isDockerAvailable()) {
            throw new SkipException("Docker is not available");
        }
        pulsarClient = SingletonPulsarContainer.createPulsarClient();
        transport = new PulsarRpcTransport(pulsarClient, PREFIX, Map.of());

        startResponder("rpc.echo_service.echo", msg -> List.of(ReplyMarkers.ack(),
                ("echo:" + new String(msg.getValue(), UTF_8)).getBytes(UTF_8)));
        startResponder("rpc.echo_service.key", msg -> List.of(msg.getKey().getBytes(UTF_8), ReplyMarkers.ack()));
        startResponder("rpc.busy_service.run", msg -> {
            busyRequests.incrementAndGet();
            return List.of(ReplyMarkers.nack());
        });
    }

    @AfterClass(alwaysRun = true)
    public void cleanup() throws Exception {
        for (Consumer<byte[]> responder : responders) {
            responder.close();
        }
        if (transport != null) {
            transport.close();
        }
        if (pulsarClient != null) {
            pulsarClient.close();
        }
    }

    @Test
    public void testAckThenResponse() throws Exception {
        AckRpcClient client = newClient("EchoService", "echo", Map.of());

        assertEquals(new String(client.request("hello".getBytes(UTF_8)), UTF_8), "echo:hello");
        assertEquals(new String(client.request("again".getBytes(UTF_8)), UTF_8), "echo:again");
    }

    @Test
    public void testResponseBeforeAckWithMessageConfig() throws Exception {
        AckRpcClient client = newClient("EchoService", "key", Map.of());
        RequestOptions options = RequestOptions.fromMap(Map.of(TypedMessageBuilder.CONF_KEY, "order-42"));

        assertEquals(new String(client.request("ignored".getBytes(UTF_8), options), UTF_8), "order-42");
    }

    @Test
    public void testNackExhaustsRetries() throws Exception {
        AckRpcClient client = newClient("BusyService", "run", Map.of(NACK_BACKOFF_SPLAY_LIMIT_ENV, "0"));
        busyRequests.set(0);

        Assert.expectThrows(RequestTimeoutException.class, () -> client.request("work".getBytes(UTF_8)));
        assertEquals(busyRequests.get(), 6);
    }

    @Test
    public void testNoResponderTimesOut() throws Exception {
        AckRpcClient client = newClient("AbsentService", "run", Map.of(ACK_TIMEOUT_ENV, "0.5"));

        long start = System.nanoTime();
        Assert.expectThrows(RequestTimeoutException.class, () -> client.request("anyone".getBytes(UTF_8)));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMillis >= 1500, "Elapsed " + elapsedMillis + " ms");
    }

    private AckRpcClient newClient(String service, String method, Map<String, String> environment)
            throws Exception {
        return AckRpcClient.builder()
                .service(service)
                .method(method)
                .transport(transport)
                .environment(environment)
                .build();
    }

    private void startResponder(String subject, Function<Message<byte[]>, List<byte[]>> replies)
            throws PulsarClientException {
        Consumer<byte[]> responder = pulsarClient.newConsumer(Schema.BYTES)
                .topic(PREFIX + subject)
                .subscriptionName("responder")
                .messageListener((consumer, msg) -> {
                    try (Producer<byte[]> producer = pulsarClient.newProducer(Schema.BYTES)
                            .topic(msg.getProperty(REPLY_TO))
                            .create()) {
                        for (byte[] reply : replies.apply(msg)) {
                            producer.send(reply);
                        }
                        consumer.acknowledge(msg);
                    } catch (PulsarClientException e) {
                        log.error("[{}] Failed to reply", subject, e);
                        consumer.negativeAcknowledge(msg);
                    }
                })
                .subscribe();
        responders.add(responder);
    }
}
