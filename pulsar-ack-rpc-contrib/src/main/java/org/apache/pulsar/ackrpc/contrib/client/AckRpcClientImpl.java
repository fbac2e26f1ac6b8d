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

import static lombok.AccessLevel.PACKAGE;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.ACK_TIMEOUT_RETRY_LIMIT;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.RECONNECT_RETRY_LIMIT;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.ackrpc.contrib.common.AckRpcClientException;
import org.apache.pulsar.ackrpc.contrib.common.AckTimeoutException;
import org.apache.pulsar.ackrpc.contrib.common.RequestTimeoutException;
import org.apache.pulsar.ackrpc.contrib.common.TimingPolicy;
import org.apache.pulsar.ackrpc.contrib.common.TransportException;
import org.apache.pulsar.ackrpc.contrib.common.TransportUnavailableException;
import org.apache.pulsar.ackrpc.contrib.transport.RpcTransport;

@Slf4j
@RequiredArgsConstructor(access = PACKAGE)
class AckRpcClientImpl implements AckRpcClient {
    private final RequestContext context;
    private final TimingPolicy timingPolicy;
    private final RpcTransport transport;
    private final RequestSender sender;
    private final boolean ownsTransport;

    /**
     * Creates a new instance of {@link AckRpcClientImpl}.
     *
     * @param context the service method and resolved timeouts
     * @param timingPolicy the policy the context was resolved from, also supplies the NACK backoff
     * @param transport the transport to send requests through
     * @param ownsTransport whether {@link #close()} closes the transport
     * @return A new instance of {@link AckRpcClientImpl}.
     */
    static AckRpcClientImpl create(@NonNull RequestContext context, @NonNull TimingPolicy timingPolicy,
                                   @NonNull RpcTransport transport, boolean ownsTransport) {
        return new AckRpcClientImpl(context, timingPolicy, transport,
                new RequestSender(transport, timingPolicy), ownsTransport);
    }

    @Override
    public byte[] request(byte[] requestData, @NonNull RequestOptions options) throws AckRpcClientException {
        RequestOptions requestOptions = options.withDefaults(ackTimeout(), context.effectiveResponseTimeout());
        String subject = cachedSubscriptionKey().getSubject();
        List<Duration> nackBackoff = timingPolicy.getNackBackoffIntervals();
        // one counter for every failure category, it also indexes the NACK backoff table
        int attempt = 0;

        while (true) {
            ReplyOutcome outcome;
            try {
                setupConnection();
                outcome = sender.requestWithTwoResponses(subject, requestData, requestOptions);
            } catch (TransportUnavailableException e) {
                Duration delay = reconnectDelay();
                log.warn("[{}] Transport unavailable, sleeping {} ms before retrying. {}",
                        subject, delay.toMillis(), e.getMessage());
                sleep(delay);
                if (++attempt >= RECONNECT_RETRY_LIMIT) {
                    throw e;
                }
                continue;
            } catch (AckTimeoutException e) {
                if (++attempt >= ACK_TIMEOUT_RETRY_LIMIT) {
                    throw new RequestTimeoutException("No reply on " + subject + " after "
                            + attempt + " attempts");
                }
                log.debug("[{}] Ack timeout, retrying ({}/{})", subject, attempt, ACK_TIMEOUT_RETRY_LIMIT);
                continue;
            }

            if (!outcome.isNack()) {
                return outcome.getPayload();
            }
            Duration backoff = nackBackoff.get(attempt).plus(splay());
            log.debug("[{}] Request declined, backing off {} ms ({}/{})",
                    subject, backoff.toMillis(), attempt + 1, nackBackoff.size());
            sleep(backoff);
            if (++attempt >= nackBackoff.size()) {
                throw new RequestTimeoutException("Request on " + subject + " declined after "
                        + attempt + " attempts");
            }
        }
    }

    @Override
    public SubscriptionKey cachedSubscriptionKey() {
        return SubscriptionKeyCache.get(context.getService(), context.getMethod());
    }

    @Override
    public Duration ackTimeout() {
        return context.getAckTimeout();
    }

    @Override
    public Duration reconnectDelay() {
        return context.getReconnectDelay();
    }

    @Override
    public Duration responseTimeout() {
        return context.getResponseTimeout();
    }

    @Override
    public void close() throws AckRpcClientException {
        if (ownsTransport) {
            transport.close();
        }
    }

    private void setupConnection() throws TransportException {
        transport.connect();
    }

    private Duration splay() {
        long limit = timingPolicy.getNackBackoffSplayLimit().toNanos();
        return limit > 0 ? Duration.ofNanos(ThreadLocalRandom.current().nextLong(limit)) : Duration.ZERO;
    }

    private static void sleep(Duration duration) throws AckRpcClientException {
        try {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AckRpcClientException("Interrupted while backing off", e);
        }
    }
}
