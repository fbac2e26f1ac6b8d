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
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.ackrpc.contrib.common.AckRpcClientException;
import org.apache.pulsar.ackrpc.contrib.common.AckTimeoutException;
import org.apache.pulsar.ackrpc.contrib.common.ReplyMarkers;
import org.apache.pulsar.ackrpc.contrib.common.TimingPolicy;
import org.apache.pulsar.ackrpc.contrib.transport.ReplyInbox;
import org.apache.pulsar.ackrpc.contrib.transport.RpcTransport;

/**
 * Performs one request exchange: publishes the request with a private reply inbox and waits for the
 * server's ACK and response on that inbox.
 *
 * <p>The two replies are produced independently on the server side, so they may arrive in either
 * order. A response that shows up before its ACK completes the exchange at once; the ACK that follows
 * is dropped together with the inbox.
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
class RequestSender {
    private final RpcTransport transport;
    private final TimingPolicy timingPolicy;

    /**
     * Sends a request and waits for its replies.
     *
     * @param subject the subject to publish to
     * @param payload the request body
     * @param options timeouts for this exchange and message configuration for the transport
     * @return the response, or {@link ReplyOutcome#nack()} if the server declined the request
     * @throws AckTimeoutException if the ACK or the response did not arrive in time
     * @throws AckRpcClientException if the transport fails or the wait is interrupted
     */
    ReplyOutcome requestWithTwoResponses(String subject, byte[] payload, RequestOptions options)
            throws AckRpcClientException {
        try (ReplyInbox inbox = transport.openInbox()) {
            transport.publish(subject, payload, inbox.address(), options.getMessageConfig());
            long publishedAt = System.nanoTime();

            // with only an overall timeout, one deadline covers both replies
            boolean singleBudget = options.getAckTimeout() == null && options.getTimeout() != null;
            Duration ackTimeout = singleBudget ? options.getTimeout()
                    : options.getAckTimeout() != null ? options.getAckTimeout() : timingPolicy.getAckTimeout();

            byte[] first = inbox.receive(ackTimeout);
            if (first == null) {
                log.debug("[{}] No ACK within {} ms", subject, ackTimeout.toMillis());
                throw new AckTimeoutException(subject);
            }
            if (ReplyMarkers.isNack(first)) {
                return ReplyOutcome.nack();
            }
            if (!ReplyMarkers.isAck(first)) {
                return ReplyOutcome.success(first);
            }

            long deadline = singleBudget ? publishedAt + options.getTimeout().toNanos()
                    : System.nanoTime() + responseTimeout(options).toNanos();
            while (true) {
                long remaining = deadline - System.nanoTime();
                byte[] second = remaining > 0 ? inbox.receive(Duration.ofNanos(remaining)) : null;
                if (second == null) {
                    log.debug("[{}] ACK received but no response in time", subject);
                    throw new AckTimeoutException(subject);
                }
                if (ReplyMarkers.isNack(second)) {
                    return ReplyOutcome.nack();
                }
                if (!ReplyMarkers.isAck(second)) {
                    return ReplyOutcome.success(second);
                }
                log.debug("[{}] Ignoring duplicate ACK", subject);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AckRpcClientException("Interrupted while waiting for a reply on " + subject, e);
        }
    }

    private Duration responseTimeout(RequestOptions options) {
        return options.getTimeout() != null ? options.getTimeout() : timingPolicy.getResponseTimeout();
    }
}
