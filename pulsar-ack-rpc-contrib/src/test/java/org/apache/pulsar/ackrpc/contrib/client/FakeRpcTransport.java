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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.pulsar.ackrpc.contrib.common.TransportException;
import org.apache.pulsar.ackrpc.contrib.transport.ReplyInbox;
import org.apache.pulsar.ackrpc.contrib.transport.RpcTransport;

/**
 * In memory transport. Every published request gets the scheduled replies delivered to its inbox, each
 * after its own delay counted from the publish.
 */
class FakeRpcTransport implements RpcTransport {
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final List<ScheduledReply> replies = new CopyOnWriteArrayList<>();
    private final Map<String, FakeInbox> inboxes = new ConcurrentHashMap<>();
    private final AtomicInteger inboxCounter = new AtomicInteger();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger publishes = new AtomicInteger();
    private volatile TransportException publishFailure;
    private volatile FakeInbox lastInbox;

    FakeRpcTransport schedule(byte[] body, long delayMillis) {
        replies.add(new ScheduledReply(body, delayMillis));
        return this;
    }

    FakeRpcTransport failPublishWith(TransportException failure) {
        this.publishFailure = failure;
        return this;
    }

    int connects() {
        return connects.get();
    }

    int publishes() {
        return publishes.get();
    }

    FakeInbox lastInbox() {
        return lastInbox;
    }

    @Override
    public void connect() {
        connects.incrementAndGet();
    }

    @Override
    public ReplyInbox openInbox() {
        FakeInbox inbox = new FakeInbox("INBOX_" + inboxCounter.incrementAndGet());
        inboxes.put(inbox.address(), inbox);
        lastInbox = inbox;
        return inbox;
    }

    @Override
    public void publish(String subject, byte[] payload, String replyTo, Map<String, Object> messageConfig)
            throws TransportException {
        publishes.incrementAndGet();
        if (publishFailure != null) {
            throw publishFailure;
        }
        FakeInbox inbox = inboxes.get(replyTo);
        for (ScheduledReply reply : replies) {
            scheduler.schedule(() -> inbox.deliver(reply.body), reply.delayMillis, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private static final class ScheduledReply {
        private final byte[] body;
        private final long delayMillis;

        private ScheduledReply(byte[] body, long delayMillis) {
            this.body = body;
            this.delayMillis = delayMillis;
        }
    }

    static final class FakeInbox implements ReplyInbox {
        private final String address;
        private final LinkedBlockingQueue<byte[]> queue = new LinkedBlockingQueue<>();
        private final AtomicInteger dropped = new AtomicInteger();
        private volatile boolean closed;

        private FakeInbox(String address) {
            this.address = address;
        }

        void deliver(byte[] body) {
            if (closed) {
                dropped.incrementAndGet();
            } else {
                queue.offer(body);
            }
        }

        boolean isClosed() {
            return closed;
        }

        int dropped() {
            return dropped.get();
        }

        @Override
        public String address() {
            return address;
        }

        @Override
        public byte[] receive(Duration timeout) throws InterruptedException {
            return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
