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
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.pulsar.ackrpc.contrib.common.TimingPolicy;

/**
 * What a client was built for: the target service method and its resolved timeouts. Fixed for the
 * lifetime of the client.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
final class RequestContext {
    private final String service;
    private final String method;
    private final Duration ackTimeout;
    private final Duration reconnectDelay;
    private final Duration responseTimeout;
    /**
     * Caller supplied replacement for the response timeout, or {@code null}.
     */
    private final Duration overrideTimeout;

    static RequestContext of(String service, String method, TimingPolicy timingPolicy, Duration overrideTimeout) {
        return new RequestContext(service, method, timingPolicy.getAckTimeout(),
                timingPolicy.getReconnectDelay(), timingPolicy.getResponseTimeout(), overrideTimeout);
    }

    Duration effectiveResponseTimeout() {
        return overrideTimeout == null ? responseTimeout : overrideTimeout;
    }
}
