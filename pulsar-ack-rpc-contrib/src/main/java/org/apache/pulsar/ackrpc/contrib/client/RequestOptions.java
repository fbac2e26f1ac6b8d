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

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Per request settings.
 *
 * <ul>
 *   <li>{@code ackTimeout}: how long to wait for the ACK (or an early response).
 *   <li>{@code timeout}: how long to wait for the response once the ACK arrived. Without an
 *   {@code ackTimeout} it is the budget for the whole exchange.
 *   <li>{@code messageConfig}: passed to the transport for the outgoing request message, see
 *   {@link org.apache.pulsar.client.api.TypedMessageBuilder#loadConf(Map)}.
 * </ul>
 * Unset timeouts fall back to the client's resolved values.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RequestOptions {
    public static final String ACK_TIMEOUT = "ack_timeout";
    public static final String TIMEOUT = "timeout";

    private static final RequestOptions EMPTY = RequestOptions.builder().build();

    private final Duration ackTimeout;
    private final Duration timeout;
    @NonNull
    @Builder.Default
    private final Map<String, Object> messageConfig = Collections.emptyMap();

    public static RequestOptions empty() {
        return EMPTY;
    }

    /**
     * Reads options from a loosely typed map. {@value #ACK_TIMEOUT} and {@value #TIMEOUT} accept a
     * {@link Duration} or a number of seconds; every other entry is handed to the transport as message
     * configuration.
     *
     * @param options the options map
     * @return the parsed options
     * @throws IllegalArgumentException if a timeout has an unsupported type
     */
    public static RequestOptions fromMap(@NonNull Map<String, Object> options) {
        Map<String, Object> messageConfig = new HashMap<>(options);
        Duration ackTimeout = toDuration(ACK_TIMEOUT, messageConfig.remove(ACK_TIMEOUT));
        Duration timeout = toDuration(TIMEOUT, messageConfig.remove(TIMEOUT));
        return new RequestOptions(ackTimeout, timeout, Collections.unmodifiableMap(messageConfig));
    }

    /**
     * Fills in the timeouts this instance leaves unset. A timeout given without an ack timeout is kept
     * alone, it bounds the whole exchange.
     */
    RequestOptions withDefaults(Duration defaultAckTimeout, Duration defaultTimeout) {
        if (ackTimeout == null && timeout != null) {
            return this;
        }
        return new RequestOptions(
                ackTimeout == null ? defaultAckTimeout : ackTimeout,
                timeout == null ? defaultTimeout : timeout,
                messageConfig);
    }

    private static Duration toDuration(String name, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            BigDecimal seconds = new BigDecimal(value.toString());
            return Duration.ofNanos(seconds.movePointRight(9).longValue());
        }
        throw new IllegalArgumentException("Unsupported value for " + name + ": " + value);
    }
}
