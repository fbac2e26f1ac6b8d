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

import static org.apache.pulsar.ackrpc.contrib.common.Constants.ACK_TIMEOUT_ENV;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.NACK_BACKOFF_SPLAY_LIMIT_ENV;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.RECONNECT_DELAY_ENV;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.RESPONSE_TIMEOUT_ENV;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Timeouts and backoff intervals used by the ack RPC client. Values are resolved once, from the process
 * environment or an explicit map, and never change afterwards.
 *
 * <p>The ack timeout, reconnect delay and response timeout are read in seconds and may be fractional.
 * When the reconnect delay is not set it takes the resolved ack timeout. The NACK backoff splay limit is
 * read in milliseconds.
 */
@Getter
@ToString
public final class TimingPolicy {
    public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_NACK_BACKOFF_SPLAY_LIMIT = Duration.ofMillis(10);
    public static final List<Duration> NACK_BACKOFF_INTERVALS = List.of(
            Duration.ofMillis(1),
            Duration.ofMillis(2),
            Duration.ofMillis(3),
            Duration.ofMillis(5),
            Duration.ofMillis(10),
            Duration.ofMillis(20));

    private static final int NANOS_PER_SECOND_EXPONENT = 9;
    private static final int NANOS_PER_MILLI_EXPONENT = 6;

    private final Duration ackTimeout;
    private final Duration reconnectDelay;
    private final Duration responseTimeout;
    private final List<Duration> nackBackoffIntervals;
    private final Duration nackBackoffSplayLimit;

    @Builder(toBuilder = true)
    private TimingPolicy(@NonNull Duration ackTimeout,
                         @NonNull Duration reconnectDelay,
                         @NonNull Duration responseTimeout,
                         @NonNull List<Duration> nackBackoffIntervals,
                         @NonNull Duration nackBackoffSplayLimit) {
        this.ackTimeout = ackTimeout;
        this.reconnectDelay = reconnectDelay;
        this.responseTimeout = responseTimeout;
        this.nackBackoffIntervals = List.copyOf(nackBackoffIntervals);
        this.nackBackoffSplayLimit = nackBackoffSplayLimit;
    }

    /**
     * Resolves a policy from {@link System#getenv()}.
     *
     * @return the resolved policy
     */
    public static TimingPolicy fromEnvironment() {
        return resolve(System.getenv());
    }

    /**
     * Resolves a policy from the given environment. Missing or blank variables fall back to their
     * defaults.
     *
     * @param env environment variables by name
     * @return the resolved policy
     * @throws IllegalArgumentException if a variable is set to something other than a non-negative number
     */
    public static TimingPolicy resolve(@NonNull Map<String, String> env) {
        Duration ackTimeout = duration(env, ACK_TIMEOUT_ENV, NANOS_PER_SECOND_EXPONENT, DEFAULT_ACK_TIMEOUT);
        return new TimingPolicy(
                ackTimeout,
                duration(env, RECONNECT_DELAY_ENV, NANOS_PER_SECOND_EXPONENT, ackTimeout),
                duration(env, RESPONSE_TIMEOUT_ENV, NANOS_PER_SECOND_EXPONENT, DEFAULT_RESPONSE_TIMEOUT),
                NACK_BACKOFF_INTERVALS,
                duration(env, NACK_BACKOFF_SPLAY_LIMIT_ENV, NANOS_PER_MILLI_EXPONENT,
                        DEFAULT_NACK_BACKOFF_SPLAY_LIMIT));
    }

    /**
     * @return the sum of all NACK backoff intervals, without splay
     */
    public Duration totalNackBackoff() {
        return nackBackoffIntervals.stream().reduce(Duration.ZERO, Duration::plus);
    }

    private static Duration duration(Map<String, String> env, String name, int nanosExponent,
                                     Duration defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            BigDecimal value = new BigDecimal(raw.trim());
            if (value.signum() < 0) {
                throw new IllegalArgumentException(name + " must not be negative: " + raw);
            }
            return Duration.ofNanos(value.movePointRight(nanosExponent)
                    .setScale(0, RoundingMode.HALF_UP)
                    .longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException(name + " is not a valid number: " + raw, e);
        }
    }
}
