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
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class TimingPolicyTest {

    @Test
    public void testDefaults() {
        TimingPolicy policy = TimingPolicy.resolve(Map.of());

        assertEquals(policy.getAckTimeout(), Duration.ofSeconds(5));
        assertEquals(policy.getReconnectDelay(), Duration.ofSeconds(5));
        assertEquals(policy.getResponseTimeout(), Duration.ofSeconds(60));
        assertEquals(policy.getNackBackoffSplayLimit(), Duration.ofMillis(10));
    }

    @Test
    public void testNackBackoffTable() {
        TimingPolicy policy = TimingPolicy.resolve(Map.of());

        assertEquals(policy.getNackBackoffIntervals().size(), 6);
        assertEquals(policy.getNackBackoffIntervals().get(0), Duration.ofMillis(1));
        assertEquals(policy.getNackBackoffIntervals().get(5), Duration.ofMillis(20));
        for (Duration interval : policy.getNackBackoffIntervals()) {
            assertTrue(interval.compareTo(Duration.ZERO) > 0, "Backoff interval " + interval);
        }
        assertEquals(policy.totalNackBackoff(), Duration.ofMillis(41));
    }

    @Test
    public void testOverridesFromEnvironment() {
        TimingPolicy policy = TimingPolicy.resolve(Map.of(
                ACK_TIMEOUT_ENV, "1000",
                RECONNECT_DELAY_ENV, "2",
                RESPONSE_TIMEOUT_ENV, "120",
                NACK_BACKOFF_SPLAY_LIMIT_ENV, "0"));

        assertEquals(policy.getAckTimeout(), Duration.ofSeconds(1000));
        assertEquals(policy.getReconnectDelay(), Duration.ofSeconds(2));
        assertEquals(policy.getResponseTimeout(), Duration.ofSeconds(120));
        assertEquals(policy.getNackBackoffSplayLimit(), Duration.ZERO);
    }

    @Test
    public void testReconnectDelayFollowsAckTimeout() {
        TimingPolicy policy = TimingPolicy.resolve(Map.of(ACK_TIMEOUT_ENV, "12"));

        assertEquals(policy.getReconnectDelay(), Duration.ofSeconds(12));
    }

    @Test
    public void testFractionalSeconds() {
        TimingPolicy policy = TimingPolicy.resolve(Map.of(ACK_TIMEOUT_ENV, "0.25", RESPONSE_TIMEOUT_ENV, " 1.5 "));

        assertEquals(policy.getAckTimeout(), Duration.ofMillis(250));
        assertEquals(policy.getResponseTimeout(), Duration.ofMillis(1500));
    }

    @Test
    public void testBlankValuesUseDefaults() {
        TimingPolicy policy = TimingPolicy.resolve(Map.of(ACK_TIMEOUT_ENV, "", RESPONSE_TIMEOUT_ENV, "  "));

        assertEquals(policy.getAckTimeout(), Duration.ofSeconds(5));
        assertEquals(policy.getResponseTimeout(), Duration.ofSeconds(60));
    }

    @DataProvider
    public Object[][] invalidValues() {
        return new Object[][] {{"soon"}, {"-1"}, {"5s"}, {"1e400"}};
    }

    @Test(dataProvider = "invalidValues")
    public void testRejectsInvalidValue(String value) {
        IllegalArgumentException e = Assert.expectThrows(IllegalArgumentException.class,
                () -> TimingPolicy.resolve(Map.of(RESPONSE_TIMEOUT_ENV, value)));
        assertTrue(e.getMessage().contains(RESPONSE_TIMEOUT_ENV), e.getMessage());
    }

    @Test
    public void testResolvedOnce() {
        Map<String, String> env = new HashMap<>();
        env.put(ACK_TIMEOUT_ENV, "3");
        TimingPolicy policy = TimingPolicy.resolve(env);

        env.put(ACK_TIMEOUT_ENV, "30");

        assertEquals(policy.getAckTimeout(), Duration.ofSeconds(3));
    }
}
