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

public final class Constants {
    public static final String REPLY_TO = "reply_to";
    public static final String INBOX_TOPIC_PREFIX = "inbox-";
    public static final String INBOX_SUBSCRIPTION = "ack-rpc-inbox";

    public static final String ACK_TIMEOUT_ENV = "PULSAR_ACK_RPC_CLIENT_ACK_TIMEOUT";
    public static final String RECONNECT_DELAY_ENV = "PULSAR_ACK_RPC_CLIENT_RECONNECT_DELAY";
    public static final String RESPONSE_TIMEOUT_ENV = "PULSAR_ACK_RPC_CLIENT_RESPONSE_TIMEOUT";
    public static final String NACK_BACKOFF_SPLAY_LIMIT_ENV = "PULSAR_ACK_RPC_CLIENT_NACK_BACKOFF_SPLAY_LIMIT";
    public static final String SERVICE_URL_ENV = "PULSAR_SERVICE_URL";
    public static final String DEFAULT_SERVICE_URL = "pulsar://localhost:6650";

    public static final int ACK_TIMEOUT_RETRY_LIMIT = 3;
    public static final int RECONNECT_RETRY_LIMIT = 3;

    private Constants() {
    }
}
