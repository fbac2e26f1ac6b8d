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
/**
 * Client side of an acknowledged request/response protocol on Apache Pulsar.
 *
 * <p>Each request gets a private reply inbox. The server first answers with an ACK (or a NACK when it
 * declines the request) and later with the response. The client waits for both with separate budgets,
 * tolerates them arriving out of order, and retries timeouts, NACKs and broker outages with separate
 * limits.
 *
 * <p>Key classes and interfaces include:
 * <ul>
 *   <li>{@link org.apache.pulsar.ackrpc.contrib.client.AckRpcClient} - The RPC client used for sending requests.
 *   <li>{@link org.apache.pulsar.ackrpc.contrib.client.RequestSender} - Performs a single request exchange.
 *   <li>{@link org.apache.pulsar.ackrpc.contrib.client.SubscriptionKeyCache} - Process wide cache of the
 *   subjects requests are published to.
 * </ul>
 */
package org.apache.pulsar.ackrpc.contrib.client;
