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
import java.util.Map;
import lombok.NonNull;
import org.apache.pulsar.ackrpc.contrib.common.AckRpcClientException;
import org.apache.pulsar.ackrpc.contrib.common.TimingPolicy;
import org.apache.pulsar.ackrpc.contrib.transport.RpcTransport;

/**
 * Builder class for constructing an {@link AckRpcClient} instance.
 */
public interface AckRpcClientBuilder {

  /**
   * Sets the service the client calls, e.g. its fully qualified interface name.
   *
   * @param service the service name
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder service(@NonNull String service);

  /**
   * Sets the service the client calls from its class.
   *
   * @param service the service class
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder service(@NonNull Class<?> service);

  /**
   * Sets the method of the service the client calls.
   *
   * @param method the method name
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder method(@NonNull String method);

  /**
   * Sets the transport requests are sent through. The client does not close a transport passed here.
   *
   * @param transport the transport
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder transport(@NonNull RpcTransport transport);

  /**
   * Sets the Pulsar service URL of a transport the client creates and owns. Ignored when a
   * {@link #transport(RpcTransport)} is set. Defaults to {@code PULSAR_SERVICE_URL} or
   * {@code pulsar://localhost:6650}.
   *
   * @param serviceUrl the Pulsar service URL
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder serviceUrl(@NonNull String serviceUrl);

  /**
   * Sets the topic prefix of a transport the client creates, {@code persistent://public/default/} by
   * default.
   *
   * @param topicPrefix the topic prefix
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder topicPrefix(@NonNull String topicPrefix);

  /**
   * Specifies the producer configuration of a transport the client creates.
   *
   * @param requestProducerConfig Configuration map for creating request message producers, will
   *     call {@link org.apache.pulsar.client.api.ProducerBuilder#loadConf(java.util.Map)}
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder requestProducerConfig(@NonNull Map<String, Object> requestProducerConfig);

  /**
   * Sets the environment the timing policy is resolved from, {@link System#getenv()} by default.
   *
   * @param environment environment variables by name
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder environment(@NonNull Map<String, String> environment);

  /**
   * Uses an already resolved timing policy instead of reading the environment.
   *
   * @param timingPolicy the timing policy
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder timingPolicy(@NonNull TimingPolicy timingPolicy);

  /**
   * Overrides the response timeout for every request of this client.
   *
   * @param timeout the time to wait for a response once the request was acknowledged
   * @return this builder instance for chaining
   */
  AckRpcClientBuilder timeout(@NonNull Duration timeout);

  /**
   * Builds and returns an {@link AckRpcClient} configured with the current builder settings.
   *
   * @return a new instance of {@link AckRpcClient}
   * @throws AckRpcClientException if the service or method is missing
   * @throws IllegalArgumentException if an environment variable holds an invalid number
   */
  AckRpcClient build() throws AckRpcClientException;
}
