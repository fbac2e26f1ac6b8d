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

import static org.apache.pulsar.ackrpc.contrib.common.Constants.DEFAULT_SERVICE_URL;
import static org.apache.pulsar.ackrpc.contrib.common.Constants.SERVICE_URL_ENV;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import org.apache.pulsar.ackrpc.contrib.common.AckRpcClientException;
import org.apache.pulsar.ackrpc.contrib.common.TimingPolicy;
import org.apache.pulsar.ackrpc.contrib.transport.PulsarRpcTransport;
import org.apache.pulsar.ackrpc.contrib.transport.RpcTransport;

@Getter(AccessLevel.PACKAGE)
class AckRpcClientBuilderImpl implements AckRpcClientBuilder {
    private String service;
    private String method;
    private RpcTransport transport;
    private String serviceUrl;
    private String topicPrefix = "persistent://public/default/";
    private Map<String, Object> requestProducerConfig = Collections.emptyMap();
    private Map<String, String> environment;
    private TimingPolicy timingPolicy;
    private Duration timeout;

    public AckRpcClientBuilderImpl service(@NonNull String service) {
        this.service = service;
        return this;
    }

    public AckRpcClientBuilderImpl service(@NonNull Class<?> service) {
        this.service = service.getName();
        return this;
    }

    public AckRpcClientBuilderImpl method(@NonNull String method) {
        this.method = method;
        return this;
    }

    public AckRpcClientBuilderImpl transport(@NonNull RpcTransport transport) {
        this.transport = transport;
        return this;
    }

    public AckRpcClientBuilderImpl serviceUrl(@NonNull String serviceUrl) {
        this.serviceUrl = serviceUrl;
        return this;
    }

    public AckRpcClientBuilderImpl topicPrefix(@NonNull String topicPrefix) {
        this.topicPrefix = topicPrefix;
        return this;
    }

    public AckRpcClientBuilderImpl requestProducerConfig(@NonNull Map<String, Object> requestProducerConfig) {
        this.requestProducerConfig = requestProducerConfig;
        return this;
    }

    public AckRpcClientBuilderImpl environment(@NonNull Map<String, String> environment) {
        this.environment = environment;
        return this;
    }

    public AckRpcClientBuilderImpl timingPolicy(@NonNull TimingPolicy timingPolicy) {
        this.timingPolicy = timingPolicy;
        return this;
    }

    public AckRpcClientBuilderImpl timeout(@NonNull Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public AckRpcClientImpl build() throws AckRpcClientException {
        if (service == null || service.isBlank()) {
            throw new AckRpcClientException("A service must be set.");
        }
        if (method == null || method.isBlank()) {
            throw new AckRpcClientException("A method must be set.");
        }
        Map<String, String> env = environment == null ? System.getenv() : environment;
        TimingPolicy policy = timingPolicy == null ? TimingPolicy.resolve(env) : timingPolicy;
        RequestContext context = RequestContext.of(service, method, policy, timeout);
        if (transport != null) {
            return AckRpcClientImpl.create(context, policy, transport, false);
        }
        String url = serviceUrl != null ? serviceUrl : env.getOrDefault(SERVICE_URL_ENV, DEFAULT_SERVICE_URL);
        return AckRpcClientImpl.create(context, policy,
                new PulsarRpcTransport(url, topicPrefix, requestProducerConfig), true);
    }
}
