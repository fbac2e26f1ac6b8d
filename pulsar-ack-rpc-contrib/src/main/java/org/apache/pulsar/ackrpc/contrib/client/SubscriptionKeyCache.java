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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.NonNull;

/**
 * Process wide cache of {@link SubscriptionKey}s. A key is built the first time its service method is
 * requested and the same instance is handed out until {@link #clear()} is called.
 */
public final class SubscriptionKeyCache {
    private static final ConcurrentMap<String, ConcurrentMap<String, SubscriptionKey>> CACHE =
            new ConcurrentHashMap<>();

    private SubscriptionKeyCache() {
    }

    public static SubscriptionKey get(@NonNull String service, @NonNull String method) {
        return CACHE.computeIfAbsent(service, key -> new ConcurrentHashMap<>())
                .computeIfAbsent(method, key -> SubscriptionKey.of(service, method));
    }

    /**
     * Drops every cached key; the next lookup builds a new instance.
     */
    public static void clear() {
        CACHE.clear();
    }
}
