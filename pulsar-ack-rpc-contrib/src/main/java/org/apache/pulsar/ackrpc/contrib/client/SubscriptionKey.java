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

import java.util.Locale;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Identifies the subject requests for one service method are published to,
 * {@code rpc.<service>.<method>} with the service name in snake case.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SubscriptionKey {
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("([a-z\\d])([A-Z])");

    private final String service;
    private final String method;
    private final String subject;

    static SubscriptionKey of(String service, String method) {
        return new SubscriptionKey(service, method, "rpc." + underscore(service) + "." + method);
    }

    /**
     * Converts a class name such as {@code com.example.HTTPEchoService} into
     * {@code com.example.http_echo_service}. Nested class separators become dots.
     */
    static String underscore(String name) {
        String result = ACRONYM_BOUNDARY.matcher(name.replace('$', '.')).replaceAll("$1_$2");
        result = WORD_BOUNDARY.matcher(result).replaceAll("$1_$2");
        return result.toLowerCase(Locale.ROOT);
    }
}
