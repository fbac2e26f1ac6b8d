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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of a single request attempt that got an answer: either the response body or a NACK. Timeouts
 * and transport failures are raised as exceptions instead.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ReplyOutcome {
    private static final ReplyOutcome NACK = new ReplyOutcome(true, null);

    private final boolean nack;
    private final byte[] payload;

    public static ReplyOutcome success(byte[] payload) {
        return new ReplyOutcome(false, payload);
    }

    public static ReplyOutcome nack() {
        return NACK;
    }
}
