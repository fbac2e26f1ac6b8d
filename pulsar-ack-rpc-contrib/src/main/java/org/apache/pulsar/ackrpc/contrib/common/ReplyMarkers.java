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

import java.util.Arrays;

/**
 * Reserved reply bodies sent by a server on the reply inbox. An ACK means the request was accepted and a
 * response will follow, a NACK means the server declined it. Neither can be a valid response body.
 */
public final class ReplyMarkers {
    private static final byte[] ACK = {0x01};
    private static final byte[] NACK = {0x02};

    private ReplyMarkers() {
    }

    public static byte[] ack() {
        return ACK.clone();
    }

    public static byte[] nack() {
        return NACK.clone();
    }

    public static boolean isAck(byte[] body) {
        return Arrays.equals(ACK, body);
    }

    public static boolean isNack(byte[] body) {
        return Arrays.equals(NACK, body);
    }
}
