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

/**
 * Raised for a single request attempt when either the ACK or the final response did not arrive within
 * its budget. The client retries these without backoff.
 */
public class AckTimeoutException extends AckRpcClientException {

    public AckTimeoutException(String subject) {
        super("Timed out waiting for a reply on " + subject);
    }
}
