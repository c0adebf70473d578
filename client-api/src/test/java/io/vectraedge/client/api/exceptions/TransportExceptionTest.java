/*
 * Copyright © 2026 The VectraEdge Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.vectraedge.client.api.exceptions;

import static org.assertj.core.api.Assertions.assertThat;

import io.vectraedge.client.api.ClientOperation;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import org.junit.jupiter.api.Test;

class TransportExceptionTest {

    @Test
    void messageNamesOperationAndCause() {
        var e =
                new TransportException(
                        ClientOperation.EXECUTE_QUERY, new HttpTimeoutException("request timed out"));

        assertThat(e).hasMessage("Failed to execute query: request timed out");
        assertThat(e.getOperation()).isEqualTo(ClientOperation.EXECUTE_QUERY);
        assertThat(e.getCause()).isInstanceOf(HttpTimeoutException.class);
    }

    @Test
    void causeWithoutMessage() {
        var e = new TransportException(ClientOperation.HEALTH_CHECK, new ConnectException());

        assertThat(e).hasMessage("Failed to perform health check: ConnectException");
    }

    @Test
    void detail() {
        var e = new TransportException(ClientOperation.SUBSCRIBE_STREAM, "no subscription id");

        assertThat(e).hasMessage("Failed to subscribe to stream: no subscription id").hasNoCause();
        assertThat(e).isInstanceOf(VectraException.class);
    }
}
