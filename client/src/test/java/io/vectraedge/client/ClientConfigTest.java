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
package io.vectraedge.client;

import static org.assertj.core.api.Assertions.assertThat;

import io.vectraedge.client.api.TransportMode;
import io.vectraedge.client.metrics.api.Metrics;
import java.time.Duration;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ClientConfigTest {

    @ParameterizedTest
    @CsvSource({
        "localhost, 8080, http://localhost:8080",
        "127.0.0.1, 1, http://127.0.0.1:1",
        "engine.internal, 65535, http://engine.internal:65535"
    })
    void baseAddress(String host, int port, String expected) {
        var config =
                new ClientConfig(
                        host,
                        port,
                        TransportMode.REMOTE,
                        Duration.ofSeconds(30),
                        Duration.ofSeconds(10),
                        false,
                        Metrics.nullObject);
        assertThat(config.baseAddress()).isEqualTo(expected);
    }
}
