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
package io.vectraedge.client.embedded;

import static org.assertj.core.api.Assertions.assertThat;

import io.vectraedge.client.api.TransportMode;
import io.vectraedge.client.api.VectraClientBuilder;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EmbeddedEnginesTest {

    @Test
    void discoversRegisteredProvider() {
        assertThat(EmbeddedEngines.findProvider())
                .hasValueSatisfying(p -> assertThat(p.name()).isEqualTo("in-memory"));
        assertThat(EmbeddedEngines.detectEmbeddedCapability()).isTrue();
    }

    @Test
    void builderOpensDiscoveredEngine() throws Exception {
        try (var client =
                VectraClientBuilder.create("localhost", 8080)
                        .transportMode(TransportMode.EMBEDDED)
                        .embeddedAvailable(true)
                        .build()) {
            assertThat(client).isInstanceOf(EmbeddedVectraClient.class);
            assertThat(client.transportMode()).isEqualTo(TransportMode.EMBEDDED);

            client.createTable("docs", "id INT, body TEXT");
            client.insertData("docs", Map.of("id", 1, "body", "hello"));
            assertThat(client.listTables()).containsExactly("docs");
            assertThat(client.getTableInfo("docs").rows()).isEqualTo(1);
            assertThat(client.healthCheck().isHealthy()).isTrue();
        }
    }
}
