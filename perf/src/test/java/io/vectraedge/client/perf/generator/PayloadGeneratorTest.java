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
package io.vectraedge.client.perf.generator;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PayloadGeneratorTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @ParameterizedTest
    @ValueSource(ints = {100, 1000, 10000})
    void sizedRowApproximatesTarget(int target) throws Exception {
        var row = PayloadGenerator.sizedRow(target);

        int size = mapper.writeValueAsBytes(row).length;

        assertThat(row).containsKeys("id", "data", "timestamp");
        assertThat(size)
                .isBetween(
                        target - PayloadGenerator.FIXED_OVERHEAD,
                        target + PayloadGenerator.FIXED_OVERHEAD);
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 10, 50})
    void smallTargets(int target) {
        assertThat(PayloadGenerator.sizedRow(target))
                .containsExactly(Map.entry("id", 1), Map.entry("data", "small"));
    }

    @Test
    void blob() {
        assertThat((String) PayloadGenerator.blob(2048).get("data")).hasSize(2048);
        assertThat((String) PayloadGenerator.blob(0).get("data")).isEmpty();
    }

    @Test
    void vectorRows() {
        var rows = PayloadGenerator.vectorRows(3, 16, 4);

        assertThat(rows).hasSize(3);
        assertThat(rows.get(2))
                .containsEntry("id", 2)
                .containsEntry("data", "x".repeat(16))
                .containsEntry("vector", List.of(0.1, 0.1, 0.1, 0.1));

        rows.clear();
        assertThat(rows).isEmpty();
    }

    @Test
    void vectorRowsDoNotShareStorage() {
        var rows = PayloadGenerator.vectorRows(1000, 1000, 384);

        var first = rows.get(0);
        var last = rows.get(999);
        assertThat(last.get("data")).isEqualTo(first.get("data")).isNotSameAs(first.get("data"));
        assertThat(last.get("vector"))
                .isEqualTo(first.get("vector"))
                .isNotSameAs(first.get("vector"));
        assertThat((List<?>) last.get("vector")).hasSize(384);
    }
}
