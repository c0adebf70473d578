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

import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;

/** Builds the rows inserted by the benchmark. */
@UtilityClass
public class PayloadGenerator {
    /** Bytes left for the JSON structure around the padded {@code data} field. */
    public static final int FIXED_OVERHEAD = 50;

    public static final String TIMESTAMP = "2024-01-01T00:00:00Z";

    /**
     * A row whose serialized size approximates {@code targetSize} bytes. Targets that leave no room
     * for padding yield a small fixed row.
     */
    public static Map<String, Object> sizedRow(int targetSize) {
        int padding = targetSize - FIXED_OVERHEAD;
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 1);
        if (padding <= 0) {
            row.put("data", "small");
            return row;
        }
        row.put("data", Strings.repeat("x", padding));
        row.put("timestamp", TIMESTAMP);
        return row;
    }

    /** A row holding only a {@code data} string of the given length. */
    public static Map<String, Object> blob(int bytes) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("data", Strings.repeat("x", Math.max(bytes, 0)));
        return row;
    }

    /**
     * Rows with an id, a {@code rowBytes} long string and a vector of the given size. Each row owns
     * its string and vector, so the batch really occupies about {@code count * rowBytes} bytes plus
     * the vectors.
     */
    public static List<Map<String, Object>> vectorRows(int count, int rowBytes, int dimension) {
        List<Map<String, Object>> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", i);
            row.put("data", Strings.repeat("x", Math.max(rowBytes, 0)));
            row.put("vector", new ArrayList<>(Collections.nCopies(dimension, 0.1)));
            rows.add(row);
        }
        return rows;
    }
}
