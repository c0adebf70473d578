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
package io.vectraedge.client.perf.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.NonNull;

/**
 * Measurement of one phase, or one case of a phase.
 *
 * @param name Unique name of the measurement, e.g. {@code data_insertion_100b}.
 * @param avgMs Mean latency of the successful calls.
 * @param minMs Lowest latency, when reported.
 * @param maxMs Highest latency, when reported.
 * @param samples Number of successful calls.
 * @param latency Latency percentiles, when reported.
 * @param extra Additional values. Only integers, doubles, strings and booleans are allowed so that
 *     a result survives a JSON round trip unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BenchmarkResult(
        @JsonProperty("name") @NonNull String name,
        @JsonProperty("avg_ms") double avgMs,
        @JsonProperty("min_ms") Double minMs,
        @JsonProperty("max_ms") Double maxMs,
        @JsonProperty("samples") int samples,
        @JsonProperty("latency") HistogramSnapshot latency,
        @JsonProperty("extra") Map<String, Object> extra) {

    public BenchmarkResult {
        finite("avg_ms", avgMs);
        if (minMs != null) {
            finite("min_ms", minMs);
        }
        if (maxMs != null) {
            finite("max_ms", maxMs);
        }
        if (samples < 0) {
            throw new IllegalArgumentException("samples must not be negative: " + samples);
        }
        var copy = new TreeMap<String, Object>();
        if (extra != null) {
            extra.forEach(
                    (key, value) -> {
                        if (!(value instanceof Integer
                                || value instanceof Double
                                || value instanceof String
                                || value instanceof Boolean)) {
                            throw new IllegalArgumentException(
                                    "unsupported value for extra field " + key + ": " + value);
                        }
                        if (value instanceof Double d) {
                            finite(key, d);
                        }
                        copy.put(key, value);
                    });
        }
        extra = Collections.unmodifiableMap(copy);
    }

    public BenchmarkResult(
            @NonNull String name, double avgMs, int samples, @NonNull Map<String, Object> extra) {
        this(name, avgMs, null, null, samples, null, extra);
    }

    public Object extra(@NonNull String key) {
        return extra.get(key);
    }

    private static void finite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be finite: " + value);
        }
    }
}
