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

import static com.google.common.base.Preconditions.checkArgument;

import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/** Named benchmark results. Recording a name again replaces the earlier result. */
@Slf4j
public class ResultStore {
    public static final String DEFAULT_FILE_NAME = "performance_results.json";

    private static final TypeReference<Map<String, BenchmarkResult>> RESULTS =
            new TypeReference<>() {};
    private static final ObjectMapper MAPPER =
            JsonMapper.builder()
                    .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                    .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                    .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
                    .build();

    private static final Pattern INSERTION = Pattern.compile("data_insertion_(\\d{1,18})b");
    private static final Pattern QUERY = Pattern.compile("query_(\\d{1,18})");
    private static final Pattern VECTOR_SEARCH = Pattern.compile("vector_search_(\\d{1,18})");
    private static final Pattern CONCURRENT = Pattern.compile("concurrent_(\\d{1,18})");

    private final NavigableMap<String, BenchmarkResult> results = new ConcurrentSkipListMap<>();

    public void record(@NonNull String name, @NonNull BenchmarkResult result) {
        checkArgument(
                name.equals(result.name()), "result %s recorded as %s", result.name(), name);
        if (results.put(name, result) != null) {
            log.debug("Replaced result {}", name);
        }
    }

    public Optional<BenchmarkResult> get(@NonNull String name) {
        return Optional.ofNullable(results.get(name));
    }

    public Map<String, BenchmarkResult> results() {
        return Collections.unmodifiableMap(results);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /** Writes every result as indented JSON with sorted keys. The stream is left open. */
    public void serialize(@NonNull OutputStream out) throws IOException {
        MAPPER.writeValue(out, results);
    }

    public static @NonNull ResultStore load(@NonNull InputStream in) throws IOException {
        Map<String, BenchmarkResult> loaded = MAPPER.readValue(in, RESULTS);
        var store = new ResultStore();
        if (loaded != null) {
            loaded.forEach(store::record);
        }
        return store;
    }

    public void writeTo(@NonNull Path path) throws IOException {
        try (var out = Files.newOutputStream(path)) {
            serialize(out);
        }
        log.info("Results saved to {}", path);
    }

    /**
     * Display lines for the known result categories, in a fixed order: connection, table creation,
     * insertion by size, queries, vector search by limit, concurrency by level, then the stress
     * tests. Other results are left out.
     */
    public @NonNull List<String> summarize() {
        List<String> lines = new ArrayList<>();
        get("connection").ifPresent(r -> lines.add(format("Connection: %.2fms avg", r.avgMs())));
        get("table_creation")
                .ifPresent(r -> lines.add(format("Table Creation: %.2fms avg", r.avgMs())));
        numbered(INSERTION)
                .forEach(
                        (size, r) ->
                                lines.add(
                                        format(
                                                "%dB Data Insertion: %.2fms avg, %.2f KB/s",
                                                size,
                                                r.avgMs(),
                                                number(r, "throughput_kbs"))));
        numbered(QUERY)
                .forEach((n, r) -> lines.add(format("Query %d: %.2fms avg", n, r.avgMs())));
        numbered(VECTOR_SEARCH)
                .forEach(
                        (limit, r) ->
                                lines.add(format("Vector Search (limit %d): %.2fms avg", limit, r.avgMs())));
        numbered(CONCURRENT)
                .forEach(
                        (level, r) ->
                                lines.add(
                                        format(
                                                "Concurrent %d: %.2f ops/sec",
                                                level,
                                                number(r, "throughput_ops_per_sec"))));
        get("stress_rapid_operations")
                .ifPresent(r -> lines.add(format("Rapid Operations: %.2fms avg", r.avgMs())));
        get("stress_large_data")
                .ifPresent(
                        r ->
                                lines.add(
                                        format(
                                                "Large Data (%sKB): %.2fms avg",
                                                r.extra().getOrDefault("data_size_kb", "?"),
                                                r.avgMs())));
        return lines;
    }

    private Map<Long, BenchmarkResult> numbered(Pattern pattern) {
        var matching = new TreeMap<Long, BenchmarkResult>();
        results.forEach(
                (name, result) -> {
                    Matcher matcher = pattern.matcher(name);
                    if (matcher.matches()) {
                        matching.put(Long.parseLong(matcher.group(1)), result);
                    }
                });
        return matching;
    }

    private static double number(BenchmarkResult result, String key) {
        return result.extra(key) instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static String format(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
