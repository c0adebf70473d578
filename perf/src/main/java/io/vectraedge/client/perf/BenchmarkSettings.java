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
package io.vectraedge.client.perf;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.With;

/**
 * What the benchmark runs and how often. Validated on construction.
 *
 * @param connectionChecks Health checks in the connection phase.
 * @param tableCount Tables created in the table phase.
 * @param tableSchema Schema of the created tables.
 * @param payloadSizes Approximate serialized row sizes of the insertion phase, in bytes.
 * @param insertsPerSize Inserts per payload size.
 * @param queries Statements of the query phase.
 * @param queryRepetitions Executions per statement.
 * @param searchQuery Query text of the vector search phase.
 * @param searchLimits Result limits of the vector search phase.
 * @param searchRepetitions Searches per limit.
 * @param concurrencyLevels Worker counts of the concurrency phase.
 * @param memoryRows Rows generated by the memory phase.
 * @param memoryRowBytes Length of the string field of each generated row.
 * @param vectorDimension Length of the vector field of each generated row.
 * @param memoryInsertedRows Generated rows actually inserted.
 * @param rapidOperations Statistics calls of the rapid stress test.
 * @param largePayloadBytes Size of the large stress payload.
 * @param largeInserts Inserts of the large stress payload.
 * @param skippedPhases Phases not run by {@link BenchmarkHarness#runAll()}.
 */
@With
public record BenchmarkSettings(
        int connectionChecks,
        int tableCount,
        String tableSchema,
        List<Integer> payloadSizes,
        int insertsPerSize,
        List<String> queries,
        int queryRepetitions,
        String searchQuery,
        List<Integer> searchLimits,
        int searchRepetitions,
        List<Integer> concurrencyLevels,
        int memoryRows,
        int memoryRowBytes,
        int vectorDimension,
        int memoryInsertedRows,
        int rapidOperations,
        int largePayloadBytes,
        int largeInserts,
        Set<Phase> skippedPhases) {

    public BenchmarkSettings {
        positive("connectionChecks", connectionChecks);
        positive("tableCount", tableCount);
        notBlank("tableSchema", tableSchema);
        notEmpty("payloadSizes", payloadSizes);
        positive("insertsPerSize", insertsPerSize);
        notEmpty("queries", queries);
        for (var query : queries) {
            notBlank("queries", query);
        }
        positive("queryRepetitions", queryRepetitions);
        notBlank("searchQuery", searchQuery);
        notEmpty("searchLimits", searchLimits);
        for (int limit : searchLimits) {
            positive("searchLimits", limit);
        }
        positive("searchRepetitions", searchRepetitions);
        notEmpty("concurrencyLevels", concurrencyLevels);
        for (int level : concurrencyLevels) {
            positive("concurrencyLevels", level);
        }
        positive("memoryRows", memoryRows);
        positive("vectorDimension", vectorDimension);
        positive("memoryInsertedRows", memoryInsertedRows);
        if (memoryInsertedRows > memoryRows) {
            throw new ValidationException(
                    "memoryInsertedRows must not exceed memoryRows: "
                            + memoryInsertedRows
                            + " > "
                            + memoryRows);
        }
        positive("rapidOperations", rapidOperations);
        positive("largeInserts", largeInserts);
        if (skippedPhases == null || skippedPhases.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("skippedPhases must not be null or contain null");
        }

        payloadSizes = List.copyOf(payloadSizes);
        queries = List.copyOf(queries);
        searchLimits = List.copyOf(searchLimits);
        concurrencyLevels = List.copyOf(concurrencyLevels);
        skippedPhases = Set.copyOf(skippedPhases);
    }

    public static BenchmarkSettings defaults() {
        return new BenchmarkSettings(
                10,
                5,
                "id INT, name TEXT, data TEXT",
                List.of(100, 1000, 10000),
                10,
                List.of(
                        "SELECT * FROM perf_test_table LIMIT 10",
                        "SELECT COUNT(*) FROM perf_test_table",
                        "SELECT * FROM perf_test_table WHERE id > 5"),
                10,
                "test query",
                List.of(5, 10, 20, 50),
                10,
                List.of(5, 10, 20),
                1000,
                1000,
                384,
                100,
                50,
                100_000,
                10,
                Set.of());
    }

    private static void positive(String name, int value) {
        if (value <= 0) {
            throw new ValidationException(name + " must be greater than zero: " + value);
        }
    }

    private static void notBlank(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " must not be null or blank");
        }
    }

    private static void notEmpty(String name, Collection<?> values) {
        if (values == null || values.isEmpty() || values.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException(name + " must be a non-empty list without nulls");
        }
    }
}
