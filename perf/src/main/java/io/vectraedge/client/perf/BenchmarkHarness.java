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

import com.google.common.base.Ticker;
import io.vectraedge.client.api.VectraClient;
import io.vectraedge.client.api.exceptions.TransportException;
import io.vectraedge.client.perf.generator.PayloadGenerator;
import io.vectraedge.client.perf.output.BenchmarkResult;
import io.vectraedge.client.perf.output.ResultStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a {@link VectraClient} through the benchmark phases and records the measurements in a
 * {@link ResultStore}.
 *
 * <p>Phases run one after the other on the calling thread. A failed call is counted and the phase
 * goes on. A phase that throws records nothing and the run continues with the next phase. The
 * results of a phase are only recorded once the whole phase has completed.
 */
@Slf4j
public class BenchmarkHarness {
    static final String INSERT_TABLE = "perf_test_table";
    static final String MEMORY_TABLE = "memory_test_table";
    static final String STRESS_TABLE = "stress_test_table";
    static final String TABLE_PREFIX = "perf_test_table_";

    private final VectraClient client;
    private final BenchmarkSettings settings;
    @Getter private final ResultStore store;
    private final ConcurrentLoadGenerator loadGenerator;
    private final Ticker ticker;

    public BenchmarkHarness(
            @NonNull VectraClient client,
            @NonNull BenchmarkSettings settings,
            @NonNull ResultStore store) {
        this(client, settings, store, new ConcurrentLoadGenerator(client), Ticker.systemTicker());
    }

    BenchmarkHarness(
            @NonNull VectraClient client,
            @NonNull BenchmarkSettings settings,
            @NonNull ResultStore store,
            @NonNull ConcurrentLoadGenerator loadGenerator,
            @NonNull Ticker ticker) {
        this.client = client;
        this.settings = settings;
        this.store = store;
        this.loadGenerator = loadGenerator;
        this.ticker = ticker;
    }

    /**
     * Runs every phase that is not skipped. An interrupt stops the run after the current phase,
     * with the interrupt flag left set.
     *
     * @return The phases that completed.
     */
    public List<Phase> runAll() {
        List<Phase> completed = new ArrayList<>();
        for (Phase phase : Phase.values()) {
            if (phase == Phase.DONE) {
                break;
            }
            if (settings.skippedPhases().contains(phase)) {
                log.info("Skipping phase {}", phase);
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Interrupted, not running phase {} and later phases", phase);
                break;
            }
            try {
                run(phase);
                completed.add(phase);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted during phase {}", phase);
                break;
            } catch (RuntimeException e) {
                log.error("Phase {} failed", phase, e);
            }
        }
        log.info("Benchmark done, {} phase(s) completed", completed.size());
        return completed;
    }

    public void run(@NonNull Phase phase) throws InterruptedException {
        log.info("Running phase {}", phase);
        switch (phase) {
            case CONNECTION -> connection();
            case TABLE_OPS -> tableOperations();
            case INSERTION -> insertion();
            case QUERY -> queries();
            case VECTOR_SEARCH -> vectorSearch();
            case CONCURRENCY -> concurrency();
            case MEMORY -> memory();
            case STRESS -> stress();
            case DONE -> throw new IllegalArgumentException("DONE is not a runnable phase");
        }
    }

    public void connection() {
        var samples = measure(settings.connectionChecks(), i -> client.healthCheck());
        var pending = new Pending();
        pending.latency("connection", samples, true, Map.of());
        pending.commit();
    }

    public void tableOperations() {
        var samples =
                measure(
                        settings.tableCount(),
                        i -> client.createTable(TABLE_PREFIX + i, settings.tableSchema()));
        var pending = new Pending();
        pending.latency("table_creation", samples, false, Map.of());
        pending.commit();
    }

    public void insertion() {
        var pending = new Pending();
        for (int size : settings.payloadSizes()) {
            var row = PayloadGenerator.sizedRow(size);
            var samples =
                    measure(settings.insertsPerSize(), i -> client.insertData(INSERT_TABLE, row));
            double avgMs = samples.meanMs();
            double throughputKbs = avgMs > 0 ? (size / 1024.0) / (avgMs / 1000.0) : 0.0;
            pending.latency(
                    "data_insertion_" + size + "b",
                    samples,
                    false,
                    Map.of("throughput_kbs", throughputKbs));
        }
        pending.commit();
    }

    public void queries() {
        var pending = new Pending();
        var queries = settings.queries();
        for (int i = 0; i < queries.size(); i++) {
            var query = queries.get(i);
            var samples = measure(settings.queryRepetitions(), n -> client.executeQuery(query));
            pending.latency("query_" + (i + 1), samples, false, Map.of("query", query));
        }
        pending.commit();
    }

    public void vectorSearch() {
        var pending = new Pending();
        for (int limit : settings.searchLimits()) {
            var samples =
                    measure(
                            settings.searchRepetitions(),
                            n -> client.vectorSearch(settings.searchQuery(), limit));
            pending.latency("vector_search_" + limit, samples, false, Map.of("limit", limit));
        }
        pending.commit();
    }

    public void concurrency() throws InterruptedException {
        var pending = new Pending();
        for (int level : settings.concurrencyLevels()) {
            var outcome = loadGenerator.run(level);
            log.info(
                    "Concurrency {}: {}/{} completed, {} ops/s",
                    level,
                    outcome.completed(),
                    level,
                    outcome.throughputOpsPerSec());
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("concurrency_level", level);
            extra.put("total_time_s", outcome.totalSeconds());
            extra.put("completed_operations", outcome.completed());
            extra.put("failed_operations", outcome.failed());
            extra.put("throughput_ops_per_sec", outcome.throughputOpsPerSec());
            pending.add(
                    new BenchmarkResult(
                            "concurrent_" + level,
                            outcome.avgLatencyMs(),
                            null,
                            null,
                            outcome.completed(),
                            outcome.latency(),
                            extra));
        }
        pending.commit();
    }

    /**
     * Inserts part of a large generated batch, then drops the batch. Only records whether the
     * inserts went through, not how much memory was used.
     */
    public void memory() {
        var rows =
                PayloadGenerator.vectorRows(
                        settings.memoryRows(), settings.memoryRowBytes(), settings.vectorDimension());
        double sizeMb = (double) settings.memoryRows() * settings.memoryRowBytes() / 1_000_000;
        var samples = new LatencySamples();
        boolean failed = false;
        for (var row : rows.subList(0, settings.memoryInsertedRows())) {
            long start = ticker.read();
            try {
                client.insertData(MEMORY_TABLE, row);
                samples.record(ticker.read() - start);
            } catch (TransportException e) {
                log.warn("Memory test failed: {}", e.getMessage());
                samples.fail();
                failed = true;
                break;
            }
        }
        rows.clear();

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("test_data_size_mb", sizeMb);
        extra.put("status", failed ? "failed" : "completed");
        var pending = new Pending();
        pending.add(new BenchmarkResult("memory_usage", samples.meanMs(), samples.count(), extra));
        pending.commit();
    }

    public void stress() {
        var pending = new Pending();
        var rapid = measure(settings.rapidOperations(), i -> client.getStats());
        pending.latency("stress_rapid_operations", rapid, false, Map.of());

        var blob = PayloadGenerator.blob(settings.largePayloadBytes());
        var large = measure(settings.largeInserts(), i -> client.insertData(STRESS_TABLE, blob));
        pending.latency(
                "stress_large_data",
                large,
                false,
                Map.of("data_size_kb", settings.largePayloadBytes() / 1000));
        pending.commit();
    }

    private LatencySamples measure(int repetitions, TimedCall call) {
        var samples = new LatencySamples();
        for (int i = 0; i < repetitions; i++) {
            long start = ticker.read();
            try {
                call.call(i);
                samples.record(ticker.read() - start);
            } catch (TransportException e) {
                samples.fail();
                log.warn("Call {} of {} failed: {}", i + 1, repetitions, e.getMessage());
            }
        }
        return samples;
    }

    @FunctionalInterface
    private interface TimedCall {
        void call(int iteration) throws TransportException;
    }

    /** Results of the running phase, recorded together once the phase completes. */
    private final class Pending {
        private final List<BenchmarkResult> results = new ArrayList<>();

        void add(BenchmarkResult result) {
            results.add(result);
        }

        /** Adds a latency result, unless no call succeeded. */
        void latency(
                String name, LatencySamples samples, boolean withRange, Map<String, Object> extra) {
            if (samples.isEmpty()) {
                log.warn("No successful call for {}, {} failed", name, samples.failures());
                return;
            }
            Map<String, Object> values = new LinkedHashMap<>(extra);
            values.put("failed", samples.failures());
            results.add(
                    new BenchmarkResult(
                            name,
                            samples.meanMs(),
                            withRange ? samples.minMs() : null,
                            withRange ? samples.maxMs() : null,
                            samples.count(),
                            samples.snapshot(),
                            values));
        }

        void commit() {
            results.forEach(result -> store.record(result.name(), result));
        }
    }
}
