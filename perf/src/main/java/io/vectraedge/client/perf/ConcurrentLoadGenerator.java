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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import io.vectraedge.client.api.VectraClient;
import io.vectraedge.client.perf.operations.Status;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one call per worker on {@code level} concurrent workers. Worker {@code i} executes a query,
 * a vector search or a statistics call for {@code i % 3} equal to 0, 1 or 2.
 *
 * <p>Each worker reports its own outcome through its future, and outcomes are merged only after
 * every worker finished, so no counter is shared between threads.
 */
@Slf4j
@RequiredArgsConstructor
public class ConcurrentLoadGenerator {
    static final String QUERY = "SELECT * FROM perf_test_table LIMIT 1";
    static final String SEARCH_QUERY = "test";
    static final int SEARCH_LIMIT = 5;

    @NonNull private final VectraClient client;

    record WorkerOutcome(Status status, long latencyNanos, long finishedAt) {}

    /**
     * Runs a batch of {@code level} workers on a pool of the same size, torn down afterwards.
     *
     * @throws InterruptedException if the calling thread was interrupted. The workers are not
     *     cancelled: all of them are awaited first and no aggregate is produced.
     */
    public @NonNull LoadOutcome run(int level) throws InterruptedException {
        checkArgument(level >= 1, "level must be at least 1: %s", level);
        ExecutorService executor =
                Executors.newFixedThreadPool(
                        level,
                        new ThreadFactoryBuilder()
                                .setNameFormat("vectra-load-" + level + "-%d")
                                .setDaemon(true)
                                .build());
        try {
            List<Future<WorkerOutcome>> futures = new ArrayList<>(level);
            final long dispatchedAt = System.nanoTime();
            for (int i = 0; i < level; i++) {
                final int index = i;
                futures.add(executor.submit(() -> runWorker(index)));
            }

            var latencies = new LatencySamples();
            int completed = 0;
            int failed = 0;
            long lastFinishedAt = dispatchedAt;
            for (var future : futures) {
                WorkerOutcome outcome;
                try {
                    outcome = Uninterruptibles.getUninterruptibly(future);
                } catch (ExecutionException e) {
                    log.warn("Load worker terminated abnormally", e.getCause());
                    failed++;
                    lastFinishedAt = Math.max(lastFinishedAt, System.nanoTime());
                    continue;
                }
                lastFinishedAt = Math.max(lastFinishedAt, outcome.finishedAt());
                if (outcome.status().isSuccess()) {
                    completed++;
                    latencies.record(outcome.latencyNanos());
                } else {
                    failed++;
                    log.debug("Load worker failed: {}", outcome.status().getErrorInfo());
                }
            }
            if (Thread.interrupted()) {
                throw new InterruptedException(
                        "Interrupted while running " + level + " concurrent workers");
            }
            return new LoadOutcome(
                    level,
                    completed,
                    failed,
                    lastFinishedAt - dispatchedAt,
                    latencies.meanMs(),
                    latencies.snapshot());
        } finally {
            executor.shutdownNow();
        }
    }

    private WorkerOutcome runWorker(int index) {
        final long start = System.nanoTime();
        Status status;
        try {
            switch (index % 3) {
                case 0 -> client.executeQuery(QUERY);
                case 1 -> client.vectorSearch(SEARCH_QUERY, SEARCH_LIMIT);
                default -> client.getStats();
            }
            status = Status.success();
        } catch (Exception e) {
            status = Status.failed(e.getMessage());
        }
        final long finishedAt = System.nanoTime();
        return new WorkerOutcome(status, finishedAt - start, finishedAt);
    }
}
