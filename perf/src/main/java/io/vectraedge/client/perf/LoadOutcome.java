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

import io.vectraedge.client.perf.output.HistogramSnapshot;
import java.util.concurrent.TimeUnit;

/**
 * Aggregate of one batch of concurrent workers. Only built once every worker has finished.
 *
 * @param level Number of workers.
 * @param completed Workers whose call succeeded.
 * @param failed Workers whose call failed.
 * @param elapsedNanos Time from the first dispatch to the last completion.
 * @param avgLatencyMs Mean latency of the successful calls, {@code 0} when none succeeded.
 * @param latency Latency percentiles of the successful calls.
 */
public record LoadOutcome(
        int level,
        int completed,
        int failed,
        long elapsedNanos,
        double avgLatencyMs,
        HistogramSnapshot latency) {

    public double totalSeconds() {
        return elapsedNanos / (double) TimeUnit.SECONDS.toNanos(1);
    }

    public double throughputOpsPerSec() {
        double seconds = totalSeconds();
        return seconds > 0 ? completed / seconds : 0.0;
    }
}
