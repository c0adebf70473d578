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

import io.vectraedge.client.perf.output.HistogramSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.HdrHistogram.Histogram;

/**
 * Latencies of the successful calls of one measurement, plus the number of failed calls. Not
 * thread-safe: each measurement owns its instance.
 */
public final class LatencySamples {
    private static final double NANOS_PER_MILLI = TimeUnit.MILLISECONDS.toNanos(1);

    private final Histogram histogram = new Histogram(3);
    private final List<Double> millis = new ArrayList<>();
    private int failures;

    public void record(long elapsedNanos) {
        checkArgument(elapsedNanos >= 0, "negative latency: %s", elapsedNanos);
        millis.add(elapsedNanos / NANOS_PER_MILLI);
        histogram.recordValue(TimeUnit.NANOSECONDS.toMicros(elapsedNanos));
    }

    public void fail() {
        failures++;
    }

    public int count() {
        return millis.size();
    }

    public int failures() {
        return failures;
    }

    public boolean isEmpty() {
        return millis.isEmpty();
    }

    public double meanMs() {
        if (millis.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double value : millis) {
            sum += value;
        }
        return sum / millis.size();
    }

    public double minMs() {
        return millis.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }

    public double maxMs() {
        return millis.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public HistogramSnapshot snapshot() {
        return HistogramSnapshot.fromHistogram(histogram);
    }
}
