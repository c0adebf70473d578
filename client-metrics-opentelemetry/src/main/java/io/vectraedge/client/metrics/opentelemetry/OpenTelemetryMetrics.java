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
package io.vectraedge.client.metrics.opentelemetry;

import static lombok.AccessLevel.PACKAGE;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.vectraedge.client.metrics.api.Metrics;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/** Records client metrics as OpenTelemetry long histograms on the {@value #METER_NAME} meter. */
@RequiredArgsConstructor(access = PACKAGE)
public class OpenTelemetryMetrics implements Metrics {
    static final String METER_NAME = "vectra_client";

    private static final List<Long> BUCKETS =
            List.of(
                    0L, 1L, 2L, 5L, 10L, 20L, 30L, 50L, 75L, 100L, 200L, 500L, 1_000L, 10_000L, 30_000L,
                    60_000L);

    private final Meter meter;

    public static Metrics create(@NonNull OpenTelemetry openTelemetry) {
        return new OpenTelemetryMetrics(openTelemetry.getMeter(METER_NAME));
    }

    @Override
    public Histogram histogram(@NonNull String name, @NonNull Unit unit) {
        var histogram =
                meter
                        .histogramBuilder(name)
                        .ofLongs()
                        .setExplicitBucketBoundariesAdvice(BUCKETS)
                        .setUnit(unit(unit))
                        .build();
        return (value, attributes) -> histogram.record(value, attributes(attributes));
    }

    private static String unit(Unit unit) {
        return unit == Unit.MILLISECONDS ? "ms" : "1";
    }

    private static Attributes attributes(Map<String, String> attributes) {
        var builder = Attributes.builder();
        attributes.forEach(builder::put);
        return builder.build();
    }
}
