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

import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import io.vectraedge.client.VectraClientBuilderImpl;
import io.vectraedge.client.api.TransportMode;
import io.vectraedge.client.api.VectraClientBuilder;
import io.vectraedge.client.metrics.opentelemetry.OpenTelemetryMetrics;
import io.vectraedge.client.perf.output.ResultStore;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

@Slf4j
@CommandLine.Command(
        name = "vectra-perf",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = 1,
        description = "Runs the VectraEdge performance benchmark and writes a JSON report.")
public final class PerfOptions implements Callable<Integer> {
    /** Exporters stay off unless enabled through the usual OTEL_* environment variables. */
    private static final Map<String, String> EXPORTER_DEFAULTS =
            Map.of(
                    "otel.metrics.exporter", "none",
                    "otel.traces.exporter", "none",
                    "otel.logs.exporter", "none");

    @CommandLine.Spec CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = {"--host"},
            description = "VectraEdge server host")
    String host = "localhost";

    @CommandLine.Option(
            names = {"--port"},
            description = "VectraEdge server port")
    int port = 8080;

    @CommandLine.Option(
            names = {"--embedded"},
            description = "Use the embedded engine. Fails when none is available in this process")
    boolean embedded;

    @CommandLine.Option(
            names = {"--placeholder"},
            description = "Use the placeholder transport, which returns canned payloads")
    boolean placeholder;

    @CommandLine.Option(
            names = {"--config"},
            description = "Client properties file. Its values override the other client options")
    File config;

    @CommandLine.Option(
            names = {"--request-timeout-ms"},
            description = "Timeout of query, search and administrative calls")
    long requestTimeoutMs = VectraClientBuilderImpl.DefaultRequestTimeout.toMillis();

    @CommandLine.Option(
            names = {"--output"},
            description = "Output file for results")
    Path output = Path.of(ResultStore.DEFAULT_FILE_NAME);

    @CommandLine.Option(
            names = {"--skip"},
            split = ",",
            description = "Phases to skip, e.g. concurrency,memory")
    List<String> skip = new ArrayList<>();

    TransportMode transportMode() {
        if (embedded && placeholder) {
            throw new ValidationException("--embedded and --placeholder are mutually exclusive");
        }
        if (embedded) {
            return TransportMode.EMBEDDED;
        }
        return placeholder ? TransportMode.PLACEHOLDER : TransportMode.REMOTE;
    }

    BenchmarkSettings settings() {
        var skipped = EnumSet.noneOf(Phase.class);
        for (var name : skip) {
            skipped.add(Phase.fromString(name));
        }
        return BenchmarkSettings.defaults().withSkippedPhases(skipped);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        var store = new ResultStore();
        try {
            var settings = settings();
            var mode = transportMode();
            final var sdk =
                    AutoConfiguredOpenTelemetrySdk.builder()
                            .addPropertiesSupplier(() -> EXPORTER_DEFAULTS)
                            .build()
                            .getOpenTelemetrySdk();
            try {
                var builder =
                        VectraClientBuilder.create(host, port)
                                .transportMode(mode)
                                .requestTimeout(Duration.ofMillis(requestTimeoutMs))
                                .metrics(OpenTelemetryMetrics.create(sdk));
                if (config != null) {
                    builder.loadConfig(config);
                }
                try (var client = builder.build()) {
                    log.info(
                            "Starting benchmark against {}:{} using {}",
                            host,
                            port,
                            client.transportMode());
                    try {
                        new BenchmarkHarness(client, settings, store).runAll();
                    } finally {
                        report(store, out);
                    }
                }
            } finally {
                sdk.close();
            }
            if (Thread.currentThread().isInterrupted()) {
                err.println("Performance testing interrupted");
                return 1;
            }
            out.println("Performance testing completed. Results saved to: " + output);
            return 0;
        } catch (Exception e) {
            log.debug("Performance testing failed", e);
            err.println("Performance testing failed: " + e.getMessage());
            return 1;
        }
    }

    private void report(ResultStore store, PrintWriter out) throws IOException {
        out.println("Performance Test Summary");
        out.println("=".repeat(50));
        var lines = store.summarize();
        if (lines.isEmpty()) {
            out.println("No test results available.");
        }
        lines.forEach(out::println);
        store.writeTo(output);
        out.flush();
    }
}
