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

import static org.assertj.core.api.Assertions.assertThat;

import io.vectraedge.client.perf.output.ResultStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class PerfOptionsTest {
    @TempDir Path dir;

    StringWriter out;
    StringWriter err;
    CommandLine commandLine;

    @BeforeEach
    void setup() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine =
                new CommandLine(new PerfOptions())
                        .setOut(new PrintWriter(out))
                        .setErr(new PrintWriter(err));
    }

    @Test
    void placeholderRun() throws Exception {
        var output = dir.resolve("results.json");

        int exitCode =
                commandLine.execute(
                        "--placeholder",
                        "--output",
                        output.toString(),
                        "--skip",
                        "concurrency,memory,stress");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Performance Test Summary")
                .contains("Connection: ")
                .contains("Vector Search (limit 50): ")
                .contains("Results saved to: " + output);
        try (var in = Files.newInputStream(output)) {
            assertThat(ResultStore.load(in).results())
                    .containsKeys("connection", "table_creation", "query_1", "vector_search_5")
                    .doesNotContainKeys("concurrent_5", "memory_usage", "stress_large_data");
        }
    }

    @Test
    void nothingRun() throws Exception {
        var output = dir.resolve("results.json");

        int exitCode =
                commandLine.execute(
                        "--placeholder",
                        "--output",
                        output.toString(),
                        "--skip",
                        "connection,table-ops,insertion,query,vector-search,concurrency,memory,stress");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("No test results available.");
        assertThat(Files.readString(output).trim()).isEqualTo("{ }");
    }

    @Test
    void conflictingTransports() {
        int exitCode = commandLine.execute("--placeholder", "--embedded");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("mutually exclusive");
    }

    @Test
    void unknownPhase() {
        int exitCode = commandLine.execute("--placeholder", "--skip", "warmup");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("unknown phase: warmup");
    }

    @Test
    void unknownOption() {
        assertThat(commandLine.execute("--bogus")).isEqualTo(1);
    }

    @Test
    void embeddedWithoutEngine() {
        int exitCode =
                commandLine.execute("--embedded", "--output", dir.resolve("r.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Performance testing failed");
    }
}
