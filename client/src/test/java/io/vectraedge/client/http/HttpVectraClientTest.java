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
package io.vectraedge.client.http;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.vectraedge.client.ClientConfig;
import io.vectraedge.client.admin.AdminOperations;
import io.vectraedge.client.api.ClientOperation;
import io.vectraedge.client.api.TransportMode;
import io.vectraedge.client.api.exceptions.TransportException;
import io.vectraedge.client.metrics.api.Metrics;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HttpVectraClientTest {
    private static final String HOST = "127.0.0.1";

    @Mock AdminOperations admin;

    HttpServer server;
    ExecutorService executor;
    final Map<String, Response> responses = new ConcurrentHashMap<>();
    final Map<String, String> requests = new ConcurrentHashMap<>();
    HttpVectraClient client;

    record Response(int status, String body, long delayMillis) {
        static Response ok(String body) {
            return new Response(200, body, 0);
        }
    }

    @BeforeEach
    void setup() throws IOException {
        executor = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress(HOST, 0), 0);
        server.setExecutor(executor);
        server.createContext("/", this::handle);
        server.start();
        client = new HttpVectraClient(config(server.getAddress().getPort()), admin);
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.stop(0);
        executor.shutdownNow();
    }

    private ClientConfig config(int port) {
        return new ClientConfig(
                HOST,
                port,
                TransportMode.REMOTE,
                Duration.ofSeconds(5),
                Duration.ofMillis(300),
                false,
                Metrics.nullObject);
    }

    private void handle(HttpExchange exchange) throws IOException {
        var path = exchange.getRequestURI().getPath();
        try (var in = exchange.getRequestBody()) {
            requests.put(exchange.getRequestMethod() + " " + path, new String(in.readAllBytes(), UTF_8));
        }
        var response = responses.getOrDefault(path, new Response(404, "{\"error\":\"not found\"}", 0));
        if (response.delayMillis() > 0) {
            try {
                Thread.sleep(response.delayMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        var bytes = response.body().getBytes(UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
        try (var out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void executeQuery() throws Exception {
        responses.put("/query", Response.ok("{\"rows\":1,\"sql\":\"SELECT 1\",\"status\":\"success\"}"));

        var result = client.executeQuery("SELECT 1");

        assertThat(result.body())
                .containsEntry("rows", 1)
                .containsEntry("sql", "SELECT 1")
                .containsEntry("status", "success");
        assertThat(requests.get("POST /query")).isEqualTo("{\"query\":\"SELECT 1\"}");
    }

    @Test
    void vectorSearch() throws Exception {
        responses.put(
                "/vector/search",
                Response.ok(
                        "{\"results\":[{\"id\":1,\"score\":0.95}],\"query\":\"test query\",\"limit\":5}"));

        var result = client.vectorSearch("test query", 5);

        assertThat(result.query()).isEqualTo("test query");
        assertThat(result.limit()).isEqualTo(5);
        assertThat(result.results()).containsExactly(Map.of("id", 1, "score", 0.95));
        assertThat(requests.get("POST /vector/search"))
                .isEqualTo("{\"query\":\"test query\",\"limit\":5}");
    }

    @Test
    void vectorSearchWithoutEchoedLimit() throws Exception {
        responses.put("/vector/search", Response.ok("{\"results\":[]}"));

        var result = client.vectorSearch("test");

        assertThat(result.limit()).isEqualTo(10);
        assertThat(result.query()).isEqualTo("test");
        assertThat(result.results()).isEmpty();
    }

    @Test
    void vectorSearchWithNullMatch() {
        responses.put("/vector/search", Response.ok("{\"results\":[null],\"query\":\"q\",\"limit\":5}"));

        assertThatThrownBy(() -> client.vectorSearch("q", 5))
                .isInstanceOf(TransportException.class)
                .hasMessage(
                        "Failed to perform vector search: expected a JSON object in results but got: null");
    }

    @Test
    void vectorSearchWithNonArrayResults() {
        responses.put("/vector/search", Response.ok("{\"results\":\"none\"}"));

        assertThatThrownBy(() -> client.vectorSearch("q", 5))
                .isInstanceOf(TransportException.class)
                .hasMessageStartingWith("Failed to perform vector search: expected a JSON array");
    }

    @Test
    void vectorSearchInvalidLimit() {
        assertThatThrownBy(() -> client.vectorSearch("test", 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    void subscribe() throws Exception {
        responses.put(
                "/stream/subscribe", Response.ok("{\"subscriptionId\":\"sub-1\",\"status\":\"active\"}"));

        var subscription = client.subscribeStream("events");

        assertThat(subscription.getId()).isEqualTo("sub-1");
        assertThat(subscription.getTopic()).isEqualTo("events");
        assertThat(subscription.getStatus()).isEqualTo("active");
        assertThat(requests.get("POST /stream/subscribe")).isEqualTo("{\"topic\":\"events\"}");
    }

    @Test
    void subscribeWithSnakeCaseAcknowledgement() throws Exception {
        responses.put("/stream/subscribe", Response.ok("{\"subscription_id\":\"sub-2\"}"));

        var subscription = client.subscribeStream("events");

        assertThat(subscription.getId()).isEqualTo("sub-2");
        assertThat(subscription.getStatus()).isEqualTo("unknown");
    }

    @Test
    void subscribeWithoutId() {
        responses.put("/stream/subscribe", Response.ok("{\"status\":\"active\"}"));

        assertThatThrownBy(() -> client.subscribeStream("events"))
                .isInstanceOf(TransportException.class)
                .hasMessageStartingWith("Failed to subscribe to stream: ");
    }

    @Test
    void serverError() {
        responses.put("/query", new Response(500, "{\"error\":\"boom\"}", 0));

        assertThatThrownBy(() -> client.executeQuery("SELECT 1"))
                .isInstanceOf(TransportException.class)
                .hasMessageStartingWith("Failed to execute query: unexpected status 500")
                .satisfies(
                        e ->
                                assertThat(((TransportException) e).getOperation())
                                        .isEqualTo(ClientOperation.EXECUTE_QUERY));
    }

    @Test
    void malformedBody() {
        responses.put("/query", Response.ok("not json"));

        assertThatThrownBy(() -> client.executeQuery("SELECT 1"))
                .isInstanceOf(TransportException.class)
                .hasMessageStartingWith("Failed to execute query: ");
    }

    @Test
    void emptyBody() {
        responses.put("/vector/search", Response.ok(""));

        assertThatThrownBy(() -> client.vectorSearch("test", 5))
                .isInstanceOf(TransportException.class)
                .hasMessage("Failed to perform vector search: empty response body");
    }

    @Test
    void healthCheck() throws Exception {
        responses.put(
                "/health",
                Response.ok(
                        "{\"status\":\"healthy\",\"version\":\"0.1.0\",\"timestamp\":\"2024-01-01T00:00:00Z\"}"));

        var health = client.healthCheck();

        assertThat(health.isHealthy()).isTrue();
        assertThat(health.version()).isEqualTo("0.1.0");
        assertThat(health.timestamp()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(requests).containsKey("GET /health");
    }

    @Test
    void healthCheckTimeout() {
        responses.put("/health", new Response(200, "{\"status\":\"healthy\"}", 2000));

        assertThatThrownBy(() -> client.healthCheck())
                .isInstanceOf(TransportException.class)
                .hasMessageStartingWith("Failed to perform health check: ");
    }

    @Test
    void connectionRefused() throws Exception {
        var closed = HttpServer.create(new InetSocketAddress(HOST, 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);

        try (var unreachable = new HttpVectraClient(config(port), admin)) {
            assertThatThrownBy(unreachable::healthCheck)
                    .isInstanceOf(TransportException.class)
                    .hasMessageStartingWith("Failed to perform health check: ")
                    .hasCauseInstanceOf(IOException.class);
        }
    }

    @Test
    void administrationIsDelegated() throws Exception {
        var rows = List.<Map<String, Object>>of(Map.of("id", 1));

        client.createTable("docs", "id INT");
        client.insertData("docs", rows);
        client.getStats();

        verify(admin).createTable("docs", "id INT");
        verify(admin).insertData("docs", rows);
        verify(admin).getStats();
        assertThat(requests).isEmpty();
    }
}
