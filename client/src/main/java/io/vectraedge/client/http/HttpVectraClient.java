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

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import io.vectraedge.client.ClientConfig;
import io.vectraedge.client.admin.AdminOperations;
import io.vectraedge.client.api.ClientOperation;
import io.vectraedge.client.api.HealthStatus;
import io.vectraedge.client.api.IndexHandle;
import io.vectraedge.client.api.QueryResult;
import io.vectraedge.client.api.SearchResult;
import io.vectraedge.client.api.StorageStats;
import io.vectraedge.client.api.SubscriptionHandle;
import io.vectraedge.client.api.TableInfo;
import io.vectraedge.client.api.TransportMode;
import io.vectraedge.client.api.VectraClient;
import io.vectraedge.client.api.exceptions.TransportException;
import io.vectraedge.client.metrics.OperationMetrics;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Remote transport: JSON request/response over HTTP.
 *
 * <table>
 *   <caption>Wire contract</caption>
 *   <tr><th>Operation</th><th>Request</th><th>Response</th></tr>
 *   <tr><td>executeQuery</td><td>{@code POST /query {query}}</td><td>any object</td></tr>
 *   <tr><td>vectorSearch</td><td>{@code POST /vector/search {query, limit}}</td>
 *       <td>{@code {results, query, limit}}</td></tr>
 *   <tr><td>subscribeStream</td><td>{@code POST /stream/subscribe {topic}}</td>
 *       <td>{@code {subscriptionId, status}}</td></tr>
 *   <tr><td>healthCheck</td><td>{@code GET /health}</td>
 *       <td>{@code {status, version, timestamp}}</td></tr>
 * </table>
 *
 * <p>The server has no administrative endpoints yet. Table and index administration, stream
 * unsubscription and storage statistics are handed to the {@link AdminOperations} given at
 * construction, which by default only logs the call and returns fixed values. Callers must not
 * assume those calls reached the server.
 *
 * <p>Health checks always go to the server and use {@link ClientConfig#healthCheckTimeout()}; the
 * other calls use {@link ClientConfig#requestTimeout()}. Nothing is retried.
 */
@Slf4j
public class HttpVectraClient implements VectraClient {
    private final ClientConfig config;
    private final URI baseUri;
    private final HttpClient httpClient;
    private final JsonCodec codec = new JsonCodec();
    private final AdminOperations admin;
    private final OperationMetrics metrics;

    public HttpVectraClient(@NonNull ClientConfig config, @NonNull AdminOperations admin) {
        this.config = config;
        this.baseUri = URI.create(config.baseAddress());
        this.httpClient =
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(config.requestTimeout())
                        .build();
        this.admin = admin;
        this.metrics =
                OperationMetrics.create(Clock.systemUTC(), TransportMode.REMOTE, config.metrics());
    }

    @Override
    public @NonNull QueryResult executeQuery(@NonNull String sql) throws TransportException {
        var operation = ClientOperation.EXECUTE_QUERY;
        return metrics.call(
                operation,
                () -> {
                    var body = post(operation, "/query", Map.of("query", sql));
                    return new QueryResult(codec.decodeObject(operation, body));
                });
    }

    @Override
    public @NonNull SearchResult vectorSearch(@NonNull String query, int limit)
            throws TransportException {
        checkArgument(limit >= 1, "limit must be at least 1: %s", limit);
        var operation = ClientOperation.VECTOR_SEARCH;
        return metrics.call(
                operation,
                () -> {
                    var request = new LinkedHashMap<String, Object>();
                    request.put("query", query);
                    request.put("limit", limit);
                    var body = post(operation, "/vector/search", request);
                    var response = codec.decodeTree(operation, body);
                    var results = codec.decodeList(operation, response, "results");
                    var echoedQuery = JsonCodec.text(response, "query");
                    var echoedLimit = response.get("limit");
                    return new SearchResult(
                            results,
                            echoedQuery != null ? echoedQuery : query,
                            echoedLimit != null && echoedLimit.canConvertToInt()
                                    ? echoedLimit.asInt()
                                    : limit);
                });
    }

    @Override
    public @NonNull SubscriptionHandle subscribeStream(@NonNull String topic)
            throws TransportException {
        var operation = ClientOperation.SUBSCRIBE_STREAM;
        return metrics.call(
                operation,
                () -> {
                    var body = post(operation, "/stream/subscribe", Map.of("topic", topic));
                    var ack = codec.decodeTree(operation, body);
                    var id = JsonCodec.text(ack, "subscriptionId", "subscription_id");
                    if (id == null || id.isEmpty()) {
                        throw new TransportException(
                                operation, "acknowledgement carries no subscription id: " + ack);
                    }
                    var status = JsonCodec.text(ack, "status");
                    return new SubscriptionHandle(
                            this, id, topic, status != null ? status : "unknown");
                });
    }

    @Override
    public @NonNull HealthStatus healthCheck() throws TransportException {
        var operation = ClientOperation.HEALTH_CHECK;
        return metrics.call(
                operation,
                () -> {
                    var request =
                            HttpRequest.newBuilder(baseUri.resolve("/health"))
                                    .timeout(config.healthCheckTimeout())
                                    .header("Accept", "application/json")
                                    .GET()
                                    .build();
                    var health = codec.decodeTree(operation, send(operation, request));
                    var status = JsonCodec.text(health, "status");
                    return new HealthStatus(
                            status != null ? status : "unknown",
                            JsonCodec.text(health, "version"),
                            JsonCodec.text(health, "timestamp"));
                });
    }

    @Override
    public void createTable(@NonNull String name, @NonNull String schema) throws TransportException {
        metrics.run(ClientOperation.CREATE_TABLE, () -> admin.createTable(name, schema));
    }

    @Override
    public void insertData(@NonNull String table, @NonNull List<Map<String, Object>> rows)
            throws TransportException {
        metrics.run(ClientOperation.INSERT_DATA, () -> admin.insertData(table, rows));
    }

    @Override
    public @NonNull IndexHandle createVectorIndex(@NonNull String table, @NonNull String column)
            throws TransportException {
        return metrics.call(
                ClientOperation.CREATE_VECTOR_INDEX,
                () -> admin.createVectorIndex(this, table, column));
    }

    @Override
    public @NonNull List<String> listTables() throws TransportException {
        return metrics.call(ClientOperation.LIST_TABLES, admin::listTables);
    }

    @Override
    public @NonNull TableInfo getTableInfo(@NonNull String table) throws TransportException {
        return metrics.call(ClientOperation.GET_TABLE_INFO, () -> admin.getTableInfo(table));
    }

    @Override
    public @NonNull StorageStats getStats() throws TransportException {
        return metrics.call(ClientOperation.GET_STATS, admin::getStats);
    }

    @Override
    public @NonNull SearchResult searchIndex(
            @NonNull IndexHandle index, @NonNull float[] vector, int limit)
            throws TransportException {
        checkArgument(limit >= 1, "limit must be at least 1: %s", limit);
        return metrics.call(
                ClientOperation.SEARCH_INDEX, () -> admin.searchIndex(index, vector, limit));
    }

    @Override
    public void insertVector(@NonNull IndexHandle index, long vectorId, @NonNull float[] vector)
            throws TransportException {
        metrics.run(
                ClientOperation.INSERT_VECTOR, () -> admin.insertVector(index, vectorId, vector));
    }

    @Override
    public void deleteIndex(@NonNull IndexHandle index) throws TransportException {
        metrics.run(ClientOperation.DELETE_INDEX, () -> admin.deleteIndex(index));
    }

    @Override
    public void unsubscribe(@NonNull SubscriptionHandle subscription) throws TransportException {
        metrics.run(ClientOperation.UNSUBSCRIBE, () -> admin.unsubscribe(subscription));
    }

    @Override
    public @NonNull TransportMode transportMode() {
        return TransportMode.REMOTE;
    }

    @Override
    public void close() {
        log.debug("Closed remote client for {}", baseUri);
    }

    private String post(ClientOperation operation, String path, Object body)
            throws TransportException {
        var request =
                HttpRequest.newBuilder(baseUri.resolve(path))
                        .timeout(config.requestTimeout())
                        .header("Content-Type", "application/json")
                        .header("Accept", "application/json")
                        .POST(BodyPublishers.ofString(codec.encode(operation, body), UTF_8))
                        .build();
        return send(operation, request);
    }

    private String send(ClientOperation operation, HttpRequest request)
            throws TransportException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, BodyHandlers.ofString(UTF_8));
        } catch (IOException e) {
            throw new TransportException(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(operation, e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.debug(
                    "{} {} returned status {}: {}",
                    request.method(),
                    request.uri(),
                    status,
                    response.body());
            throw new TransportException(
                    operation,
                    "unexpected status " + status + " from " + request.method() + " " + request.uri());
        }
        return response.body();
    }
}
