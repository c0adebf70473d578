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
package io.vectraedge.client.placeholder;

import static com.google.common.base.Preconditions.checkArgument;

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
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A client that never leaves the process. Every operation succeeds with a fixed payload, which
 * makes it suitable for demos, for exercising the benchmark harness and for unit tests of code
 * that depends on {@link VectraClient}.
 */
@Slf4j
public class PlaceholderVectraClient implements VectraClient {
    static final String VERSION = "placeholder";
    private static final double[] SCORES = {0.95, 0.87, 0.76};

    private final AdminOperations admin;
    private final OperationMetrics metrics;
    private final Clock clock;

    public PlaceholderVectraClient(@NonNull ClientConfig config) {
        this(config, Clock.systemUTC());
    }

    PlaceholderVectraClient(@NonNull ClientConfig config, @NonNull Clock clock) {
        this.admin = new PlaceholderAdminOperations();
        this.metrics = OperationMetrics.create(clock, TransportMode.PLACEHOLDER, config.metrics());
        this.clock = clock;
    }

    @Override
    public @NonNull QueryResult executeQuery(@NonNull String sql) throws TransportException {
        return metrics.call(
                ClientOperation.EXECUTE_QUERY,
                () -> new QueryResult(Map.of("rows", 1, "sql", sql, "status", "success")));
    }

    @Override
    public @NonNull SearchResult vectorSearch(@NonNull String query, int limit)
            throws TransportException {
        checkArgument(limit >= 1, "limit must be at least 1: %s", limit);
        return metrics.call(
                ClientOperation.VECTOR_SEARCH,
                () -> {
                    List<Map<String, Object>> results = new ArrayList<>();
                    for (int i = 0; i < Math.min(limit, SCORES.length); i++) {
                        results.add(Map.of("id", i + 1, "score", SCORES[i]));
                    }
                    return new SearchResult(results, query, limit);
                });
    }

    @Override
    public @NonNull SubscriptionHandle subscribeStream(@NonNull String topic)
            throws TransportException {
        return metrics.call(
                ClientOperation.SUBSCRIBE_STREAM,
                () -> new SubscriptionHandle(this, "sub_" + topic, topic, "active"));
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
    public @NonNull HealthStatus healthCheck() throws TransportException {
        return metrics.call(
                ClientOperation.HEALTH_CHECK,
                () -> new HealthStatus(HealthStatus.HEALTHY, VERSION, Instant.now(clock).toString()));
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
        return TransportMode.PLACEHOLDER;
    }

    @Override
    public void close() {
        log.debug("Closed placeholder client");
    }
}
