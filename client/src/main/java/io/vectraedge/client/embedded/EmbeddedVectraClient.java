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
package io.vectraedge.client.embedded;

import static com.google.common.base.Preconditions.checkArgument;

import io.vectraedge.client.ClientConfig;
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
import io.vectraedge.client.api.exceptions.UnavailableTransportException;
import io.vectraedge.client.metrics.OperationMetrics;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/** Client for an engine loaded in the same process through an {@link EmbeddedEngineProvider}. */
@Slf4j
public class EmbeddedVectraClient implements VectraClient {
    private final EmbeddedEngine engine;
    private final OperationMetrics metrics;

    EmbeddedVectraClient(@NonNull EmbeddedEngine engine, @NonNull OperationMetrics metrics) {
        this.engine = engine;
        this.metrics = metrics;
    }

    /**
     * Opens the first available embedded engine.
     *
     * @throws UnavailableTransportException if the startup probe found no engine, or the engine
     *     failed to open.
     */
    public static @NonNull EmbeddedVectraClient open(@NonNull ClientConfig config)
            throws UnavailableTransportException {
        if (!config.embeddedAvailable()) {
            throw new UnavailableTransportException(
                    TransportMode.EMBEDDED,
                    "No embedded engine is available in this process, use the REMOTE transport");
        }
        var provider = EmbeddedEngines.findProvider();
        if (provider.isEmpty()) {
            throw new UnavailableTransportException(
                    TransportMode.EMBEDDED, "No embedded engine provider found");
        }
        var name = provider.get().name();
        EmbeddedEngine engine;
        try {
            engine = provider.get().open(config);
        } catch (Exception e) {
            throw new UnavailableTransportException(
                    TransportMode.EMBEDDED, "Failed to open embedded engine " + name, e);
        }
        log.info("Opened embedded engine {}", name);
        var metrics =
                OperationMetrics.create(Clock.systemUTC(), TransportMode.EMBEDDED, config.metrics());
        return new EmbeddedVectraClient(engine, metrics);
    }

    @Override
    public @NonNull QueryResult executeQuery(@NonNull String sql) throws TransportException {
        return call(ClientOperation.EXECUTE_QUERY, () -> new QueryResult(engine.executeQuery(sql)));
    }

    @Override
    public @NonNull SearchResult vectorSearch(@NonNull String query, int limit)
            throws TransportException {
        checkArgument(limit >= 1, "limit must be at least 1: %s", limit);
        return call(ClientOperation.VECTOR_SEARCH, () -> engine.vectorSearch(query, limit));
    }

    @Override
    public @NonNull SubscriptionHandle subscribeStream(@NonNull String topic)
            throws TransportException {
        return call(
                ClientOperation.SUBSCRIBE_STREAM,
                () -> new SubscriptionHandle(this, engine.subscribe(topic), topic, "active"));
    }

    @Override
    public void createTable(@NonNull String name, @NonNull String schema) throws TransportException {
        run(ClientOperation.CREATE_TABLE, () -> engine.createTable(name, schema));
    }

    @Override
    public void insertData(@NonNull String table, @NonNull List<Map<String, Object>> rows)
            throws TransportException {
        run(ClientOperation.INSERT_DATA, () -> engine.insertData(table, rows));
    }

    @Override
    public @NonNull IndexHandle createVectorIndex(@NonNull String table, @NonNull String column)
            throws TransportException {
        return call(
                ClientOperation.CREATE_VECTOR_INDEX,
                () -> {
                    var id = engine.createVectorIndex(table, column);
                    return new IndexHandle(this, id, table, column, "ready");
                });
    }

    @Override
    public @NonNull List<String> listTables() throws TransportException {
        return call(ClientOperation.LIST_TABLES, engine::listTables);
    }

    @Override
    public @NonNull TableInfo getTableInfo(@NonNull String table) throws TransportException {
        return call(ClientOperation.GET_TABLE_INFO, () -> engine.getTableInfo(table));
    }

    @Override
    public @NonNull StorageStats getStats() throws TransportException {
        return call(ClientOperation.GET_STATS, engine::getStats);
    }

    @Override
    public @NonNull HealthStatus healthCheck() throws TransportException {
        return call(ClientOperation.HEALTH_CHECK, engine::health);
    }

    @Override
    public @NonNull SearchResult searchIndex(
            @NonNull IndexHandle index, @NonNull float[] vector, int limit)
            throws TransportException {
        checkArgument(limit >= 1, "limit must be at least 1: %s", limit);
        return call(
                ClientOperation.SEARCH_INDEX, () -> engine.searchIndex(index.getId(), vector, limit));
    }

    @Override
    public void insertVector(@NonNull IndexHandle index, long vectorId, @NonNull float[] vector)
            throws TransportException {
        run(
                ClientOperation.INSERT_VECTOR,
                () -> engine.insertVector(index.getId(), vectorId, vector));
    }

    @Override
    public void deleteIndex(@NonNull IndexHandle index) throws TransportException {
        run(ClientOperation.DELETE_INDEX, () -> engine.deleteIndex(index.getId()));
    }

    @Override
    public void unsubscribe(@NonNull SubscriptionHandle subscription) throws TransportException {
        run(ClientOperation.UNSUBSCRIBE, () -> engine.unsubscribe(subscription.getId()));
    }

    @Override
    public @NonNull TransportMode transportMode() {
        return TransportMode.EMBEDDED;
    }

    @Override
    public void close() throws Exception {
        engine.close();
    }

    private <R> R call(ClientOperation operation, EngineCall<R> call) throws TransportException {
        return metrics.call(
                operation,
                () -> {
                    R result;
                    try {
                        result = call.call();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new TransportException(operation, e);
                    } catch (Exception e) {
                        throw new TransportException(operation, e);
                    }
                    if (result == null) {
                        throw new TransportException(operation, "engine returned no result");
                    }
                    return result;
                });
    }

    private void run(ClientOperation operation, EngineAction action) throws TransportException {
        metrics.run(
                operation,
                () -> {
                    try {
                        action.run();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new TransportException(operation, e);
                    } catch (Exception e) {
                        throw new TransportException(operation, e);
                    }
                });
    }

    @FunctionalInterface
    private interface EngineCall<R> {
        R call() throws Exception;
    }

    @FunctionalInterface
    private interface EngineAction {
        void run() throws Exception;
    }
}
