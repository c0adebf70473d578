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

import io.vectraedge.client.ClientConfig;
import io.vectraedge.client.api.HealthStatus;
import io.vectraedge.client.api.SearchResult;
import io.vectraedge.client.api.StorageStats;
import io.vectraedge.client.api.TableInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Minimal engine registered for tests through {@code META-INF/services}. */
public class InMemoryEngineProvider implements EmbeddedEngineProvider {

    @Override
    public String name() {
        return "in-memory";
    }

    @Override
    public EmbeddedEngine open(ClientConfig config) {
        return new Engine();
    }

    static class Engine implements EmbeddedEngine {
        final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();
        final Map<String, String> subscriptions = new ConcurrentHashMap<>();
        final AtomicInteger ids = new AtomicInteger();

        @Override
        public Map<String, Object> executeQuery(String sql) {
            return Map.of("sql", sql, "status", "success");
        }

        @Override
        public SearchResult vectorSearch(String query, int limit) {
            return new SearchResult(List.of(), query, limit);
        }

        @Override
        public String subscribe(String topic) {
            var id = "sub-" + ids.incrementAndGet();
            subscriptions.put(id, topic);
            return id;
        }

        @Override
        public void unsubscribe(String subscriptionId) {
            subscriptions.remove(subscriptionId);
        }

        @Override
        public void createTable(String name, String schema) {
            tables.putIfAbsent(name, new ArrayList<>());
        }

        @Override
        public void insertData(String table, List<Map<String, Object>> rows) {
            tables.computeIfAbsent(table, t -> new ArrayList<>()).addAll(rows);
        }

        @Override
        public String createVectorIndex(String table, String column) {
            return "idx-" + ids.incrementAndGet();
        }

        @Override
        public SearchResult searchIndex(String indexId, float[] vector, int limit) {
            return new SearchResult(List.of(), null, limit);
        }

        @Override
        public void insertVector(String indexId, long vectorId, float[] vector) {}

        @Override
        public void deleteIndex(String indexId) {}

        @Override
        public List<String> listTables() {
            return List.copyOf(tables.keySet());
        }

        @Override
        public TableInfo getTableInfo(String table) {
            var rows = tables.get(table);
            if (rows == null) {
                throw new IllegalArgumentException("no such table: " + table);
            }
            return new TableInfo(table, rows.size(), 0, null);
        }

        @Override
        public StorageStats getStats() {
            long rows = tables.values().stream().mapToLong(List::size).sum();
            return new StorageStats(tables.size(), rows, 0);
        }

        @Override
        public HealthStatus health() {
            return new HealthStatus(HealthStatus.HEALTHY, "in-memory", null);
        }

        @Override
        public void close() {}
    }
}
