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

import io.vectraedge.client.admin.AdminOperations;
import io.vectraedge.client.api.IndexHandle;
import io.vectraedge.client.api.SearchResult;
import io.vectraedge.client.api.StorageStats;
import io.vectraedge.client.api.SubscriptionHandle;
import io.vectraedge.client.api.TableInfo;
import io.vectraedge.client.api.VectraClient;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Administration that only logs what it was asked to do and answers with fixed values. Used until
 * the engine exposes an administrative API over the wire.
 */
@Slf4j
public class PlaceholderAdminOperations implements AdminOperations {
    static final List<String> TABLES = List.of("docs", "users", "products");
    static final long TABLE_ROWS = 1000;
    static final long TABLE_SIZE_BYTES = 1024000;
    static final String TABLE_CREATED_AT = "2024-01-01T00:00:00Z";
    static final StorageStats STATS = new StorageStats(3, 5000, 5120000);
    static final String INDEX_READY = "ready";

    private static final List<Map<String, Object>> INDEX_MATCHES =
            List.of(
                    Map.of("id", 1, "score", 0.95, "metadata", Map.of("text", "Sample result")),
                    Map.of("id", 2, "score", 0.87, "metadata", Map.of("text", "Another result")));

    @Override
    public void createTable(@NonNull String name, @NonNull String schema) {
        log.info("Creating table '{}' with schema: {}", name, schema);
    }

    @Override
    public void insertData(@NonNull String table, @NonNull List<Map<String, Object>> rows) {
        log.info("Inserting {} row(s) into table '{}'", rows.size(), table);
        log.debug("Rows for table '{}': {}", table, rows);
    }

    @Override
    public @NonNull IndexHandle createVectorIndex(
            @NonNull VectraClient owner, @NonNull String table, @NonNull String column) {
        log.info("Creating vector index on {}.{}", table, column);
        return new IndexHandle(owner, "idx_" + table + "_" + column, table, column, INDEX_READY);
    }

    @Override
    public @NonNull SearchResult searchIndex(
            @NonNull IndexHandle index, @NonNull float[] vector, int limit) {
        log.info(
                "Searching index {} with a {}-dimensional vector, limit {}",
                index.getId(),
                vector.length,
                limit);
        var matches = INDEX_MATCHES.subList(0, Math.min(limit, INDEX_MATCHES.size()));
        return new SearchResult(matches, null, limit);
    }

    @Override
    public void insertVector(@NonNull IndexHandle index, long vectorId, @NonNull float[] vector) {
        log.info("Inserting vector {} into index {}", vectorId, index.getId());
    }

    @Override
    public void deleteIndex(@NonNull IndexHandle index) {
        log.info("Deleting index {} on {}.{}", index.getId(), index.getTable(), index.getColumn());
    }

    @Override
    public void unsubscribe(@NonNull SubscriptionHandle subscription) {
        log.info("Unsubscribing {} from topic: {}", subscription.getId(), subscription.getTopic());
    }

    @Override
    public @NonNull List<String> listTables() {
        return TABLES;
    }

    @Override
    public @NonNull TableInfo getTableInfo(@NonNull String table) {
        return new TableInfo(table, TABLE_ROWS, TABLE_SIZE_BYTES, TABLE_CREATED_AT);
    }

    @Override
    public @NonNull StorageStats getStats() {
        return STATS;
    }
}
