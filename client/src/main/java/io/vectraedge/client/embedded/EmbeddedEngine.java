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

import io.vectraedge.client.api.HealthStatus;
import io.vectraedge.client.api.SearchResult;
import io.vectraedge.client.api.StorageStats;
import io.vectraedge.client.api.TableInfo;
import java.util.List;
import java.util.Map;

/**
 * An engine running inside the client process. Implementations are typically thin bindings to a
 * native library and may fail with any exception; the client maps every failure to a {@link
 * io.vectraedge.client.api.exceptions.TransportException}.
 *
 * <p>Engines must be safe for concurrent use.
 */
public interface EmbeddedEngine extends AutoCloseable {

    Map<String, Object> executeQuery(String sql) throws Exception;

    SearchResult vectorSearch(String query, int limit) throws Exception;

    /** Returns the id of the new subscription. */
    String subscribe(String topic) throws Exception;

    /** Ends a subscription. Ending one that already ended must succeed. */
    void unsubscribe(String subscriptionId) throws Exception;

    void createTable(String name, String schema) throws Exception;

    void insertData(String table, List<Map<String, Object>> rows) throws Exception;

    /** Returns the id of the new index. */
    String createVectorIndex(String table, String column) throws Exception;

    SearchResult searchIndex(String indexId, float[] vector, int limit) throws Exception;

    void insertVector(String indexId, long vectorId, float[] vector) throws Exception;

    void deleteIndex(String indexId) throws Exception;

    List<String> listTables() throws Exception;

    TableInfo getTableInfo(String table) throws Exception;

    StorageStats getStats() throws Exception;

    HealthStatus health() throws Exception;
}
