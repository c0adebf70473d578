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
package io.vectraedge.client.admin;

import io.vectraedge.client.api.IndexHandle;
import io.vectraedge.client.api.SearchResult;
import io.vectraedge.client.api.StorageStats;
import io.vectraedge.client.api.SubscriptionHandle;
import io.vectraedge.client.api.TableInfo;
import io.vectraedge.client.api.VectraClient;
import io.vectraedge.client.api.exceptions.TransportException;
import java.util.List;
import java.util.Map;
import lombok.NonNull;

/**
 * Table, index and subscription administration for transports whose wire protocol only covers
 * queries, searches, subscriptions and health checks.
 *
 * <p>Implementations must be thread-safe: a single instance serves every caller of the client it
 * is attached to.
 */
public interface AdminOperations {

    void createTable(@NonNull String name, @NonNull String schema) throws TransportException;

    void insertData(@NonNull String table, @NonNull List<Map<String, Object>> rows)
            throws TransportException;

    /**
     * Creates a vector index.
     *
     * @param owner The client the returned handle dispatches its operations to.
     */
    @NonNull IndexHandle createVectorIndex(
            @NonNull VectraClient owner, @NonNull String table, @NonNull String column)
            throws TransportException;

    @NonNull SearchResult searchIndex(@NonNull IndexHandle index, @NonNull float[] vector, int limit)
            throws TransportException;

    void insertVector(@NonNull IndexHandle index, long vectorId, @NonNull float[] vector)
            throws TransportException;

    void deleteIndex(@NonNull IndexHandle index) throws TransportException;

    void unsubscribe(@NonNull SubscriptionHandle subscription) throws TransportException;

    @NonNull List<String> listTables() throws TransportException;

    @NonNull TableInfo getTableInfo(@NonNull String table) throws TransportException;

    @NonNull StorageStats getStats() throws TransportException;
}
