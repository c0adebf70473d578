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
package io.vectraedge.client.api;

import io.vectraedge.client.api.exceptions.TransportException;
import java.util.List;
import java.util.Map;
import lombok.NonNull;

/**
 * Synchronous client for a VectraEdge engine.
 *
 * <p>All implementations are interchangeable: the transport is chosen once, when the client is
 * built, and callers only depend on this interface. Calls block until the engine answers or the
 * per-call timeout expires. Nothing is retried; every failure surfaces immediately as a {@link
 * TransportException} naming the failed operation. Instances are safe to share between threads.
 */
public interface VectraClient extends AutoCloseable {
    int DEFAULT_SEARCH_LIMIT = 10;

    /**
     * Executes a SQL statement.
     *
     * @param sql The statement.
     * @return The result object produced by the engine. Never {@code null}.
     * @throws TransportException if the call could not be completed.
     */
    @NonNull QueryResult executeQuery(@NonNull String sql) throws TransportException;

    /**
     * Runs a similarity search for a text query.
     *
     * @param query The query text.
     * @param limit The maximum number of results, at least 1.
     * @return The matches, with the limit echoed back.
     * @throws TransportException if the call could not be completed.
     */
    @NonNull SearchResult vectorSearch(@NonNull String query, int limit) throws TransportException;

    default @NonNull SearchResult vectorSearch(@NonNull String query) throws TransportException {
        return vectorSearch(query, DEFAULT_SEARCH_LIMIT);
    }

    /**
     * Subscribes to a stream topic.
     *
     * @param topic The topic name.
     * @return A handle built from the server acknowledgement.
     * @throws TransportException if the server did not acknowledge the subscription.
     */
    @NonNull SubscriptionHandle subscribeStream(@NonNull String topic) throws TransportException;

    void createTable(@NonNull String name, @NonNull String schema) throws TransportException;

    void insertData(@NonNull String table, @NonNull List<Map<String, Object>> rows)
            throws TransportException;

    default void insertData(@NonNull String table, @NonNull Map<String, Object> row)
            throws TransportException {
        insertData(table, List.of(row));
    }

    @NonNull IndexHandle createVectorIndex(@NonNull String table, @NonNull String column)
            throws TransportException;

    @NonNull List<String> listTables() throws TransportException;

    @NonNull TableInfo getTableInfo(@NonNull String table) throws TransportException;

    @NonNull StorageStats getStats() throws TransportException;

    /**
     * Checks that the engine is serving. Remote transports always issue a real network call, with
     * a shorter timeout than the other operations.
     */
    @NonNull HealthStatus healthCheck() throws TransportException;

    /* Operations dispatched by resource handles */

    @NonNull SearchResult searchIndex(@NonNull IndexHandle index, @NonNull float[] vector, int limit)
            throws TransportException;

    void insertVector(@NonNull IndexHandle index, long vectorId, @NonNull float[] vector)
            throws TransportException;

    void deleteIndex(@NonNull IndexHandle index) throws TransportException;

    void unsubscribe(@NonNull SubscriptionHandle subscription) throws TransportException;

    @NonNull TransportMode transportMode();
}
