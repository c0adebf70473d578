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

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/** The logical operations a {@link VectraClient} can perform, independent of the transport. */
@Getter
@RequiredArgsConstructor
public enum ClientOperation {
    EXECUTE_QUERY("execute query", "query"),
    VECTOR_SEARCH("perform vector search", "vector_search"),
    SUBSCRIBE_STREAM("subscribe to stream", "subscribe"),
    CREATE_TABLE("create table", "create_table"),
    INSERT_DATA("insert data", "insert"),
    CREATE_VECTOR_INDEX("create vector index", "create_index"),
    LIST_TABLES("list tables", "list_tables"),
    GET_TABLE_INFO("get table info", "table_info"),
    GET_STATS("get stats", "stats"),
    HEALTH_CHECK("perform health check", "health"),
    SEARCH_INDEX("search vector index", "index_search"),
    INSERT_VECTOR("insert vector", "index_insert"),
    DELETE_INDEX("delete vector index", "index_delete"),
    UNSUBSCRIBE("unsubscribe from stream", "unsubscribe");

    /** Human readable phrase used in error messages, e.g. "Failed to execute query". */
    @NonNull private final String description;

    /** Value of the {@code type} attribute used when recording operation metrics. */
    @NonNull private final String metricName;
}
