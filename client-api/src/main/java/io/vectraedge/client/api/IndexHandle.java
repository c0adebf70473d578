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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Identifies a vector index created by {@link VectraClient#createVectorIndex(String, String)}.
 *
 * <p>The handle holds no connection. Every operation is dispatched through the client that
 * created it, and failures from that client are propagated unchanged. Dropping the handle does
 * not remove the index on the server.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class IndexHandle {
    @NonNull private final String id;
    @NonNull private final String table;
    @NonNull private final String column;
    @NonNull private final String status;

    @Getter(lombok.AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final VectraClient owner;

    public IndexHandle(
            @NonNull VectraClient owner,
            @NonNull String id,
            @NonNull String table,
            @NonNull String column,
            @NonNull String status) {
        this.owner = owner;
        this.id = id;
        this.table = table;
        this.column = column;
        this.status = status;
    }

    public @NonNull SearchResult search(@NonNull float[] vector) throws TransportException {
        return search(vector, VectraClient.DEFAULT_SEARCH_LIMIT);
    }

    public @NonNull SearchResult search(@NonNull float[] vector, int limit)
            throws TransportException {
        return owner.searchIndex(this, vector, limit);
    }

    public void insertVector(long vectorId, @NonNull float[] vector) throws TransportException {
        owner.insertVector(this, vectorId, vector);
    }

    public void deleteIndex() throws TransportException {
        owner.deleteIndex(this);
    }
}
