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

import java.util.List;
import java.util.Map;
import lombok.NonNull;

/**
 * Vector search results.
 *
 * @param results The matches, in the order returned by the engine.
 * @param query The query text echoed back by the engine, {@code null} for searches by vector.
 * @param limit The requested maximum number of results, echoed back.
 */
public record SearchResult(
        @NonNull List<Map<String, Object>> results, String query, int limit) {

    public SearchResult {
        results = List.copyOf(results);
    }
}
