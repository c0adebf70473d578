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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.NonNull;

/**
 * The result of {@link VectraClient#executeQuery(String)}. The engine decides the shape of the
 * object, the client hands it back untouched.
 *
 * @param body The decoded result object.
 */
public record QueryResult(@NonNull Map<String, Object> body) {

    public QueryResult {
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public Object get(@NonNull String field) {
        return body.get(field);
    }
}
