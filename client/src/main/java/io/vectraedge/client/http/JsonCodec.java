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
package io.vectraedge.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vectraedge.client.api.ClientOperation;
import io.vectraedge.client.api.exceptions.TransportException;
import java.util.List;
import java.util.Map;
import lombok.NonNull;

/** JSON encoding of request bodies and decoding of response bodies. */
final class JsonCodec {
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> LIST_OF_OBJECTS =
            new TypeReference<>() {};

    private final ObjectMapper mapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @NonNull String encode(@NonNull ClientOperation operation, @NonNull Object body)
            throws TransportException {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TransportException(operation, e);
        }
    }

    @NonNull Map<String, Object> decodeObject(@NonNull ClientOperation operation, String body)
            throws TransportException {
        var node = decodeTree(operation, body);
        return mapper.convertValue(node, OBJECT);
    }

    /** Parses a response that must be a JSON object. */
    @NonNull JsonNode decodeTree(@NonNull ClientOperation operation, String body)
            throws TransportException {
        if (body == null || body.isBlank()) {
            throw new TransportException(operation, "empty response body");
        }
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException(
                    operation, "malformed response body: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new TransportException(operation, "expected a JSON object but got: " + body);
        }
        return node;
    }

    /** Reads the array {@code field} of a response object. Every element must be a JSON object. */
    @NonNull List<Map<String, Object>> decodeList(
            @NonNull ClientOperation operation, @NonNull JsonNode response, @NonNull String field)
            throws TransportException {
        var node = response.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new TransportException(
                    operation, "expected a JSON array in " + field + " but got: " + node);
        }
        for (var element : node) {
            if (!element.isObject()) {
                throw new TransportException(
                        operation, "expected a JSON object in " + field + " but got: " + element);
            }
        }
        try {
            return mapper.convertValue(node, LIST_OF_OBJECTS);
        } catch (IllegalArgumentException e) {
            throw new TransportException(operation, e);
        }
    }

    static String text(JsonNode node, String... fields) {
        for (var field : fields) {
            var value = node.get(field);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
}
