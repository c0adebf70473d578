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
package io.vectraedge.client.metrics.api;

import java.util.Map;
import lombok.NonNull;

/**
 * Recording side of the client metrics. Implementations bridge to a metrics library; {@link
 * #nullObject} drops everything and is used when no metrics are configured.
 */
public interface Metrics {
    String TYPE = "type";
    String TRANSPORT = "transport";
    String RESULT = "result";

    String SUCCESS = "success";
    String FAILURE = "failure";

    Metrics nullObject = NullObject.INSTANCE;

    Histogram histogram(@NonNull String name, @NonNull Unit unit);

    interface Histogram {
        void record(long value, @NonNull Map<String, String> attributes);
    }

    enum Unit {
        NONE,
        MILLISECONDS
    }

    /**
     * Attributes of one client call.
     *
     * @param type The operation, e.g. {@code query}.
     * @param transport The transport that served the call, e.g. {@code remote}.
     * @param t The failure, or {@code null} when the call succeeded.
     */
    static @NonNull Map<String, String> attributes(
            @NonNull String type, @NonNull String transport, Throwable t) {
        return Map.of(TYPE, type, TRANSPORT, transport, RESULT, t == null ? SUCCESS : FAILURE);
    }
}

enum NullObject implements Metrics {
    INSTANCE;

    private static final Histogram DISCARD = (value, attributes) -> {};

    @Override
    public Histogram histogram(@NonNull String name, @NonNull Unit unit) {
        return DISCARD;
    }
}
