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
package io.vectraedge.client;

import io.vectraedge.client.api.TransportMode;
import io.vectraedge.client.metrics.api.Metrics;
import java.time.Duration;
import lombok.NonNull;

/**
 * Immutable settings of one client instance.
 *
 * @param host The engine host.
 * @param port The engine port.
 * @param transportMode The transport selected for the client.
 * @param requestTimeout Timeout of query, search, subscribe and administrative calls.
 * @param healthCheckTimeout Timeout of health checks.
 * @param embeddedAvailable Result of the embedded engine probe done at startup.
 * @param metrics Sink for operation metrics.
 */
public record ClientConfig(
        @NonNull String host,
        int port,
        @NonNull TransportMode transportMode,
        @NonNull Duration requestTimeout,
        @NonNull Duration healthCheckTimeout,
        boolean embeddedAvailable,
        @NonNull Metrics metrics) {

    public @NonNull String baseAddress() {
        return "http://" + host + ":" + port;
    }
}
