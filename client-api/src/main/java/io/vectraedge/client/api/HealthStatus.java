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

import lombok.NonNull;

/**
 * Engine health as reported by the health endpoint.
 *
 * @param status The reported status, {@code healthy} when the engine is serving.
 * @param version The engine version, if reported.
 * @param timestamp The server time of the check, if reported.
 */
public record HealthStatus(@NonNull String status, String version, String timestamp) {
    public static final String HEALTHY = "healthy";

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
