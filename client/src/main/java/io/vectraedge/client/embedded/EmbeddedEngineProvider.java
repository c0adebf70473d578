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
package io.vectraedge.client.embedded;

import io.vectraedge.client.ClientConfig;

/**
 * Service provider for embedded engines, discovered with {@link java.util.ServiceLoader}. Register
 * an implementation in {@code META-INF/services/io.vectraedge.client.embedded.EmbeddedEngineProvider}.
 */
public interface EmbeddedEngineProvider {

    String name();

    /** Whether the engine can run in this process, e.g. because its native library is present. */
    default boolean isAvailable() {
        return true;
    }

    EmbeddedEngine open(ClientConfig config) throws Exception;
}
