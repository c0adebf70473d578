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
package io.vectraedge.client.perf;

import java.util.Locale;

/** Benchmark phases, in the order they run. */
public enum Phase {
    CONNECTION,
    TABLE_OPS,
    INSERTION,
    QUERY,
    VECTOR_SEARCH,
    CONCURRENCY,
    MEMORY,
    STRESS,
    DONE;

    /** Accepts the phase name in any case, with {@code -} in place of {@code _}. */
    public static Phase fromString(String name) {
        var normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (Phase phase : values()) {
            if (phase != DONE && phase.name().equals(normalized)) {
                return phase;
            }
        }
        throw new ValidationException("unknown phase: " + name);
    }
}
