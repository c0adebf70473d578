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

import static java.util.Objects.requireNonNull;

import java.util.Locale;

public enum TransportMode {
    /** Calls an engine loaded in the same process. */
    EMBEDDED,
    /** JSON request/response over HTTP against a remote server. */
    REMOTE,
    /** Talks to nothing; returns canned payloads. For demos and unit tests. */
    PLACEHOLDER;

    public static TransportMode fromString(String mode) {
        requireNonNull(mode);
        for (TransportMode m : TransportMode.values()) {
            if (m.name().equals(mode.trim().toUpperCase(Locale.ROOT))) {
                return m;
            }
        }
        throw new IllegalArgumentException("unknown transport mode: " + mode);
    }
}
