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
package io.vectraedge.client.api.exceptions;

import io.vectraedge.client.api.TransportMode;
import lombok.Getter;

/** The requested transport cannot be constructed. Only thrown while building a client. */
@Getter
public class UnavailableTransportException extends VectraException {
    private final TransportMode transportMode;

    public UnavailableTransportException(TransportMode transportMode, String message) {
        super(message);
        this.transportMode = transportMode;
    }

    public UnavailableTransportException(
            TransportMode transportMode, String message, Throwable cause) {
        super(message, cause);
        this.transportMode = transportMode;
    }
}
