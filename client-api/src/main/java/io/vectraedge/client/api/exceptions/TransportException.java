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

import io.vectraedge.client.api.ClientOperation;
import lombok.Getter;
import lombok.NonNull;

/**
 * A call could not be completed by the transport: the connection failed, the server answered
 * with a non-success status, the call timed out or the response could not be decoded. The
 * message always reads {@code "Failed to <operation>: <cause>"}.
 */
@Getter
public class TransportException extends VectraException {
    private final ClientOperation operation;

    public TransportException(@NonNull ClientOperation operation, @NonNull Throwable cause) {
        super(message(operation, describe(cause)), cause);
        this.operation = operation;
    }

    public TransportException(@NonNull ClientOperation operation, @NonNull String detail) {
        super(message(operation, detail));
        this.operation = operation;
    }

    private static String message(ClientOperation operation, String detail) {
        return "Failed to " + operation.getDescription() + ": " + detail;
    }

    private static String describe(Throwable cause) {
        var message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }
}
