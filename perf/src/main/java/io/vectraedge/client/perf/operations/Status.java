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
package io.vectraedge.client.perf.operations;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Outcome of a single benchmarked call. */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Status {
    public static final int CODE_SUCCESS = 0;
    public static final int CODE_UNKNOWN = 1;

    private static final Status SUCCESS = new Status(CODE_SUCCESS, null);

    private final int code;
    private final String errorInfo;

    public static Status success() {
        return SUCCESS;
    }

    public static Status failed(String errorInfo) {
        return new Status(CODE_UNKNOWN, errorInfo);
    }

    public boolean isSuccess() {
        return code == CODE_SUCCESS;
    }
}
