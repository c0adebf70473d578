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

import io.vectraedge.client.api.exceptions.TransportException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A subscription to a stream topic, as acknowledged by {@link
 * VectraClient#subscribeStream(String)}. Like {@link IndexHandle} it only identifies the
 * server-side resource; {@link #unsubscribe()} goes through the owning client.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SubscriptionHandle {
    @NonNull private final String id;
    @NonNull private final String topic;
    @NonNull private final String status;

    @Getter(lombok.AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final VectraClient owner;

    public SubscriptionHandle(
            @NonNull VectraClient owner,
            @NonNull String id,
            @NonNull String topic,
            @NonNull String status) {
        this.owner = owner;
        this.id = id;
        this.topic = topic;
        this.status = status;
    }

    /** Ends the subscription. Calling it again on the same handle does not fail. */
    public void unsubscribe() throws TransportException {
        owner.unsubscribe(this);
    }
}
