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
package io.vectraedge.client.metrics;

import static io.vectraedge.client.metrics.api.Metrics.Unit.MILLISECONDS;
import static io.vectraedge.client.metrics.api.Metrics.attributes;
import static lombok.AccessLevel.PACKAGE;

import io.vectraedge.client.api.ClientOperation;
import io.vectraedge.client.api.TransportMode;
import io.vectraedge.client.api.exceptions.TransportException;
import io.vectraedge.client.metrics.api.Metrics;
import io.vectraedge.client.metrics.api.Metrics.Histogram;
import java.time.Clock;
import java.util.Locale;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/** Times every client operation, tagged with the operation, the transport and the outcome. */
@RequiredArgsConstructor(access = PACKAGE)
public class OperationMetrics {
    public static final String TIMER_NAME = "vectra_client_operation_timer";

    private final Clock clock;
    private final String transport;
    private final Histogram timer;

    public static OperationMetrics create(
            @NonNull Clock clock, @NonNull TransportMode transportMode, @NonNull Metrics metrics) {
        var timer = metrics.histogram(TIMER_NAME, MILLISECONDS);
        return new OperationMetrics(clock, transportMode.name().toLowerCase(Locale.ROOT), timer);
    }

    public <R> Sample<R> record(@NonNull ClientOperation operation) {
        var start = clock.millis();
        return (r, t) ->
                timer.record(
                        clock.millis() - start, attributes(operation.getMetricName(), transport, t));
    }

    public <R> R call(@NonNull ClientOperation operation, @NonNull Call<R> call)
            throws TransportException {
        Sample<R> sample = record(operation);
        try {
            var result = call.call();
            sample.stop(result, null);
            return result;
        } catch (TransportException | RuntimeException e) {
            sample.stop(null, e);
            throw e;
        }
    }

    public void run(@NonNull ClientOperation operation, @NonNull Action action)
            throws TransportException {
        call(
                operation,
                () -> {
                    action.run();
                    return null;
                });
    }

    public interface Sample<R> {
        void stop(R result, Throwable t);
    }

    @FunctionalInterface
    public interface Call<R> {
        R call() throws TransportException;
    }

    @FunctionalInterface
    public interface Action {
        void run() throws TransportException;
    }
}
