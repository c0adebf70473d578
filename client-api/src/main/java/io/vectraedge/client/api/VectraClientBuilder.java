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

import io.vectraedge.client.api.exceptions.UnavailableTransportException;
import io.vectraedge.client.internal.DefaultImplementation;
import io.vectraedge.client.metrics.api.Metrics;
import java.io.File;
import java.time.Duration;
import java.util.Properties;

/**
 * Configures and builds a {@link VectraClient}.
 *
 * <p>The {@link TransportMode#REMOTE} wire protocol only covers queries, searches, subscriptions
 * and health checks. Its administrative operations go to a pluggable backend that defaults to a
 * placeholder which logs each call. That backend is part of the client implementation module, so
 * it is configured on the implementation only: cast the builder returned by {@link #create} to
 * {@code io.vectraedge.client.VectraClientBuilderImpl} and call {@code adminOperations(...)}.
 */
public interface VectraClientBuilder {

    static VectraClientBuilder create(String host, int port) {
        return DefaultImplementation.getDefaultImplementation(host, port);
    }

    /**
     * Builds the client for the configured transport.
     *
     * @throws UnavailableTransportException if {@link TransportMode#EMBEDDED} was requested and no
     *     embedded engine can be opened in this process.
     */
    VectraClient build() throws UnavailableTransportException;

    VectraClientBuilder transportMode(TransportMode transportMode);

    VectraClientBuilder requestTimeout(Duration requestTimeout);

    VectraClientBuilder healthCheckTimeout(Duration healthCheckTimeout);

    /**
     * Overrides the embedded engine probe that otherwise runs once per process. Useful when the
     * caller already detected the capability at startup.
     */
    VectraClientBuilder embeddedAvailable(boolean embeddedAvailable);

    VectraClientBuilder metrics(Metrics metrics);

    VectraClientBuilder loadConfig(String configPath);

    VectraClientBuilder loadConfig(File configFile);

    VectraClientBuilder loadConfig(Properties properties);
}
