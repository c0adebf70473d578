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
package io.vectraedge.client;

import static java.time.Duration.ZERO;

import com.google.common.base.Strings;
import com.google.common.base.Suppliers;
import io.vectraedge.client.admin.AdminOperations;
import io.vectraedge.client.api.TransportMode;
import io.vectraedge.client.api.VectraClient;
import io.vectraedge.client.api.VectraClientBuilder;
import io.vectraedge.client.api.exceptions.UnavailableTransportException;
import io.vectraedge.client.embedded.EmbeddedEngines;
import io.vectraedge.client.embedded.EmbeddedVectraClient;
import io.vectraedge.client.http.HttpVectraClient;
import io.vectraedge.client.metrics.api.Metrics;
import io.vectraedge.client.placeholder.PlaceholderAdminOperations;
import io.vectraedge.client.placeholder.PlaceholderVectraClient;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import lombok.NonNull;

public class VectraClientBuilderImpl implements VectraClientBuilder {

    public static final Duration DefaultRequestTimeout = Duration.ofSeconds(30);
    public static final Duration DefaultHealthCheckTimeout = Duration.ofSeconds(10);
    public static final TransportMode DefaultTransportMode = TransportMode.REMOTE;

    private static final Supplier<Boolean> embeddedCapability =
            Suppliers.memoize(EmbeddedEngines::detectEmbeddedCapability);

    @NonNull protected String host;
    protected int port;
    @NonNull protected TransportMode transportMode = DefaultTransportMode;
    @NonNull protected Duration requestTimeout = DefaultRequestTimeout;
    @NonNull protected Duration healthCheckTimeout = DefaultHealthCheckTimeout;
    @Nullable protected Boolean embeddedAvailable;
    @NonNull protected Metrics metrics = Metrics.nullObject;
    @Nullable protected AdminOperations adminOperations;

    public VectraClientBuilderImpl(@NonNull String host, int port) {
        this.host = validateHost(host);
        this.port = validatePort(port);
    }

    @Override
    public @NonNull VectraClientBuilder transportMode(@NonNull TransportMode transportMode) {
        this.transportMode = transportMode;
        return this;
    }

    @Override
    public @NonNull VectraClientBuilder requestTimeout(@NonNull Duration requestTimeout) {
        if (requestTimeout.isNegative() || requestTimeout.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "requestTimeout must be greater than zero: " + requestTimeout);
        }
        this.requestTimeout = requestTimeout;
        return this;
    }

    @Override
    public @NonNull VectraClientBuilder healthCheckTimeout(@NonNull Duration healthCheckTimeout) {
        if (healthCheckTimeout.isNegative() || healthCheckTimeout.equals(ZERO)) {
            throw new IllegalArgumentException(
                    "healthCheckTimeout must be greater than zero: " + healthCheckTimeout);
        }
        this.healthCheckTimeout = healthCheckTimeout;
        return this;
    }

    @Override
    public @NonNull VectraClientBuilder embeddedAvailable(boolean embeddedAvailable) {
        this.embeddedAvailable = embeddedAvailable;
        return this;
    }

    @Override
    public @NonNull VectraClientBuilder metrics(@NonNull Metrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Wires the backend for table and index administration of the remote transport. When unset,
     * administrative calls are answered by {@link PlaceholderAdminOperations}.
     */
    /**
     * Backend of the administrative operations of a {@link TransportMode#REMOTE} client. Without
     * one, those operations are logged and answered with placeholder values. Ignored by the other
     * transports.
     */
    public @NonNull VectraClientBuilderImpl adminOperations(@NonNull AdminOperations adminOperations) {
        this.adminOperations = adminOperations;
        return this;
    }

    @Override
    public VectraClientBuilder loadConfig(String configPath) {
        try {
            File configFile = new File(configPath);
            return loadConfig(configFile);
        } catch (Throwable e) {
            throw new IllegalArgumentException(
                    "Failed to load configuration from file: " + configPath, e);
        }
    }

    @Override
    public VectraClientBuilder loadConfig(File configFile) {
        Properties properties = new Properties();
        try (InputStream input = new FileInputStream(configFile)) {
            properties.load(input);
        } catch (IOException ex) {
            throw new IllegalArgumentException(
                    "Failed to load configuration from file: " + configFile, ex);
        }
        return loadConfig(properties);
    }

    @Override
    public VectraClientBuilder loadConfig(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("Properties must not be null.");
        }
        // Property names map onto the builder fields.
        for (String name : properties.stringPropertyNames()) {
            var value = properties.getProperty(name).trim();
            try {
                var field = VectraClientBuilderImpl.class.getDeclaredField(name);
                field.setAccessible(true);
                if (field.getType().equals(Duration.class)) {
                    field.set(this, Duration.ofMillis(Long.parseLong(value)));
                } else if (field.getType().equals(int.class)) {
                    field.set(this, Integer.parseInt(value));
                } else if (field.getType().equals(Boolean.class)) {
                    field.set(this, Boolean.parseBoolean(value));
                } else if (field.getType().equals(TransportMode.class)) {
                    field.set(this, TransportMode.fromString(value));
                } else if (field.getType().equals(String.class)) {
                    field.set(this, value);
                } else {
                    throw new IllegalArgumentException("Unsupported configuration property: " + name);
                }
            } catch (NoSuchFieldException | IllegalAccessException e) {
                throw new IllegalArgumentException("Invalid configuration property: " + name);
            }
        }
        return this;
    }

    @Override
    public @NonNull VectraClient build() throws UnavailableTransportException {
        var config =
                new ClientConfig(
                        validateHost(host),
                        validatePort(port),
                        transportMode,
                        requestTimeout,
                        healthCheckTimeout,
                        embeddedAvailable != null ? embeddedAvailable : embeddedCapability.get(),
                        metrics);
        return switch (transportMode) {
            case REMOTE -> new HttpVectraClient(
                    config,
                    adminOperations != null ? adminOperations : new PlaceholderAdminOperations());
            case EMBEDDED -> EmbeddedVectraClient.open(config);
            case PLACEHOLDER -> new PlaceholderVectraClient(config);
        };
    }

    private static String validateHost(String host) {
        if (Strings.isNullOrEmpty(host)) {
            throw new IllegalArgumentException("host must not be null or empty.");
        }
        return host;
    }

    private static int validatePort(int port) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        return port;
    }
}
