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

import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UtilityClass
public class EmbeddedEngines {

    /**
     * Probes for an embedded engine that can run in this process. Meant to be called once at
     * startup; the result is carried in {@link io.vectraedge.client.ClientConfig}.
     */
    public static boolean detectEmbeddedCapability() {
        var provider = findProvider();
        if (provider.isPresent()) {
            log.info("Embedded engine available: {}", provider.get().name());
            return true;
        }
        log.debug("No embedded engine available");
        return false;
    }

    public static Optional<EmbeddedEngineProvider> findProvider() {
        try {
            return ServiceLoader.load(EmbeddedEngineProvider.class).stream()
                    .map(ServiceLoader.Provider::get)
                    .filter(EmbeddedEngineProvider::isAvailable)
                    .findFirst();
        } catch (ServiceConfigurationError e) {
            log.warn("Failed to load embedded engine providers", e);
            return Optional.empty();
        }
    }
}
