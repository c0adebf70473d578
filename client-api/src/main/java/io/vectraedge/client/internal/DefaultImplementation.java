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
package io.vectraedge.client.internal;

import io.vectraedge.client.api.VectraClientBuilder;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * This class loads the implementation for {@link VectraClientBuilder} and allows you to decouple
 * the API from the actual implementation. <b>This class is internal to the VectraEdge API
 * implementation, and it is not part of the public API it is not meant to be used by client
 * applications.</b>
 */
public class DefaultImplementation {
    private static final Constructor<?> CONSTRUCTOR;

    private static final String IMPL_CLASS_NAME = "io.vectraedge.client.VectraClientBuilderImpl";

    static {
        Constructor<?> impl;
        try {
            impl =
                    Class.forName(IMPL_CLASS_NAME, true, DefaultImplementation.class.getClassLoader())
                            .getConstructor(String.class, int.class);
        } catch (Throwable error) {
            throw new RuntimeException("Cannot load VectraEdge Client Implementation: " + error, error);
        }
        CONSTRUCTOR = impl;
    }

    /**
     * Access the actual implementation of the VectraEdge Client API.
     *
     * @return the loaded implementation.
     */
    public static VectraClientBuilder getDefaultImplementation(String host, int port) {
        try {
            return (VectraClientBuilder) CONSTRUCTOR.newInstance(host, port);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException(e.getCause());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
