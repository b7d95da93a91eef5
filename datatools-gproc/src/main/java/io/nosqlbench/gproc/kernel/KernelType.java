package io.nosqlbench.gproc.kernel;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the type name of a {@link KernelFunction} implementation.
 *
 * <p>The name identifies the kernel in configuration and in serialized JSON,
 * where it appears as the {@code "type"} field:
 *
 * <pre>{@code
 * {
 *   "type": "exponentiated_quadratic",
 *   "variance": 1.0,
 *   "lengthscale": 0.5
 * }
 * }</pre>
 *
 * @see KernelFactory
 * @see io.nosqlbench.gproc.config.KernelTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface KernelType {
    /**
     * The type name, lowercase with underscores (e.g. "exponentiated_quadratic", "matern52").
     *
     * @return the kernel type name
     */
    String value();
}
