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

import java.util.List;
import java.util.Objects;

/**
 * Base class for kernels whose parameters are a {@link KernelParameters} set.
 *
 * <p>Subclasses validate and extract their parameters in the constructor and
 * keep the extracted values in final fields; the parameter set itself is
 * retained for serialization and reporting.
 */
public abstract class AbstractKernel implements KernelFunction {

    /** Name of the signal variance parameter shared by most kernels. */
    public static final String VARIANCE = "variance";

    /** Name of the lengthscale parameter shared by the stationary kernels. */
    public static final String LENGTHSCALE = "lengthscale";

    private final KernelParameters parameters;

    /**
     * @param parameters the parameter set
     * @param acceptedNames every parameter name this kernel reads; any other name is rejected
     * @throws io.nosqlbench.gproc.ConfigurationException if the set holds an unknown name
     */
    protected AbstractKernel(KernelParameters parameters, String... acceptedNames) {
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
        parameters.requireOnly(getKernelType(), List.of(acceptedNames));
    }

    @Override
    public KernelParameters getParameters() {
        return parameters;
    }

    @Override
    public String getKernelType() {
        KernelType annotation = getClass().getAnnotation(KernelType.class);
        if (annotation == null) {
            throw new IllegalStateException(getClass().getName() + " has no @KernelType annotation");
        }
        return annotation.value();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return parameters.equals(((AbstractKernel) o).parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), parameters);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + parameters;
    }
}
