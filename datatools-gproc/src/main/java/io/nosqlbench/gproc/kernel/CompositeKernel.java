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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for kernels built by combining other kernels.
 *
 * <p>Sums and products of valid kernels are valid kernels, so composites
 * can be nested freely. Each child keeps its own bound parameters; the
 * composite itself has none.
 */
public abstract class CompositeKernel implements KernelFunction {

    private final List<KernelFunction> kernels;

    protected CompositeKernel(List<? extends KernelFunction> kernels) {
        Objects.requireNonNull(kernels, "kernels cannot be null");
        if (kernels.isEmpty()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " requires at least one kernel");
        }
        List<KernelFunction> copy = new ArrayList<>(kernels.size());
        for (KernelFunction kernel : kernels) {
            copy.add(Objects.requireNonNull(kernel, "kernel cannot be null"));
        }
        this.kernels = Collections.unmodifiableList(copy);
    }

    /**
     * @return the combined kernels, in order
     */
    public List<KernelFunction> getKernels() {
        return kernels;
    }

    @Override
    public KernelParameters getParameters() {
        return KernelParameters.empty();
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
        return kernels.equals(((CompositeKernel) o).kernels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), kernels);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + kernels;
    }
}
