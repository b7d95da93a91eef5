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

import java.util.Arrays;
import java.util.List;

/**
 * Product of kernels, {@code k(a, b) = Π kᵢ(a, b)}.
 *
 * <p>Multiplying by a stationary kernel localizes another kernel, e.g. a
 * periodic pattern whose shape drifts slowly.
 */
@KernelType("product")
public final class ProductKernel extends CompositeKernel {

    public ProductKernel(List<? extends KernelFunction> kernels) {
        super(kernels);
    }

    public ProductKernel(KernelFunction... kernels) {
        this(Arrays.asList(kernels));
    }

    @Override
    public double covariance(double[] a, double[] b) {
        double product = 1.0;
        for (KernelFunction kernel : getKernels()) {
            product *= kernel.covariance(a, b);
        }
        return product;
    }
}
