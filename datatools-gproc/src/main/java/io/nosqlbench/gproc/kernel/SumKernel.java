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
 * Sum of kernels, {@code k(a, b) = Σ kᵢ(a, b)}.
 *
 * <p>Models a function as the sum of independent components, e.g. a
 * smooth trend plus a periodic term.
 */
@KernelType("sum")
public final class SumKernel extends CompositeKernel {

    public SumKernel(List<? extends KernelFunction> kernels) {
        super(kernels);
    }

    public SumKernel(KernelFunction... kernels) {
        this(Arrays.asList(kernels));
    }

    @Override
    public double covariance(double[] a, double[] b) {
        double sum = 0.0;
        for (KernelFunction kernel : getKernels()) {
            sum += kernel.covariance(a, b);
        }
        return sum;
    }
}
