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

/**
 * Matérn kernel with smoothness ν = 3/2.
 *
 * <pre>{@code
 * k(r) = variance * (1 + √3 r / ℓ) * exp(-√3 r / ℓ)
 * }</pre>
 *
 * <p>Sample functions are once differentiable.
 */
@KernelType("matern32")
public final class Matern32Kernel extends AbstractStationaryKernel {

    private static final double SQRT3 = Math.sqrt(3.0);

    public Matern32Kernel(KernelParameters parameters) {
        super(parameters);
    }

    public Matern32Kernel(double variance, double lengthscale) {
        this(KernelParameters.of(VARIANCE, variance, LENGTHSCALE, lengthscale));
    }

    @Override
    protected double fromSquaredDistance(double squaredDistance) {
        double scaled = SQRT3 * Math.sqrt(squaredDistance) / lengthscale;
        return variance * (1.0 + scaled) * Math.exp(-scaled);
    }
}
