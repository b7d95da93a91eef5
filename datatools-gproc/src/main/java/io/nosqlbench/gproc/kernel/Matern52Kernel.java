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
 * Matérn kernel with smoothness ν = 5/2.
 *
 * <pre>{@code
 * k(r) = variance * (1 + √5 r / ℓ + 5 r² / (3 ℓ²)) * exp(-√5 r / ℓ)
 * }</pre>
 *
 * <p>Sample functions are twice differentiable.
 */
@KernelType("matern52")
public final class Matern52Kernel extends AbstractStationaryKernel {

    private static final double SQRT5 = Math.sqrt(5.0);

    public Matern52Kernel(KernelParameters parameters) {
        super(parameters);
    }

    public Matern52Kernel(double variance, double lengthscale) {
        this(KernelParameters.of(VARIANCE, variance, LENGTHSCALE, lengthscale));
    }

    @Override
    protected double fromSquaredDistance(double squaredDistance) {
        double scaled = SQRT5 * Math.sqrt(squaredDistance) / lengthscale;
        return variance * (1.0 + scaled + scaled * scaled / 3.0) * Math.exp(-scaled);
    }
}
