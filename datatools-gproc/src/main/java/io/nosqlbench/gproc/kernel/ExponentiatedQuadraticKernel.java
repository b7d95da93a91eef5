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
 * Exponentiated quadratic (squared exponential, RBF) kernel.
 *
 * <pre>{@code
 * k(x, x') = variance * exp( -0.5 * |x - x'|² / lengthscale² )
 * }</pre>
 *
 * <p>Sample functions are infinitely differentiable. Correlation falls to
 * about 0.6 at one lengthscale and is negligible beyond four or five.
 */
@KernelType("exponentiated_quadratic")
public final class ExponentiatedQuadraticKernel extends AbstractStationaryKernel {

    private final double inverseTwiceLengthscaleSquared;

    public ExponentiatedQuadraticKernel(KernelParameters parameters) {
        super(parameters);
        this.inverseTwiceLengthscaleSquared = 0.5 / (lengthscale * lengthscale);
    }

    /**
     * @param variance signal variance; must be positive
     * @param lengthscale lengthscale; must be positive
     * @throws io.nosqlbench.gproc.ConfigurationException if either is not positive
     */
    public ExponentiatedQuadraticKernel(double variance, double lengthscale) {
        this(KernelParameters.of(VARIANCE, variance, LENGTHSCALE, lengthscale));
    }

    @Override
    protected double fromSquaredDistance(double squaredDistance) {
        return variance * Math.exp(-squaredDistance * inverseTwiceLengthscaleSquared);
    }
}
