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
 * Periodic (exp-sine-squared) kernel.
 *
 * <pre>{@code
 * k(r) = variance * exp( -2 sin²(π r / period) / ℓ² )
 * }</pre>
 *
 * <p>Inputs a whole number of periods apart are perfectly correlated.
 */
@KernelType("periodic")
public final class PeriodicKernel extends AbstractStationaryKernel {

    public static final String PERIOD = "period";

    private final double period;

    public PeriodicKernel(KernelParameters parameters) {
        super(parameters, PERIOD);
        this.period = parameters.requirePositive(PERIOD);
    }

    public PeriodicKernel(double variance, double lengthscale, double period) {
        this(KernelParameters.of(VARIANCE, variance, LENGTHSCALE, lengthscale, PERIOD, period));
    }

    @Override
    protected double fromSquaredDistance(double squaredDistance) {
        double sine = Math.sin(Math.PI * Math.sqrt(squaredDistance) / period);
        return variance * Math.exp(-2.0 * sine * sine / (lengthscale * lengthscale));
    }

    public double getPeriod() {
        return period;
    }
}
