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
 * Linear (dot product) kernel, {@code k(x, x') = variance * x·x'}.
 *
 * <p>Equivalent to Bayesian linear regression through the origin with a
 * Gaussian prior of the given variance on the weights. The resulting
 * covariance has rank at most the input dimensionality, so it needs
 * observation noise to be factorizable for more points than dimensions.
 */
@KernelType("linear")
public final class LinearKernel extends AbstractKernel {

    private final double variance;

    public LinearKernel(KernelParameters parameters) {
        super(parameters, VARIANCE);
        this.variance = parameters.requirePositive(VARIANCE);
    }

    public LinearKernel(double variance) {
        this(KernelParameters.of(VARIANCE, variance));
    }

    @Override
    public double covariance(double[] a, double[] b) {
        return variance * Vectors.dot(a, b);
    }

    public double getVariance() {
        return variance;
    }
}
