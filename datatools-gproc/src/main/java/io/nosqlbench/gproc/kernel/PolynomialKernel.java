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

import io.nosqlbench.gproc.ConfigurationException;

/**
 * Polynomial kernel.
 *
 * <pre>{@code
 * k(x, x') = variance * (weight_variance * x·x' + bias_variance) ^ degree
 * }</pre>
 *
 * <p>{@code degree} must be a whole number between 1 and {@link #MAX_DEGREE}; {@code weight_variance}
 * and {@code bias_variance} default to 1 and must not be negative.
 */
@KernelType("polynomial")
public final class PolynomialKernel extends AbstractKernel {

    public static final String DEGREE = "degree";
    public static final String WEIGHT_VARIANCE = "weight_variance";
    public static final String BIAS_VARIANCE = "bias_variance";

    /** Largest accepted degree. */
    public static final int MAX_DEGREE = 64;

    private final double variance;
    private final int degree;
    private final double weightVariance;
    private final double biasVariance;

    public PolynomialKernel(KernelParameters parameters) {
        super(parameters, VARIANCE, DEGREE, WEIGHT_VARIANCE, BIAS_VARIANCE);
        this.variance = parameters.requirePositive(VARIANCE);
        double rawDegree = parameters.requirePositive(DEGREE);
        if (rawDegree != Math.rint(rawDegree)) {
            throw new ConfigurationException(DEGREE, rawDegree, "must be a whole number");
        }
        if (rawDegree > MAX_DEGREE) {
            throw new ConfigurationException(DEGREE, rawDegree, "must be <= " + MAX_DEGREE);
        }
        this.degree = (int) rawDegree;
        this.weightVariance = parameters.nonNegative(WEIGHT_VARIANCE, 1.0);
        this.biasVariance = parameters.nonNegative(BIAS_VARIANCE, 1.0);
    }

    public PolynomialKernel(double variance, int degree, double weightVariance, double biasVariance) {
        this(KernelParameters.of(VARIANCE, variance, DEGREE, degree,
            WEIGHT_VARIANCE, weightVariance, BIAS_VARIANCE, biasVariance));
    }

    @Override
    public double covariance(double[] a, double[] b) {
        double base = weightVariance * Vectors.dot(a, b) + biasVariance;
        double result = 1.0;
        for (int i = 0; i < degree; i++) {
            result *= base;
        }
        return variance * result;
    }

    public int getDegree() {
        return degree;
    }
}
