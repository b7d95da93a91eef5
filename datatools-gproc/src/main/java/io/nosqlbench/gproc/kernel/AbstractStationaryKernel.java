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
 * Base class for stationary kernels, whose covariance depends only on the
 * distance between the two inputs.
 *
 * <p>All stationary kernels here take a {@code variance} (the value at zero
 * distance) and a {@code lengthscale} (how quickly correlation decays). Both
 * must be strictly positive.
 */
public abstract class AbstractStationaryKernel extends AbstractKernel {

    protected final double variance;
    protected final double lengthscale;

    protected AbstractStationaryKernel(KernelParameters parameters, String... extraNames) {
        super(parameters, acceptedNames(extraNames));
        this.variance = parameters.requirePositive(VARIANCE);
        this.lengthscale = parameters.requirePositive(LENGTHSCALE);
    }

    private static String[] acceptedNames(String[] extraNames) {
        String[] names = new String[extraNames.length + 2];
        names[0] = VARIANCE;
        names[1] = LENGTHSCALE;
        System.arraycopy(extraNames, 0, names, 2, extraNames.length);
        return names;
    }

    @Override
    public final double covariance(double[] a, double[] b) {
        return fromSquaredDistance(Vectors.squaredDistance(a, b));
    }

    /**
     * Computes the covariance for inputs separated by the given squared distance.
     *
     * @param squaredDistance squared Euclidean distance between the inputs, non-negative
     * @return the covariance
     */
    protected abstract double fromSquaredDistance(double squaredDistance);

    public double getVariance() {
        return variance;
    }

    public double getLengthscale() {
        return lengthscale;
    }
}
