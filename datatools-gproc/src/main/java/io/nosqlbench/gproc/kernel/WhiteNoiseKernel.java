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
 * White noise kernel: {@code variance} when the two inputs are identical,
 * zero otherwise.
 *
 * <p>Mostly useful inside a {@link SumKernel} to model an independent
 * per-point component that, unlike the model noise variance, also applies
 * to the test-test covariance.
 */
@KernelType("white_noise")
public final class WhiteNoiseKernel extends AbstractKernel {

    private final double variance;

    public WhiteNoiseKernel(KernelParameters parameters) {
        super(parameters, VARIANCE);
        this.variance = parameters.requirePositive(VARIANCE);
    }

    public WhiteNoiseKernel(double variance) {
        this(KernelParameters.of(VARIANCE, variance));
    }

    @Override
    public double covariance(double[] a, double[] b) {
        Vectors.requireSameLength(a, b);
        return sameInput(a, b) ? variance : 0.0;
    }

    // numeric equality, so 0.0 and -0.0 are the same coordinate
    private static boolean sameInput(double[] a, double[] b) {
        for (int i = 0; i < a.length; i++) {
            if (a[i] != b[i]) {
                return false;
            }
        }
        return true;
    }
}
