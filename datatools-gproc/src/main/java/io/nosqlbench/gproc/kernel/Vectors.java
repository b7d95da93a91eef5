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

import io.nosqlbench.gproc.DimensionMismatchException;

/**
 * Small vector helpers shared by kernel implementations.
 */
public final class Vectors {

    private Vectors() {
        // Utility class
    }

    /**
     * @throws DimensionMismatchException if {@code a} and {@code b} differ in length
     */
    public static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException("input vector dimensionality", a.length, b.length);
        }
    }

    /**
     * Squared Euclidean distance. Each term is (a-b)², which is exactly
     * symmetric in floating point.
     */
    public static double squaredDistance(double[] a, double[] b) {
        requireSameLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    public static double dot(double[] a, double[] b) {
        requireSameLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
