package io.nosqlbench.gproc.linalg;

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

import java.util.Objects;

/**
 * Dense matrix helpers over {@code double[row][column]} arrays.
 *
 * <p>Matrices are rectangular: every row has the same length. A matrix with
 * zero rows has zero columns.
 */
public final class Matrices {

    private Matrices() {
        // Utility class
    }

    public static int rows(double[][] m) {
        return m.length;
    }

    public static int columns(double[][] m) {
        return m.length == 0 ? 0 : m[0].length;
    }

    /**
     * @throws IllegalArgumentException if {@code m} is not square
     */
    public static void requireSquare(double[][] m, String label) {
        Objects.requireNonNull(m, label + " cannot be null");
        for (int i = 0; i < m.length; i++) {
            if (m[i] == null || m[i].length != m.length) {
                throw new IllegalArgumentException(
                    "Matrix '" + label + "' is not square: row " + i + " has "
                        + (m[i] == null ? "no" : String.valueOf(m[i].length))
                        + " columns, expected " + m.length);
            }
        }
    }

    /**
     * Checks symmetry to a relative tolerance.
     *
     * @param tolerance allowed |mᵢⱼ − mⱼᵢ| relative to max(1, |mᵢⱼ|, |mⱼᵢ|); 0 for exact
     */
    public static boolean isSymmetric(double[][] m, double tolerance) {
        for (int i = 0; i < m.length; i++) {
            for (int j = i + 1; j < m.length; j++) {
                double a = m[i][j];
                double b = m[j][i];
                double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
                if (!(Math.abs(a - b) <= tolerance * scale)) {
                    return false;
                }
            }
        }
        return true;
    }

    public static double[][] copy(double[][] m) {
        double[][] copy = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            copy[i] = m[i].clone();
        }
        return copy;
    }

    public static double[][] identity(int n) {
        double[][] identity = new double[n][n];
        for (int i = 0; i < n; i++) {
            identity[i][i] = 1.0;
        }
        return identity;
    }

    /**
     * @return a copy of {@code m} with {@code value} added to each diagonal entry
     */
    public static double[][] addToDiagonal(double[][] m, double value) {
        double[][] result = copy(m);
        for (int i = 0; i < result.length; i++) {
            result[i][i] += value;
        }
        return result;
    }

    public static double[][] transpose(double[][] m) {
        int rows = rows(m);
        int cols = columns(m);
        double[][] t = new double[cols][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                t[j][i] = m[i][j];
            }
        }
        return t;
    }

    /**
     * @return {@code a · b}
     * @throws IllegalArgumentException if the inner dimensions differ
     */
    public static double[][] multiply(double[][] a, double[][] b) {
        int n = rows(a);
        int inner = columns(a);
        if (n > 0 && inner != rows(b)) {
            throw new IllegalArgumentException(
                "Cannot multiply " + n + "x" + inner + " by " + rows(b) + "x" + columns(b));
        }
        int m = columns(b);
        double[][] result = new double[n][m];
        for (int i = 0; i < n; i++) {
            double[] row = result[i];
            for (int k = 0; k < inner; k++) {
                double aik = a[i][k];
                if (aik == 0.0) {
                    continue;
                }
                double[] bk = b[k];
                for (int j = 0; j < m; j++) {
                    row[j] += aik * bk[j];
                }
            }
        }
        return result;
    }

    /**
     * @return {@code m · v}
     */
    public static double[] multiply(double[][] m, double[] v) {
        double[] result = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            result[i] = dot(m[i], v);
        }
        return result;
    }

    /**
     * @return {@code mᵗ · v}, computed without forming the transpose
     */
    public static double[] transposeMultiply(double[][] m, double[] v) {
        int cols = columns(m);
        double[] result = new double[cols];
        for (int i = 0; i < m.length; i++) {
            double vi = v[i];
            double[] row = m[i];
            for (int j = 0; j < cols; j++) {
                result[j] += row[j] * vi;
            }
        }
        return result;
    }

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("vector lengths differ: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double squaredNorm(double[] v) {
        return dot(v, v);
    }

    /**
     * @return the largest absolute element-wise difference
     */
    public static double maxAbsDifference(double[][] a, double[][] b) {
        if (rows(a) != rows(b) || columns(a) != columns(b)) {
            throw new IllegalArgumentException("matrix shapes differ");
        }
        double max = 0.0;
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < a[i].length; j++) {
                max = Math.max(max, Math.abs(a[i][j] - b[i][j]));
            }
        }
        return max;
    }
}
