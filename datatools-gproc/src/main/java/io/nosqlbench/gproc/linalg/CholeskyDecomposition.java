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

import io.nosqlbench.gproc.DimensionMismatchException;
import io.nosqlbench.gproc.NotPositiveDefiniteException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Cholesky factorization {@code M = R·Rᵗ} of a symmetric positive-definite
 * matrix, with the solves and determinant that follow from it.
 *
 * <h2>Factor Convention</h2>
 *
 * <p>{@code R} is lower triangular with a strictly positive diagonal, which
 * makes it unique. Callers form the complete matrix to factor (for a GP,
 * {@code K + σ²I}) before calling {@link #factor}; no noise term is passed
 * separately.
 *
 * <h2>Operations</h2>
 *
 * <pre>{@code
 *   solveLower(b)   R x = b            forward substitution   O(n²)
 *   solveUpper(b)   Rᵗ x = b           back substitution      O(n²)
 *   solve(b)        M x = b            both of the above      O(n²)
 *   logDeterminant  2 Σ log Rᵢᵢ                               O(1), cached
 *   inverse()       R⁻ᵗ R⁻¹            computed on first use  O(n³)
 * }</pre>
 *
 * <p>The log-determinant is taken from the factor's diagonal because
 * {@code det(M)} itself overflows or underflows for moderate n. The dense
 * inverse is only built when explicitly requested; likelihood and
 * prediction use triangular solves.
 *
 * <h2>Failure</h2>
 *
 * <p>A pivot that is not strictly positive (or not finite) raises
 * {@link NotPositiveDefiniteException} carrying the matrix label, size and
 * the failing pivot. The matrix is only altered when the caller passes an
 * enabled {@link JitterPolicy}.
 *
 * <p>Instances are immutable after construction and safe to share between threads.
 */
public final class CholeskyDecomposition {

    private static final Logger logger = LogManager.getLogger(CholeskyDecomposition.class);

    /** Relative tolerance for the symmetry precondition. */
    public static final double SYMMETRY_TOLERANCE = 1e-10;

    private final String label;
    private final double[][] lower;
    private final int n;
    private final double logDeterminant;
    private final double appliedJitter;

    private volatile double[][] inverse;

    private CholeskyDecomposition(String label, double[][] lower, double appliedJitter) {
        this.label = label;
        this.lower = lower;
        this.n = lower.length;
        this.appliedJitter = appliedJitter;
        double sumLog = 0.0;
        for (int i = 0; i < n; i++) {
            sumLog += Math.log(lower[i][i]);
        }
        this.logDeterminant = 2.0 * sumLog;
    }

    /**
     * Factorizes {@code m} without any stabilization.
     *
     * @param m square symmetric matrix; not modified
     * @param label name of the matrix, used in error messages
     * @return the factorization
     * @throws NotPositiveDefiniteException if a pivot is not strictly positive
     * @throws IllegalArgumentException if {@code m} is not square or not symmetric
     */
    public static CholeskyDecomposition factor(double[][] m, String label) {
        return factor(m, label, JitterPolicy.none());
    }

    /**
     * Factorizes {@code m}, retrying with diagonal jitter if the policy allows.
     *
     * @param m square symmetric matrix; not modified
     * @param label name of the matrix, used in log and error messages
     * @param jitter the stabilization policy; {@link JitterPolicy#none()} to fail fast
     * @return the factorization
     * @throws NotPositiveDefiniteException if factorization fails on every allowed attempt
     * @throws IllegalArgumentException if {@code m} is not square or not symmetric
     */
    public static CholeskyDecomposition factor(double[][] m, String label, JitterPolicy jitter) {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(jitter, "jitter cannot be null");
        Matrices.requireSquare(m, label);
        if (!Matrices.isSymmetric(m, SYMMETRY_TOLERANCE)) {
            throw new IllegalArgumentException("Matrix '" + label + "' is not symmetric");
        }

        try {
            return new CholeskyDecomposition(label, decompose(m, label, 0.0), 0.0);
        } catch (NotPositiveDefiniteException e) {
            if (!jitter.isEnabled()) {
                throw e;
            }
            NotPositiveDefiniteException last = e;
            for (int attempt = 1; attempt <= jitter.getMaxAttempts(); attempt++) {
                double amount = jitter.jitterFor(attempt);
                logger.warn("Matrix '{}' ({}x{}) not positive definite, retrying with jitter {} (attempt {}/{})",
                    label, m.length, m.length, amount, attempt, jitter.getMaxAttempts());
                try {
                    return new CholeskyDecomposition(label, decompose(m, label, amount), amount);
                } catch (NotPositiveDefiniteException retry) {
                    last = retry;
                }
            }
            throw new NotPositiveDefiniteException(String.format(
                "Matrix '%s' (%dx%d) is not positive definite even with jitter up to %s",
                label, m.length, m.length, jitter.jitterFor(jitter.getMaxAttempts())), last);
        }
    }

    private static double[][] decompose(double[][] m, String label, double diagonalShift) {
        int size = m.length;
        double[][] l = new double[size][size];
        for (int i = 0; i < size; i++) {
            double[] li = l[i];
            for (int j = 0; j <= i; j++) {
                double[] lj = l[j];
                double sum = m[i][j];
                for (int k = 0; k < j; k++) {
                    sum -= li[k] * lj[k];
                }
                if (i == j) {
                    sum += diagonalShift;
                    if (!(sum > 0.0) || Double.isInfinite(sum)) {
                        throw new NotPositiveDefiniteException(label, size, i, sum);
                    }
                    li[i] = Math.sqrt(sum);
                } else {
                    li[j] = sum / lj[j];
                }
            }
        }
        return l;
    }

    /**
     * @return the matrix dimension n
     */
    public int size() {
        return n;
    }

    public String label() {
        return label;
    }

    /**
     * @return the diagonal jitter that was added to make factorization succeed, 0 if none
     */
    public double appliedJitter() {
        return appliedJitter;
    }

    /**
     * @return a copy of the lower-triangular factor R
     */
    public double[][] lower() {
        return Matrices.copy(lower);
    }

    /**
     * @return {@code log det(M)}, computed as {@code 2 Σ log Rᵢᵢ}
     */
    public double logDeterminant() {
        return logDeterminant;
    }

    /**
     * Solves {@code R x = b} by forward substitution.
     */
    public double[] solveLower(double[] b) {
        requireLength(b);
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            double[] li = lower[i];
            double sum = b[i];
            for (int k = 0; k < i; k++) {
                sum -= li[k] * x[k];
            }
            x[i] = sum / li[i];
        }
        return x;
    }

    /**
     * Solves {@code Rᵗ x = b} by back substitution.
     */
    public double[] solveUpper(double[] b) {
        requireLength(b);
        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = b[i];
            for (int k = i + 1; k < n; k++) {
                sum -= lower[k][i] * x[k];
            }
            x[i] = sum / lower[i][i];
        }
        return x;
    }

    /**
     * Solves {@code M x = b} with one forward and one back substitution.
     */
    public double[] solve(double[] b) {
        return solveUpper(solveLower(b));
    }

    /**
     * Solves {@code R X = B} for every column of the n×m matrix {@code B}.
     */
    public double[][] solveLower(double[][] b) {
        return solveLower(b, ParallelBlocks.serial());
    }

    /**
     * Solves {@code R X = B}, processing blocks of columns in parallel.
     *
     * @param b n×m right-hand sides, one per column; not modified
     * @param blocks parallel execution settings
     * @return the n×m solution
     */
    public double[][] solveLower(double[][] b, ParallelBlocks blocks) {
        double[][] x = copyRightHandSide(b);
        int m = Matrices.columns(x);
        blocks.run(m, (long) n * n, (from, to) -> {
            for (int i = 0; i < n; i++) {
                double[] li = lower[i];
                double[] xi = x[i];
                for (int k = 0; k < i; k++) {
                    double lik = li[k];
                    if (lik == 0.0) {
                        continue;
                    }
                    double[] xk = x[k];
                    for (int c = from; c < to; c++) {
                        xi[c] -= lik * xk[c];
                    }
                }
                double pivot = li[i];
                for (int c = from; c < to; c++) {
                    xi[c] /= pivot;
                }
            }
        });
        return x;
    }

    /**
     * Solves {@code Rᵗ X = B} for every column of {@code B}.
     */
    public double[][] solveUpper(double[][] b) {
        return solveUpper(b, ParallelBlocks.serial());
    }

    /**
     * Solves {@code Rᵗ X = B}, processing blocks of columns in parallel.
     */
    public double[][] solveUpper(double[][] b, ParallelBlocks blocks) {
        double[][] x = copyRightHandSide(b);
        int m = Matrices.columns(x);
        blocks.run(m, (long) n * n, (from, to) -> {
            for (int i = n - 1; i >= 0; i--) {
                double[] xi = x[i];
                for (int k = i + 1; k < n; k++) {
                    double lki = lower[k][i];
                    if (lki == 0.0) {
                        continue;
                    }
                    double[] xk = x[k];
                    for (int c = from; c < to; c++) {
                        xi[c] -= lki * xk[c];
                    }
                }
                double pivot = lower[i][i];
                for (int c = from; c < to; c++) {
                    xi[c] /= pivot;
                }
            }
        });
        return x;
    }

    /**
     * Solves {@code M X = B} for every column of {@code B}.
     */
    public double[][] solve(double[][] b) {
        return solve(b, ParallelBlocks.serial());
    }

    public double[][] solve(double[][] b, ParallelBlocks blocks) {
        return solveUpper(solveLower(b, blocks), blocks);
    }

    /**
     * Returns the dense inverse {@code M⁻¹ = R⁻ᵗ R⁻¹}.
     *
     * <p>Computed on first call from the triangular inverse and cached. The
     * result is exactly symmetric.
     *
     * @return a copy of the inverse
     */
    public double[][] inverse() {
        double[][] result = inverse;
        if (result == null) {
            synchronized (this) {
                result = inverse;
                if (result == null) {
                    result = computeInverse();
                    inverse = result;
                }
            }
        }
        return Matrices.copy(result);
    }

    private double[][] computeInverse() {
        double[][] rInverse = solveLower(Matrices.identity(n));
        double[][] inv = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double sum = 0.0;
                for (int k = j; k < n; k++) {
                    sum += rInverse[k][i] * rInverse[k][j];
                }
                inv[i][j] = sum;
                inv[j][i] = sum;
            }
        }
        return inv;
    }

    /**
     * @return {@code R·Rᵗ}, which equals the factored matrix plus any applied jitter
     */
    public double[][] reconstruct() {
        double[][] m = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = 0.0;
                for (int k = 0; k <= j; k++) {
                    sum += lower[i][k] * lower[j][k];
                }
                m[i][j] = sum;
                m[j][i] = sum;
            }
        }
        return m;
    }

    private void requireLength(double[] b) {
        Objects.requireNonNull(b, "right-hand side cannot be null");
        if (b.length != n) {
            throw new DimensionMismatchException("right-hand side length for '" + label + "'", n, b.length);
        }
    }

    private double[][] copyRightHandSide(double[][] b) {
        Objects.requireNonNull(b, "right-hand side cannot be null");
        if (b.length != n) {
            throw new DimensionMismatchException("right-hand side rows for '" + label + "'", n, b.length);
        }
        return Matrices.copy(b);
    }

    @Override
    public String toString() {
        return "CholeskyDecomposition[label=" + label + ", n=" + n + ", logDet=" + logDeterminant
            + (appliedJitter > 0.0 ? ", jitter=" + appliedJitter : "") + "]";
    }
}
