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

/// Opt-in diagonal stabilization for Cholesky factorization.
///
/// A near-singular covariance (duplicate inputs, very long lengthscales, no
/// noise) can produce a non-positive pivot. By default that is reported as an
/// error. A caller may instead allow a bounded number of retries, each adding
/// a growing multiple of the identity:
///
/// ```text
/// attempt 1: M + initial·I
/// attempt 2: M + initial·growth·I
/// ...
/// attempt k: M + initial·growthᵏ⁻¹·I      (k ≤ maxAttempts)
/// ```
///
/// The jitter actually applied is reported by [CholeskyDecomposition#appliedJitter()].
public final class JitterPolicy {

    private static final JitterPolicy NONE = new JitterPolicy(0.0, 0, 1.0);

    /// Default starting jitter for [#escalating()].
    public static final double DEFAULT_INITIAL = 1e-10;

    /// Default number of retries for [#escalating()].
    public static final int DEFAULT_MAX_ATTEMPTS = 6;

    /// Default growth factor between retries.
    public static final double DEFAULT_GROWTH = 10.0;

    private final double initial;
    private final int maxAttempts;
    private final double growth;

    private JitterPolicy(double initial, int maxAttempts, double growth) {
        this.initial = initial;
        this.maxAttempts = maxAttempts;
        this.growth = growth;
    }

    /// @return the policy that never alters the matrix
    public static JitterPolicy none() {
        return NONE;
    }

    /// @return escalating jitter from 1e-10 up to 1e-5 over six retries
    public static JitterPolicy escalating() {
        return new JitterPolicy(DEFAULT_INITIAL, DEFAULT_MAX_ATTEMPTS, DEFAULT_GROWTH);
    }

    /// @param initial first jitter added; must be positive
    /// @param maxAttempts number of retries; must be positive
    /// @param growth factor applied between retries; must be at least 1
    public static JitterPolicy escalating(double initial, int maxAttempts, double growth) {
        if (!(initial > 0.0) || !Double.isFinite(initial)) {
            throw new IllegalArgumentException("initial jitter must be positive and finite, got " + initial);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
        if (!(growth >= 1.0) || !Double.isFinite(growth)) {
            throw new IllegalArgumentException("growth must be >= 1, got " + growth);
        }
        return new JitterPolicy(initial, maxAttempts, growth);
    }

    public boolean isEnabled() {
        return maxAttempts > 0;
    }

    public double getInitial() {
        return initial;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public double getGrowth() {
        return growth;
    }

    /// @param attempt retry number, starting at 1
    /// @return the jitter to add on that retry
    public double jitterFor(int attempt) {
        if (attempt < 1 || attempt > maxAttempts) {
            throw new IllegalArgumentException("attempt " + attempt + " outside 1.." + maxAttempts);
        }
        return initial * Math.pow(growth, attempt - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JitterPolicy)) {
            return false;
        }
        JitterPolicy that = (JitterPolicy) o;
        return Double.compare(initial, that.initial) == 0
            && maxAttempts == that.maxAttempts
            && Double.compare(growth, that.growth) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(initial, maxAttempts, growth);
    }

    @Override
    public String toString() {
        return isEnabled()
            ? "JitterPolicy[initial=" + initial + ", maxAttempts=" + maxAttempts + ", growth=" + growth + "]"
            : "JitterPolicy[none]";
    }
}
