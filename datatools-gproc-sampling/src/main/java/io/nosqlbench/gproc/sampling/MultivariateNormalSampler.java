package io.nosqlbench.gproc.sampling;

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
import io.nosqlbench.gproc.linalg.CholeskyDecomposition;
import io.nosqlbench.gproc.linalg.JitterPolicy;
import io.nosqlbench.gproc.linalg.Matrices;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Random;

/// Sampler for a multivariate normal distribution, bound at construction.
///
/// The covariance is factored once as `C = R Rᵗ`; each draw maps a vector of
/// independent standard normals `z` to `μ + R z`. Posterior covariances are often
/// only positive semi-definite, so the default policy adds escalating jitter to the
/// diagonal until the factorization succeeds.
///
/// Instances are immutable and may be shared between threads. The [Random] passed
/// to [#sample(Random)] is not.
public final class MultivariateNormalSampler {

    private static final Logger logger = LogManager.getLogger(MultivariateNormalSampler.class);

    static final String COVARIANCE_LABEL = "sampling covariance";

    private final double[] mean;
    private final double[][] factor; // lower triangular R
    private final double appliedJitter;

    /// Creates a sampler with escalating jitter.
    ///
    /// @param mean the mean vector
    /// @param covariance the symmetric covariance matrix
    /// @throws io.nosqlbench.gproc.NotPositiveDefiniteException if the covariance cannot be factored
    public MultivariateNormalSampler(double[] mean, double[][] covariance) {
        this(mean, covariance, JitterPolicy.escalating());
    }

    /// @param mean the mean vector
    /// @param covariance the symmetric covariance matrix
    /// @param jitter policy for repairing an ill-conditioned covariance
    public MultivariateNormalSampler(double[] mean, double[][] covariance, JitterPolicy jitter) {
        Objects.requireNonNull(mean, "mean cannot be null");
        Objects.requireNonNull(covariance, "covariance cannot be null");
        Objects.requireNonNull(jitter, "jitter cannot be null");
        Matrices.requireSquare(covariance, COVARIANCE_LABEL);
        if (covariance.length != mean.length) {
            throw new DimensionMismatchException("covariance size", mean.length, covariance.length);
        }
        this.mean = mean.clone();
        if (mean.length == 0) {
            this.factor = new double[0][0];
            this.appliedJitter = 0.0;
        } else {
            CholeskyDecomposition cholesky = CholeskyDecomposition.factor(covariance, COVARIANCE_LABEL, jitter);
            this.factor = cholesky.lower();
            this.appliedJitter = cholesky.appliedJitter();
        }
        logger.debug("Bound {}-dimensional normal sampler (jitter {})", mean.length, appliedJitter);
    }

    public int dimensions() {
        return mean.length;
    }

    public double[] mean() {
        return mean.clone();
    }

    /// @return the diagonal shift needed to factor the covariance, zero if none
    public double appliedJitter() {
        return appliedJitter;
    }

    /// Maps standard normal deviates to a draw from this distribution.
    ///
    /// @param z independent N(0,1) values, one per dimension
    /// @return `μ + R z`
    public double[] sample(double[] z) {
        Objects.requireNonNull(z, "z cannot be null");
        if (z.length != mean.length) {
            throw new DimensionMismatchException("standard normal vector", mean.length, z.length);
        }
        double[] x = mean.clone();
        for (int i = 0; i < x.length; i++) {
            double[] row = factor[i];
            double sum = 0.0;
            for (int j = 0; j <= i; j++) {
                sum += row[j] * z[j];
            }
            x[i] += sum;
        }
        return x;
    }

    public double[] sample(Random random) {
        Objects.requireNonNull(random, "random cannot be null");
        double[] z = new double[mean.length];
        for (int i = 0; i < z.length; i++) {
            z[i] = random.nextGaussian();
        }
        return sample(z);
    }

    /// @param random source of randomness
    /// @param count number of draws
    /// @return `count` draws, one per row
    public double[][] samples(Random random, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got " + count);
        }
        double[][] out = new double[count][];
        for (int i = 0; i < count; i++) {
            out[i] = sample(random);
        }
        return out;
    }
}
