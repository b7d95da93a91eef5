package io.nosqlbench.gproc.model;

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

import io.nosqlbench.gproc.linalg.Matrices;

import java.util.Objects;

/**
 * Posterior predictive distribution at a set of test inputs.
 *
 * <p>Holds the posterior mean {@code μ} (length m) and covariance {@code C}
 * (m×m). Marginal variances, standard deviations and uncertainty bands are
 * derived from these on request rather than stored.
 *
 * <pre>{@code
 * PosteriorPrediction p = model.predict(testInputs);
 * double[] mu = p.mean();
 * double[] sd = p.standardDeviation();
 * double[] lo = p.lowerBand(2.0);   // μ - 2σ
 * double[] hi = p.upperBand(2.0);   // μ + 2σ
 * }</pre>
 *
 * <p>Accessors return copies; instances are immutable.
 */
public final class PosteriorPrediction {

    private static final PosteriorPrediction EMPTY = new PosteriorPrediction(new double[0], new double[0][0], false);

    private final double[] mean;
    private final double[][] covariance;

    /**
     * @param mean posterior mean, length m
     * @param covariance posterior covariance, m×m
     * @throws IllegalArgumentException if the shapes disagree
     */
    public PosteriorPrediction(double[] mean, double[][] covariance) {
        this(Objects.requireNonNull(mean, "mean cannot be null").clone(),
            Matrices.copy(Objects.requireNonNull(covariance, "covariance cannot be null")), true);
    }

    private PosteriorPrediction(double[] mean, double[][] covariance, boolean validate) {
        if (validate) {
            Matrices.requireSquare(covariance, "posterior covariance");
            if (covariance.length != mean.length) {
                throw new IllegalArgumentException(
                    "covariance is " + covariance.length + "x" + covariance.length
                        + " but mean has length " + mean.length);
            }
        }
        this.mean = mean;
        this.covariance = covariance;
    }

    /** Wraps arrays the caller will not touch again. */
    static PosteriorPrediction wrap(double[] mean, double[][] covariance) {
        return new PosteriorPrediction(mean, covariance, true);
    }

    /**
     * @return the prediction over an empty test set
     */
    public static PosteriorPrediction empty() {
        return EMPTY;
    }

    public int size() {
        return mean.length;
    }

    public boolean isEmpty() {
        return mean.length == 0;
    }

    public double[] mean() {
        return mean.clone();
    }

    public double[][] covariance() {
        return Matrices.copy(covariance);
    }

    /**
     * Marginal posterior variances, the diagonal of the covariance.
     *
     * <p>Values that round-off pushed slightly below zero are reported as zero.
     */
    public double[] variance() {
        double[] variance = new double[mean.length];
        for (int i = 0; i < variance.length; i++) {
            variance[i] = Math.max(0.0, covariance[i][i]);
        }
        return variance;
    }

    /**
     * @return the square root of each marginal variance
     */
    public double[] standardDeviation() {
        double[] sd = variance();
        for (int i = 0; i < sd.length; i++) {
            sd[i] = Math.sqrt(sd[i]);
        }
        return sd;
    }

    /**
     * @param k number of standard deviations
     * @return {@code μ - k·σ} per test point
     */
    public double[] lowerBand(double k) {
        return band(-k);
    }

    /**
     * @param k number of standard deviations
     * @return {@code μ + k·σ} per test point
     */
    public double[] upperBand(double k) {
        return band(k);
    }

    private double[] band(double k) {
        double[] sd = standardDeviation();
        double[] band = new double[mean.length];
        for (int i = 0; i < band.length; i++) {
            band[i] = mean[i] + k * sd[i];
        }
        return band;
    }

    @Override
    public String toString() {
        return "PosteriorPrediction[size=" + mean.length + "]";
    }
}
