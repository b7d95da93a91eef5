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

import io.nosqlbench.gproc.ConfigurationException;
import io.nosqlbench.gproc.DimensionMismatchException;
import io.nosqlbench.gproc.InputSet;
import io.nosqlbench.gproc.NotPositiveDefiniteException;
import io.nosqlbench.gproc.config.GaussianProcessConfig;
import io.nosqlbench.gproc.kernel.KernelFunction;
import io.nosqlbench.gproc.kernel.KernelMatrixBuilder;
import io.nosqlbench.gproc.linalg.CholeskyDecomposition;
import io.nosqlbench.gproc.linalg.JitterPolicy;
import io.nosqlbench.gproc.linalg.Matrices;
import io.nosqlbench.gproc.linalg.ParallelBlocks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A fitted zero-mean Gaussian process regression model with homoscedastic
 * Gaussian observation noise.
 *
 * <h2>Construction</h2>
 *
 * <p>Fitting binds training inputs {@code X}, observations {@code y}, a noise
 * variance {@code σ²} and a kernel, then computes everything that queries need:
 *
 * <pre>{@code
 *   K      = k(X, X)                         KernelMatrixBuilder.buildSymmetric
 *   R Rᵗ   = K + σ²I                         CholeskyDecomposition      O(n³)
 *   w      = R⁻¹ y                           forward substitution       O(n²)
 *   α      = R⁻ᵗ w = (K + σ²I)⁻¹ y           back substitution          O(n²)
 *   fit    = yᵗ (K + σ²I)⁻¹ y = |w|²
 *   logdet = 2 Σ log Rᵢᵢ
 * }</pre>
 *
 * <p>Construction either completes or throws; there is no partially fitted
 * instance. Instances are immutable, so "updating" a parameter returns a new
 * snapshot ({@link #withNoiseVariance}, {@link #withKernel}) and any number
 * of threads may query one snapshot concurrently.
 *
 * <h2>Queries</h2>
 *
 * <pre>{@code
 *   logLikelihood()   -½ (n log 2π + logdet + fit)                 O(1)
 *   predict(X*)       K* = k(X, X*),  K** = k(X*, X*)
 *                     V  = R⁻¹ K*                                   O(n²m)
 *                     μ  = Vᵗ w          (= K*ᵗ (K+σ²I)⁻¹ y)
 *                     C  = K** − Vᵗ V    (= K** − K*ᵗ (K+σ²I)⁻¹ K*)
 * }</pre>
 *
 * <p>No dense inverse of {@code K + σ²I} is ever formed.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * GaussianProcessModel model = GaussianProcessModel.fit(
 *     InputSet.ofScalars(0, 1, 2), new double[]{0, 1, 0},
 *     0.01, new ExponentiatedQuadraticKernel(1.0, 1.0));
 *
 * double logLik = model.logLikelihood();
 * PosteriorPrediction p = model.predict(InputSet.linspace(-1, 3, 50));
 * }</pre>
 *
 * @see GaussianProcessRegressor
 */
public final class GaussianProcessModel {

    private static final Logger logger = LogManager.getLogger(GaussianProcessModel.class);

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    /** Label given to the training covariance in factorization errors. */
    public static final String TRAINING_COVARIANCE = "K + noise_variance*I";

    private final InputSet inputs;
    private final double[] observations;
    private final double noiseVariance;
    private final KernelFunction kernel;
    private final JitterPolicy jitterPolicy;
    private final KernelMatrixBuilder matrixBuilder;

    private final CholeskyDecomposition cholesky;
    private final double[] whitened;
    private final double[] weights;
    private final double dataFit;
    private final double logLikelihood;

    private GaussianProcessModel(Builder builder) {
        this.inputs = Objects.requireNonNull(builder.inputs, "inputs cannot be null");
        Objects.requireNonNull(builder.observations, "observations cannot be null");
        this.kernel = Objects.requireNonNull(builder.kernel, "kernel cannot be null");
        this.jitterPolicy = Objects.requireNonNull(builder.jitterPolicy, "jitterPolicy cannot be null");
        this.matrixBuilder = Objects.requireNonNull(builder.matrixBuilder, "matrixBuilder cannot be null");
        this.noiseVariance = validateNoiseVariance(builder.noiseVariance);

        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("training inputs cannot be empty");
        }
        if (builder.observations.length != inputs.size()) {
            throw new DimensionMismatchException("observation count", inputs.size(), builder.observations.length);
        }
        this.observations = builder.observations.clone();
        for (int i = 0; i < observations.length; i++) {
            if (!Double.isFinite(observations[i])) {
                throw new IllegalArgumentException("observation " + i + " is not finite: " + observations[i]);
            }
        }

        int n = inputs.size();
        double[][] covariance = matrixBuilder.buildSymmetric(inputs, kernel);
        for (int i = 0; i < n; i++) {
            covariance[i][i] += noiseVariance;
        }
        try {
            this.cholesky = CholeskyDecomposition.factor(covariance, TRAINING_COVARIANCE, jitterPolicy);
        } catch (NotPositiveDefiniteException e) {
            logger.warn("Factorization of {} failed for n={} with {} and noise variance {}: {}",
                TRAINING_COVARIANCE, n, kernel, noiseVariance, e.getMessage());
            throw e;
        }

        this.whitened = cholesky.solveLower(observations);
        this.weights = cholesky.solveUpper(whitened);
        this.dataFit = Matrices.squaredNorm(whitened);
        this.logLikelihood = -0.5 * (n * LOG_2PI + cholesky.logDeterminant() + dataFit);

        logger.debug("Fitted GP: n={}, dimensions={}, kernel={}, noise variance={}, log likelihood={}",
            n, inputs.dimensions(), kernel.getKernelType(), noiseVariance, logLikelihood);
    }

    private static double validateNoiseVariance(double noiseVariance) {
        if (!Double.isFinite(noiseVariance)) {
            throw new ConfigurationException(GaussianProcessConfig.NOISE_VARIANCE, noiseVariance, "must be finite");
        }
        if (noiseVariance < 0.0) {
            throw new ConfigurationException(GaussianProcessConfig.NOISE_VARIANCE, noiseVariance, "must be >= 0");
        }
        return noiseVariance;
    }

    /**
     * Fits a model with default settings (no jitter, default parallelism).
     *
     * @param inputs training inputs
     * @param observations one observation per input
     * @param noiseVariance observation noise variance σ², non-negative
     * @param kernel prior covariance function
     * @return the fitted model
     * @throws ConfigurationException if σ² is negative or not finite
     * @throws DimensionMismatchException if the observation count differs from the input count
     * @throws NotPositiveDefiniteException if {@code K + σ²I} cannot be factorized
     */
    public static GaussianProcessModel fit(InputSet inputs, double[] observations,
                                           double noiseVariance, KernelFunction kernel) {
        return builder()
            .inputs(inputs)
            .observations(observations)
            .noiseVariance(noiseVariance)
            .kernel(kernel)
            .build();
    }

    /**
     * Fits a model that retries factorization with diagonal jitter when {@code K + σ²I}
     * is not positive definite.
     *
     * @param jitterPolicy the opt-in stabilization; {@link JitterPolicy#none()} fails fast
     */
    public static GaussianProcessModel fit(InputSet inputs, double[] observations,
                                           double noiseVariance, KernelFunction kernel, JitterPolicy jitterPolicy) {
        return builder()
            .inputs(inputs)
            .observations(observations)
            .noiseVariance(noiseVariance)
            .kernel(kernel)
            .jitterPolicy(jitterPolicy)
            .build();
    }

    /**
     * Fits a model from raw arrays, {@code inputs[index][dimension]}.
     */
    public static GaussianProcessModel fit(double[][] inputs, double[] observations,
                                           double noiseVariance, KernelFunction kernel) {
        return fit(InputSet.of(inputs), observations, noiseVariance, kernel);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder preset with this model's training data and settings
     */
    public Builder toBuilder() {
        return new Builder()
            .inputs(inputs)
            .observations(observations)
            .noiseVariance(noiseVariance)
            .kernel(kernel)
            .jitterPolicy(jitterPolicy)
            .matrixBuilder(matrixBuilder);
    }

    /**
     * Refits with a different noise variance; this model is unchanged.
     */
    public GaussianProcessModel withNoiseVariance(double noiseVariance) {
        return toBuilder().noiseVariance(noiseVariance).build();
    }

    /**
     * Refits with a different kernel or kernel parameters; this model is unchanged.
     */
    public GaussianProcessModel withKernel(KernelFunction kernel) {
        return toBuilder().kernel(kernel).build();
    }

    /**
     * Refits with a different jitter policy; this model is unchanged.
     */
    public GaussianProcessModel withJitterPolicy(JitterPolicy jitterPolicy) {
        return toBuilder().jitterPolicy(jitterPolicy).build();
    }

    /**
     * Refits with the noise variance, kernel and jitter policy of a configuration.
     */
    public GaussianProcessModel withConfig(GaussianProcessConfig config) {
        return toBuilder().config(config).build();
    }

    /**
     * @return {@code log p(y | X)} under the prior, {@code -½ (n log 2π + log|K+σ²I| + yᵗ(K+σ²I)⁻¹y)}
     */
    public double logLikelihood() {
        return logLikelihood;
    }

    /**
     * @return the data-fit term {@code yᵗ (K+σ²I)⁻¹ y}
     */
    public double dataFit() {
        return dataFit;
    }

    /**
     * @return {@code log |K + σ²I|}
     */
    public double logDeterminant() {
        return cholesky.logDeterminant();
    }

    /**
     * @return {@code α = (K + σ²I)⁻¹ y}, the weights of the posterior mean on the training kernels
     */
    public double[] weights() {
        return weights.clone();
    }

    /**
     * @return {@code R⁻¹ y}, the observations whitened by the training factor
     */
    public double[] whitenedObservations() {
        return whitened.clone();
    }

    /**
     * Computes the posterior predictive distribution at the test inputs.
     *
     * @param testInputs inputs to predict at; may be empty
     * @return mean and covariance; empty for an empty test set
     * @throws DimensionMismatchException if the test dimensionality differs from training
     */
    public PosteriorPrediction predict(InputSet testInputs) {
        Objects.requireNonNull(testInputs, "testInputs cannot be null");
        inputs.requireCompatible(testInputs);
        if (testInputs.isEmpty()) {
            return PosteriorPrediction.empty();
        }
        int n = inputs.size();
        int m = testInputs.size();
        ParallelBlocks blocks = matrixBuilder.blocks();

        double[][] crossCovariance = matrixBuilder.build(inputs, testInputs, kernel);
        double[][] v = cholesky.solveLower(crossCovariance, blocks);

        double[] mean = Matrices.transposeMultiply(v, whitened);

        // K** is overwritten in place with C; row a owns cells (a, b) and (b, a) for b >= a
        double[][] vt = Matrices.transpose(v);
        double[][] covariance = matrixBuilder.buildSymmetric(testInputs, kernel);
        blocks.run(m, (long) m * n / 2, (from, to) -> {
            for (int a = from; a < to; a++) {
                double[] va = vt[a];
                for (int b = a; b < m; b++) {
                    double value = covariance[a][b] - Matrices.dot(va, vt[b]);
                    covariance[a][b] = value;
                    covariance[b][a] = value;
                }
            }
        });

        return PosteriorPrediction.wrap(mean, covariance);
    }

    /**
     * Posterior predictive distribution at raw test inputs, {@code testInputs[index][dimension]}.
     */
    public PosteriorPrediction predict(double[][] testInputs) {
        return predict(InputSet.of(testInputs));
    }

    /**
     * Computes only the posterior mean, skipping the test-test covariance.
     *
     * @return {@code K*ᵗ α}, one value per test input
     */
    public double[] predictMean(InputSet testInputs) {
        Objects.requireNonNull(testInputs, "testInputs cannot be null");
        inputs.requireCompatible(testInputs);
        if (testInputs.isEmpty()) {
            return new double[0];
        }
        double[][] crossCovariance = matrixBuilder.build(inputs, testInputs, kernel);
        return Matrices.transposeMultiply(crossCovariance, weights);
    }

    public InputSet inputs() {
        return inputs;
    }

    public double[] observations() {
        return observations.clone();
    }

    public int trainingSize() {
        return inputs.size();
    }

    public int dimensions() {
        return inputs.dimensions();
    }

    public double noiseVariance() {
        return noiseVariance;
    }

    public KernelFunction kernel() {
        return kernel;
    }

    public JitterPolicy jitterPolicy() {
        return jitterPolicy;
    }

    /**
     * @return the diagonal jitter added during factorization, 0 when none was needed
     */
    public double appliedJitter() {
        return cholesky.appliedJitter();
    }

    /**
     * @return the factorization of {@code K + σ²I}
     */
    public CholeskyDecomposition cholesky() {
        return cholesky;
    }

    @Override
    public String toString() {
        return "GaussianProcessModel[n=" + inputs.size() + ", dimensions=" + inputs.dimensions()
            + ", kernel=" + kernel + ", noiseVariance=" + noiseVariance
            + ", logLikelihood=" + logLikelihood + "]";
    }

    /**
     * Builder for {@link GaussianProcessModel}. {@link #build()} performs the fit.
     */
    public static final class Builder {
        private InputSet inputs;
        private double[] observations;
        private double noiseVariance = 0.0;
        private KernelFunction kernel;
        private JitterPolicy jitterPolicy = JitterPolicy.none();
        private KernelMatrixBuilder matrixBuilder = KernelMatrixBuilder.defaultBuilder();

        private Builder() {
        }

        public Builder inputs(InputSet inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder inputs(double[][] inputs) {
            this.inputs = InputSet.of(inputs);
            return this;
        }

        public Builder observations(double[] observations) {
            this.observations = observations;
            return this;
        }

        public Builder noiseVariance(double noiseVariance) {
            this.noiseVariance = noiseVariance;
            return this;
        }

        public Builder kernel(KernelFunction kernel) {
            this.kernel = kernel;
            return this;
        }

        /**
         * Opts into diagonal jitter when {@code K + σ²I} is not positive definite.
         */
        public Builder jitterPolicy(JitterPolicy jitterPolicy) {
            this.jitterPolicy = jitterPolicy;
            return this;
        }

        public Builder matrixBuilder(KernelMatrixBuilder matrixBuilder) {
            this.matrixBuilder = matrixBuilder;
            return this;
        }

        /**
         * Applies noise variance, kernel and jitter policy from a configuration.
         */
        public Builder config(GaussianProcessConfig config) {
            Objects.requireNonNull(config, "config cannot be null");
            this.noiseVariance = config.getNoiseVariance();
            this.kernel = config.getKernel();
            this.jitterPolicy = config.getJitterPolicy();
            return this;
        }

        /**
         * Fits the model.
         *
         * @throws ConfigurationException if σ² is invalid
         * @throws DimensionMismatchException if the data shapes disagree
         * @throws NotPositiveDefiniteException if factorization fails
         */
        public GaussianProcessModel build() {
            return new GaussianProcessModel(this);
        }
    }
}
