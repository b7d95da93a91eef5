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

import io.nosqlbench.gproc.InputSet;
import io.nosqlbench.gproc.kernel.KernelFunction;
import io.nosqlbench.gproc.kernel.KernelMatrixBuilder;
import io.nosqlbench.gproc.linalg.JitterPolicy;
import io.nosqlbench.gproc.model.GaussianProcessModel;
import io.nosqlbench.gproc.model.PosteriorPrediction;

import java.util.Objects;

/// Factory methods binding samplers to Gaussian process distributions.
///
/// ```java
/// MultivariateNormalSampler prior = GaussianProcessSamplers.prior(kernel, InputSet.linspace(0, 1, 50));
/// double[] path = prior.sample(new Random(42));
///
/// MultivariateNormalSampler posterior = GaussianProcessSamplers.posterior(model, testInputs);
/// ```
public final class GaussianProcessSamplers {

    private GaussianProcessSamplers() {
    }

    /// Sampler over function values at `inputs` under the zero-mean prior `N(0, K(X, X))`.
    public static MultivariateNormalSampler prior(KernelFunction kernel, InputSet inputs) {
        return prior(kernel, inputs, KernelMatrixBuilder.defaultBuilder(), JitterPolicy.escalating());
    }

    public static MultivariateNormalSampler prior(KernelFunction kernel, InputSet inputs,
                                                  KernelMatrixBuilder builder, JitterPolicy jitter) {
        Objects.requireNonNull(kernel, "kernel cannot be null");
        Objects.requireNonNull(inputs, "inputs cannot be null");
        Objects.requireNonNull(builder, "builder cannot be null");
        double[][] covariance = builder.buildSymmetric(inputs, kernel);
        return new MultivariateNormalSampler(new double[inputs.size()], covariance, jitter);
    }

    /// Sampler over a computed posterior.
    public static MultivariateNormalSampler posterior(PosteriorPrediction prediction) {
        return posterior(prediction, JitterPolicy.escalating());
    }

    public static MultivariateNormalSampler posterior(PosteriorPrediction prediction, JitterPolicy jitter) {
        Objects.requireNonNull(prediction, "prediction cannot be null");
        return new MultivariateNormalSampler(prediction.mean(), prediction.covariance(), jitter);
    }

    /// Sampler over the posterior of `model` at `testInputs`.
    public static MultivariateNormalSampler posterior(GaussianProcessModel model, InputSet testInputs) {
        Objects.requireNonNull(model, "model cannot be null");
        return posterior(model.predict(testInputs));
    }
}
