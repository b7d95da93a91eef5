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
import io.nosqlbench.gproc.kernel.ExponentiatedQuadraticKernel;
import io.nosqlbench.gproc.kernel.KernelFunction;
import io.nosqlbench.gproc.model.GaussianProcessModel;
import io.nosqlbench.gproc.model.PosteriorPrediction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class GaussianProcessSamplersTest {

    private static final KernelFunction SE = new ExponentiatedQuadraticKernel(1.0, 1.0);

    @Test
    void testPriorSamplesAreSmoothAndCentered() {
        InputSet grid = InputSet.linspace(0.0, 5.0, 40);
        MultivariateNormalSampler prior = GaussianProcessSamplers.prior(SE, grid);
        assertEquals(40, prior.dimensions());
        assertArrayEquals(new double[40], prior.mean(), 0.0);

        Random random = new Random(12345);
        int count = 4000;
        double sumSquares = 0.0;
        double neighbourProduct = 0.0;
        for (int s = 0; s < count; s++) {
            double[] path = prior.sample(random);
            sumSquares += path[20] * path[20];
            neighbourProduct += path[20] * path[21];
        }
        assertEquals(1.0, sumSquares / count, 0.1);
        double spacing = 5.0 / 39;
        assertEquals(Math.exp(-0.5 * spacing * spacing), neighbourProduct / count, 0.1);
    }

    @Test
    void testPosteriorSamplesPinnedAtData() {
        InputSet x = InputSet.ofScalars(0.0, 1.0, 2.0);
        double[] y = {0.0, 1.0, 0.0};
        GaussianProcessModel model = GaussianProcessModel.fit(x, y, 1e-6, SE);
        InputSet test = InputSet.ofScalars(0.0, 1.0, 2.0, 1.5);

        MultivariateNormalSampler posterior = GaussianProcessSamplers.posterior(model, test);
        PosteriorPrediction prediction = model.predict(test);
        assertArrayEquals(prediction.mean(), posterior.mean(), 0.0);

        Random random = new Random(99);
        for (int s = 0; s < 100; s++) {
            double[] draw = posterior.sample(random);
            assertEquals(0.0, draw[0], 0.02);
            assertEquals(1.0, draw[1], 0.02);
            assertEquals(0.0, draw[2], 0.02);
        }
    }

    @Test
    void testPosteriorFromPrediction() {
        PosteriorPrediction prediction = new PosteriorPrediction(new double[]{3.0}, new double[][]{{0.25}});
        MultivariateNormalSampler sampler = GaussianProcessSamplers.posterior(prediction);
        assertEquals(3.5, sampler.sample(new double[]{1.0})[0], 1e-12);
    }
}
