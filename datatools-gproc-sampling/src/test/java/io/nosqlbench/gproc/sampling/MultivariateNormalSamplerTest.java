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
import io.nosqlbench.gproc.NotPositiveDefiniteException;
import io.nosqlbench.gproc.linalg.JitterPolicy;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MultivariateNormalSamplerTest {

    private static final double[] MEAN = {1.0, -2.0, 0.5};
    private static final double[][] COVARIANCE = {
        {2.0, 0.6, 0.2},
        {0.6, 1.0, -0.3},
        {0.2, -0.3, 0.5}
    };

    @Test
    void testEmpiricalMomentsMatch() {
        MultivariateNormalSampler sampler = new MultivariateNormalSampler(MEAN, COVARIANCE);
        assertEquals(3, sampler.dimensions());
        assertEquals(0.0, sampler.appliedJitter());

        int count = 200_000;
        double[][] draws = sampler.samples(new Random(12345), count);
        assertEquals(count, draws.length);

        double[] mean = new double[3];
        for (double[] draw : draws) {
            for (int i = 0; i < 3; i++) {
                mean[i] += draw[i] / count;
            }
        }
        assertArrayEquals(MEAN, mean, 0.02);

        double[][] cov = new double[3][3];
        for (double[] draw : draws) {
            for (int i = 0; i < 3; i++) {
                for (int j = 0; j < 3; j++) {
                    cov[i][j] += (draw[i] - mean[i]) * (draw[j] - mean[j]) / (count - 1);
                }
            }
        }
        for (int i = 0; i < 3; i++) {
            assertArrayEquals(COVARIANCE[i], cov[i], 0.03, "row " + i);
        }
    }

    @Test
    void testDeterministicMapping() {
        MultivariateNormalSampler sampler = new MultivariateNormalSampler(MEAN, COVARIANCE);
        assertArrayEquals(MEAN, sampler.sample(new double[3]), 0.0);
        // first coordinate only depends on z0: μ0 + sqrt(C00) z0
        assertEquals(1.0 + Math.sqrt(2.0), sampler.sample(new double[]{1.0, 0.0, 0.0})[0], 1e-12);
        assertArrayEquals(sampler.sample(new Random(7)), sampler.sample(new Random(7)), 0.0);
    }

    @Test
    void testDegenerateCovarianceUsesJitter() {
        double[][] rankOne = {{1.0, 1.0}, {1.0, 1.0}};
        MultivariateNormalSampler sampler = new MultivariateNormalSampler(new double[2], rankOne);
        assertTrue(sampler.appliedJitter() > 0.0);
        double[] draw = sampler.sample(new Random(3));
        assertEquals(draw[0], draw[1], 1e-3);

        assertThrows(NotPositiveDefiniteException.class,
            () -> new MultivariateNormalSampler(new double[2], rankOne, JitterPolicy.none()));
    }

    @Test
    void testShapeChecks() {
        assertThrows(DimensionMismatchException.class,
            () -> new MultivariateNormalSampler(new double[2], COVARIANCE));
        MultivariateNormalSampler sampler = new MultivariateNormalSampler(MEAN, COVARIANCE);
        assertThrows(DimensionMismatchException.class, () -> sampler.sample(new double[2]));
        assertThrows(IllegalArgumentException.class, () -> sampler.samples(new Random(1), -1));
        assertThrows(IllegalArgumentException.class,
            () -> new MultivariateNormalSampler(new double[1], new double[][]{{1.0, 2.0}}));
    }

    @Test
    void testEmptyDistribution() {
        MultivariateNormalSampler sampler = new MultivariateNormalSampler(new double[0], new double[0][0]);
        assertEquals(0, sampler.sample(new Random(1)).length);
    }

    @Test
    void testMeanIsCopied() {
        double[] mean = {1.0};
        MultivariateNormalSampler sampler = new MultivariateNormalSampler(mean, new double[][]{{1.0}});
        mean[0] = 5.0;
        sampler.mean()[0] = 9.0;
        assertArrayEquals(new double[]{1.0}, sampler.mean(), 0.0);
    }
}
