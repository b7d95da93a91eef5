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
import io.nosqlbench.gproc.InputSet;
import io.nosqlbench.gproc.ModelNotReadyException;
import io.nosqlbench.gproc.NotPositiveDefiniteException;
import io.nosqlbench.gproc.config.GaussianProcessConfig;
import io.nosqlbench.gproc.kernel.ExponentiatedQuadraticKernel;
import io.nosqlbench.gproc.kernel.KernelFunction;
import io.nosqlbench.gproc.kernel.Matern32Kernel;
import io.nosqlbench.gproc.linalg.JitterPolicy;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class GaussianProcessRegressorTest {

    private static final KernelFunction SE = new ExponentiatedQuadraticKernel(1.0, 1.0);
    private static final InputSet X = InputSet.ofScalars(0.0, 1.0, 2.0);
    private static final double[] Y = {0.0, 1.0, 0.0};

    @Test
    void testUninitializedRefusesQueries() {
        GaussianProcessRegressor gp = new GaussianProcessRegressor();
        assertEquals(ModelState.UNINITIALIZED, gp.state());
        ModelNotReadyException e = assertThrows(ModelNotReadyException.class, gp::logLikelihood);
        assertEquals(ModelState.UNINITIALIZED, e.getState());
        assertThrows(ModelNotReadyException.class, () -> gp.predict(X));
        assertThrows(ModelNotReadyException.class, () -> gp.updateNoiseVariance(0.1));
        assertThrows(ModelNotReadyException.class, gp::rollback);
        assertTrue(gp.lastValidSnapshot().isEmpty());
    }

    @Test
    void testFitThenQuery() {
        GaussianProcessRegressor gp = new GaussianProcessRegressor();
        GaussianProcessModel model = gp.fit(X, Y, 0.01, SE);
        assertTrue(gp.isReady());
        assertSame(model, gp.snapshot());
        assertEquals(model.logLikelihood(), gp.logLikelihood());
        assertArrayEquals(new double[]{0.0, 1.0, 0.0}, gp.predictMean(X), 0.05);
        assertEquals(3, gp.predict(X).size());
    }

    @Test
    void testUpdatesRefitFromLastSnapshot() {
        GaussianProcessRegressor gp = new GaussianProcessRegressor();
        GaussianProcessModel first = gp.fit(X, Y, 0.01, SE);

        GaussianProcessModel noisier = gp.updateNoiseVariance(0.2);
        assertEquals(0.2, noisier.noiseVariance());
        assertNotEquals(first.logLikelihood(), gp.logLikelihood());

        GaussianProcessModel rekerneled = gp.updateKernel(new Matern32Kernel(1.0, 0.5));
        assertEquals(0.2, rekerneled.noiseVariance());
        assertEquals("matern32", rekerneled.kernel().getKernelType());
        assertEquals(0.01, first.noiseVariance(), "earlier snapshots are immutable");
    }

    @Test
    void testFailedUpdateEntersFailedStateAndRollsBack() {
        GaussianProcessRegressor gp = new GaussianProcessRegressor();
        GaussianProcessModel good = gp.fit(X, Y, 0.01, SE);

        assertThrows(ConfigurationException.class, () -> gp.updateNoiseVariance(-1.0));
        assertEquals(ModelState.FAILED, gp.state());
        ModelNotReadyException e = assertThrows(ModelNotReadyException.class, gp::logLikelihood);
        assertEquals(ModelState.FAILED, e.getState());
        assertInstanceOf(ConfigurationException.class, e.getCause());
        assertSame(good, gp.lastValidSnapshot().orElseThrow());
        assertTrue(gp.lastFailure().isPresent());

        assertSame(good, gp.rollback());
        assertEquals(ModelState.READY, gp.state());
        assertTrue(gp.lastFailure().isEmpty());
        assertEquals(good.logLikelihood(), gp.logLikelihood());
    }

    @Test
    void testUpdateAfterFailureStartsFromLastValid() {
        GaussianProcessRegressor gp = new GaussianProcessRegressor();
        gp.fit(X, Y, 0.01, SE);
        assertThrows(ConfigurationException.class, () -> gp.updateNoiseVariance(Double.NaN));
        GaussianProcessModel recovered = gp.updateNoiseVariance(0.05);
        assertTrue(gp.isReady());
        assertEquals(X, recovered.inputs());
    }

    @Test
    void testFailedFirstFitCannotRollBack() {
        GaussianProcessRegressor gp = new GaussianProcessRegressor();
        InputSet duplicates = InputSet.ofScalars(1.0, 1.0);
        assertThrows(NotPositiveDefiniteException.class, () -> gp.fit(duplicates, new double[]{0.0, 1.0}, 0.0, SE));
        assertEquals(ModelState.FAILED, gp.state());
        assertThrows(ModelNotReadyException.class, gp::rollback);

        gp.fit(duplicates, new double[]{0.0, 1.0}, 0.0, SE, JitterPolicy.escalating());
        assertTrue(gp.isReady());
    }

    @Test
    void testConfigDrivenFitAndUpdate() {
        GaussianProcessRegressor gp = new GaussianProcessRegressor();
        gp.fit(X, Y, GaussianProcessConfig.of(0.01, SE));
        GaussianProcessModel updated = gp.update(GaussianProcessConfig.of(0.1, new Matern32Kernel(2.0, 1.0),
            JitterPolicy.escalating()));
        assertEquals(0.1, updated.noiseVariance());
        assertEquals(JitterPolicy.escalating(), updated.jitterPolicy());
    }

    @Test
    void testReadersSeeCompleteSnapshotsDuringUpdates() throws Exception {
        GaussianProcessRegressor gp = new GaussianProcessRegressor();
        gp.fit(InputSet.linspace(0.0, 10.0, 80), sine(80), 0.01, SE);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        GaussianProcessModel snapshot = gp.snapshot();
                        assertEquals(snapshot.logLikelihood(), snapshot.withNoiseVariance(snapshot.noiseVariance()).logLikelihood(), 1e-9);
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 20; i++) {
                    gp.updateNoiseVariance(0.01 + i * 0.001);
                }
                return null;
            }));
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertTrue(gp.isReady());
        assertEquals(0.01 + 19 * 0.001, gp.snapshot().noiseVariance(), 1e-15);
    }

    private static double[] sine(int n) {
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = Math.sin(i * 10.0 / (n - 1));
        }
        return y;
    }
}
