package io.nosqlbench.gproc.kernel;

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
import io.nosqlbench.gproc.InputSet;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.concurrent.ForkJoinPool;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class KernelMatrixBuilderTest {

    private static InputSet randomInputs(Random random, int n, int d) {
        double[][] points = new double[n][d];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < d; j++) {
                points[i][j] = random.nextGaussian();
            }
        }
        return InputSet.of(points);
    }

    private static final ForkJoinPool POOL = new ForkJoinPool(4);

    @AfterAll
    static void shutdownPool() {
        POOL.shutdown();
    }

    private static KernelMatrixBuilder eagerParallel() {
        return KernelMatrixBuilder.builder().pool(POOL).threshold(0).blockSize(2).build();
    }

    @Test
    void testSymmetricMatrixIsExactlySymmetric() {
        InputSet inputs = randomInputs(new Random(42), 37, 3);
        KernelFunction kernel = new SumKernel(new Matern52Kernel(1.0, 0.8), new LinearKernel(0.3));
        double[][] k = eagerParallel().buildSymmetric(inputs, kernel);
        for (int i = 0; i < k.length; i++) {
            for (int j = 0; j < k.length; j++) {
                assertEquals(k[i][j], k[j][i], 0.0, "cell " + i + "," + j);
            }
        }
    }

    @Test
    void testParallelMatchesSerial() {
        Random random = new Random(7);
        InputSet a = randomInputs(random, 41, 2);
        InputSet b = randomInputs(random, 13, 2);
        KernelFunction kernel = new ExponentiatedQuadraticKernel(1.3, 0.6);

        double[][] serial = KernelMatrixBuilder.serial().build(a, b, kernel);
        double[][] parallel = eagerParallel().build(a, b, kernel);
        assertEquals(41, parallel.length);
        assertEquals(13, parallel[0].length);
        for (int i = 0; i < serial.length; i++) {
            assertArrayEquals(serial[i], parallel[i], 0.0);
        }

        double[][] serialSym = KernelMatrixBuilder.serial().buildSymmetric(a, kernel);
        double[][] parallelSym = eagerParallel().buildSymmetric(a, kernel);
        for (int i = 0; i < serialSym.length; i++) {
            assertArrayEquals(serialSym[i], parallelSym[i], 0.0);
        }
    }

    @Test
    void testCellsMatchKernel() {
        InputSet a = InputSet.ofScalars(0.0, 1.0);
        InputSet b = InputSet.ofScalars(0.5, 2.0, 3.0);
        KernelFunction kernel = new ExponentiatedQuadraticKernel(1.0, 1.0);
        double[][] k = KernelMatrixBuilder.defaultBuilder().build(a, b, kernel);
        assertEquals(kernel.covariance(new double[]{1.0}, new double[]{3.0}), k[1][2], 0.0);
        assertArrayEquals(new double[]{1.0, 1.0}, KernelMatrixBuilder.serial().diagonal(a, kernel), 0.0);
    }

    @Test
    void testEmptyInputs() {
        KernelFunction kernel = new LinearKernel(1.0);
        assertEquals(0, KernelMatrixBuilder.serial().buildSymmetric(InputSet.empty(), kernel).length);
        double[][] k = KernelMatrixBuilder.serial().build(InputSet.ofScalars(1.0, 2.0), InputSet.empty(), kernel);
        assertEquals(2, k.length);
        assertEquals(0, k[0].length);
    }

    @Test
    void testDimensionMismatch() {
        InputSet a = InputSet.ofScalars(1.0, 2.0);
        InputSet b = InputSet.of(new double[][]{{1.0, 2.0}});
        assertThrows(DimensionMismatchException.class,
            () -> KernelMatrixBuilder.serial().build(a, b, new LinearKernel(1.0)));
    }
}
