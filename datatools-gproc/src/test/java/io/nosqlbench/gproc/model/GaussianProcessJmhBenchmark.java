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

import io.nosqlbench.gproc.InputSet;
import io.nosqlbench.gproc.kernel.KernelMatrixBuilder;
import io.nosqlbench.gproc.kernel.Matern52Kernel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/// JMH benchmarks for fitting and prediction, serial against parallel matrix builds.
///
/// ## Running the Benchmarks
///
/// ```bash
/// mvn test -pl datatools-gproc -Pperformance -Dtest=GaussianProcessJmhBenchmark
/// ```
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Thread)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 3, time = 1)
@Fork(1)
@Tag("performance")
public class GaussianProcessJmhBenchmark {

    @Param({"200", "800"})
    private int trainingSize;

    @Param({"true", "false"})
    private boolean parallel;

    private InputSet inputs;
    private double[] observations;
    private InputSet testInputs;
    private GaussianProcessModel model;
    private KernelMatrixBuilder matrixBuilder;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(42);
        double[][] points = new double[trainingSize][3];
        observations = new double[trainingSize];
        for (int i = 0; i < trainingSize; i++) {
            for (int d = 0; d < 3; d++) {
                points[i][d] = random.nextDouble() * 10.0;
            }
            observations[i] = Math.sin(points[i][0]) + Math.cos(points[i][1]) + 0.1 * random.nextGaussian();
        }
        inputs = InputSet.of(points);
        double[][] test = new double[100][3];
        for (double[] row : test) {
            for (int d = 0; d < 3; d++) {
                row[d] = random.nextDouble() * 10.0;
            }
        }
        testInputs = InputSet.of(test);
        matrixBuilder = parallel ? KernelMatrixBuilder.defaultBuilder() : KernelMatrixBuilder.serial();
        model = fit();
    }

    private GaussianProcessModel fit() {
        return GaussianProcessModel.builder()
            .inputs(inputs)
            .observations(observations)
            .noiseVariance(0.01)
            .kernel(new Matern52Kernel(1.0, 2.0))
            .matrixBuilder(matrixBuilder)
            .build();
    }

    @Benchmark
    public void fitModel(Blackhole bh) {
        bh.consume(fit().logLikelihood());
    }

    @Benchmark
    public void predictPosterior(Blackhole bh) {
        bh.consume(model.predict(testInputs));
    }

    @Benchmark
    public void buildTrainingCovariance(Blackhole bh) {
        bh.consume(matrixBuilder.buildSymmetric(inputs, model.kernel()));
    }

    @Test
    @Tag("performance")
    public void runBenchmark() throws RunnerException {
        Options options = new OptionsBuilder()
            .include(GaussianProcessJmhBenchmark.class.getSimpleName())
            .build();
        new Runner(options).run();
    }
}
