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

import io.nosqlbench.gproc.InputSet;
import io.nosqlbench.gproc.linalg.ParallelBlocks;

import java.util.Objects;
import java.util.concurrent.ForkJoinPool;

/**
 * Builds dense covariance matrices by applying a {@link KernelFunction}
 * pairwise across input sets.
 *
 * <h2>Shapes</h2>
 *
 * <pre>{@code
 *   build(A, B, k)          p×q    entry (i, j) = k(A[i], B[j])
 *   buildSymmetric(A, k)    p×p    upper triangle computed, mirrored below
 *   diagonal(A, k)          p      entry i = k(A[i], A[i])
 * }</pre>
 *
 * <p>{@link #buildSymmetric} evaluates each unordered pair once and writes
 * the same value to both cells, so its result is exactly symmetric whatever
 * the kernel's rounding behaviour.
 *
 * <h2>Parallelism</h2>
 *
 * <p>Rows are independent, so matrices are filled in row blocks through
 * {@link ParallelBlocks}. Small matrices are built on the calling thread.
 * Serial and parallel builds produce identical results because each entry
 * is computed by the same single kernel call either way.
 *
 * <pre>{@code
 * KernelMatrixBuilder builder = KernelMatrixBuilder.builder()
 *     .pool(new ForkJoinPool(8))
 *     .threshold(10_000)
 *     .build();
 * double[][] k = builder.buildSymmetric(inputs, kernel);
 * }</pre>
 */
public final class KernelMatrixBuilder {

    private static final KernelMatrixBuilder DEFAULT = new KernelMatrixBuilder(ParallelBlocks.commonPool());
    private static final KernelMatrixBuilder SERIAL = new KernelMatrixBuilder(ParallelBlocks.serial());

    private final ParallelBlocks blocks;

    public KernelMatrixBuilder(ParallelBlocks blocks) {
        this.blocks = Objects.requireNonNull(blocks, "blocks cannot be null");
    }

    /**
     * @return a builder running on the common pool with default thresholds
     */
    public static KernelMatrixBuilder defaultBuilder() {
        return DEFAULT;
    }

    /**
     * @return a builder that never leaves the calling thread
     */
    public static KernelMatrixBuilder serial() {
        return SERIAL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the parallel execution settings, shared with solves that follow a build
     */
    public ParallelBlocks blocks() {
        return blocks;
    }

    /**
     * Builds the cross-covariance matrix between two input sets.
     *
     * @return a {@code a.size() × b.size()} matrix
     * @throws io.nosqlbench.gproc.DimensionMismatchException if the sets differ in dimensionality
     */
    public double[][] build(InputSet a, InputSet b, KernelFunction kernel) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(b, "b cannot be null");
        Objects.requireNonNull(kernel, "kernel cannot be null");
        a.requireCompatible(b);

        int p = a.size();
        int q = b.size();
        double[][] k = new double[p][q];
        blocks.run(p, (long) q * Math.max(1, a.dimensions()), (from, to) -> {
            for (int i = from; i < to; i++) {
                double[] ai = a.rawRow(i);
                double[] row = k[i];
                for (int j = 0; j < q; j++) {
                    row[j] = kernel.covariance(ai, b.rawRow(j));
                }
            }
        });
        return k;
    }

    /**
     * Builds the covariance matrix of an input set with itself.
     *
     * @return a {@code a.size() × a.size()} exactly symmetric matrix
     */
    public double[][] buildSymmetric(InputSet a, KernelFunction kernel) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(kernel, "kernel cannot be null");

        int p = a.size();
        double[][] k = new double[p][p];
        // row i owns cells (i, j) and (j, i) for j >= i
        blocks.run(p, (long) p * Math.max(1, a.dimensions()) / 2, (from, to) -> {
            for (int i = from; i < to; i++) {
                double[] ai = a.rawRow(i);
                for (int j = i; j < p; j++) {
                    double value = kernel.covariance(ai, a.rawRow(j));
                    k[i][j] = value;
                    k[j][i] = value;
                }
            }
        });
        return k;
    }

    /**
     * Computes the prior variance {@code k(x, x)} for each input.
     */
    public double[] diagonal(InputSet a, KernelFunction kernel) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(kernel, "kernel cannot be null");
        double[] diag = new double[a.size()];
        for (int i = 0; i < diag.length; i++) {
            diag[i] = kernel.variance(a.rawRow(i));
        }
        return diag;
    }

    /**
     * Builder for a {@link KernelMatrixBuilder} with custom parallel settings.
     */
    public static final class Builder {
        private ForkJoinPool pool = ForkJoinPool.commonPool();
        private long threshold = ParallelBlocks.DEFAULT_THRESHOLD;
        private int blockSize = ParallelBlocks.DEFAULT_BLOCK_SIZE;

        private Builder() {
        }

        /**
         * @param pool the pool to run row blocks on; owned and shut down by the caller
         */
        public Builder pool(ForkJoinPool pool) {
            this.pool = Objects.requireNonNull(pool, "pool cannot be null");
            return this;
        }

        /**
         * @param threshold minimum estimated kernel evaluations before building in parallel
         */
        public Builder threshold(long threshold) {
            this.threshold = threshold;
            return this;
        }

        /**
         * @param blockSize rows per parallel task
         */
        public Builder blockSize(int blockSize) {
            this.blockSize = blockSize;
            return this;
        }

        public KernelMatrixBuilder build() {
            return new KernelMatrixBuilder(ParallelBlocks.of(pool, threshold, blockSize));
        }
    }
}
