package io.nosqlbench.gproc.linalg;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;

/**
 * Runs an index range in contiguous blocks, in parallel on a {@link ForkJoinPool}
 * when the work is large enough to pay for it.
 *
 * <h2>Work Model</h2>
 *
 * <pre>{@code
 *   indices [0, count)
 *        │
 *        ▼  count × costPerIndex < threshold ?
 *   ┌────────────┐  yes   body.apply(0, count) on the caller thread
 *   │  decision  │───────►
 *   └────────────┘
 *        │ no
 *        ▼
 *   BlockAction(0, count) ──fork──► BlockAction(0, mid)   ... until ≤ blockSize
 *                          ──────► BlockAction(mid, count)
 * }</pre>
 *
 * <p>Each block writes only to the output cells it owns, so no locking is
 * needed; joining the root task publishes all writes to the caller.
 *
 * <p>Instances are immutable and can be shared.
 */
public final class ParallelBlocks {

    private static final Logger logger = LogManager.getLogger(ParallelBlocks.class);

    /** Default minimum estimated work units before going parallel. */
    public static final long DEFAULT_THRESHOLD = 64L * 64L * 8L;

    /** Default number of indices handled by one leaf task. */
    public static final int DEFAULT_BLOCK_SIZE = 16;

    private static final ParallelBlocks COMMON = new ParallelBlocks(null, DEFAULT_THRESHOLD, DEFAULT_BLOCK_SIZE);
    private static final ParallelBlocks SERIAL = new ParallelBlocks(null, Long.MAX_VALUE, Integer.MAX_VALUE);

    private final ForkJoinPool pool;
    private final long threshold;
    private final int blockSize;

    private ParallelBlocks(ForkJoinPool pool, long threshold, int blockSize) {
        this.pool = pool;
        this.threshold = threshold;
        this.blockSize = blockSize;
    }

    /**
     * @return blocks run on the common pool with default settings
     */
    public static ParallelBlocks commonPool() {
        return COMMON;
    }

    /**
     * @return blocks always run on the calling thread
     */
    public static ParallelBlocks serial() {
        return SERIAL;
    }

    /**
     * @param pool the pool to run on
     * @param threshold minimum estimated work units before going parallel
     * @param blockSize indices per leaf task
     */
    public static ParallelBlocks of(ForkJoinPool pool, long threshold, int blockSize) {
        Objects.requireNonNull(pool, "pool cannot be null");
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative, got " + threshold);
        }
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be positive, got " + blockSize);
        }
        return new ParallelBlocks(pool, threshold, blockSize);
    }

    /**
     * Processes a contiguous range of indices.
     */
    @FunctionalInterface
    public interface BlockBody {
        /**
         * @param from first index, inclusive
         * @param to last index, exclusive
         */
        void apply(int from, int to);
    }

    /**
     * Runs {@code body} over {@code [0, count)}.
     *
     * @param count number of indices
     * @param costPerIndex rough work units per index, used only for the parallel decision
     * @param body the block body
     */
    public void run(int count, long costPerIndex, BlockBody body) {
        if (count <= 0) {
            return;
        }
        long cost = Math.max(1L, costPerIndex);
        long work = cost > Long.MAX_VALUE / count ? Long.MAX_VALUE : count * cost;
        if (work < threshold || count <= blockSize) {
            logger.trace("running {} indices serially (work={})", count, work);
            body.apply(0, count);
            return;
        }
        ForkJoinPool target = pool != null ? pool : ForkJoinPool.commonPool();
        logger.trace("running {} indices in blocks of {} on pool of parallelism {}",
            count, blockSize, target.getParallelism());
        target.invoke(new BlockAction(body, 0, count, blockSize));
    }

    public long getThreshold() {
        return threshold;
    }

    public int getBlockSize() {
        return blockSize;
    }

    private static final class BlockAction extends RecursiveAction {
        private final BlockBody body;
        private final int from;
        private final int to;
        private final int blockSize;

        BlockAction(BlockBody body, int from, int to, int blockSize) {
            this.body = body;
            this.from = from;
            this.to = to;
            this.blockSize = blockSize;
        }

        @Override
        protected void compute() {
            if (to - from <= blockSize) {
                body.apply(from, to);
                return;
            }
            int mid = (from + to) >>> 1;
            invokeAll(new BlockAction(body, from, mid, blockSize),
                new BlockAction(body, mid, to, blockSize));
        }
    }
}
