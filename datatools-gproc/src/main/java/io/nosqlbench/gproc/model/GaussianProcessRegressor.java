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
import io.nosqlbench.gproc.ModelNotReadyException;
import io.nosqlbench.gproc.config.GaussianProcessConfig;
import io.nosqlbench.gproc.kernel.KernelFunction;
import io.nosqlbench.gproc.kernel.KernelMatrixBuilder;
import io.nosqlbench.gproc.linalg.JitterPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/// Long-lived handle over a sequence of [GaussianProcessModel] snapshots.
///
/// ## Purpose
///
/// A [GaussianProcessModel] is immutable; this class adds the lifecycle a
/// caller needs when parameters change over time. It tracks a [ModelState],
/// installs a new snapshot after each successful fit or update, and refuses
/// queries with [ModelNotReadyException] when no valid snapshot is installed.
///
/// ## Concurrency
///
/// ```text
///   writers (fit / update / rollback)      readers (logLikelihood / predict)
///   ─────────────────────────────────      ─────────────────────────────────
///   updateLock: one writer at a time       readLock: read (state, snapshot)
///   build new snapshot, no lock held             │
///   writeLock: swap (state, snapshot)            ▼
///                                          query the immutable snapshot
/// ```
///
/// The O(n³) refit runs without blocking readers, who keep using the
/// previous snapshot until the swap. A reader never sees a half-built
/// snapshot because snapshots are only published once complete.
///
/// ## Failure
///
/// A failed fit or update moves the handle to [ModelState#FAILED] and
/// rethrows. The previously installed snapshot is not modified; it stays
/// available from [#lastValidSnapshot()] and [#rollback()] reinstates it.
/// Updates after a failure start from that last valid snapshot.
///
/// ```java
/// GaussianProcessRegressor gp = new GaussianProcessRegressor();
/// gp.fit(inputs, y, 0.01, new ExponentiatedQuadraticKernel(1.0, 1.0));
/// double ll = gp.logLikelihood();
/// gp.updateNoiseVariance(0.1);
/// PosteriorPrediction p = gp.predict(testInputs);
/// ```
public final class GaussianProcessRegressor {

    private static final Logger logger = LogManager.getLogger(GaussianProcessRegressor.class);

    private final KernelMatrixBuilder matrixBuilder;

    private final ReentrantLock updateLock = new ReentrantLock();
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();

    // guarded by stateLock
    private ModelState state = ModelState.UNINITIALIZED;
    private GaussianProcessModel current;
    private GaussianProcessModel lastValid;
    private RuntimeException lastFailure;

    public GaussianProcessRegressor() {
        this(KernelMatrixBuilder.defaultBuilder());
    }

    /// @param matrixBuilder the matrix builder, and thereby the parallel settings, used for every fit
    public GaussianProcessRegressor(KernelMatrixBuilder matrixBuilder) {
        this.matrixBuilder = Objects.requireNonNull(matrixBuilder, "matrixBuilder cannot be null");
    }

    /// Fits to new training data, replacing any previous snapshot.
    ///
    /// @return the installed snapshot
    public GaussianProcessModel fit(InputSet inputs, double[] observations,
                                    double noiseVariance, KernelFunction kernel) {
        return fit(inputs, observations, noiseVariance, kernel, JitterPolicy.none());
    }

    /// Fits to new training data with an explicit jitter policy.
    ///
    /// @return the installed snapshot
    public GaussianProcessModel fit(InputSet inputs, double[] observations,
                                    double noiseVariance, KernelFunction kernel, JitterPolicy jitterPolicy) {
        return apply("fit", base -> GaussianProcessModel.builder()
            .inputs(inputs)
            .observations(observations)
            .noiseVariance(noiseVariance)
            .kernel(kernel)
            .jitterPolicy(jitterPolicy)
            .matrixBuilder(matrixBuilder)
            .build(), false);
    }

    /// Fits to new training data with settings from a configuration.
    public GaussianProcessModel fit(InputSet inputs, double[] observations, GaussianProcessConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return apply("fit", base -> GaussianProcessModel.builder()
            .inputs(inputs)
            .observations(observations)
            .config(config)
            .matrixBuilder(matrixBuilder)
            .build(), false);
    }

    /// Refits the last valid snapshot with a new noise variance.
    ///
    /// @throws ModelNotReadyException if nothing has been fitted yet
    public GaussianProcessModel updateNoiseVariance(double noiseVariance) {
        return apply("update noise variance", base -> base.withNoiseVariance(noiseVariance), true);
    }

    /// Refits the last valid snapshot with a new kernel or new kernel parameters.
    ///
    /// @throws ModelNotReadyException if nothing has been fitted yet
    public GaussianProcessModel updateKernel(KernelFunction kernel) {
        return apply("update kernel", base -> base.withKernel(kernel), true);
    }

    /// Refits the last valid snapshot with noise variance, kernel and jitter from a configuration.
    ///
    /// @throws ModelNotReadyException if nothing has been fitted yet
    public GaussianProcessModel update(GaussianProcessConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return apply("update", base -> base.withConfig(config), true);
    }

    /// Reinstates the last valid snapshot after a failed fit or update.
    ///
    /// @return the reinstated snapshot
    /// @throws ModelNotReadyException if there has never been a valid snapshot
    public GaussianProcessModel rollback() {
        updateLock.lock();
        try {
            stateLock.writeLock().lock();
            try {
                if (lastValid == null) {
                    throw new ModelNotReadyException(state);
                }
                current = lastValid;
                state = ModelState.READY;
                lastFailure = null;
                logger.info("Rolled back to last valid snapshot {}", current);
                return current;
            } finally {
                stateLock.writeLock().unlock();
            }
        } finally {
            updateLock.unlock();
        }
    }

    private GaussianProcessModel apply(String operation, UnaryOperator<GaussianProcessModel> change,
                                       boolean requiresBase) {
        updateLock.lock();
        try {
            GaussianProcessModel base;
            stateLock.readLock().lock();
            try {
                base = lastValid;
                if (requiresBase && base == null) {
                    throw new ModelNotReadyException(state);
                }
            } finally {
                stateLock.readLock().unlock();
            }

            GaussianProcessModel next;
            try {
                next = change.apply(base);
            } catch (RuntimeException e) {
                install(ModelState.FAILED, null, e);
                logger.warn("{} failed, model is now {}: {}", operation, ModelState.FAILED, e.getMessage());
                throw e;
            }
            install(ModelState.READY, next, null);
            logger.debug("{} installed {}", operation, next);
            return next;
        } finally {
            updateLock.unlock();
        }
    }

    private void install(ModelState newState, GaussianProcessModel snapshot, RuntimeException failure) {
        stateLock.writeLock().lock();
        try {
            state = newState;
            current = snapshot;
            lastFailure = failure;
            if (snapshot != null) {
                lastValid = snapshot;
            }
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    /// @return the installed snapshot
    /// @throws ModelNotReadyException unless the state is [ModelState#READY]
    public GaussianProcessModel snapshot() {
        stateLock.readLock().lock();
        try {
            if (state != ModelState.READY) {
                throw lastFailure != null
                    ? new ModelNotReadyException(state, lastFailure)
                    : new ModelNotReadyException(state);
            }
            return current;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /// @throws ModelNotReadyException unless the state is [ModelState#READY]
    public double logLikelihood() {
        return snapshot().logLikelihood();
    }

    /// @throws ModelNotReadyException unless the state is [ModelState#READY]
    public PosteriorPrediction predict(InputSet testInputs) {
        return snapshot().predict(testInputs);
    }

    /// @throws ModelNotReadyException unless the state is [ModelState#READY]
    public double[] predictMean(InputSet testInputs) {
        return snapshot().predictMean(testInputs);
    }

    public ModelState state() {
        stateLock.readLock().lock();
        try {
            return state;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public boolean isReady() {
        return state() == ModelState.READY;
    }

    /// @return the most recent successfully installed snapshot, even in [ModelState#FAILED]
    public Optional<GaussianProcessModel> lastValidSnapshot() {
        stateLock.readLock().lock();
        try {
            return Optional.ofNullable(lastValid);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /// @return the error that put the handle in [ModelState#FAILED], if that is the current state
    public Optional<RuntimeException> lastFailure() {
        stateLock.readLock().lock();
        try {
            return Optional.ofNullable(lastFailure);
        } finally {
            stateLock.readLock().unlock();
        }
    }
}
