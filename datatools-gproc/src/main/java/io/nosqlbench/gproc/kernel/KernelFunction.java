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

/// Prior covariance between two function values, as a function of their inputs.
///
/// ## Contract
///
/// - `covariance(a, b)` is a real scalar for any two vectors of equal length.
/// - It is symmetric: `covariance(a, b) == covariance(b, a)`.
/// - Applied pairwise over any input set it yields a positive semi-definite matrix.
/// - Parameters are bound at construction and never change afterwards, so the
///   same values drive training covariance and cross-covariance alike.
///
/// Implementations are immutable and may be called from many threads at once;
/// [KernelMatrixBuilder] relies on this to fill matrix blocks in parallel.
///
/// ## Implementations
///
/// | Type | Class |
/// |------|-------|
/// | exponentiated_quadratic | [ExponentiatedQuadraticKernel] |
/// | matern32 | [Matern32Kernel] |
/// | matern52 | [Matern52Kernel] |
/// | periodic | [PeriodicKernel] |
/// | linear | [LinearKernel] |
/// | polynomial | [PolynomialKernel] |
/// | white_noise | [WhiteNoiseKernel] |
/// | sum | [SumKernel] |
/// | product | [ProductKernel] |
///
/// @see KernelFactory
public interface KernelFunction {

    /// Computes the prior covariance between the function values at `a` and `b`.
    ///
    /// @param a first input vector
    /// @param b second input vector, same length as `a`
    /// @return the covariance k(a, b)
    /// @throws io.nosqlbench.gproc.DimensionMismatchException if the vectors differ in length
    double covariance(double[] a, double[] b);

    /// Returns the type name used in configuration and serialization.
    ///
    /// @return the kernel type name
    String getKernelType();

    /// Returns the parameters bound to this kernel.
    ///
    /// @return the bound parameters, empty for composite kernels
    KernelParameters getParameters();

    /// Prior variance of the function value at `x`, i.e. `covariance(x, x)`.
    ///
    /// @param x the input vector
    /// @return the marginal prior variance
    default double variance(double[] x) {
        return covariance(x, x);
    }
}
