package io.nosqlbench.gproc;

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

/// Base type for all errors raised by the Gaussian process engine.
///
/// Every failure is local to the model instance that raised it. Construction
/// and update either install a complete new state or leave the previous one
/// untouched, so catching one of these never requires global cleanup.
///
/// | Subtype | Raised when |
/// |---------|-------------|
/// | [ConfigurationException] | kernel parameters or noise variance are invalid |
/// | [DimensionMismatchException] | input or observation shapes disagree |
/// | [NotPositiveDefiniteException] | a Cholesky pivot is not positive |
/// | [ModelNotReadyException] | a query is made without a valid fitted state |
public class GaussianProcessException extends RuntimeException {

    public GaussianProcessException(String message) {
        super(message);
    }

    public GaussianProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}
