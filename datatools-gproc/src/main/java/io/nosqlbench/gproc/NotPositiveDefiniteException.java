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

/// Thrown when Cholesky factorization meets a pivot that is not strictly positive.
///
/// This usually means duplicate or near-duplicate inputs combined with a noise
/// variance that is too small to keep the covariance matrix non-singular. The
/// matrix is never altered to recover unless the caller opted into a jitter
/// policy.
public class NotPositiveDefiniteException extends GaussianProcessException {

    private final String matrixLabel;
    private final int size;
    private final int pivotIndex;
    private final double pivotValue;

    public NotPositiveDefiniteException(String matrixLabel, int size, int pivotIndex, double pivotValue) {
        super(String.format(
            "Matrix '%s' (%dx%d) is not positive definite: pivot %d is %s",
            matrixLabel, size, size, pivotIndex, pivotValue));
        this.matrixLabel = matrixLabel;
        this.size = size;
        this.pivotIndex = pivotIndex;
        this.pivotValue = pivotValue;
    }

    public NotPositiveDefiniteException(String message, NotPositiveDefiniteException cause) {
        super(message, cause);
        this.matrixLabel = cause.matrixLabel;
        this.size = cause.size;
        this.pivotIndex = cause.pivotIndex;
        this.pivotValue = cause.pivotValue;
    }

    public String getMatrixLabel() {
        return matrixLabel;
    }

    public int getSize() {
        return size;
    }

    public int getPivotIndex() {
        return pivotIndex;
    }

    public double getPivotValue() {
        return pivotValue;
    }
}
