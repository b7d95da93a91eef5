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

/// Thrown when vector lengths or set sizes that must agree do not.
///
/// Covers input vectors of differing dimensionality within one call and an
/// observation vector whose length differs from the training set size.
public class DimensionMismatchException extends GaussianProcessException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(String.format("%s: expected %d but was %d", what, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
