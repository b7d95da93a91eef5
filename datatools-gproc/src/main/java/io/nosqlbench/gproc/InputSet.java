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

import java.util.Arrays;
import java.util.Objects;

/// An ordered, immutable set of input vectors of uniform dimensionality.
///
/// Training inputs and test inputs are both input sets. The vectors are
/// copied on construction and handed out by reference afterwards only to
/// engine internals through [#rawRow(int)]; callers get copies.
///
/// ```java
/// InputSet grid = InputSet.ofScalars(0.0, 0.5, 1.0);       // three 1-D inputs
/// InputSet plane = InputSet.of(new double[][]{{0, 0}, {1, 2}});
/// ```
///
/// An empty set has dimensionality 0 and is compatible with any other set.
public final class InputSet {

    private static final InputSet EMPTY = new InputSet(new double[0][], 0);

    private final double[][] points;
    private final int dimensions;

    private InputSet(double[][] points, int dimensions) {
        this.points = points;
        this.dimensions = dimensions;
    }

    /// @return the empty input set
    public static InputSet empty() {
        return EMPTY;
    }

    /// Creates an input set from row vectors.
    ///
    /// @param points `points[index][dimension]`
    /// @return a validated copy
    /// @throws DimensionMismatchException if rows differ in length
    /// @throws IllegalArgumentException if a row is empty or a value is not finite
    public static InputSet of(double[][] points) {
        Objects.requireNonNull(points, "points cannot be null");
        if (points.length == 0) {
            return EMPTY;
        }
        Objects.requireNonNull(points[0], "point 0 cannot be null");
        int dims = points[0].length;
        if (dims == 0) {
            throw new IllegalArgumentException("input vectors must have at least one dimension");
        }
        double[][] copy = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            double[] row = Objects.requireNonNull(points[i], "point " + i + " cannot be null");
            if (row.length != dims) {
                throw new DimensionMismatchException("dimensionality of input " + i, dims, row.length);
            }
            for (int d = 0; d < dims; d++) {
                if (!Double.isFinite(row[d])) {
                    throw new IllegalArgumentException(
                        "input " + i + " has a non-finite value at dimension " + d + ": " + row[d]);
                }
            }
            copy[i] = row.clone();
        }
        return new InputSet(copy, dims);
    }

    /// Creates a set of one-dimensional inputs.
    public static InputSet ofScalars(double... values) {
        Objects.requireNonNull(values, "values cannot be null");
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[]{values[i]};
        }
        return of(rows);
    }

    /// Creates `count` evenly spaced one-dimensional inputs over `[from, to]`.
    public static InputSet linspace(double from, double to, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got " + count);
        }
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = count == 1 ? from : from + (to - from) * i / (count - 1);
        }
        return ofScalars(values);
    }

    public int size() {
        return points.length;
    }

    public boolean isEmpty() {
        return points.length == 0;
    }

    public int dimensions() {
        return dimensions;
    }

    /// @return a copy of the vector at `index`
    public double[] row(int index) {
        return points[index].clone();
    }

    /// Engine-internal access without copying. Callers must not modify the array.
    public double[] rawRow(int index) {
        return points[index];
    }

    /// @return a deep copy of all vectors
    public double[][] toArray() {
        double[][] copy = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            copy[i] = points[i].clone();
        }
        return copy;
    }

    /// Checks that two sets can be combined by a kernel.
    ///
    /// @throws DimensionMismatchException if both are non-empty and their dimensionality differs
    public void requireCompatible(InputSet other) {
        if (!isEmpty() && !other.isEmpty() && dimensions != other.dimensions) {
            throw new DimensionMismatchException("input set dimensionality", dimensions, other.dimensions);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InputSet)) {
            return false;
        }
        return Arrays.deepEquals(points, ((InputSet) o).points);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(points);
    }

    @Override
    public String toString() {
        return "InputSet[size=" + points.length + ", dimensions=" + dimensions + "]";
    }
}
