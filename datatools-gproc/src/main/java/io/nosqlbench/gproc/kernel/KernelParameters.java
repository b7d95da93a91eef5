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

import io.nosqlbench.gproc.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of named real-valued kernel parameters.
 *
 * <p>Kernel configuration arrives as a flat set of named values such as
 * {@code variance}, {@code lengthscale} or {@code period}. Each kernel reads
 * and validates the names it understands when it is constructed, so the same
 * bound values are used for every covariance it computes afterwards.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * KernelParameters params = KernelParameters.of(
 *     "variance", 1.0,
 *     "lengthscale", 0.5);
 *
 * double ell = params.requirePositive("lengthscale");
 * KernelParameters wider = params.with("lengthscale", 2.0);
 * }</pre>
 *
 * <p>Insertion order is preserved so that serialized forms are stable.
 */
public final class KernelParameters {

    private static final KernelParameters EMPTY = new KernelParameters(new LinkedHashMap<>());

    private final Map<String, Double> values;

    private KernelParameters(LinkedHashMap<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * @return a parameter set with no entries
     */
    public static KernelParameters empty() {
        return EMPTY;
    }

    /**
     * Creates a parameter set from alternating name/value pairs.
     *
     * @param nameValuePairs a sequence of {@code String} names each followed by a {@code Number}
     * @return the parameter set
     * @throws IllegalArgumentException if the pairs are malformed
     */
    public static KernelParameters of(Object... nameValuePairs) {
        if (nameValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("name/value pairs must have even length, got " + nameValuePairs.length);
        }
        LinkedHashMap<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            Object name = nameValuePairs[i];
            Object value = nameValuePairs[i + 1];
            if (!(name instanceof String)) {
                throw new IllegalArgumentException("parameter name at position " + i + " is not a String: " + name);
            }
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("value for '" + name + "' is not a number: " + value);
            }
            map.put((String) name, ((Number) value).doubleValue());
        }
        return new KernelParameters(map);
    }

    /**
     * Creates a parameter set by copying a map.
     *
     * @param values named values, copied in iteration order
     * @return the parameter set
     */
    public static KernelParameters fromMap(Map<String, ? extends Number> values) {
        Objects.requireNonNull(values, "values cannot be null");
        LinkedHashMap<String, Double> map = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Number> entry : values.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "parameter name cannot be null");
            Objects.requireNonNull(entry.getValue(), "value for '" + entry.getKey() + "' cannot be null");
            map.put(entry.getKey(), entry.getValue().doubleValue());
        }
        return new KernelParameters(map);
    }

    /**
     * Returns a copy of this set with one value added or replaced.
     *
     * @param name the parameter name
     * @param value the new value
     * @return a new parameter set
     */
    public KernelParameters with(String name, double value) {
        Objects.requireNonNull(name, "name cannot be null");
        LinkedHashMap<String, Double> map = new LinkedHashMap<>(values);
        map.put(name, value);
        return new KernelParameters(map);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns a value or a default when absent.
     */
    public double get(String name, double defaultValue) {
        Double value = values.get(name);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns a required finite value.
     *
     * @throws ConfigurationException if the value is missing or not finite
     */
    public double require(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new ConfigurationException("Missing required kernel parameter '" + name + "'");
        }
        if (!Double.isFinite(value)) {
            throw new ConfigurationException(name, value, "must be finite");
        }
        return value;
    }

    /**
     * Returns a required value that must be strictly positive.
     *
     * @throws ConfigurationException if the value is missing, not finite or not positive
     */
    public double requirePositive(String name) {
        double value = require(name);
        if (value <= 0.0) {
            throw new ConfigurationException(name, value, "must be > 0");
        }
        return value;
    }

    /**
     * Returns an optional value that must be non-negative, or the default when absent.
     *
     * @throws ConfigurationException if the value is present and negative or not finite
     */
    public double nonNegative(String name, double defaultValue) {
        if (!values.containsKey(name)) {
            return defaultValue;
        }
        double value = require(name);
        if (value < 0.0) {
            throw new ConfigurationException(name, value, "must be >= 0");
        }
        return value;
    }

    /**
     * Rejects any parameter whose name is not in the accepted set.
     *
     * @param kernelType the kernel type, for the error message
     * @param accepted the parameter names the kernel understands
     * @throws ConfigurationException naming the unknown parameters
     */
    public void requireOnly(String kernelType, Collection<String> accepted) {
        List<String> unknown = new ArrayList<>();
        for (String name : values.keySet()) {
            if (!accepted.contains(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown parameter(s) " + unknown + " for kernel '"
                + kernelType + "', accepted: " + accepted);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KernelParameters)) {
            return false;
        }
        return values.equals(((KernelParameters) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
