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

/// Thrown when a kernel parameter or the noise variance is invalid.
///
/// Raised before any matrix is built, so no partial work is discarded.
public class ConfigurationException extends GaussianProcessException {

    private final String parameter;
    private final double value;

    public ConfigurationException(String parameter, double value, String requirement) {
        super(String.format("Invalid value for '%s': %s (%s)", parameter, value, requirement));
        this.parameter = parameter;
        this.value = value;
    }

    public ConfigurationException(String message) {
        super(message);
        this.parameter = null;
        this.value = Double.NaN;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.parameter = null;
        this.value = Double.NaN;
    }

    /// @return the offending parameter name, or null when the error is not about a single parameter
    public String getParameter() {
        return parameter;
    }

    /// @return the offending value, or NaN when the error is not about a single parameter
    public double getValue() {
        return value;
    }
}
