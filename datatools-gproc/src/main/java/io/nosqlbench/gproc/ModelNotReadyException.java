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

import io.nosqlbench.gproc.model.ModelState;

/// Thrown when likelihood or prediction is requested from a regressor that
/// has no valid fitted state, either because it was never fitted or because
/// its last update failed.
public class ModelNotReadyException extends GaussianProcessException {

    private final ModelState state;

    public ModelNotReadyException(ModelState state) {
        super("Gaussian process model not ready (state " + state + ")");
        this.state = state;
    }

    public ModelNotReadyException(ModelState state, Throwable cause) {
        super("Gaussian process model not ready (state " + state + "): " + cause.getMessage(), cause);
        this.state = state;
    }

    public ModelState getState() {
        return state;
    }
}
