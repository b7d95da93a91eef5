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

/// Lifecycle state of a [GaussianProcessRegressor].
///
/// ```text
/// UNINITIALIZED ──fit──────────► READY ──update──► READY
///       │                          │
///       └──fit fails──► FAILED ◄───┴──update fails
///
/// FAILED ──fit / update / rollback──► READY
/// ```
///
/// Likelihood and prediction queries succeed only in [#READY].
public enum ModelState {
    /// No fit has been attempted yet.
    UNINITIALIZED,
    /// A valid fitted snapshot is installed.
    READY,
    /// The most recent fit or update failed; queries are refused until the next success or a rollback.
    FAILED
}
