package io.nosqlbench.gproc.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for Gaussian process configuration files.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable config files |
/// | Serialize nulls | Disabled | Omitted sections fall back to defaults |
/// | HTML escaping | Disabled | Cleaner numeric output |
/// | Kernel adapter | Registered | Polymorphic kernel support |
///
/// The shared [Gson] instance is thread-safe.
///
/// @see KernelTypeAdapterFactory
/// @see GaussianProcessConfig
public final class GprocGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private GprocGsonConfig() {
        // Utility class
    }

    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the kernel adapter and formatting defaults,
    /// for callers that register further adapters.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(KernelTypeAdapterFactory.create());
    }

    /// Creates a compact (single-line) Gson instance.
    ///
    /// @return a compact Gson instance
    public static Gson compactGson() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(KernelTypeAdapterFactory.create())
            .create();
    }
}
