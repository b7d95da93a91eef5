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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.gproc.ConfigurationException;
import io.nosqlbench.gproc.kernel.KernelFunction;
import io.nosqlbench.gproc.linalg.JitterPolicy;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable configuration of a Gaussian process: the kernel, the observation
 * noise variance and the optional factorization jitter.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "noise_variance": 0.01,
 *   "jitter": {                 // optional, disabled when absent
 *     "enabled": true,
 *     "initial": 1e-10,
 *     "max_attempts": 6,
 *     "growth": 10.0
 *   },
 *   "kernel": {
 *     "type": "exponentiated_quadratic",
 *     "variance": 1.0,
 *     "lengthscale": 1.0
 *   }
 * }
 * }</pre>
 *
 * <p>Values are checked when they are read through the typed getters, and
 * {@link #validate()} checks all of them at once. Invalid kernel parameters are
 * rejected while the JSON is parsed.
 *
 * @see KernelTypeAdapterFactory
 */
public class GaussianProcessConfig {

    public static final String NOISE_VARIANCE = "noise_variance";

    @SerializedName("noise_variance")
    private Double noiseVariance;

    @SerializedName("jitter")
    private JitterConfig jitter;

    @SerializedName("kernel")
    private KernelFunction kernel;

    /**
     * Jitter section. Absent or disabled means the training covariance is factored as is.
     */
    public static class JitterConfig {
        @SerializedName("enabled")
        private Boolean enabled;

        @SerializedName("initial")
        private Double initial;

        @SerializedName("max_attempts")
        private Integer maxAttempts;

        @SerializedName("growth")
        private Double growth;

        public JitterConfig() {
        }

        public static JitterConfig of(JitterPolicy policy) {
            JitterConfig config = new JitterConfig();
            config.enabled = policy.isEnabled();
            if (policy.isEnabled()) {
                config.initial = policy.getInitial();
                config.maxAttempts = policy.getMaxAttempts();
                config.growth = policy.getGrowth();
            }
            return config;
        }

        public boolean isEnabled() {
            return enabled == null || enabled;
        }

        public Double getInitial() {
            return initial;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public Double getGrowth() {
            return growth;
        }

        /**
         * @throws ConfigurationException if an enabled section holds invalid values
         */
        public JitterPolicy toJitterPolicy() {
            if (!isEnabled()) {
                return JitterPolicy.none();
            }
            double i = initial != null ? initial : JitterPolicy.DEFAULT_INITIAL;
            int m = maxAttempts != null ? maxAttempts : JitterPolicy.DEFAULT_MAX_ATTEMPTS;
            double g = growth != null ? growth : JitterPolicy.DEFAULT_GROWTH;
            try {
                return JitterPolicy.escalating(i, m, g);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid jitter section: " + e.getMessage(), e);
            }
        }
    }

    public GaussianProcessConfig() {
    }

    /**
     * Creates a configuration without jitter.
     */
    public static GaussianProcessConfig of(double noiseVariance, KernelFunction kernel) {
        return of(noiseVariance, kernel, JitterPolicy.none());
    }

    public static GaussianProcessConfig of(double noiseVariance, KernelFunction kernel, JitterPolicy jitterPolicy) {
        GaussianProcessConfig config = new GaussianProcessConfig();
        config.setNoiseVariance(noiseVariance);
        config.setKernel(kernel);
        config.setJitterPolicy(jitterPolicy);
        return config;
    }

    /**
     * @return the noise variance
     * @throws ConfigurationException if it is missing, negative or not finite
     */
    public double getNoiseVariance() {
        if (noiseVariance == null) {
            throw new ConfigurationException("'" + NOISE_VARIANCE + "' is required");
        }
        double value = noiseVariance;
        if (!Double.isFinite(value)) {
            throw new ConfigurationException(NOISE_VARIANCE, value, "must be finite");
        }
        if (value < 0.0) {
            throw new ConfigurationException(NOISE_VARIANCE, value, "must be >= 0");
        }
        return value;
    }

    public void setNoiseVariance(double noiseVariance) {
        this.noiseVariance = noiseVariance;
    }

    /**
     * @return the kernel
     * @throws ConfigurationException if no kernel is configured
     */
    public KernelFunction getKernel() {
        if (kernel == null) {
            throw new ConfigurationException("'kernel' is required");
        }
        return kernel;
    }

    public void setKernel(KernelFunction kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel cannot be null");
    }

    /**
     * @return the jitter policy, {@link JitterPolicy#none()} when no jitter section is present
     */
    public JitterPolicy getJitterPolicy() {
        return jitter == null ? JitterPolicy.none() : jitter.toJitterPolicy();
    }

    public void setJitterPolicy(JitterPolicy jitterPolicy) {
        Objects.requireNonNull(jitterPolicy, "jitterPolicy cannot be null");
        this.jitter = jitterPolicy.isEnabled() ? JitterConfig.of(jitterPolicy) : null;
    }

    /**
     * Checks every section.
     *
     * @return this configuration
     * @throws ConfigurationException on the first invalid value
     */
    public GaussianProcessConfig validate() {
        getNoiseVariance();
        getKernel();
        getJitterPolicy();
        return this;
    }

    /**
     * Parses a configuration from a JSON string and validates it.
     *
     * @throws ConfigurationException if the JSON is malformed or holds invalid values
     */
    public static GaussianProcessConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        return parsed(parse(json, null));
    }

    /**
     * Parses a configuration from a Reader and validates it.
     */
    public static GaussianProcessConfig fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        return parsed(parse(null, reader));
    }

    /**
     * Loads and validates a configuration file.
     */
    public static GaussianProcessConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    public String toJson() {
        return GprocGsonConfig.gson().toJson(this);
    }

    public void toJson(Writer writer) {
        GprocGsonConfig.gson().toJson(this, writer);
    }

    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    private static GaussianProcessConfig parse(String json, Reader reader) {
        try {
            return json != null
                ? GprocGsonConfig.gson().fromJson(json, GaussianProcessConfig.class)
                : GprocGsonConfig.gson().fromJson(reader, GaussianProcessConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed Gaussian process configuration: " + e.getMessage(), e);
        }
    }

    private static GaussianProcessConfig parsed(GaussianProcessConfig config) {
        if (config == null) {
            throw new ConfigurationException("Empty Gaussian process configuration");
        }
        return config.validate();
    }

    @Override
    public String toString() {
        return "GaussianProcessConfig{noise_variance=" + noiseVariance
            + ", jitter=" + (jitter != null && jitter.isEnabled() ? "enabled" : "disabled")
            + ", kernel=" + kernel + "}";
    }
}
