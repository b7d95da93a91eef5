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
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.gproc.ConfigurationException;
import io.nosqlbench.gproc.kernel.CompositeKernel;
import io.nosqlbench.gproc.kernel.KernelFactory;
import io.nosqlbench.gproc.kernel.KernelFunction;
import io.nosqlbench.gproc.kernel.KernelParameters;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * GSON TypeAdapterFactory for polymorphic {@link KernelFunction} serialization.
 *
 * <p>Every kernel is written as a JSON object whose {@code "type"} field names the
 * registered {@link io.nosqlbench.gproc.kernel.KernelType}. Parametric kernels carry
 * their hyperparameters as sibling numeric fields; composite kernels carry a
 * {@code "kernels"} array of nested kernel objects.
 *
 * <pre>{@code
 *  { "type": "sum",
 *    "kernels": [
 *      { "type": "exponentiated_quadratic", "variance": 1.0, "lengthscale": 0.5 },
 *      { "type": "white_noise", "variance": 0.01 }
 *    ] }
 * }</pre>
 *
 * <p>Kernels are built through a {@link KernelFactory}, so every hyperparameter read
 * from JSON goes through the same validation as programmatic construction.
 */
public final class KernelTypeAdapterFactory implements TypeAdapterFactory {

    /** Discriminator field naming the kernel type. */
    public static final String TYPE_FIELD = "type";
    /** Child array field of composite kernels. */
    public static final String KERNELS_FIELD = "kernels";

    private final KernelFactory kernels;

    private KernelTypeAdapterFactory(KernelFactory kernels) {
        this.kernels = Objects.requireNonNull(kernels, "kernel factory cannot be null");
    }

    /**
     * @return an adapter factory backed by {@link KernelFactory#standard()}
     */
    public static KernelTypeAdapterFactory create() {
        return new KernelTypeAdapterFactory(KernelFactory.standard());
    }

    /**
     * @param kernels the factory used to resolve type names, including any custom kernels
     * @return an adapter factory backed by the given kernel factory
     */
    public static KernelTypeAdapterFactory create(KernelFactory kernels) {
        return new KernelTypeAdapterFactory(kernels);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<? super T> rawType = type.getRawType();
        if (!KernelFunction.class.isAssignableFrom(rawType)) {
            return null;
        }

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                Streams.write(toTree((KernelFunction) value), out);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                KernelFunction kernel = fromTree(element);
                if (!rawType.isInstance(kernel)) {
                    throw new ConfigurationException("Expected kernel of " + rawType.getSimpleName()
                        + " but JSON declared type '" + kernel.getKernelType() + "'");
                }
                return (T) kernel;
            }
        };
    }

    /**
     * Converts a kernel to its JSON tree.
     */
    public JsonObject toTree(KernelFunction kernel) {
        JsonObject result = new JsonObject();
        result.addProperty(TYPE_FIELD, kernel.getKernelType());
        if (kernel instanceof CompositeKernel) {
            JsonArray children = new JsonArray();
            for (KernelFunction child : ((CompositeKernel) kernel).getKernels()) {
                children.add(toTree(child));
            }
            result.add(KERNELS_FIELD, children);
        } else {
            for (Map.Entry<String, Double> entry : kernel.getParameters().asMap().entrySet()) {
                result.addProperty(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Builds a kernel from its JSON tree.
     *
     * @throws ConfigurationException if the type is missing or unknown, or a hyperparameter is invalid
     * @throws JsonParseException if the tree does not have the shape of a kernel object
     */
    public KernelFunction fromTree(JsonElement element) {
        if (!element.isJsonObject()) {
            throw new JsonParseException("Kernel must be a JSON object, got: " + element);
        }
        JsonObject obj = element.getAsJsonObject();
        JsonElement typeElement = obj.get(TYPE_FIELD);
        if (typeElement == null || !typeElement.isJsonPrimitive()) {
            throw new ConfigurationException("Missing '" + TYPE_FIELD + "' field in kernel JSON: " + obj);
        }
        String typeName = typeElement.getAsString();
        if (!kernels.isRegistered(typeName)) {
            throw new ConfigurationException("Unknown kernel type '" + typeName
                + "', known types: " + kernels.registeredTypes());
        }

        if (kernels.isComposite(typeName)) {
            JsonElement children = obj.get(KERNELS_FIELD);
            if (children == null || !children.isJsonArray() || children.getAsJsonArray().size() == 0) {
                throw new ConfigurationException("Composite kernel '" + typeName
                    + "' requires a non-empty '" + KERNELS_FIELD + "' array");
            }
            List<KernelFunction> parts = new ArrayList<>();
            for (JsonElement child : children.getAsJsonArray()) {
                parts.add(fromTree(child));
            }
            return kernels.composite(typeName, parts);
        }

        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
            if (TYPE_FIELD.equals(entry.getKey())) {
                continue;
            }
            JsonElement value = entry.getValue();
            if (!value.isJsonPrimitive() || !((JsonPrimitive) value).isNumber()) {
                throw new ConfigurationException("Kernel parameter '" + entry.getKey()
                    + "' of '" + typeName + "' must be numeric, got: " + value);
            }
            values.put(entry.getKey(), value.getAsDouble());
        }
        return kernels.create(typeName, KernelParameters.fromMap(values));
    }
}
