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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Creates kernels from a type name and a flat set of named parameters.
 *
 * <p>This is the configuration entry point for kernels: a caller that holds
 * only {@code "exponentiated_quadratic"} and {@code {variance=1, lengthscale=2}}
 * gets back a validated {@link KernelFunction}.
 *
 * <h2>Registration</h2>
 *
 * <p>Parametric kernels are registered with a constructor reference; the type
 * name comes from the class's {@link KernelType} annotation. Composite kernels
 * ({@code sum}, {@code product}) take child kernels rather than parameters and
 * are built with {@link #composite(String, List)}.
 *
 * <pre>{@code
 * KernelFactory factory = KernelFactory.create();
 * factory.register(MyKernel.class, MyKernel::new);
 * KernelFunction kernel = factory.create("matern52",
 *     KernelParameters.of("variance", 2.0, "lengthscale", 0.3));
 * }</pre>
 */
public final class KernelFactory {

    private static final KernelFactory STANDARD = createStandard().readOnly();

    private final Map<String, Function<KernelParameters, ? extends KernelFunction>> constructors;
    private final Map<String, Function<List<KernelFunction>, ? extends CompositeKernel>> composites;
    private final boolean readOnly;

    private KernelFactory() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>(), false);
    }

    private KernelFactory(Map<String, Function<KernelParameters, ? extends KernelFunction>> constructors,
                          Map<String, Function<List<KernelFunction>, ? extends CompositeKernel>> composites,
                          boolean readOnly) {
        this.constructors = constructors;
        this.composites = composites;
        this.readOnly = readOnly;
    }

    /**
     * Returns the shared read-only factory with the built-in kernels. Use
     * {@link #create()} for a factory that accepts further registrations.
     *
     * @return the shared factory
     */
    public static KernelFactory standard() {
        return STANDARD;
    }

    /**
     * Creates a new factory with all built-in kernels registered, to which
     * further kernel types can be added.
     *
     * @return a new factory
     */
    public static KernelFactory create() {
        return createStandard();
    }

    private static KernelFactory createStandard() {
        KernelFactory factory = new KernelFactory();
        factory.register(ExponentiatedQuadraticKernel.class, ExponentiatedQuadraticKernel::new);
        factory.register(Matern32Kernel.class, Matern32Kernel::new);
        factory.register(Matern52Kernel.class, Matern52Kernel::new);
        factory.register(PeriodicKernel.class, PeriodicKernel::new);
        factory.register(LinearKernel.class, LinearKernel::new);
        factory.register(PolynomialKernel.class, PolynomialKernel::new);
        factory.register(WhiteNoiseKernel.class, WhiteNoiseKernel::new);
        factory.registerComposite(SumKernel.class, SumKernel::new);
        factory.registerComposite(ProductKernel.class, ProductKernel::new);
        return factory;
    }

    private KernelFactory readOnly() {
        return new KernelFactory(
            Collections.unmodifiableMap(new LinkedHashMap<>(constructors)),
            Collections.unmodifiableMap(new LinkedHashMap<>(composites)),
            true);
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Registers a parametric kernel type.
     *
     * @param kernelClass the kernel class, carrying a {@link KernelType} annotation
     * @param constructor builds an instance from parameters
     * @throws IllegalArgumentException if the class has no annotation or the name is taken
     * @throws UnsupportedOperationException if this is the shared {@link #standard()} factory
     */
    public <K extends KernelFunction> void register(Class<K> kernelClass,
                                                    Function<KernelParameters, K> constructor) {
        requireWritable();
        String type = typeName(kernelClass);
        if (constructors.containsKey(type) || composites.containsKey(type)) {
            throw new IllegalArgumentException("Kernel type '" + type + "' is already registered");
        }
        constructors.put(type, Objects.requireNonNull(constructor, "constructor cannot be null"));
    }

    /**
     * Registers a composite kernel type.
     */
    public <K extends CompositeKernel> void registerComposite(Class<K> kernelClass,
                                                              Function<List<KernelFunction>, K> constructor) {
        requireWritable();
        String type = typeName(kernelClass);
        if (constructors.containsKey(type) || composites.containsKey(type)) {
            throw new IllegalArgumentException("Kernel type '" + type + "' is already registered");
        }
        composites.put(type, Objects.requireNonNull(constructor, "constructor cannot be null"));
    }

    /**
     * Creates a parametric kernel.
     *
     * @param type the kernel type name
     * @param parameters the kernel parameters
     * @return the validated kernel
     * @throws ConfigurationException if the type is unknown or a parameter is invalid
     */
    public KernelFunction create(String type, KernelParameters parameters) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Function<KernelParameters, ? extends KernelFunction> constructor = constructors.get(type);
        if (constructor == null) {
            if (composites.containsKey(type)) {
                throw new ConfigurationException("Kernel type '" + type + "' is composite and takes child kernels, not parameters");
            }
            throw new ConfigurationException("Unknown kernel type '" + type + "', known types: " + registeredTypes());
        }
        return constructor.apply(parameters);
    }

    /**
     * Creates a composite kernel from child kernels.
     *
     * @throws ConfigurationException if the type is not a registered composite
     */
    public CompositeKernel composite(String type, List<KernelFunction> kernels) {
        Objects.requireNonNull(type, "type cannot be null");
        Function<List<KernelFunction>, ? extends CompositeKernel> constructor = composites.get(type);
        if (constructor == null) {
            throw new ConfigurationException("Unknown composite kernel type '" + type + "'");
        }
        return constructor.apply(kernels);
    }

    public boolean isComposite(String type) {
        return composites.containsKey(type);
    }

    public boolean isRegistered(String type) {
        return constructors.containsKey(type) || composites.containsKey(type);
    }

    /**
     * @return all registered type names, parametric first
     */
    public Set<String> registeredTypes() {
        LinkedHashMap<String, Boolean> all = new LinkedHashMap<>();
        constructors.keySet().forEach(t -> all.put(t, Boolean.TRUE));
        composites.keySet().forEach(t -> all.put(t, Boolean.TRUE));
        return Collections.unmodifiableSet(all.keySet());
    }

    private void requireWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException(
                "The standard kernel factory is read-only, register on KernelFactory.create() instead");
        }
    }

    private static String typeName(Class<?> kernelClass) {
        KernelType annotation = kernelClass.getAnnotation(KernelType.class);
        if (annotation == null) {
            throw new IllegalArgumentException(kernelClass.getName() + " has no @KernelType annotation");
        }
        return annotation.value();
    }
}
