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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class KernelFactoryTest {

    @KernelType("constant")
    public static final class ConstantKernel extends AbstractKernel {
        private final double value;

        public ConstantKernel(KernelParameters parameters) {
            super(parameters, "value");
            this.value = parameters.require("value");
        }

        @Override
        public double covariance(double[] a, double[] b) {
            Vectors.requireSameLength(a, b);
            return value;
        }
    }

    @Test
    void testStandardTypesAreRegistered() {
        KernelFactory factory = KernelFactory.standard();
        for (String type : List.of("exponentiated_quadratic", "matern32", "matern52", "periodic",
            "linear", "polynomial", "white_noise", "sum", "product")) {
            assertTrue(factory.isRegistered(type), type);
        }
        assertTrue(factory.isComposite("sum"));
        assertFalse(factory.isComposite("linear"));
    }

    @Test
    void testCreateParametricKernel() {
        KernelFunction kernel = KernelFactory.standard().create("exponentiated_quadratic",
            KernelParameters.of("variance", 2.0, "lengthscale", 0.5));
        assertInstanceOf(ExponentiatedQuadraticKernel.class, kernel);
        assertEquals(new ExponentiatedQuadraticKernel(2.0, 0.5), kernel);
    }

    @Test
    void testCreateComposite() {
        CompositeKernel kernel = KernelFactory.standard().composite("product",
            List.of(new LinearKernel(1.0), new WhiteNoiseKernel(1.0)));
        assertInstanceOf(ProductKernel.class, kernel);
        assertEquals("product", kernel.getKernelType());
    }

    @Test
    void testUnknownAndMisusedTypes() {
        KernelFactory factory = KernelFactory.standard();
        ConfigurationException unknown = assertThrows(ConfigurationException.class,
            () -> factory.create("rational_quadratic", KernelParameters.empty()));
        assertTrue(unknown.getMessage().contains("rational_quadratic"));
        assertThrows(ConfigurationException.class, () -> factory.create("sum", KernelParameters.empty()));
        assertThrows(ConfigurationException.class, () -> factory.composite("linear", List.of(new LinearKernel(1.0))));
    }

    @Test
    void testInvalidParametersPropagate() {
        assertThrows(ConfigurationException.class, () -> KernelFactory.standard()
            .create("matern52", KernelParameters.of("variance", 1.0, "lengthscale", 0.0)));
    }

    @Test
    void testStandardFactoryIsReadOnly() {
        KernelFactory standard = KernelFactory.standard();
        assertTrue(standard.isReadOnly());
        assertThrows(UnsupportedOperationException.class,
            () -> standard.register(ConstantKernel.class, ConstantKernel::new));
        assertThrows(UnsupportedOperationException.class,
            () -> standard.registerComposite(SumKernel.class, SumKernel::new));
        assertFalse(standard.isRegistered("constant"));
        assertFalse(KernelFactory.create().isReadOnly());
    }

    @Test
    void testMisspelledParameterIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> KernelFactory.standard()
            .create("polynomial", KernelParameters.of("variance", 1.0, "degree", 2.0, "weight_varience", 5.0)));
        assertTrue(e.getMessage().contains("weight_varience"));
        assertTrue(e.getMessage().contains("polynomial"));
    }

    @Test
    void testCustomRegistrationIsLocal() {
        KernelFactory factory = KernelFactory.create();
        factory.register(ConstantKernel.class, ConstantKernel::new);

        KernelFunction kernel = factory.create("constant", KernelParameters.of("value", 3.0));
        assertEquals(3.0, kernel.covariance(new double[]{1.0}, new double[]{5.0}));
        assertEquals("constant", kernel.getKernelType());
        assertFalse(KernelFactory.standard().isRegistered("constant"));

        assertThrows(IllegalArgumentException.class,
            () -> factory.register(ConstantKernel.class, ConstantKernel::new));
    }
}
