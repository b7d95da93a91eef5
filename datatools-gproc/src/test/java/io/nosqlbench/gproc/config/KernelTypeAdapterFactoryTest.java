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
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.gproc.ConfigurationException;
import io.nosqlbench.gproc.kernel.ExponentiatedQuadraticKernel;
import io.nosqlbench.gproc.kernel.KernelFactory;
import io.nosqlbench.gproc.kernel.KernelFactoryTest;
import io.nosqlbench.gproc.kernel.KernelFunction;
import io.nosqlbench.gproc.kernel.Matern52Kernel;
import io.nosqlbench.gproc.kernel.PolynomialKernel;
import io.nosqlbench.gproc.kernel.ProductKernel;
import io.nosqlbench.gproc.kernel.WhiteNoiseKernel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class KernelTypeAdapterFactoryTest {

    private final Gson gson = GprocGsonConfig.compactGson();

    @Test
    void testTypeFieldComesFirst() {
        String json = gson.toJson(new ExponentiatedQuadraticKernel(1.5, 0.25), KernelFunction.class);
        assertEquals("{\"type\":\"exponentiated_quadratic\",\"variance\":1.5,\"lengthscale\":0.25}", json);
    }

    @Test
    void testCompositeLayout() {
        KernelFunction kernel = new ProductKernel(new Matern52Kernel(1.0, 2.0), new WhiteNoiseKernel(0.5));
        JsonObject tree = JsonParser.parseString(gson.toJson(kernel, KernelFunction.class)).getAsJsonObject();
        assertEquals("product", tree.get("type").getAsString());
        assertEquals(2, tree.getAsJsonArray("kernels").size());
        assertEquals("matern52", tree.getAsJsonArray("kernels").get(0).getAsJsonObject().get("type").getAsString());
    }

    @Test
    void testReadsPolymorphically() {
        KernelFunction kernel = gson.fromJson(
            "{\"type\":\"polynomial\",\"variance\":1.0,\"degree\":2,\"bias_variance\":0.0}", KernelFunction.class);
        assertInstanceOf(PolynomialKernel.class, kernel);
        assertEquals(2, ((PolynomialKernel) kernel).getDegree());
        assertEquals(4.0, kernel.covariance(new double[]{1.0, 1.0}, new double[]{1.0, 1.0}), 1e-12);
    }

    @Test
    void testConcreteTargetTypeIsChecked() {
        assertInstanceOf(WhiteNoiseKernel.class,
            gson.fromJson("{\"type\":\"white_noise\",\"variance\":1.0}", WhiteNoiseKernel.class));
        assertThrows(ConfigurationException.class,
            () -> gson.fromJson("{\"type\":\"white_noise\",\"variance\":1.0}", Matern52Kernel.class));
    }

    @Test
    void testNullKernel() {
        assertNull(gson.fromJson("null", KernelFunction.class));
        assertEquals("null", gson.toJson(null, KernelFunction.class));
    }

    @Test
    void testCustomFactory() {
        KernelFactory factory = KernelFactory.create();
        factory.register(KernelFactoryTest.ConstantKernel.class, KernelFactoryTest.ConstantKernel::new);
        Gson custom = GprocGsonConfig.builder()
            .registerTypeAdapterFactory(KernelTypeAdapterFactory.create(factory))
            .create();
        KernelFunction kernel = custom.fromJson("{\"type\":\"constant\",\"value\":2.5}", KernelFunction.class);
        assertEquals(2.5, kernel.covariance(new double[]{0.0}, new double[]{9.0}));
    }
}
