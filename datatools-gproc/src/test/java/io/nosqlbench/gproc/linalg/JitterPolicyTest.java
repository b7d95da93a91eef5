package io.nosqlbench.gproc.linalg;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class JitterPolicyTest {

    @Test
    void testNoneIsDisabled() {
        assertFalse(JitterPolicy.none().isEnabled());
        assertThrows(IllegalArgumentException.class, () -> JitterPolicy.none().jitterFor(1));
    }

    @Test
    void testEscalatingSchedule() {
        JitterPolicy policy = JitterPolicy.escalating(1e-6, 3, 100.0);
        assertTrue(policy.isEnabled());
        assertEquals(1e-6, policy.jitterFor(1), 1e-20);
        assertEquals(1e-4, policy.jitterFor(2), 1e-18);
        assertEquals(1e-2, policy.jitterFor(3), 1e-16);
        assertThrows(IllegalArgumentException.class, () -> policy.jitterFor(4));
        assertEquals(JitterPolicy.escalating(1e-6, 3, 100.0), policy);
    }

    @Test
    void testDefaults() {
        JitterPolicy policy = JitterPolicy.escalating();
        assertEquals(JitterPolicy.DEFAULT_INITIAL, policy.getInitial());
        assertEquals(JitterPolicy.DEFAULT_MAX_ATTEMPTS, policy.getMaxAttempts());
        assertEquals(JitterPolicy.DEFAULT_GROWTH, policy.getGrowth());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> JitterPolicy.escalating(0.0, 3, 10.0));
        assertThrows(IllegalArgumentException.class, () -> JitterPolicy.escalating(1e-8, 0, 10.0));
        assertThrows(IllegalArgumentException.class, () -> JitterPolicy.escalating(1e-8, 3, 0.5));
        assertThrows(IllegalArgumentException.class, () -> JitterPolicy.escalating(Double.NaN, 3, 10.0));
    }
}
