package io.nosqlbench.gpkernels.param;

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

import io.nosqlbench.gpkernels.KernelInvariantException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Parameter}.
 */
class ParameterTest {

    @Test
    void testScalarBroadcast() {
        Parameter p = Parameter.scalar("lengthscales", 0.5, Constraint.POSITIVE);
        assertTrue(p.isScalar());
        assertEquals(0.5, p.value());
        assertArrayEquals(new double[]{0.5, 0.5, 0.5}, p.broadcast(3), 0.0);
    }

    @Test
    void testVectorBroadcastRequiresMatchingLength() {
        Parameter p = Parameter.vector("lengthscales", new double[]{1.0, 2.0}, Constraint.POSITIVE);
        assertArrayEquals(new double[]{1.0, 2.0}, p.broadcast(2), 0.0);
        assertThrows(KernelInvariantException.class, () -> p.broadcast(3));
        assertThrows(IllegalStateException.class, p::value);
    }

    @Test
    void testMatrixRoundTrip() {
        double[][] w = {{1.0, -2.0}, {0.5, 0.0}, {3.0, 1.0}};
        Parameter p = Parameter.matrix("W", w, Constraint.UNCONSTRAINED);
        assertEquals(3, p.getRows());
        assertEquals(2, p.getCols());
        assertThat(p.matrix()).isDeepEqualTo(w);
        assertArrayEquals(new double[]{1.0, -2.0, 0.5, 0.0, 3.0, 1.0}, p.values(), 0.0);
    }

    @Test
    void testAssignValidatesConstraint() {
        Parameter p = Parameter.scalar("variance", 1.0, Constraint.POSITIVE);
        p.assign(2.5);
        assertEquals(2.5, p.value());
        assertThatThrownBy(() -> p.assign(0.0))
            .isInstanceOf(KernelInvariantException.class)
            .hasMessageContaining("variance");
        assertThrows(KernelInvariantException.class, () -> p.assign(Double.NaN));
        assertEquals(2.5, p.value());
    }

    @Test
    void testAssignValidatesShape() {
        Parameter p = Parameter.matrix("W", new double[][]{{1.0}, {2.0}}, Constraint.UNCONSTRAINED);
        assertThrows(KernelInvariantException.class, () -> p.assign(1.0, 2.0, 3.0));
        assertThrows(KernelInvariantException.class, () -> p.assign(new double[][]{{1.0, 2.0}, {3.0, 4.0}}));
        p.assign(new double[][]{{-1.0}, {4.0}});
        assertArrayEquals(new double[]{-1.0, 4.0}, p.values(), 0.0);
    }

    @Test
    void testValuesAreCopies() {
        double[] source = {1.0, 2.0};
        Parameter p = Parameter.vector("kappa", source, Constraint.POSITIVE);
        source[0] = 99.0;
        p.values()[1] = 42.0;
        assertArrayEquals(new double[]{1.0, 2.0}, p.values(), 0.0);
    }

    @Test
    void testRaggedMatrixRejected() {
        assertThrows(KernelInvariantException.class,
            () -> Parameter.matrix("W", new double[][]{{1.0, 2.0}, {3.0}}, Constraint.UNCONSTRAINED));
    }
}
