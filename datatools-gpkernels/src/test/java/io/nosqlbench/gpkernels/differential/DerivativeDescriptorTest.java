package io.nosqlbench.gpkernels.differential;

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

import io.nosqlbench.gpkernels.KernelConfigurationException;
import io.nosqlbench.gpkernels.ShapeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link DerivativeDescriptor} and {@link DerivativeCase}.
 */
class DerivativeDescriptorTest {

    @Test
    void testFromInfoMatrix() {
        List<DerivativeDescriptor> d = DerivativeDescriptor.fromInfoMatrix(new int[][]{
            {2, 0, 1},
            {1, 1, -1},
            {0, -1, -1},
            {1, 2}
        });
        assertThat(d).containsExactly(
            DerivativeDescriptor.second(0, 1),
            DerivativeDescriptor.first(1),
            DerivativeDescriptor.VALUE,
            DerivativeDescriptor.first(2));
    }

    @Test
    void testShortRowsArePadded() {
        List<DerivativeDescriptor> d = DerivativeDescriptor.fromInfoMatrix(new int[][]{{0}});
        assertThat(d.get(0).toInfoRow()).containsExactly(0, -1, -1);
    }

    @Test
    void testMalformedInfoRows() {
        assertThrows(ShapeMismatchException.class,
            () -> DerivativeDescriptor.fromInfoMatrix(new int[][]{{}}));
        assertThrows(ShapeMismatchException.class,
            () -> DerivativeDescriptor.fromInfoMatrix(new int[][]{{1, 0, 0, 0}}));
        assertThatThrownBy(() -> DerivativeDescriptor.fromInfoMatrix(new int[][]{{3, 0, 0}}))
            .isInstanceOf(KernelConfigurationException.class)
            .hasMessageContaining("order 3");
        assertThrows(KernelConfigurationException.class,
            () -> DerivativeDescriptor.fromInfoMatrix(new int[][]{{1, -1, -1}}));
    }

    @Test
    void testUnusedSlotsNormalized() {
        DerivativeDescriptor d = new DerivativeDescriptor(1, 4, 7);
        assertEquals(4, d.firstDim());
        assertEquals(-1, d.secondDim());
        assertThat(new DerivativeDescriptor(0, 2, 3)).isEqualTo(DerivativeDescriptor.VALUE);
    }

    @Test
    void testFromMask() {
        assertThat(DerivativeDescriptor.fromMask(new double[]{0, 0})).isEqualTo(DerivativeDescriptor.VALUE);
        assertThat(DerivativeDescriptor.fromMask(new double[]{0, 1})).isEqualTo(DerivativeDescriptor.first(1));
        assertThat(DerivativeDescriptor.fromMask(new double[]{2, 0})).isEqualTo(DerivativeDescriptor.second(0, 0));
        assertThat(DerivativeDescriptor.fromMask(new double[]{1, 1})).isEqualTo(DerivativeDescriptor.second(0, 1));
        assertThat(DerivativeDescriptor.fromMask(new double[]{0, 0, 2})).isEqualTo(DerivativeDescriptor.second(2, 2));
    }

    @Test
    void testFromMaskWithinRow() {
        double[] row = {0.3, -1.2, 0.0, 1.0};
        assertThat(DerivativeDescriptor.fromMask(row, 2, 2)).isEqualTo(DerivativeDescriptor.first(1));
    }

    @Test
    void testInvalidMasks() {
        assertThatThrownBy(() -> DerivativeDescriptor.fromMask(new double[]{1, 2}))
            .isInstanceOf(KernelConfigurationException.class)
            .hasMessageContaining("order 3");
        assertThrows(KernelConfigurationException.class, () -> DerivativeDescriptor.fromMask(new double[]{-1, 0}));
        assertThrows(KernelConfigurationException.class, () -> DerivativeDescriptor.fromMask(new double[]{0.5, 0}));
    }

    @Test
    void testDispatchTable() {
        assertThat(DerivativeCase.of(0, 0)).isEqualTo(DerivativeCase.VALUE);
        assertThat(DerivativeCase.of(2, 1)).isEqualTo(DerivativeCase.D2_LEFT_D_RIGHT);
        assertThat(DerivativeCase.of(DerivativeDescriptor.first(0), DerivativeDescriptor.second(1, 1)))
            .isEqualTo(DerivativeCase.D_LEFT_D2_RIGHT);
        assertThat(DerivativeCase.D2_LEFT_D2_RIGHT.slotOrders()).containsExactly(1, 1, 1, 1);
        assertThat(DerivativeCase.D_RIGHT.slotOrders()).containsExactly(0, 0, 1, 0);
        assertThat(DerivativeCase.D2_RIGHT.order()).isEqualTo(2);
        for (int l = 0; l <= 2; l++) {
            for (int r = 0; r <= 2; r++) {
                DerivativeCase c = DerivativeCase.of(l, r);
                assertThat(c.leftCount()).isEqualTo(l);
                assertThat(c.rightCount()).isEqualTo(r);
            }
        }
        assertThrows(KernelConfigurationException.class, () -> DerivativeCase.of(3, 0));
        assertThrows(KernelConfigurationException.class, () -> DerivativeCase.of(0, -1));
    }
}
