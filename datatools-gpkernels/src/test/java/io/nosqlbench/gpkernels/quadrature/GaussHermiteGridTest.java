package io.nosqlbench.gpkernels.quadrature;

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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link GaussHermiteGrid} and {@link MultivariateNormalQuadrature}.
 */
class GaussHermiteGridTest {

    @Test
    void testOneDimensionalRule() {
        double[][] rule = GaussHermiteGrid.hermgauss(2);
        assertEquals(Math.sqrt(0.5), Math.abs(rule[0][0]), 1e-12);
        assertEquals(0.0, rule[0][0] + rule[0][1], 1e-12);
        assertEquals(Math.sqrt(Math.PI) / 2.0, rule[1][0], 1e-12);
        assertEquals(Math.sqrt(Math.PI) / 2.0, rule[1][1], 1e-12);
    }

    @Test
    void testWeightsAreNormalized() {
        for (int d = 1; d <= 3; d++) {
            GaussHermiteGrid grid = GaussHermiteGrid.of(6, d);
            double sum = 0.0;
            for (double w : grid.weights()) {
                sum += w;
            }
            assertEquals(1.0, sum, 1e-12, "dimension " + d);
            assertThat(grid.size()).isEqualTo((int) Math.pow(6, d));
        }
    }

    @Test
    void testLastDimensionVariesFastest() {
        GaussHermiteGrid grid = GaussHermiteGrid.of(3, 2);
        double[][] points = grid.points();
        assertEquals(points[0][0], points[1][0], 0.0);
        assertThat(points[0][1]).isNotEqualTo(points[1][1]);
        assertThat(points[3][0]).isNotEqualTo(points[0][0]);
    }

    @Test
    void testGridsAreCached() {
        assertThat(GaussHermiteGrid.of(5, 2)).isSameAs(GaussHermiteGrid.of(5, 2));
        assertThat(GaussHermiteGrid.of(5, 2)).isNotSameAs(GaussHermiteGrid.of(5, 3));
    }

    @Test
    void testRejectsInvalidSizes() {
        assertThatThrownBy(() -> GaussHermiteGrid.of(0, 2)).isInstanceOf(KernelConfigurationException.class);
        assertThatThrownBy(() -> GaussHermiteGrid.of(3, 0)).isInstanceOf(KernelConfigurationException.class);
        assertThatThrownBy(() -> GaussHermiteGrid.of(100, 6))
            .isInstanceOf(KernelConfigurationException.class)
            .hasMessageContaining("too large");
    }

    @Test
    void testSecondMomentsOfCorrelatedNormal() {
        double[][] mu = {{0.5, -1.0}};
        double[][][] cov = {{{0.4, 0.1}, {0.1, 0.3}}};
        double[][] moments = MultivariateNormalQuadrature.integrate(points -> {
            double[][] out = new double[points.length][3];
            for (int p = 0; p < points.length; p++) {
                out[p][0] = points[p][0] * points[p][0];
                out[p][1] = points[p][0] * points[p][1];
                out[p][2] = points[p][1] * points[p][1];
            }
            return out;
        }, mu, cov, 4, 2, 3);
        assertEquals(0.25 + 0.4, moments[0][0], 1e-12);
        assertEquals(-0.5 + 0.1, moments[0][1], 1e-12);
        assertEquals(1.0 + 0.3, moments[0][2], 1e-12);
    }
}
