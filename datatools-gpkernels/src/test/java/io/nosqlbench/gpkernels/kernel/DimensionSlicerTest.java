package io.nosqlbench.gpkernels.kernel;

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

import io.nosqlbench.gpkernels.ShapeMismatchException;
import org.apache.commons.math3.util.Decimal64;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for {@link DimensionSlicer} and {@link ActiveDims}.
 */
class DimensionSlicerTest {

    private static final double[][] WIDE = {
        {0.0, 1.0, 2.0, 3.0, 4.0},
        {0.5, -1.0, 0.7, 1.1, -2.0},
        {1.5, 0.2, -0.3, 0.0, 0.9}
    };

    @Test
    void testSingleActiveColumnMatchesExtractedColumn() {
        RBF sliced = new RBF(1, 1.3, 0.6, ActiveDims.of(2), false);
        RBF direct = new RBF(1, 1.3, 0.6);
        double[][] column = CombinationTest.column(WIDE, 2);
        assertThat(sliced.K(WIDE)).isDeepEqualTo(direct.K(column));
        assertThat(sliced.Kdiag(WIDE)).containsExactly(direct.Kdiag(column));
        assertThat(sliced.K(column, column, true)).isDeepEqualTo(direct.K(column, column));
    }

    @Test
    void testFullRangeIsNotCopied() {
        DimensionSlicer slicer = new DimensionSlicer(5, ActiveDims.first(5));
        assertSame(WIDE, slicer.slice(WIDE));
    }

    @Test
    void testRangeSlicing() {
        DimensionSlicer slicer = new DimensionSlicer(2, ActiveDims.range(1, 3));
        double[][] out = slicer.slice(WIDE);
        assertArrayEquals(new double[]{1.0, 2.0}, out[0], 0.0);
        assertArrayEquals(new double[]{0.2, -0.3}, out[2], 0.0);
    }

    @Test
    void testRangeOpenEndedPastWidth() {
        DimensionSlicer slicer = new DimensionSlicer(3, ActiveDims.first(3));
        assertThatThrownBy(() -> slicer.slice(new double[][]{{1.0, 2.0}}))
            .isInstanceOf(ShapeMismatchException.class)
            .satisfies(e -> {
                ShapeMismatchException sme = (ShapeMismatchException) e;
                assertThat(sme.getExpected()).isEqualTo(3);
                assertThat(sme.getActual()).isEqualTo(2);
            });
    }

    @Test
    void testGatherSlicingKeepsOrder() {
        DimensionSlicer slicer = new DimensionSlicer(3, ActiveDims.of(4, 0, 2));
        double[][] out = slicer.slice(WIDE);
        assertArrayEquals(new double[]{4.0, 0.0, 2.0}, out[0], 0.0);
        assertThatThrownBy(() -> slicer.slice(new double[][]{{1.0, 2.0, 3.0}}))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void testCovarianceSlicing() {
        double[][][] cov = {{
            {1.0, 0.1, 0.2},
            {0.1, 2.0, 0.3},
            {0.2, 0.3, 3.0}
        }};
        double[][][] out = new DimensionSlicer(2, ActiveDims.of(0, 2)).sliceCovariance(cov);
        assertArrayEquals(new double[]{1.0, 0.2}, out[0][0], 0.0);
        assertArrayEquals(new double[]{0.2, 3.0}, out[0][1], 0.0);
    }

    @Test
    void testRowSlicing() {
        Decimal64[] row = StationaryKernelTest.field(WIDE[1]);
        Decimal64[] out = new DimensionSlicer(2, ActiveDims.of(3, 1)).sliceRow(row);
        assertThat(out).containsExactly(new Decimal64(1.1), new Decimal64(-1.0));
    }

    @Test
    void testExpandDiagonal() {
        double[][][] full = DimensionSlicer.expandDiagonal(new double[][]{{1.0, 2.0}});
        assertArrayEquals(new double[]{1.0, 0.0}, full[0][0], 0.0);
        assertArrayEquals(new double[]{0.0, 2.0}, full[0][1], 0.0);
    }

    @Test
    void testActiveDimsDescriptions() {
        assertThat(ActiveDims.first(3).isRange()).isTrue();
        assertThat(ActiveDims.range(2, 5).indices()).containsExactly(2, 3, 4);
        assertThat(ActiveDims.of(1, 4).maxIndex()).isEqualTo(4);
        assertThat(ActiveDims.of(1, 4)).isEqualTo(ActiveDims.of(1, 4));
        assertThat(ActiveDims.range(0, 2).toString()).isEqualTo("ActiveDims[0:2]");
    }
}
