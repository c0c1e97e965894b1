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

import org.apache.commons.math3.util.Decimal64;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link Stationary} and its concrete kernels.
 */
class StationaryKernelTest {

    private static final double[][] X = {
        {0.0, 1.0, -0.5},
        {0.3, -0.2, 0.8},
        {1.5, 0.4, 0.1},
        {-1.1, 0.9, 2.0}
    };

    private static final double[][] X2 = {
        {0.2, 0.2, 0.2},
        {-0.7, 1.3, 0.0}
    };

    private static List<Stationary> kernels(int dim) {
        return List.of(
            new RBF(dim, 1.3, 0.7),
            new Exponential(dim, 0.9, 1.4),
            new Matern12(dim, 1.1, 0.5),
            new Matern32(dim, 2.0, 1.2),
            new Matern52(dim, 0.6, 0.9),
            new Cosine(dim, 1.7, 2.5)
        );
    }

    @Test
    void testRbfConcreteValues() {
        RBF rbf = new RBF(1, 2.0, 1.0);
        double[][] k = rbf.K(new double[][]{{0.0}, {1.0}});
        double off = 2.0 * Math.exp(-0.5);
        assertArrayEquals(new double[]{2.0, off}, k[0], 1e-12);
        assertArrayEquals(new double[]{off, 2.0}, k[1], 1e-12);
    }

    @Test
    void testKdiagMatchesDiagonal() {
        for (Stationary kernel : kernels(3)) {
            double[][] k = kernel.K(X);
            double[] diag = kernel.Kdiag(X);
            for (int i = 0; i < X.length; i++) {
                // the 1e-12 distance jitter leaves r ≈ 1e-6 on the diagonal
                assertEquals(k[i][i], diag[i], 1e-5 * diag[i], kernel.name() + " diagonal " + i);
            }
        }
    }

    @Test
    void testSymmetry() {
        for (Stationary kernel : kernels(3)) {
            double[][] k = kernel.K(X);
            for (int i = 0; i < X.length; i++) {
                for (int j = 0; j < X.length; j++) {
                    assertEquals(k[i][j], k[j][i], 1e-12, kernel.name() + " at " + i + "," + j);
                }
            }
        }
    }

    @Test
    void testArdEquivalence() {
        RBF plain = new RBF(3, 1.5, 0.8);
        RBF ard = new RBF(3, 1.5, new double[]{0.8, 0.8, 0.8}, null);
        RBF broadcast = new RBF(3, 1.5, 0.8, null, true);
        double[][] expected = plain.K(X, X2);
        assertThat(ard.K(X, X2)).isDeepEqualTo(expected);
        assertThat(broadcast.K(X, X2)).isDeepEqualTo(expected);
        assertThat(broadcast.getLengthscales().size()).isEqualTo(3);
        assertThat(plain.getLengthscales().isScalar()).isTrue();
    }

    @Test
    void testArdScalesEachDimension() {
        Matern52 ard = new Matern52(2, 1.0, new double[]{1.0, 100.0}, null);
        Matern52 first = new Matern52(1, 1.0, 1.0);
        double[][] a = {{0.0, 0.0}, {0.5, 0.0}};
        double[][] b = {{0.0, 3.0}, {0.5, -2.0}};
        double[][] k = ard.K(a, b);
        double[][] reference = first.K(new double[][]{{0.0}, {0.5}});
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                assertEquals(reference[i][j], k[i][j], 1e-3);
            }
        }
    }

    @Test
    void testSquareDistIsNonNegative() {
        RBF rbf = new RBF(3, 1.0, 1.0e-4);
        double[][] r2 = rbf.squareDist(X, null);
        for (double[] row : r2) {
            for (double v : row) {
                assertThat(v).isGreaterThanOrEqualTo(0.0);
            }
        }
        for (int i = 0; i < X.length; i++) {
            assertEquals(0.0, r2[i][i], 1e-3);
        }
    }

    @Test
    void testEuclidDistIsJittered() {
        Exponential k = new Exponential(3, 1.0, 1.0);
        double[][] r = k.euclidDist(X, null);
        assertEquals(Math.sqrt(Stationary.DISTANCE_JITTER), r[0][0], 1e-15);
    }

    @Test
    void testExponentialHalvesTheRate() {
        Exponential exp = new Exponential(3, 1.2, 0.9);
        Matern12 m12 = new Matern12(3, 1.2, 1.8);
        double[][] a = exp.K(X, X2);
        double[][] b = m12.K(X, X2);
        for (int i = 0; i < a.length; i++) {
            assertArrayEquals(b[i], a[i], 1e-6);
        }
        assertThat(exp.name()).isEqualTo("exponential");
    }

    @Test
    void testCosineValue() {
        Cosine cos = new Cosine(1, 2.0, 0.5);
        double[][] k = cos.K(new double[][]{{0.0}}, new double[][]{{0.25}});
        assertEquals(2.0 * Math.cos(0.5), k[0][0], 1e-6);
    }

    @Test
    void testPairwiseCovarianceMatchesMatrix() {
        for (Stationary kernel : kernels(3)) {
            double[][] k = kernel.K(X, X2);
            for (int i = 0; i < X.length; i++) {
                for (int j = 0; j < X2.length; j++) {
                    double v = kernel.covariance(field(X[i]), field(X2[j])).doubleValue();
                    assertEquals(k[i][j], v, 1e-9, kernel.name() + " at " + i + "," + j);
                }
            }
        }
    }

    @Test
    void testParameterUpdateIsObserved() {
        RBF rbf = new RBF(3, 1.0, 1.0);
        double before = rbf.K(X)[0][1];
        rbf.getVariance().assign(3.0);
        assertEquals(3.0 * before, rbf.K(X)[0][1], 1e-12);
        assertArrayEquals(new double[]{3.0, 3.0, 3.0, 3.0}, rbf.Kdiag(X), 0.0);
    }

    static Decimal64[] field(double[] row) {
        Decimal64[] out = new Decimal64[row.length];
        for (int i = 0; i < row.length; i++) {
            out[i] = new Decimal64(row[i]);
        }
        return out;
    }
}
