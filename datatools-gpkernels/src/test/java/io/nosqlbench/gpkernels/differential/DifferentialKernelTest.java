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
import io.nosqlbench.gpkernels.kernel.Add;
import io.nosqlbench.gpkernels.kernel.Kernel;
import io.nosqlbench.gpkernels.kernel.Linear;
import io.nosqlbench.gpkernels.kernel.RBF;
import org.apache.commons.math3.util.Decimal64;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link PreDefinedDifferentialKernel} and {@link DynamicDifferentialKernel},
 * checked against analytic derivatives of the squared exponential kernel.
 */
class DifferentialKernelTest {

    private static final double VARIANCE = 1.5;
    private static final double LENGTHSCALE = 0.7;

    private static final double[][] X = {{0.2}, {0.9}};
    private static final double[][] X2 = {{-0.4}, {0.5}, {0.9}};

    /// n-th derivative of VARIANCE·exp(-r²/2ℓ²) with respect to r.
    private static double rbfDerivative(int n, double r) {
        double l2 = LENGTHSCALE * LENGTHSCALE;
        double e = VARIANCE * Math.exp(-0.5 * r * r / l2);
        switch (n) {
            case 0:
                return e;
            case 1:
                return -r / l2 * e;
            case 2:
                return (r * r / (l2 * l2) - 1.0 / l2) * e;
            case 3:
                return (3.0 * r / (l2 * l2) - r * r * r / (l2 * l2 * l2)) * e;
            default:
                return (3.0 / (l2 * l2) - 6.0 * r * r / (l2 * l2 * l2) + Math.pow(r, 4) / (l2 * l2 * l2 * l2)) * e;
        }
    }

    private static DerivativeDescriptor along(int count) {
        switch (count) {
            case 0:
                return DerivativeDescriptor.VALUE;
            case 1:
                return DerivativeDescriptor.first(0);
            default:
                return DerivativeDescriptor.second(0, 0);
        }
    }

    private static RBF rbf() {
        return new RBF(1, VARIANCE, LENGTHSCALE);
    }

    @Test
    void testZeroOrderReproducesBaseKernel() {
        RBF base = rbf();
        PreDefinedDifferentialKernel k = new PreDefinedDifferentialKernel(1, base,
            Collections.nCopies(X.length, DerivativeDescriptor.VALUE),
            Collections.nCopies(X2.length, DerivativeDescriptor.VALUE));
        assertThat(k.K(X, X2)).isDeepEqualTo(base.K(X, X2));
        assertThat(k.K(X)).isDeepEqualTo(base.K(X));
    }

    @Test
    void testEveryBranchMatchesAnalyticDerivative() {
        for (int left = 0; left <= 2; left++) {
            for (int right = 0; right <= 2; right++) {
                PreDefinedDifferentialKernel k = new PreDefinedDifferentialKernel(1, rbf(),
                    Collections.nCopies(X.length, along(left)),
                    Collections.nCopies(X2.length, along(right)));
                double[][] cov = k.K(X, X2);
                double sign = right % 2 == 0 ? 1.0 : -1.0;
                for (int i = 0; i < X.length; i++) {
                    for (int j = 0; j < X2.length; j++) {
                        double r = X[i][0] - X2[j][0];
                        assertEquals(sign * rbfDerivative(left + right, r), cov[i][j], 1e-10,
                            "orders (" + left + ", " + right + ") at " + i + "," + j);
                    }
                }
            }
        }
    }

    @Test
    void testFourthOrderAtCoincidentPoints() {
        PreDefinedDifferentialKernel k = new PreDefinedDifferentialKernel(1, rbf(),
            List.of(DerivativeDescriptor.second(0, 0)), List.of(DerivativeDescriptor.second(0, 0)));
        double l2 = LENGTHSCALE * LENGTHSCALE;
        assertEquals(3.0 * VARIANCE / (l2 * l2), k.K(new double[][]{{0.4}}, new double[][]{{0.4}})[0][0], 1e-9);
    }

    @Test
    void testMixedDimensions() {
        double l0 = 0.7;
        double l1 = 1.3;
        RBF base = new RBF(2, VARIANCE, new double[]{l0, l1}, null);
        double[][] a = {{0.1, 0.4}};
        double[][] b = {{-0.3, 1.0}};
        double r0 = a[0][0] - b[0][0];
        double r1 = a[0][1] - b[0][1];
        double e = base.K(a, b)[0][0];

        PreDefinedDifferentialKernel cross = new PreDefinedDifferentialKernel(2, base,
            List.of(DerivativeDescriptor.first(0)), List.of(DerivativeDescriptor.first(1)));
        assertEquals(-r0 * r1 / (l0 * l0 * l1 * l1) * e, cross.K(a, b)[0][0], 1e-10);

        PreDefinedDifferentialKernel mixedLeft = new PreDefinedDifferentialKernel(2, base,
            List.of(DerivativeDescriptor.second(0, 1)), List.of(DerivativeDescriptor.VALUE));
        assertEquals(r0 * r1 / (l0 * l0 * l1 * l1) * e, mixedLeft.K(a, b)[0][0], 1e-10);
    }

    @Test
    void testSymmetricPathMatchesFullEvaluation() {
        double[][] x = {{0.1, 0.4}, {-0.3, 1.0}, {0.8, -0.2}, {0.5, 0.5}};
        List<DerivativeDescriptor> d = List.of(
            DerivativeDescriptor.VALUE,
            DerivativeDescriptor.first(1),
            DerivativeDescriptor.second(0, 1),
            DerivativeDescriptor.second(1, 1));
        RBF base = new RBF(2, VARIANCE, new double[]{0.9, 1.4}, null);
        PreDefinedDifferentialKernel k = new PreDefinedDifferentialKernel(2, base, d, d);
        double[][] symmetric = k.K(x);
        double[][] full = k.K(x, x);
        for (int i = 0; i < x.length; i++) {
            for (int j = 0; j < x.length; j++) {
                assertEquals(full[i][j], symmetric[i][j], 1e-10, "at " + i + "," + j);
            }
        }
    }

    @Test
    void testKdiagUsesFullCovariance() {
        PreDefinedDifferentialKernel k = new PreDefinedDifferentialKernel(1, rbf(),
            new int[][]{{0}, {1, 0}, {2, 0, 0}}, null);
        double l2 = LENGTHSCALE * LENGTHSCALE;
        double[] diag = k.Kdiag(new double[][]{{0.3}, {-0.1}, {1.2}});
        assertEquals(VARIANCE, diag[0], 1e-12);
        assertEquals(VARIANCE / l2, diag[1], 1e-10);
        assertEquals(3.0 * VARIANCE / (l2 * l2), diag[2], 1e-9);
    }

    @Test
    void testDifferentiatesCombinations() {
        Kernel base = new Add(List.of(rbf(), new Linear(1, 0.5)));
        PreDefinedDifferentialKernel k = new PreDefinedDifferentialKernel(1, base,
            Collections.nCopies(X.length, DerivativeDescriptor.first(0)),
            Collections.nCopies(X2.length, DerivativeDescriptor.VALUE));
        double[][] cov = k.K(X, X2);
        for (int i = 0; i < X.length; i++) {
            for (int j = 0; j < X2.length; j++) {
                double expected = rbfDerivative(1, X[i][0] - X2[j][0]) + 0.5 * X2[j][0];
                assertEquals(expected, cov[i][j], 1e-10);
            }
        }
        assertThat(k.parameters()).containsOnlyKeys("rbf.variance", "rbf.lengthscales", "linear.variance");
    }

    @Test
    void testDynamicMatchesPreDefined() {
        double[][] locations = {{0.1, 0.4}, {-0.3, 1.0}, {0.8, -0.2}, {0.5, 0.5}};
        double[][] masks = {{0, 1}, {0, 0}, {2, 0}, {1, 1}};
        double[][] inputs = new double[locations.length][4];
        for (int i = 0; i < locations.length; i++) {
            System.arraycopy(locations[i], 0, inputs[i], 0, 2);
            System.arraycopy(masks[i], 0, inputs[i], 2, 2);
        }
        RBF base = new RBF(2, VARIANCE, new double[]{0.9, 1.4}, null);
        DynamicDifferentialKernel dynamic = new DynamicDifferentialKernel(4, base, 2);
        PreDefinedDifferentialKernel fixed = new PreDefinedDifferentialKernel(2, base, List.of(
            DerivativeDescriptor.first(1),
            DerivativeDescriptor.VALUE,
            DerivativeDescriptor.second(0, 0),
            DerivativeDescriptor.second(0, 1)), null);
        assertThat(dynamic.K(inputs)).isDeepEqualTo(fixed.K(locations));
        assertThat(dynamic.Kdiag(inputs)).containsExactly(fixed.Kdiag(locations));

        double[][] others = {{0.0, 0.0, 0, 1}, {1.0, -1.0, 1, 0}};
        PreDefinedDifferentialKernel fixedCross = new PreDefinedDifferentialKernel(2, base,
            fixed.getDescriptorsX(), List.of(DerivativeDescriptor.first(1), DerivativeDescriptor.first(0)));
        assertThat(dynamic.K(inputs, others))
            .isDeepEqualTo(fixedCross.K(locations, new double[][]{{0.0, 0.0}, {1.0, -1.0}}));
    }

    @Test
    void testDynamicRejectsThirdOrder() {
        DynamicDifferentialKernel dynamic = new DynamicDifferentialKernel(4, new RBF(2), 2);
        assertThatThrownBy(() -> dynamic.K(new double[][]{{0.0, 0.0, 2, 1}}))
            .isInstanceOf(KernelConfigurationException.class)
            .hasMessageContaining("order 3");
    }

    @Test
    void testDynamicRejectsNarrowInput() {
        DynamicDifferentialKernel dynamic = new DynamicDifferentialKernel(3, new RBF(2), 2);
        assertThatThrownBy(() -> dynamic.K(new double[][]{{0.0, 0.0, 1}}))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("input columns");
    }

    @Test
    void testDynamicRejectsWideInput() {
        DynamicDifferentialKernel dynamic = new DynamicDifferentialKernel(5, new RBF(2), 2);
        assertThatThrownBy(() -> dynamic.K(new double[][]{{0.0, 0.0, 7.0, 1, 0}}))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("input columns");
    }

    @Test
    void testDescriptorShapeErrors() {
        PreDefinedDifferentialKernel tooFew = new PreDefinedDifferentialKernel(1, rbf(),
            List.of(DerivativeDescriptor.VALUE), null);
        assertThatThrownBy(() -> tooFew.K(X))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("X rows");

        PreDefinedDifferentialKernel outside = new PreDefinedDifferentialKernel(1, rbf(),
            Collections.nCopies(X.length, DerivativeDescriptor.first(1)), null);
        assertThatThrownBy(() -> outside.K(X))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("derivative dimension");
    }

    @Test
    void testDifferentialKernelsAreNotDifferentiable() {
        PreDefinedDifferentialKernel inner = new PreDefinedDifferentialKernel(1, rbf(),
            Collections.nCopies(X.length, DerivativeDescriptor.first(0)), null);
        assertThatThrownBy(() -> inner.covariance(new Decimal64[]{new Decimal64(0.1)}, new Decimal64[]{new Decimal64(0.2)}))
            .isInstanceOf(KernelConfigurationException.class);

        PreDefinedDifferentialKernel outer = new PreDefinedDifferentialKernel(1, inner,
            Collections.nCopies(X.length, DerivativeDescriptor.first(0)), null);
        assertThatThrownBy(() -> outer.K(X)).isInstanceOf(KernelConfigurationException.class);
    }
}
