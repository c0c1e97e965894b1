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
import io.nosqlbench.gpkernels.kernel.ActiveDims;
import io.nosqlbench.gpkernels.kernel.Kernel;
import io.nosqlbench.gpkernels.linalg.Matrices;
import io.nosqlbench.gpkernels.param.Parameter;
import org.apache.commons.math3.RealFieldElement;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Covariances between observations of a function and of its partial derivatives.
///
/// A wrapped base kernel supplies `k(x, x')`. For an observation pair with
/// descriptors `(a)` on the left and `(b)` on the right the entry is
///
/// ```
///   ∂^{|a|} ∂^{|b|} k(x, x') / (∂x_a ∂x'_b)
/// ```
///
/// obtained by automatic differentiation of the base kernel's pairwise formula, so any
/// base kernel with a differentiable pairwise formula can be wrapped.
///
/// Subclasses decide where descriptors come from; see [PreDefinedDifferentialKernel] and
/// [DynamicDifferentialKernel].
public abstract class DifferentialKernel extends Kernel {

    private final Kernel base;

    protected DifferentialKernel(int inputDim, Kernel base, ActiveDims activeDims) {
        super(inputDim, activeDims);
        this.base = Objects.requireNonNull(base, "base kernel cannot be null");
    }

    public Kernel getBase() {
        return base;
    }

    /// @return the base kernel's parameters
    @Override
    public Map<String, Parameter> parameters() {
        return base.parameters();
    }

    /// Always the diagonal of the full covariance. Closed-form diagonals of base kernels
    /// do not depend on the point and would lose every derivative term.
    @Override
    protected double[] computeKdiag(double[][] x) {
        return Matrices.diagonalOf(computeK(x, null));
    }

    /// Not supported: a differential kernel is not itself differentiable.
    ///
    /// @throws KernelConfigurationException always
    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        throw new KernelConfigurationException(getClass().getSimpleName()
            + " has no pairwise formula and cannot be differentiated again");
    }

    /// Differentiates the base kernel over every pair.
    ///
    /// @param locations N x W observation coordinates
    /// @param descriptors one descriptor per row of locations
    /// @param locations2 M x W observation coordinates
    /// @param descriptors2 one descriptor per row of locations2
    /// @param symmetric true when both sides are the same observations, in which case only
    ///     the upper triangle is differentiated
    /// @return N x M covariances
    protected final double[][] differentiate(double[][] locations, List<DerivativeDescriptor> descriptors,
                                             double[][] locations2, List<DerivativeDescriptor> descriptors2,
                                             boolean symmetric) {
        checkDescriptors(locations, descriptors, "X");
        checkDescriptors(locations2, descriptors2, "X2");
        double[][] raw = base.K(locations, symmetric ? null : locations2);
        int n = locations.length;
        int m = locations2.length;
        double[][] k = new double[n][m];
        for (int i = 0; i < n; i++) {
            DerivativeDescriptor left = descriptors.get(i);
            for (int j = symmetric ? i : 0; j < m; j++) {
                DerivativeDescriptor right = descriptors2.get(j);
                DerivativeCase branch = DerivativeCase.of(left, right);
                DerivativeChain chain = new DerivativeChain(base, locations[i], left, locations2[j], right);
                k[i][j] = branch.apply(chain, raw[i][j]);
                if (symmetric) {
                    k[j][i] = k[i][j];
                }
            }
        }
        return k;
    }

    private static void checkDescriptors(double[][] locations, List<DerivativeDescriptor> descriptors, String side) {
        if (descriptors.size() != locations.length) {
            throw new ShapeMismatchException(side + " rows", descriptors.size(), locations.length,
                "one derivative descriptor is needed per observation");
        }
        int width = Matrices.columns(locations, side);
        for (DerivativeDescriptor d : descriptors) {
            if (d.maxDim() >= width) {
                throw new ShapeMismatchException(side + " derivative dimension", width - 1, d.maxDim(),
                    "derivative dimension outside the observation coordinates");
            }
        }
    }
}
