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

import io.nosqlbench.gpkernels.kernel.ActiveDims;
import io.nosqlbench.gpkernels.kernel.Kernel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/// Differential kernel whose derivative layout is fixed when it is constructed.
///
/// Descriptors for the rows of `X` and of `X2` are supplied up front. `K(X)` uses
/// the `X` descriptors on both sides.
///
/// ```java
/// Kernel rbf = new RBF(1);
/// Kernel k = new PreDefinedDifferentialKernel(1, rbf,
///     DerivativeDescriptor.fromInfoMatrix(new int[][]{{0}, {1, 0}}),
///     DerivativeDescriptor.fromInfoMatrix(new int[][]{{2, 0, 0}}));
/// double[][] cov = k.K(x, x2);   // [f(x0), f'(x1)] against [f''(x2_0)]
/// ```
public class PreDefinedDifferentialKernel extends DifferentialKernel {

    private static final Logger logger = LogManager.getLogger(PreDefinedDifferentialKernel.class);

    private final List<DerivativeDescriptor> descriptorsX;
    private final List<DerivativeDescriptor> descriptorsX2;

    public PreDefinedDifferentialKernel(int inputDim, Kernel base, List<DerivativeDescriptor> descriptorsX,
                                        List<DerivativeDescriptor> descriptorsX2) {
        this(inputDim, base, descriptorsX, descriptorsX2, null);
    }

    /// @param inputDim width of the observation coordinates
    /// @param base the kernel being differentiated
    /// @param descriptorsX one descriptor per row of X
    /// @param descriptorsX2 one descriptor per row of X2, or null to reuse descriptorsX
    /// @param activeDims the coordinate columns, or null for the first inputDim
    public PreDefinedDifferentialKernel(int inputDim, Kernel base, List<DerivativeDescriptor> descriptorsX,
                                        List<DerivativeDescriptor> descriptorsX2, ActiveDims activeDims) {
        super(inputDim, base, activeDims);
        this.descriptorsX = List.copyOf(Objects.requireNonNull(descriptorsX, "descriptorsX cannot be null"));
        this.descriptorsX2 = descriptorsX2 == null ? this.descriptorsX : List.copyOf(descriptorsX2);
    }

    /// @param inputDim width of the observation coordinates
    /// @param base the kernel being differentiated
    /// @param infoX derivative information matrix for X
    /// @param infoX2 derivative information matrix for X2, or null to reuse infoX
    public PreDefinedDifferentialKernel(int inputDim, Kernel base, int[][] infoX, int[][] infoX2) {
        this(inputDim, base, DerivativeDescriptor.fromInfoMatrix(infoX),
            infoX2 == null ? null : DerivativeDescriptor.fromInfoMatrix(infoX2), null);
    }

    public List<DerivativeDescriptor> getDescriptorsX() {
        return descriptorsX;
    }

    public List<DerivativeDescriptor> getDescriptorsX2() {
        return descriptorsX2;
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        boolean symmetric = x2 == null;
        double[][] right = symmetric ? x : x2;
        List<DerivativeDescriptor> rightDescriptors = symmetric ? descriptorsX : descriptorsX2;
        logger.debug("Differentiating {} over {} x {} observations", getBase().name(), x.length, right.length);
        return differentiate(x, descriptorsX, right, rightDescriptors, symmetric);
    }
}
