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

import io.nosqlbench.gpkernels.KernelInvariantException;
import io.nosqlbench.gpkernels.ShapeMismatchException;
import io.nosqlbench.gpkernels.kernel.ActiveDims;
import io.nosqlbench.gpkernels.kernel.Kernel;
import io.nosqlbench.gpkernels.linalg.Matrices;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Differential kernel that reads each observation's derivative layout from its input row.
///
/// The first `obsDims` columns of a row are the observation coordinates and the last
/// `obsDims` columns count how often the observation was differentiated along each
/// coordinate:
///
/// ```
/// x = [[a, b, 0, 1],      ∂f/∂x_2  at (a, b)
///      [c, d, 0, 0],      f        at (c, d)
///      [e, f, 2, 0]]      ∂²f/∂x_1² at (e, f)
/// ```
///
/// ## Limits
///
/// At most second derivatives per observation. A mask summing above 2 is rejected with a
/// [io.nosqlbench.gpkernels.KernelConfigurationException].
public class DynamicDifferentialKernel extends DifferentialKernel {

    private static final Logger logger = LogManager.getLogger(DynamicDifferentialKernel.class);

    private final int obsDims;

    public DynamicDifferentialKernel(int inputDim, Kernel base, int obsDims) {
        this(inputDim, base, obsDims, null);
    }

    /// @param inputDim width of the input rows after slicing, coordinates and mask included
    /// @param base the kernel being differentiated, over obsDims coordinates
    /// @param obsDims number of observation coordinates
    /// @param activeDims the input columns, or null for the first inputDim
    public DynamicDifferentialKernel(int inputDim, Kernel base, int obsDims, ActiveDims activeDims) {
        super(inputDim, base, activeDims);
        if (obsDims <= 0) {
            throw new KernelInvariantException("obs_dims must be positive, was " + obsDims);
        }
        this.obsDims = obsDims;
    }

    public int getObsDims() {
        return obsDims;
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        boolean symmetric = x2 == null;
        double[][] locations = locations(x);
        List<DerivativeDescriptor> descriptors = descriptors(x);
        double[][] locations2 = symmetric ? locations : locations(x2);
        List<DerivativeDescriptor> descriptors2 = symmetric ? descriptors : descriptors(x2);
        logger.debug("Differentiating {} over {} x {} observations with {} coordinates",
            getBase().name(), locations.length, locations2.length, obsDims);
        return differentiate(locations, descriptors, locations2, descriptors2, symmetric);
    }

    /// Splits off the coordinate columns.
    ///
    /// @param x N x W inputs, W = 2·obsDims
    /// @return N x obsDims coordinates
    double[][] locations(double[][] x) {
        checkWidth(x);
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = Arrays.copyOfRange(x[i], 0, obsDims);
        }
        return out;
    }

    /// Decodes the trailing mask columns.
    ///
    /// @param x N x W inputs, W = 2·obsDims
    /// @return one descriptor per row
    List<DerivativeDescriptor> descriptors(double[][] x) {
        int width = checkWidth(x);
        List<DerivativeDescriptor> out = new ArrayList<>(x.length);
        for (double[] row : x) {
            out.add(DerivativeDescriptor.fromMask(row, width - obsDims, obsDims));
        }
        return out;
    }

    private int checkWidth(double[][] x) {
        int width = Matrices.columns(x, "input");
        if (x.length > 0 && width != 2 * obsDims) {
            throw new ShapeMismatchException("input columns", 2 * obsDims, width,
                "coordinates and derivative mask take " + obsDims + " columns each");
        }
        return width;
    }
}
