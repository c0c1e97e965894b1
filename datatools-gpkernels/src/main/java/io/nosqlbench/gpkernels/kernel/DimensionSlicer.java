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
import io.nosqlbench.gpkernels.linalg.Matrices;
import org.apache.commons.math3.util.MathArrays;
import org.apache.commons.math3.RealFieldElement;

import java.util.Arrays;
import java.util.Objects;

/// Narrows inputs to a kernel's [ActiveDims].
///
/// ## Operations
///
/// | Input | Method | Output |
/// |-------|--------|--------|
/// | N x D points | `slice` | N x input_dim |
/// | N x D x D covariances | `sliceCovariance` | N x input_dim x input_dim |
/// | N x D diagonal covariances | `expandDiagonal` then slice | N x input_dim x input_dim |
/// | one point row | `sliceRow` | input_dim |
///
/// Range selectors copy contiguous blocks, and a range covering every column
/// returns the input unchanged. Explicit selectors gather columns one by one.
/// The result width is checked against `input_dim`.
public final class DimensionSlicer {

    private final int inputDim;
    private final ActiveDims activeDims;
    private final int[] gather;

    /// @param inputDim the number of columns the kernel consumes
    /// @param activeDims the selector, whose size equals inputDim
    public DimensionSlicer(int inputDim, ActiveDims activeDims) {
        this.inputDim = inputDim;
        this.activeDims = Objects.requireNonNull(activeDims, "activeDims cannot be null");
        this.gather = activeDims.isRange() ? null : activeDims.indices();
    }

    public int getInputDim() {
        return inputDim;
    }

    public ActiveDims getActiveDims() {
        return activeDims;
    }

    /// Restricts the columns of a point matrix.
    ///
    /// @param x N x D points
    /// @return N x input_dim points
    /// @throws ShapeMismatchException if the sliced width differs from input_dim
    public double[][] slice(double[][] x) {
        Objects.requireNonNull(x, "x cannot be null");
        int cols = Matrices.columns(x, "input");
        if (x.length == 0) {
            return x;
        }
        if (activeDims.isRange()) {
            int start = activeDims.start();
            int stop = Math.min(activeDims.stop(), cols);
            int width = Math.max(0, stop - start);
            checkWidth(width, cols);
            if (start == 0 && stop == cols) {
                return x;
            }
            double[][] out = new double[x.length][];
            for (int i = 0; i < x.length; i++) {
                out[i] = Arrays.copyOfRange(x[i], start, stop);
            }
            return out;
        }
        checkGather(cols);
        double[][] out = new double[x.length][gather.length];
        for (int i = 0; i < x.length; i++) {
            for (int d = 0; d < gather.length; d++) {
                out[i][d] = x[i][gather[d]];
            }
        }
        return out;
    }

    /// Restricts both index axes of a batch of covariance matrices.
    ///
    /// @param cov N x D x D covariances
    /// @return N x input_dim x input_dim covariances
    public double[][][] sliceCovariance(double[][][] cov) {
        Objects.requireNonNull(cov, "cov cannot be null");
        int[] dims = null;
        double[][][] out = new double[cov.length][][];
        for (int n = 0; n < cov.length; n++) {
            int d = cov[n].length;
            if (Matrices.columns(cov[n], "covariance") != d) {
                throw new ShapeMismatchException("covariance columns", d, cov[n].length == 0 ? 0 : cov[n][0].length);
            }
            if (dims == null) {
                dims = selectedColumns(d);
            }
            double[][] block = new double[dims.length][dims.length];
            for (int i = 0; i < dims.length; i++) {
                for (int j = 0; j < dims.length; j++) {
                    block[i][j] = cov[n][dims[i]][dims[j]];
                }
            }
            out[n] = block;
        }
        return out;
    }

    /// Restricts the entries of a single point row.
    ///
    /// @param row one point of width D
    /// @param <T> field element type
    /// @return input_dim entries
    public <T extends RealFieldElement<T>> T[] sliceRow(T[] row) {
        Objects.requireNonNull(row, "row cannot be null");
        if (activeDims.isRange()) {
            int start = activeDims.start();
            int stop = Math.min(activeDims.stop(), row.length);
            checkWidth(Math.max(0, stop - start), row.length);
            if (start == 0 && stop == row.length) {
                return row;
            }
            return Arrays.copyOfRange(row, start, stop);
        }
        checkGather(row.length);
        T[] out = MathArrays.buildArray(row[0].getField(), gather.length);
        for (int d = 0; d < gather.length; d++) {
            out[d] = row[gather[d]];
        }
        return out;
    }

    /// Expands diagonal-only covariances into full diagonal matrices.
    ///
    /// @param diag N x D variances
    /// @return N x D x D covariances
    public static double[][][] expandDiagonal(double[][] diag) {
        Objects.requireNonNull(diag, "diag cannot be null");
        double[][][] out = new double[diag.length][][];
        for (int n = 0; n < diag.length; n++) {
            out[n] = Matrices.diagonal(diag[n]);
        }
        return out;
    }

    private int[] selectedColumns(int cols) {
        if (activeDims.isRange()) {
            int start = activeDims.start();
            int stop = Math.min(activeDims.stop(), cols);
            int width = Math.max(0, stop - start);
            checkWidth(width, cols);
            return ActiveDims.range(start, stop).indices();
        }
        checkGather(cols);
        return gather;
    }

    private void checkWidth(int width, int cols) {
        if (width != inputDim) {
            throw new ShapeMismatchException("sliced columns", inputDim, width,
                "selector " + activeDims + " applied to " + cols + " columns");
        }
    }

    private void checkGather(int cols) {
        int max = activeDims.maxIndex();
        if (max >= cols) {
            throw new ShapeMismatchException("input columns", max + 1, cols,
                "selector " + activeDims + " references column " + max);
        }
        checkWidth(gather.length, cols);
    }
}
