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

import io.nosqlbench.gpkernels.KernelInvariantException;
import io.nosqlbench.gpkernels.ShapeMismatchException;
import io.nosqlbench.gpkernels.param.Constraint;
import io.nosqlbench.gpkernels.param.Parameter;
import org.apache.commons.math3.RealFieldElement;

import java.util.Arrays;

/// A coregionalization kernel over integer category indices.
///
/// Inputs are category indices stored in a float column and truncated to
/// integers. The parameters W (output_dim x rank) and kappa (output_dim,
/// positive) define the positive semi-definite matrix
///
/// ```
/// B = W·Wᵀ + diag(kappa)
/// ```
///
/// and the kernel is an indexing of it: `K(x, y) = B[x, y]`.
///
/// W = 0 is a symmetric stationary point of most objectives, so optimisation
/// should start from a random W.
public class Coregion extends Kernel {

    private final int outputDim;
    private final int rank;
    private final Parameter w;
    private final Parameter kappa;

    public Coregion(int inputDim, int outputDim, int rank) {
        this(inputDim, outputDim, rank, null);
    }

    public Coregion(int inputDim, int outputDim, int rank, ActiveDims activeDims) {
        this(inputDim, new double[outputDim][rank], ones(outputDim), activeDims);
    }

    /// @param inputDim must be 1
    /// @param w initial output_dim x rank factor
    /// @param kappa initial positive diagonal offset of length output_dim
    /// @param activeDims the category column, or null for column 0
    public Coregion(int inputDim, double[][] w, double[] kappa, ActiveDims activeDims) {
        super(requireOneDimension(inputDim), activeDims);
        this.outputDim = w.length;
        this.rank = w.length == 0 ? 0 : w[0].length;
        if (kappa.length != outputDim) {
            throw new KernelInvariantException("kappa has " + kappa.length + " entries but W has "
                + outputDim + " rows");
        }
        this.w = register(Parameter.matrix("W", w, Constraint.UNCONSTRAINED));
        this.kappa = register(Parameter.vector("kappa", kappa, Constraint.POSITIVE));
    }

    private static int requireOneDimension(int inputDim) {
        if (inputDim != 1) {
            throw new KernelInvariantException("Coregion kernel requires input_dim 1, was " + inputDim);
        }
        return inputDim;
    }

    private static double[] ones(int n) {
        double[] out = new double[n];
        Arrays.fill(out, 1.0);
        return out;
    }

    public int getOutputDim() {
        return outputDim;
    }

    public int getRank() {
        return rank;
    }

    public Parameter getW() {
        return w;
    }

    public Parameter getKappa() {
        return kappa;
    }

    /// Returns the dense coregionalization matrix.
    ///
    /// @return `W·Wᵀ + diag(kappa)`, output_dim x output_dim
    public double[][] coregionMatrix() {
        double[][] factor = w.matrix();
        double[] k = kappa.values();
        double[][] b = new double[outputDim][outputDim];
        for (int i = 0; i < outputDim; i++) {
            for (int j = 0; j < outputDim; j++) {
                double s = 0.0;
                for (int r = 0; r < rank; r++) {
                    s += factor[i][r] * factor[j][r];
                }
                b[i][j] = s;
            }
            b[i][i] += k[i];
        }
        return b;
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        int[] rows = categories(x);
        int[] cols = x2 == null ? rows : categories(x2);
        double[][] b = coregionMatrix();
        double[][] k = new double[rows.length][cols.length];
        for (int i = 0; i < rows.length; i++) {
            for (int j = 0; j < cols.length; j++) {
                k[i][j] = b[rows[i]][cols[j]];
            }
        }
        return k;
    }

    @Override
    protected double[] computeKdiag(double[][] x) {
        int[] rows = categories(x);
        double[][] factor = w.matrix();
        double[] k = kappa.values();
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            double s = k[rows[i]];
            for (int r = 0; r < rank; r++) {
                s += factor[rows[i]][r] * factor[rows[i]][r];
            }
            out[i] = s;
        }
        return out;
    }

    /// Category indices carry no derivative; the result is a constant of the field.
    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        int i = category(x[0].getReal());
        int j = category(x2[0].getReal());
        return x[0].getField().getZero().add(coregionMatrix()[i][j]);
    }

    private int[] categories(double[][] x) {
        int[] out = new int[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = category(x[i][0]);
        }
        return out;
    }

    private int category(double value) {
        int index = (int) value;
        if (index < 0 || index >= outputDim) {
            throw new ShapeMismatchException("category index", outputDim, index,
                "categories must lie in [0, " + outputDim + ")");
        }
        return index;
    }
}
