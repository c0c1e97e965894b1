package io.nosqlbench.gpkernels.linalg;

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
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;

/// Dense helpers over row-major `double[][]` matrices.
///
/// Products and factorisations go through commons-math; this class only adds
/// the shape checks and empty-extent handling the kernels need, since
/// commons-math matrices cannot have a zero-length axis.
public final class Matrices {

    /// Relative symmetry threshold passed to [CholeskyDecomposition].
    public static final double CHOLESKY_SYMMETRY_THRESHOLD = 1.0e-10;

    /// Absolute positivity threshold passed to [CholeskyDecomposition].
    public static final double CHOLESKY_POSITIVITY_THRESHOLD = 1.0e-14;

    private Matrices() {
    }

    /// Returns the number of columns of a matrix, checking that it is rectangular.
    ///
    /// @param m the matrix
    /// @param label axis label used in error messages
    /// @return the column count, or 0 for a matrix without rows
    public static int columns(double[][] m, String label) {
        if (m.length == 0) {
            return 0;
        }
        int cols = m[0].length;
        for (int i = 1; i < m.length; i++) {
            if (m[i].length != cols) {
                throw new ShapeMismatchException(label + " columns (row " + i + ")", cols, m[i].length);
            }
        }
        return cols;
    }

    /// Computes `a · bᵀ`.
    ///
    /// @param a N x D
    /// @param b M x D
    /// @return N x M
    public static double[][] multiplyTransposed(double[][] a, double[][] b) {
        int n = a.length;
        int m = b.length;
        if (n == 0 || m == 0) {
            return new double[n][m];
        }
        int da = columns(a, "left operand");
        int db = columns(b, "right operand");
        if (da != db) {
            throw new ShapeMismatchException("inner dimension", da, db);
        }
        if (da == 0) {
            return new double[n][m];
        }
        RealMatrix left = MatrixUtils.createRealMatrix(a);
        RealMatrix right = MatrixUtils.createRealMatrix(b);
        return left.multiply(right.transpose()).getData();
    }

    /// Scales each column of a matrix by a per-column factor.
    ///
    /// @param x N x D
    /// @param factors D factors
    /// @return a new N x D matrix
    public static double[][] scaleColumns(double[][] x, double[] factors) {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            if (x[i].length != factors.length) {
                throw new ShapeMismatchException("columns", factors.length, x[i].length);
            }
            out[i] = new double[factors.length];
            for (int d = 0; d < factors.length; d++) {
                out[i][d] = x[i][d] * factors[d];
            }
        }
        return out;
    }

    /// Squared Euclidean norm of every row.
    ///
    /// @param x N x D
    /// @return N row norms
    public static double[] rowSquaredNorms(double[][] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double s = 0.0;
            for (double v : x[i]) {
                s += v * v;
            }
            out[i] = s;
        }
        return out;
    }

    /// Returns a matrix filled with a single value.
    public static double[][] filled(int rows, int cols, double value) {
        double[][] out = new double[rows][cols];
        if (value != 0.0) {
            for (double[] row : out) {
                Arrays.fill(row, value);
            }
        }
        return out;
    }

    /// Returns a vector filled with a single value.
    public static double[] filled(int length, double value) {
        double[] out = new double[length];
        Arrays.fill(out, value);
        return out;
    }

    /// Returns a square matrix with the given diagonal.
    public static double[][] diagonal(double[] diag) {
        double[][] out = new double[diag.length][diag.length];
        for (int i = 0; i < diag.length; i++) {
            out[i][i] = diag[i];
        }
        return out;
    }

    /// Extracts the diagonal of a square matrix.
    public static double[] diagonalOf(double[][] m) {
        double[] out = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            if (m[i].length != m.length) {
                throw new ShapeMismatchException("square matrix columns", m.length, m[i].length);
            }
            out[i] = m[i][i];
        }
        return out;
    }

    /// Lower-triangular Cholesky factor `L` with `L·Lᵀ = cov`.
    ///
    /// @param cov a symmetric positive-definite D x D matrix
    /// @return the lower factor
    /// @throws org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException if cov is not
    ///     positive definite
    public static double[][] choleskyLower(double[][] cov) {
        int d = cov.length;
        if (columns(cov, "covariance") != d) {
            throw new ShapeMismatchException("covariance columns", d, cov.length == 0 ? 0 : cov[0].length);
        }
        CholeskyDecomposition decomposition = new CholeskyDecomposition(
            MatrixUtils.createRealMatrix(cov), CHOLESKY_SYMMETRY_THRESHOLD, CHOLESKY_POSITIVITY_THRESHOLD);
        return decomposition.getL().getData();
    }
}
