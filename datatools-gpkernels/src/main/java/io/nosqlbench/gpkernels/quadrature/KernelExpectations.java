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
import io.nosqlbench.gpkernels.ShapeMismatchException;
import io.nosqlbench.gpkernels.config.KernelSettings;
import io.nosqlbench.gpkernels.kernel.DimensionSlicer;
import io.nosqlbench.gpkernels.kernel.Kernel;
import io.nosqlbench.gpkernels.linalg.Matrices;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Kernel expectations under Gaussian input uncertainty, by Gauss-Hermite quadrature.
///
/// ## Operations
///
/// | Operation  | Inputs                     | Result    |
/// |------------|----------------------------|-----------|
/// | eKdiag     | Xmu N x D, Xcov N x D x D  | N         |
/// | eKxz       | Z M x D, Xmu, Xcov         | N x M     |
/// | eKzxKxz    | Z M x D, Xmu, Xcov         | N x M x M |
/// | exKxz      | Z, Xmu (T+1) x D, Xcov 2 x (T+1) x D x D | T x M x D |
///
/// Every operation first consults the quadrature policy from [KernelSettings#current()].
/// With `error`, or when the kernel has zero Gauss-Hermite points, it refuses with a
/// [KernelConfigurationException]. With `warn` it logs a warning and proceeds.
///
/// The first three operations integrate over the kernel's active dimensions only. exKxz
/// integrates over the full width [Kernel#getInputSize()], since its result carries one
/// column per input dimension whether or not the kernel reads it.
public final class KernelExpectations {

    private static final Logger logger = LogManager.getLogger(KernelExpectations.class);

    static final String REFUSAL = "Settings indicate that quadrature may not be used.";

    private KernelExpectations() {
    }

    /// Expected diagonal `<k(x, x)>`.
    ///
    /// @param kernel the kernel
    /// @param xMu N x D means
    /// @param xCov N x D x D covariances
    /// @return N expectations
    public static double[] eKdiag(Kernel kernel, double[][] xMu, double[][][] xCov) {
        checkQuadrature(kernel);
        checkRows(xMu, xCov);
        DimensionSlicer slicer = kernel.getSlicer();
        double[][] mu = slicer.slice(xMu);
        double[][][] cov = slicer.sliceCovariance(xCov);
        double[][] result = MultivariateNormalQuadrature.integrate(points -> {
            double[] diag = kernel.Kdiag(points, true);
            double[][] out = new double[diag.length][1];
            for (int p = 0; p < diag.length; p++) {
                out[p][0] = diag[p];
            }
            return out;
        }, mu, cov, kernel.getNumGaussHermitePoints(), kernel.getInputDim(), 1);
        double[] flat = new double[result.length];
        for (int n = 0; n < result.length; n++) {
            flat[n] = result[n][0];
        }
        return flat;
    }

    /// Expected cross-covariance `<K(x, Z)>`.
    ///
    /// @param kernel the kernel
    /// @param z M x D fixed points
    /// @param xMu N x D means
    /// @param xCov N x D x D covariances
    /// @return N x M expectations
    public static double[][] eKxz(Kernel kernel, double[][] z, double[][] xMu, double[][][] xCov) {
        checkQuadrature(kernel);
        Objects.requireNonNull(z, "z cannot be null");
        checkRows(xMu, xCov);
        DimensionSlicer slicer = kernel.getSlicer();
        double[][] zs = slicer.slice(z);
        double[][] mu = slicer.slice(xMu);
        double[][][] cov = slicer.sliceCovariance(xCov);
        return MultivariateNormalQuadrature.integrate(points -> kernel.K(points, zs, true),
            mu, cov, kernel.getNumGaussHermitePoints(), kernel.getInputDim(), zs.length);
    }

    /// Expected outer product `<K(Z, x) K(x, Z)>`.
    ///
    /// @param kernel the kernel
    /// @param z M x D fixed points
    /// @param xMu N x D means
    /// @param xCov N x D x D covariances
    /// @return N x M x M expectations
    public static double[][][] eKzxKxz(Kernel kernel, double[][] z, double[][] xMu, double[][][] xCov) {
        checkQuadrature(kernel);
        Objects.requireNonNull(z, "z cannot be null");
        checkRows(xMu, xCov);
        DimensionSlicer slicer = kernel.getSlicer();
        double[][] zs = slicer.slice(z);
        double[][] mu = slicer.slice(xMu);
        double[][][] cov = slicer.sliceCovariance(xCov);
        int m = zs.length;
        double[][] flat = MultivariateNormalQuadrature.integrate(points -> {
            double[][] kxz = kernel.K(points, zs, true);
            double[][] out = new double[kxz.length][m * m];
            for (int p = 0; p < kxz.length; p++) {
                double[] row = kxz[p];
                for (int a = 0; a < m; a++) {
                    for (int b = 0; b < m; b++) {
                        out[p][a * m + b] = row[a] * row[b];
                    }
                }
            }
            return out;
        }, mu, cov, kernel.getNumGaussHermitePoints(), kernel.getInputDim(), m * m);
        double[][][] result = new double[flat.length][m][m];
        for (int n = 0; n < flat.length; n++) {
            for (int a = 0; a < m; a++) {
                System.arraycopy(flat[n], a * m, result[n][a], 0, m);
            }
        }
        return result;
    }

    /// Expected `<K(x_t, Z) ⊗ x_{t+1}>` for each consecutive pair of a chain of inputs.
    ///
    /// The joint distribution of `(x_t, x_{t+1})` is assembled as
    ///
    /// ```
    /// mean = [ Xmu[t] , Xmu[t+1] ]
    /// cov  = [ Xcov[0][t]      Xcov[1][t]   ]
    ///        [ Xcov[1][t]^T    Xcov[0][t+1] ]
    /// ```
    ///
    /// and quadrature runs in 2·D dimensions.
    ///
    /// @param kernel the kernel
    /// @param z M x D fixed points
    /// @param xMu (T+1) x D means, D = [Kernel#getInputSize()]
    /// @param xCov 2 x (T+1) x D x D marginal and cross covariances
    /// @return T x M x D expectations
    /// @throws ShapeMismatchException if xMu is not D wide, or xCov does not line up with xMu
    public static double[][][] exKxz(Kernel kernel, double[][] z, double[][] xMu, double[][][][] xCov) {
        checkQuadrature(kernel);
        Objects.requireNonNull(z, "z cannot be null");
        Objects.requireNonNull(xMu, "xMu cannot be null");
        Objects.requireNonNull(xCov, "xCov cannot be null");
        int d = kernel.getInputSize();
        int cols = Matrices.columns(xMu, "Xmu");
        if (xMu.length > 0 && cols != d) {
            throw new ShapeMismatchException("Xmu columns", d, cols,
                "numerical quadrature needs to know the full input size of Xmu");
        }
        if (xCov.length != 2) {
            throw new ShapeMismatchException("Xcov leading axis", 2, xCov.length);
        }
        if (xCov[0].length != xMu.length) {
            throw new ShapeMismatchException("Xcov[0] rows", xMu.length, xCov[0].length);
        }
        if (xCov[1].length != xMu.length) {
            throw new ShapeMismatchException("Xcov[1] rows", xMu.length, xCov[1].length);
        }
        int steps = Math.max(0, xMu.length - 1);
        int m = z.length;
        double[][] jointMu = new double[steps][2 * d];
        double[][][] jointCov = new double[steps][2 * d][2 * d];
        for (int t = 0; t < steps; t++) {
            System.arraycopy(xMu[t], 0, jointMu[t], 0, d);
            System.arraycopy(xMu[t + 1], 0, jointMu[t], d, d);
            double[][] now = square(xCov[0][t], d, "Xcov[0][" + t + "]");
            double[][] next = square(xCov[0][t + 1], d, "Xcov[0][" + (t + 1) + "]");
            double[][] cross = square(xCov[1][t], d, "Xcov[1][" + t + "]");
            for (int i = 0; i < d; i++) {
                for (int j = 0; j < d; j++) {
                    jointCov[t][i][j] = now[i][j];
                    jointCov[t][i][d + j] = cross[i][j];
                    jointCov[t][d + i][j] = cross[j][i];
                    jointCov[t][d + i][d + j] = next[i][j];
                }
            }
        }
        double[][] flat = MultivariateNormalQuadrature.integrate(points -> {
            double[][] current = new double[points.length][d];
            for (int p = 0; p < points.length; p++) {
                System.arraycopy(points[p], 0, current[p], 0, d);
            }
            double[][] kxz = kernel.K(current, z);
            double[][] out = new double[points.length][m * d];
            for (int p = 0; p < points.length; p++) {
                for (int a = 0; a < m; a++) {
                    double k = kxz[p][a];
                    for (int j = 0; j < d; j++) {
                        out[p][a * d + j] = k * points[p][d + j];
                    }
                }
            }
            return out;
        }, jointMu, jointCov, kernel.getNumGaussHermitePoints(), 2 * d, m * d);
        double[][][] result = new double[steps][m][d];
        for (int t = 0; t < steps; t++) {
            for (int a = 0; a < m; a++) {
                System.arraycopy(flat[t], a * d, result[t][a], 0, d);
            }
        }
        return result;
    }

    /// Applies the quadrature policy.
    ///
    /// @param kernel the kernel about to be integrated
    /// @throws KernelConfigurationException if quadrature is disallowed for this kernel
    static void checkQuadrature(Kernel kernel) {
        QuadraturePolicy policy = KernelSettings.current().getQuadraturePolicy();
        if (policy == QuadraturePolicy.ERROR || kernel.getNumGaussHermitePoints() == 0) {
            throw new KernelConfigurationException(REFUSAL);
        }
        if (policy == QuadraturePolicy.WARN) {
            logger.warn("Using numerical quadrature for kernel expectation of {}.", kernel.getClass().getName());
        }
    }

    private static void checkRows(double[][] xMu, double[][][] xCov) {
        Objects.requireNonNull(xMu, "xMu cannot be null");
        Objects.requireNonNull(xCov, "xCov cannot be null");
        if (xCov.length != xMu.length) {
            throw new ShapeMismatchException("Xcov rows", xMu.length, xCov.length);
        }
    }

    private static double[][] square(double[][] m, int d, String label) {
        if (m.length != d) {
            throw new ShapeMismatchException(label + " rows", d, m.length);
        }
        int cols = Matrices.columns(m, label);
        if (cols != d) {
            throw new ShapeMismatchException(label + " columns", d, cols);
        }
        return m;
    }
}
