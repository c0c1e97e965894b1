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

import io.nosqlbench.gpkernels.ShapeMismatchException;
import io.nosqlbench.gpkernels.linalg.Matrices;

import java.util.Objects;

/// Computes `E[f(x)]` for `x ~ N(mu_n, cov_n)`, one expectation per row n.
///
/// ```
/// for each n:
///     L      = chol(cov_n)
///     x_p    = mu_n + √2·L·u_p         u_p: Gauss-Hermite grid point
///     E[f]  ≈ Σ_p w_p · f(x_p)
/// ```
public final class MultivariateNormalQuadrature {

    private static final double SQRT2 = Math.sqrt(2.0);

    private MultivariateNormalQuadrature() {
    }

    /// @param integrand the function to integrate
    /// @param mu N x d means
    /// @param cov N x d x d covariances, each positive definite
    /// @param pointsPerDimension H
    /// @param dimensions d
    /// @param outputSize flattened size of one integrand value
    /// @return N x outputSize expectations
    /// @throws ShapeMismatchException if mu and cov disagree in N or d
    public static double[][] integrate(QuadratureIntegrand integrand, double[][] mu, double[][][] cov,
                                       int pointsPerDimension, int dimensions, int outputSize) {
        Objects.requireNonNull(integrand, "integrand cannot be null");
        Objects.requireNonNull(mu, "mu cannot be null");
        Objects.requireNonNull(cov, "cov cannot be null");
        if (mu.length != cov.length) {
            throw new ShapeMismatchException("covariance rows", mu.length, cov.length);
        }
        GaussHermiteGrid grid = GaussHermiteGrid.of(pointsPerDimension, dimensions);
        int size = grid.size();
        double[][] result = new double[mu.length][outputSize];
        double[][] points = new double[size][dimensions];
        for (int n = 0; n < mu.length; n++) {
            if (mu[n].length != dimensions) {
                throw new ShapeMismatchException("mean columns", dimensions, mu[n].length);
            }
            if (cov[n].length != dimensions) {
                throw new ShapeMismatchException("covariance rows of entry " + n, dimensions, cov[n].length);
            }
            double[][] chol = Matrices.choleskyLower(cov[n]);
            for (int p = 0; p < size; p++) {
                double[] u = grid.point(p);
                for (int i = 0; i < dimensions; i++) {
                    double s = 0.0;
                    for (int k = 0; k <= i; k++) {
                        s += chol[i][k] * u[k];
                    }
                    points[p][i] = mu[n][i] + SQRT2 * s;
                }
            }
            double[][] values = integrand.evaluate(points);
            if (values.length != size) {
                throw new ShapeMismatchException("integrand rows", size, values.length);
            }
            double[] acc = result[n];
            for (int p = 0; p < size; p++) {
                double w = grid.weight(p);
                double[] v = values[p];
                if (v.length != outputSize) {
                    throw new ShapeMismatchException("integrand columns", outputSize, v.length);
                }
                for (int o = 0; o < outputSize; o++) {
                    acc[o] += w * v[o];
                }
            }
        }
        return result;
    }
}
