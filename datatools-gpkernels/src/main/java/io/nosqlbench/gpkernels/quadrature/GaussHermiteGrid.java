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
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegrator;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegratorFactory;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/// Tensor-product Gauss-Hermite rule in d dimensions.
///
/// ## Construction
///
/// ```
/// 1-D rule (H nodes, weight exp(-x²))  ──►  H^d grid points
///                                          weights = ∏ w_i · π^(-d/2)
/// ```
///
/// The weights are pre-normalized by `π^(-d/2)` so that, for a standard normal
/// `u`, `E[f(√2·u)] ≈ Σ_p weights[p]·f(√2·points[p])`. Points are ordered with
/// the last dimension varying fastest.
///
/// Grids are immutable and cached per (H, d).
public final class GaussHermiteGrid {

    private static final Logger logger = LogManager.getLogger(GaussHermiteGrid.class);

    private static final GaussIntegratorFactory FACTORY = new GaussIntegratorFactory();
    private static final Map<Long, GaussHermiteGrid> CACHE = new ConcurrentHashMap<>();

    private final int pointsPerDimension;
    private final int dimensions;
    private final double[][] points;
    private final double[] weights;

    private GaussHermiteGrid(int pointsPerDimension, int dimensions, double[][] points, double[] weights) {
        this.pointsPerDimension = pointsPerDimension;
        this.dimensions = dimensions;
        this.points = points;
        this.weights = weights;
    }

    /// Returns the grid for H points per dimension in d dimensions.
    ///
    /// @param pointsPerDimension H, positive
    /// @param dimensions d, positive
    /// @return the (cached) grid
    /// @throws KernelConfigurationException if H or d is not positive, or H^d overflows
    public static GaussHermiteGrid of(int pointsPerDimension, int dimensions) {
        if (pointsPerDimension <= 0) {
            throw new KernelConfigurationException("Gauss-Hermite point count must be positive, was "
                + pointsPerDimension);
        }
        if (dimensions <= 0) {
            throw new KernelConfigurationException("Quadrature dimensionality must be positive, was " + dimensions);
        }
        long key = ((long) pointsPerDimension << 32) | dimensions;
        return CACHE.computeIfAbsent(key, k -> build(pointsPerDimension, dimensions));
    }

    /// One-dimensional Gauss-Hermite nodes and weights for weight function `exp(-x²)`.
    ///
    /// @param n number of nodes
    /// @return `{nodes, weights}`
    public static double[][] hermgauss(int n) {
        GaussIntegrator rule = FACTORY.hermite(n);
        double[] x = new double[n];
        double[] w = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = rule.getPoint(i);
            w[i] = rule.getWeight(i);
        }
        return new double[][]{x, w};
    }

    private static GaussHermiteGrid build(int h, int d) {
        long size = 1;
        for (int i = 0; i < d; i++) {
            size *= h;
            if (size > Integer.MAX_VALUE) {
                throw new KernelConfigurationException("Gauss-Hermite grid of " + h + "^" + d
                    + " points is too large");
            }
        }
        double[][] rule = hermgauss(h);
        double[] x = rule[0];
        double[] w = rule[1];
        int n = (int) size;
        double[][] points = new double[n][d];
        double[] weights = new double[n];
        double norm = FastMath.pow(Math.PI, -0.5 * d);
        int[] digits = new int[d];
        for (int p = 0; p < n; p++) {
            double weight = norm;
            for (int k = 0; k < d; k++) {
                points[p][k] = x[digits[k]];
                weight *= w[digits[k]];
            }
            weights[p] = weight;
            for (int k = d - 1; k >= 0; k--) {
                if (++digits[k] < h) {
                    break;
                }
                digits[k] = 0;
            }
        }
        logger.debug("Built Gauss-Hermite grid H={} d={} ({} points)", h, d, n);
        return new GaussHermiteGrid(h, d, points, weights);
    }

    public int getPointsPerDimension() {
        return pointsPerDimension;
    }

    public int getDimensions() {
        return dimensions;
    }

    /// @return number of grid points, H^d
    public int size() {
        return weights.length;
    }

    /// @param p grid point index
    /// @return the unscaled node coordinates of point p (shared, do not modify)
    double[] point(int p) {
        return points[p];
    }

    /// @param p grid point index
    /// @return the normalized weight of point p
    public double weight(int p) {
        return weights[p];
    }

    /// @return a copy of the normalized weights
    public double[] weights() {
        return weights.clone();
    }

    /// @return a copy of the unscaled node coordinates
    public double[][] points() {
        double[][] out = new double[points.length][];
        for (int p = 0; p < points.length; p++) {
            out[p] = points[p].clone();
        }
        return out;
    }
}
