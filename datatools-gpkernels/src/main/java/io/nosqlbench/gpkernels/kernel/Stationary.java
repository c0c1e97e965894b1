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
import io.nosqlbench.gpkernels.linalg.Matrices;
import io.nosqlbench.gpkernels.param.Constraint;
import io.nosqlbench.gpkernels.param.Parameter;
import org.apache.commons.math3.RealFieldElement;

import java.util.Arrays;

/// Base class for kernels that depend only on the scaled distance between points.
///
/// ## Distances
///
/// ```
/// r² = Σ_d ((x_d - x'_d) / ℓ_d)²       squared distance
/// r  = sqrt(r² + 1e-12)                Euclidean distance, jittered at r = 0
/// ```
///
/// The matrix path computes r² through `‖a‖² + ‖b‖² - 2a·b` on the rescaled
/// inputs, so no N x M x D difference tensor is formed.
///
/// ## ARD
///
/// With ARD off, `lengthscales` is a single positive scalar shared by every
/// dimension. With ARD on it is a positive vector of length `input_dim`; a scalar
/// initial value is broadcast.
///
/// Subclasses supply the profile `k(r²) / σ²` in double and field form.
public abstract class Stationary extends Kernel {

    /// Added to r² before taking the square root.
    public static final double DISTANCE_JITTER = 1.0e-12;

    protected final Parameter variance;
    protected final Parameter lengthscales;
    private final boolean ard;

    protected Stationary(int inputDim, double variance, double lengthscale, ActiveDims activeDims, boolean ard) {
        super(inputDim, activeDims);
        this.ard = ard;
        this.variance = register(Parameter.scalar("variance", variance, Constraint.POSITIVE));
        if (ard) {
            double[] ls = new double[inputDim];
            Arrays.fill(ls, lengthscale);
            this.lengthscales = register(Parameter.vector("lengthscales", ls, Constraint.POSITIVE));
        } else {
            this.lengthscales = register(Parameter.scalar("lengthscales", lengthscale, Constraint.POSITIVE));
        }
    }

    protected Stationary(int inputDim, double variance, double[] lengthscales, ActiveDims activeDims) {
        super(inputDim, activeDims);
        if (lengthscales.length != inputDim) {
            throw new KernelInvariantException("ARD lengthscales has " + lengthscales.length
                + " entries but input_dim is " + inputDim);
        }
        this.ard = true;
        this.variance = register(Parameter.scalar("variance", variance, Constraint.POSITIVE));
        this.lengthscales = register(Parameter.vector("lengthscales", lengthscales, Constraint.POSITIVE));
    }

    public Parameter getVariance() {
        return variance;
    }

    public Parameter getLengthscales() {
        return lengthscales;
    }

    /// @return true if this kernel has one lengthscale per input dimension
    public boolean isArd() {
        return ard;
    }

    /// Scaled squared distances between the rows of two sliced inputs.
    ///
    /// @param x N x input_dim
    /// @param x2 M x input_dim, or null meaning x
    /// @return N x M squared distances
    public double[][] squareDist(double[][] x, double[][] x2) {
        double[] inverse = inverseLengthscales();
        double[][] a = Matrices.scaleColumns(x, inverse);
        double[][] b = x2 == null ? a : Matrices.scaleColumns(x2, inverse);
        double[] an = Matrices.rowSquaredNorms(a);
        double[] bn = x2 == null ? an : Matrices.rowSquaredNorms(b);
        double[][] r2 = Matrices.multiplyTransposed(a, b);
        for (int i = 0; i < r2.length; i++) {
            for (int j = 0; j < r2[i].length; j++) {
                // cancellation can leave tiny negatives near r = 0
                r2[i][j] = Math.max(0.0, an[i] + bn[j] - 2.0 * r2[i][j]);
            }
        }
        return r2;
    }

    /// Jittered Euclidean distances between the rows of two sliced inputs.
    ///
    /// @param x N x input_dim
    /// @param x2 M x input_dim, or null meaning x
    /// @return N x M distances
    public double[][] euclidDist(double[][] x, double[][] x2) {
        double[][] r = squareDist(x, x2);
        for (double[] row : r) {
            for (int j = 0; j < row.length; j++) {
                row[j] = euclid(row[j]);
            }
        }
        return r;
    }

    protected static double euclid(double r2) {
        return Math.sqrt(r2 + DISTANCE_JITTER);
    }

    protected static <T extends RealFieldElement<T>> T euclid(T r2) {
        return r2.add(DISTANCE_JITTER).sqrt();
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        double s = variance.value();
        double[][] k = squareDist(x, x2);
        for (double[] row : k) {
            for (int j = 0; j < row.length; j++) {
                row[j] = s * profile(row[j]);
            }
        }
        return k;
    }

    /// Stationary kernels equal their variance at r = 0.
    @Override
    protected double[] computeKdiag(double[][] x) {
        return Matrices.filled(x.length, variance.value());
    }

    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        double[] inverse = inverseLengthscales();
        T r2 = x[0].getField().getZero();
        for (int d = 0; d < x.length; d++) {
            T diff = x[d].subtract(x2[d]).multiply(inverse[d]);
            r2 = r2.add(diff.multiply(diff));
        }
        return profile(r2).multiply(variance.value());
    }

    /// Kernel value divided by the variance, as a function of the squared distance.
    ///
    /// @param r2 squared scaled distance
    /// @return the profile value
    protected abstract double profile(double r2);

    /// Field form of [#profile(double)].
    protected abstract <T extends RealFieldElement<T>> T profile(T r2);

    private double[] inverseLengthscales() {
        double[] ls = lengthscales.broadcast(getInputDim());
        for (int d = 0; d < ls.length; d++) {
            ls[d] = 1.0 / ls[d];
        }
        return ls;
    }
}
