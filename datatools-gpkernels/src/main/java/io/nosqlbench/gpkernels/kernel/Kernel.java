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
import io.nosqlbench.gpkernels.config.KernelSettings;
import io.nosqlbench.gpkernels.param.Parameter;
import io.nosqlbench.gpkernels.quadrature.KernelExpectations;
import org.apache.commons.math3.RealFieldElement;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// A covariance function between sets of input points.
///
/// ## Evaluation Paths
///
/// ```
///  X (N x D) ──► DimensionSlicer ──► computeK ──► K (N x M)
///                 (unless presliced)     │
///                                        └─► computeKdiag ──► Kdiag (N)
///
///  x, x' rows ──► sliceRow ──► evaluate<T> ──► k(x, x')   (generic field, used for autodiff)
/// ```
///
/// Subclasses supply the matrix formulas [#computeK] and [#computeKdiag], plus
/// the pairwise formula [#evaluate] written over any [RealFieldElement]. The
/// pairwise formula must agree with [#computeK] for every pair; it is what the
/// differential kernels differentiate.
///
/// ## Expectations
///
/// [#eKdiag], [#eKxz], [#eKzxKxz] and [#exKxz] default to Gauss-Hermite
/// quadrature via [KernelExpectations]. Kernels with closed-form expectations
/// may override them.
///
/// ## Parameters
///
/// Each kernel registers its [Parameter]s at construction. They are read on
/// every evaluation and never written by the kernel itself.
public abstract class Kernel {

    private final int inputDim;
    private final ActiveDims activeDims;
    private final DimensionSlicer slicer;
    private final Map<String, Parameter> parameters = new LinkedHashMap<>();
    private volatile int numGaussHermitePoints;
    private volatile int inputSize;

    /// @param inputDim number of columns consumed after slicing; must be positive
    /// @param activeDims the consumed columns, or null for the first inputDim columns
    /// @throws KernelInvariantException if activeDims does not select exactly inputDim columns
    protected Kernel(int inputDim, ActiveDims activeDims) {
        if (inputDim <= 0) {
            throw new KernelInvariantException("input_dim must be positive, was " + inputDim);
        }
        ActiveDims dims = activeDims == null ? ActiveDims.first(inputDim) : activeDims;
        if (dims.size() != inputDim) {
            throw new KernelInvariantException("active_dims " + dims + " selects " + dims.size()
                + " columns but input_dim is " + inputDim);
        }
        this.inputDim = inputDim;
        this.activeDims = dims;
        this.slicer = new DimensionSlicer(inputDim, dims);
        this.numGaussHermitePoints = KernelSettings.current().getNumGaussHermitePoints();
        this.inputSize = inputDim;
    }

    /// Registers a parameter under its own name.
    ///
    /// @param parameter the parameter
    /// @return the same parameter
    protected final Parameter register(Parameter parameter) {
        Objects.requireNonNull(parameter, "parameter cannot be null");
        if (parameters.putIfAbsent(parameter.getName(), parameter) != null) {
            throw new KernelInvariantException("Duplicate parameter name '" + parameter.getName() + "'");
        }
        return parameter;
    }

    /// Returns this kernel's parameters in registration order.
    ///
    /// @return an unmodifiable name to parameter map
    public Map<String, Parameter> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /// Returns the type name used to label this kernel inside combinations.
    ///
    /// @return the lower-cased simple class name
    public String name() {
        return getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }

    public int getInputDim() {
        return inputDim;
    }

    public ActiveDims getActiveDims() {
        return activeDims;
    }

    public DimensionSlicer getSlicer() {
        return slicer;
    }

    public int getNumGaussHermitePoints() {
        return numGaussHermitePoints;
    }

    /// Sets the number of Gauss-Hermite points per dimension used by quadrature.
    ///
    /// @param points the number of points; 0 disables quadrature for this kernel
    public void setNumGaussHermitePoints(int points) {
        if (points < 0) {
            throw new KernelInvariantException("num_gauss_hermite_points cannot be negative, was " + points);
        }
        this.numGaussHermitePoints = points;
    }

    /// Returns the total unsliced input width expected by [#exKxz].
    ///
    /// @return the input size, `input_dim` unless set
    public int getInputSize() {
        return inputSize;
    }

    /// Declares the total unsliced input width expected by [#exKxz].
    ///
    /// @param inputSize the number of columns of the caller's data
    public void setInputSize(int inputSize) {
        if (inputSize <= activeDims.maxIndex()) {
            throw new KernelInvariantException("input size " + inputSize + " does not cover active dims " + activeDims);
        }
        this.inputSize = inputSize;
    }

    /// Covariance of a point set with itself.
    ///
    /// @param x N x D points
    /// @return N x N covariance
    public double[][] K(double[][] x) {
        return K(x, null, false);
    }

    /// Cross-covariance between two point sets.
    ///
    /// @param x N x D points
    /// @param x2 M x D points, or null for `K(x)`
    /// @return N x M covariance
    public double[][] K(double[][] x, double[][] x2) {
        return K(x, x2, false);
    }

    /// Cross-covariance between two point sets.
    ///
    /// @param x N x D points
    /// @param x2 M x D points, or null
    /// @param presliced true if x and x2 already hold exactly the active columns
    /// @return N x M covariance
    public double[][] K(double[][] x, double[][] x2, boolean presliced) {
        Objects.requireNonNull(x, "x cannot be null");
        if (!presliced) {
            x = slicer.slice(x);
            if (x2 != null) {
                x2 = slicer.slice(x2);
            }
        }
        return computeK(x, x2);
    }

    /// Diagonal of `K(x)`.
    ///
    /// @param x N x D points
    /// @return N variances
    public double[] Kdiag(double[][] x) {
        return Kdiag(x, false);
    }

    /// Diagonal of `K(x)`.
    ///
    /// @param x N x D points
    /// @param presliced true if x already holds exactly the active columns
    /// @return N variances
    public double[] Kdiag(double[][] x, boolean presliced) {
        Objects.requireNonNull(x, "x cannot be null");
        if (!presliced) {
            x = slicer.slice(x);
        }
        return computeKdiag(x);
    }

    /// Evaluates the kernel for one pair of unsliced points over any real field.
    ///
    /// @param x first point, width D
    /// @param x2 second point, width D
    /// @param <T> field element type
    /// @return k(x, x2)
    public <T extends RealFieldElement<T>> T covariance(T[] x, T[] x2) {
        return evaluate(slicer.sliceRow(x), slicer.sliceRow(x2));
    }

    /// Matrix formula on sliced inputs.
    ///
    /// @param x N x input_dim
    /// @param x2 M x input_dim, or null meaning x itself
    /// @return N x M
    protected abstract double[][] computeK(double[][] x, double[][] x2);

    /// Diagonal formula on sliced inputs.
    ///
    /// @param x N x input_dim
    /// @return N
    protected abstract double[] computeKdiag(double[][] x);

    /// Pairwise formula on sliced points.
    ///
    /// @param x input_dim entries
    /// @param x2 input_dim entries
    /// @param <T> field element type
    /// @return k(x, x2)
    protected abstract <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2);

    /// Expected diagonal `<Kdiag(x)>` under `x ~ N(xMu, xCov)`.
    ///
    /// @param xMu N x D means
    /// @param xCov N x D x D covariances
    /// @return N expectations
    public double[] eKdiag(double[][] xMu, double[][][] xCov) {
        return KernelExpectations.eKdiag(this, xMu, xCov);
    }

    /// As [#eKdiag] with diagonal covariances.
    public double[] eKdiag(double[][] xMu, double[][] xCovDiag) {
        return eKdiag(xMu, DimensionSlicer.expandDiagonal(xCovDiag));
    }

    /// Expected cross-covariance `<K(x, Z)>` per row of xMu.
    ///
    /// @param z M x D fixed points
    /// @param xMu N x D means
    /// @param xCov N x D x D covariances
    /// @return N x M expectations
    public double[][] eKxz(double[][] z, double[][] xMu, double[][][] xCov) {
        return KernelExpectations.eKxz(this, z, xMu, xCov);
    }

    /// As [#eKxz] with diagonal covariances.
    public double[][] eKxz(double[][] z, double[][] xMu, double[][] xCovDiag) {
        return eKxz(z, xMu, DimensionSlicer.expandDiagonal(xCovDiag));
    }

    /// Expected outer product `<K(Z, x) K(x, Z)>` per row of xMu.
    ///
    /// @param z M x D fixed points
    /// @param xMu N x D means
    /// @param xCov N x D x D covariances
    /// @return N x M x M expectations
    public double[][][] eKzxKxz(double[][] z, double[][] xMu, double[][][] xCov) {
        return KernelExpectations.eKzxKxz(this, z, xMu, xCov);
    }

    /// As [#eKzxKxz] with diagonal covariances.
    public double[][][] eKzxKxz(double[][] z, double[][] xMu, double[][] xCovDiag) {
        return eKzxKxz(z, xMu, DimensionSlicer.expandDiagonal(xCovDiag));
    }

    /// Expected `<K(x_t, Z) ⊗ x_{t+1}>` over consecutive pairs of a Markov chain of inputs.
    ///
    /// @param z M x D fixed points
    /// @param xMu (T+1) x D means, D = [#getInputSize()]
    /// @param xCov 2 x (T+1) x D x D: `xCov[0][t]` is the covariance of x_t,
    ///     `xCov[1][t]` the cross-covariance of x_t and x_{t+1}
    /// @return T x M x D expectations
    public double[][][] exKxz(double[][] z, double[][] xMu, double[][][][] xCov) {
        return KernelExpectations.exKxz(this, z, xMu, xCov);
    }

    /// Sum of this kernel and another.
    ///
    /// @param other the other kernel
    /// @return `new Add(List.of(this, other))`
    public Kernel add(Kernel other) {
        return new Add(List.of(this, other));
    }

    /// Product of this kernel and another.
    ///
    /// @param other the other kernel
    /// @return `new Prod(List.of(this, other))`
    public Kernel multiply(Kernel other) {
        return new Prod(List.of(this, other));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append("[input_dim=").append(inputDim)
            .append(", active_dims=").append(activeDims);
        for (Parameter p : parameters.values()) {
            sb.append(", ").append(p.getName()).append('=');
            sb.append(p.isScalar() ? String.valueOf(p.value()) : Arrays.toString(p.values()));
        }
        return sb.append(']').toString();
    }
}
