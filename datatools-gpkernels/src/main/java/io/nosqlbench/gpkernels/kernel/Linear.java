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

/// The linear kernel: `K(X, X2) = (X·diag(σ²))·X2ᵀ`.
///
/// With ARD the variance holds one entry per input dimension.
public class Linear extends Kernel {

    protected final Parameter variance;
    private final boolean ard;

    public Linear(int inputDim) {
        this(inputDim, 1.0, null, false);
    }

    public Linear(int inputDim, double variance) {
        this(inputDim, variance, null, false);
    }

    public Linear(int inputDim, double variance, ActiveDims activeDims, boolean ard) {
        super(inputDim, activeDims);
        this.ard = ard;
        if (ard) {
            double[] v = new double[inputDim];
            Arrays.fill(v, variance);
            this.variance = register(Parameter.vector("variance", v, Constraint.POSITIVE));
        } else {
            this.variance = register(Parameter.scalar("variance", variance, Constraint.POSITIVE));
        }
    }

    /// Creates an ARD linear kernel with one variance per input dimension.
    public Linear(int inputDim, double[] variances, ActiveDims activeDims) {
        super(inputDim, activeDims);
        if (variances.length != inputDim) {
            throw new KernelInvariantException("ARD variances has " + variances.length
                + " entries but input_dim is " + inputDim);
        }
        this.ard = true;
        this.variance = register(Parameter.vector("variance", variances, Constraint.POSITIVE));
    }

    public Parameter getVariance() {
        return variance;
    }

    public boolean isArd() {
        return ard;
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        double[][] scaled = Matrices.scaleColumns(x, variance.broadcast(getInputDim()));
        return Matrices.multiplyTransposed(scaled, x2 == null ? x : x2);
    }

    @Override
    protected double[] computeKdiag(double[][] x) {
        double[] v = variance.broadcast(getInputDim());
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double s = 0.0;
            for (int d = 0; d < v.length; d++) {
                s += x[i][d] * x[i][d] * v[d];
            }
            out[i] = s;
        }
        return out;
    }

    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        double[] v = variance.broadcast(getInputDim());
        T sum = x[0].getField().getZero();
        for (int d = 0; d < v.length; d++) {
            sum = sum.add(x[d].multiply(x2[d]).multiply(v[d]));
        }
        return sum;
    }
}
