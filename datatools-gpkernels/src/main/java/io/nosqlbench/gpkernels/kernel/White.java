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

import io.nosqlbench.gpkernels.linalg.Matrices;
import org.apache.commons.math3.RealFieldElement;

/// The white noise kernel.
///
/// `K(X) = σ²·I`, while `K(X, X2)` is all zeros whenever a second input is
/// given, even if it holds the same points.
public class White extends Static {

    public White(int inputDim) {
        this(inputDim, 1.0, null);
    }

    public White(int inputDim, double variance) {
        this(inputDim, variance, null);
    }

    public White(int inputDim, double variance, ActiveDims activeDims) {
        super(inputDim, variance, activeDims);
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        if (x2 == null) {
            return Matrices.diagonal(Matrices.filled(x.length, variance.value()));
        }
        return new double[x.length][x2.length];
    }

    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        return x[0].getField().getZero();
    }
}
