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

import org.apache.commons.math3.RealFieldElement;

/// The cosine kernel: `σ²·cos(r)`.
public class Cosine extends Stationary {

    public Cosine(int inputDim) {
        this(inputDim, 1.0, 1.0, null, false);
    }

    public Cosine(int inputDim, double variance, double lengthscale) {
        this(inputDim, variance, lengthscale, null, false);
    }

    public Cosine(int inputDim, double variance, double lengthscale, ActiveDims activeDims, boolean ard) {
        super(inputDim, variance, lengthscale, activeDims, ard);
    }

    /// Creates an ARD kernel with one lengthscale per input dimension.
    public Cosine(int inputDim, double variance, double[] lengthscales, ActiveDims activeDims) {
        super(inputDim, variance, lengthscales, activeDims);
    }

    @Override
    protected double profile(double r2) {
        return Math.cos(euclid(r2));
    }

    @Override
    protected <T extends RealFieldElement<T>> T profile(T r2) {
        return euclid(r2).cos();
    }
}
