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

/// The Matern 5/2 kernel: `σ²·(1 + √5·r + 5r²/3)·exp(-√5·r)`.
///
/// The polynomial term uses the jittered distance, matching the exponent.
public class Matern52 extends Stationary {

    private static final double SQRT5 = Math.sqrt(5.0);

    public Matern52(int inputDim) {
        this(inputDim, 1.0, 1.0, null, false);
    }

    public Matern52(int inputDim, double variance, double lengthscale) {
        this(inputDim, variance, lengthscale, null, false);
    }

    public Matern52(int inputDim, double variance, double lengthscale, ActiveDims activeDims, boolean ard) {
        super(inputDim, variance, lengthscale, activeDims, ard);
    }

    /// Creates an ARD kernel with one lengthscale per input dimension.
    public Matern52(int inputDim, double variance, double[] lengthscales, ActiveDims activeDims) {
        super(inputDim, variance, lengthscales, activeDims);
    }

    @Override
    protected double profile(double r2) {
        double r = euclid(r2);
        double sr = SQRT5 * r;
        return (1.0 + sr + 5.0 / 3.0 * r * r) * Math.exp(-sr);
    }

    @Override
    protected <T extends RealFieldElement<T>> T profile(T r2) {
        T r = euclid(r2);
        T sr = r.multiply(SQRT5);
        return sr.add(1.0).add(r.multiply(r).multiply(5.0 / 3.0)).multiply(sr.negate().exp());
    }
}
