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
import io.nosqlbench.gpkernels.param.Constraint;
import io.nosqlbench.gpkernels.param.Parameter;

/// Kernels that ignore the values of their inputs. The only parameter is a variance.
public abstract class Static extends Kernel {

    protected final Parameter variance;

    protected Static(int inputDim, double variance, ActiveDims activeDims) {
        super(inputDim, activeDims);
        this.variance = register(Parameter.scalar("variance", variance, Constraint.POSITIVE));
    }

    public Parameter getVariance() {
        return variance;
    }

    @Override
    protected double[] computeKdiag(double[][] x) {
        return Matrices.filled(x.length, variance.value());
    }
}
