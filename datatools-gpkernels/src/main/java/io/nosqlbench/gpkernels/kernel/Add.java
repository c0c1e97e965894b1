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

import java.util.List;

/// Sum of kernels.
public class Add extends Combination {

    public Add(List<? extends Kernel> kernels) {
        super(kernels);
    }

    @Override
    protected double reduce(double acc, double value) {
        return acc + value;
    }

    @Override
    protected <T extends RealFieldElement<T>> T reduce(T acc, T value) {
        return acc.add(value);
    }
}
