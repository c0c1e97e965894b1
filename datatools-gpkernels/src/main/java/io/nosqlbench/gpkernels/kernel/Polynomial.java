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

import io.nosqlbench.gpkernels.param.Constraint;
import io.nosqlbench.gpkernels.param.Parameter;
import org.apache.commons.math3.RealFieldElement;

/// The polynomial kernel: `(Linear.K + offset)^degree`. Samples are polynomials of the given degree.
public class Polynomial extends Linear {

    private final double degree;
    private final Parameter offset;

    public Polynomial(int inputDim) {
        this(inputDim, 3.0, 1.0, 1.0, null, false);
    }

    public Polynomial(int inputDim, double degree) {
        this(inputDim, degree, 1.0, 1.0, null, false);
    }

    public Polynomial(int inputDim, double degree, double variance, double offset, ActiveDims activeDims, boolean ard) {
        super(inputDim, variance, activeDims, ard);
        this.degree = degree;
        this.offset = register(Parameter.scalar("offset", offset, Constraint.POSITIVE));
    }

    public double getDegree() {
        return degree;
    }

    public Parameter getOffset() {
        return offset;
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        double[][] k = super.computeK(x, x2);
        double c = offset.value();
        for (double[] row : k) {
            for (int j = 0; j < row.length; j++) {
                row[j] = Math.pow(row[j] + c, degree);
            }
        }
        return k;
    }

    @Override
    protected double[] computeKdiag(double[][] x) {
        double[] k = super.computeKdiag(x);
        double c = offset.value();
        for (int i = 0; i < k.length; i++) {
            k[i] = Math.pow(k[i] + c, degree);
        }
        return k;
    }

    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        T base = super.evaluate(x, x2).add(offset.value());
        if (degree == Math.rint(degree) && Math.abs(degree) <= Integer.MAX_VALUE) {
            return base.pow((int) degree);
        }
        return base.pow(degree);
    }
}
