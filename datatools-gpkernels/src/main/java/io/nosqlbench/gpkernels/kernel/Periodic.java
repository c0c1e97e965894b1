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
import org.apache.commons.math3.RealFieldElement;

/// The periodic kernel (MacKay, 1998), derived from the mapping `u = (cos x, sin x)`:
///
/// ```
/// r² = Σ_d (sin(π(x_d - x'_d) / period) / ℓ)²
/// K  = σ²·exp(-r²/2)
/// ```
///
/// Lengthscale and period are shared scalars; there is no ARD variant.
public class Periodic extends Kernel {

    private final Parameter variance;
    private final Parameter lengthscales;
    private final Parameter period;

    public Periodic(int inputDim) {
        this(inputDim, 1.0, 1.0, 1.0, null);
    }

    public Periodic(int inputDim, double period, double variance, double lengthscale) {
        this(inputDim, period, variance, lengthscale, null);
    }

    public Periodic(int inputDim, double period, double variance, double lengthscale, ActiveDims activeDims) {
        super(inputDim, activeDims);
        this.variance = register(Parameter.scalar("variance", variance, Constraint.POSITIVE));
        this.lengthscales = register(Parameter.scalar("lengthscales", lengthscale, Constraint.POSITIVE));
        this.period = register(Parameter.scalar("period", period, Constraint.POSITIVE));
    }

    public Parameter getVariance() {
        return variance;
    }

    public Parameter getLengthscales() {
        return lengthscales;
    }

    public Parameter getPeriod() {
        return period;
    }

    /// Child names and parameter prefixes use `periodickernel`.
    @Override
    public String name() {
        return "periodickernel";
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        double[][] other = x2 == null ? x : x2;
        double s = variance.value();
        double l = lengthscales.value();
        double scale = Math.PI / period.value();
        double[][] k = new double[x.length][other.length];
        for (int i = 0; i < x.length; i++) {
            for (int j = 0; j < other.length; j++) {
                double r2 = 0.0;
                for (int d = 0; d < x[i].length; d++) {
                    double u = Math.sin(scale * (x[i][d] - other[j][d])) / l;
                    r2 += u * u;
                }
                k[i][j] = s * Math.exp(-0.5 * r2);
            }
        }
        return k;
    }

    @Override
    protected double[] computeKdiag(double[][] x) {
        return Matrices.filled(x.length, variance.value());
    }

    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        double l = lengthscales.value();
        double scale = Math.PI / period.value();
        T r2 = x[0].getField().getZero();
        for (int d = 0; d < x.length; d++) {
            T u = x[d].subtract(x2[d]).multiply(scale).sin().divide(l);
            r2 = r2.add(u.multiply(u));
        }
        return r2.multiply(-0.5).exp().multiply(variance.value());
    }
}
