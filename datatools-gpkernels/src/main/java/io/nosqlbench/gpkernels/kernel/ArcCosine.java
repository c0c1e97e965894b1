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

import io.nosqlbench.gpkernels.KernelConfigurationException;
import io.nosqlbench.gpkernels.KernelInvariantException;
import io.nosqlbench.gpkernels.param.Constraint;
import io.nosqlbench.gpkernels.param.Parameter;
import org.apache.commons.math3.RealFieldElement;

import java.util.Arrays;
import java.util.Set;

/// The arc-cosine family of kernels, which mimics a single hidden layer of a
/// network with rectified monomial activations of the given order
/// (Cho and Saul, Kernel Methods for Deep Learning, NIPS 2009).
///
/// ```
/// ⟨x, x'⟩_w = Σ_d w_d·x_d·x'_d + bias_variance
/// ‖x‖_w    = sqrt(⟨x, x⟩_w)
/// θ        = acos(ε + (1 - 2ε)·⟨x, x'⟩_w / (‖x‖_w·‖x'‖_w)),   ε = 1e-15
/// K        = σ²·J(θ)/π · ‖x‖_w^order · ‖x'‖_w^order
/// ```
///
/// | order | J(θ) |
/// |-------|------|
/// | 0 | π - θ |
/// | 1 | sin θ + (π - θ) cos θ |
/// | 2 | 3 sin θ cos θ + (π - θ)(1 + 2 cos² θ) |
///
/// The order 0 kernel is closely related to the multi-layer perceptron kernel.
public class ArcCosine extends Kernel {

    /// Orders with an implemented J function.
    public static final Set<Integer> IMPLEMENTED_ORDERS = Set.of(0, 1, 2);

    /// Keeps the arc-cosine argument strictly inside (-1, 1).
    public static final double JITTER = 1.0e-15;

    private final int order;
    private final boolean ard;
    private final Parameter variance;
    private final Parameter weightVariances;
    private final Parameter biasVariance;

    public ArcCosine(int inputDim) {
        this(inputDim, 0, 1.0, 1.0, 1.0, null, false);
    }

    public ArcCosine(int inputDim, int order) {
        this(inputDim, order, 1.0, 1.0, 1.0, null, false);
    }

    public ArcCosine(int inputDim, int order, double variance, double weightVariance, double biasVariance,
                     ActiveDims activeDims, boolean ard) {
        super(inputDim, activeDims);
        this.order = checkOrder(order);
        this.ard = ard;
        this.variance = register(Parameter.scalar("variance", variance, Constraint.POSITIVE));
        if (ard) {
            double[] w = new double[inputDim];
            Arrays.fill(w, weightVariance);
            this.weightVariances = register(Parameter.vector("weight_variances", w, Constraint.POSITIVE));
        } else {
            this.weightVariances = register(Parameter.scalar("weight_variances", weightVariance, Constraint.POSITIVE));
        }
        this.biasVariance = register(Parameter.scalar("bias_variance", biasVariance, Constraint.POSITIVE));
    }

    /// Creates an ARD kernel with one weight variance per input dimension.
    public ArcCosine(int inputDim, int order, double variance, double[] weightVariances, double biasVariance,
                     ActiveDims activeDims) {
        super(inputDim, activeDims);
        if (weightVariances.length != inputDim) {
            throw new KernelInvariantException("ARD weight_variances has " + weightVariances.length
                + " entries but input_dim is " + inputDim);
        }
        this.order = checkOrder(order);
        this.ard = true;
        this.variance = register(Parameter.scalar("variance", variance, Constraint.POSITIVE));
        this.weightVariances = register(Parameter.vector("weight_variances", weightVariances, Constraint.POSITIVE));
        this.biasVariance = register(Parameter.scalar("bias_variance", biasVariance, Constraint.POSITIVE));
    }

    private static int checkOrder(int order) {
        if (!IMPLEMENTED_ORDERS.contains(order)) {
            throw new KernelConfigurationException("Requested arc-cosine kernel order " + order
                + " is not implemented, expected one of " + IMPLEMENTED_ORDERS);
        }
        return order;
    }

    public int getOrder() {
        return order;
    }

    public boolean isArd() {
        return ard;
    }

    public Parameter getVariance() {
        return variance;
    }

    public Parameter getWeightVariances() {
        return weightVariances;
    }

    public Parameter getBiasVariance() {
        return biasVariance;
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        double[] w = weightVariances.broadcast(getInputDim());
        double b = biasVariance.value();
        double[][] other = x2 == null ? x : x2;
        double[] den = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            den[i] = Math.sqrt(weightedProduct(x[i], x[i], w, b));
        }
        double[] den2 = den;
        if (x2 != null) {
            den2 = new double[other.length];
            for (int j = 0; j < other.length; j++) {
                den2[j] = Math.sqrt(weightedProduct(other[j], other[j], w, b));
            }
        }
        double s = variance.value() / Math.PI;
        double[][] k = new double[x.length][other.length];
        for (int i = 0; i < x.length; i++) {
            for (int j = 0; j < other.length; j++) {
                double cosTheta = weightedProduct(x[i], other[j], w, b) / den[i] / den2[j];
                double theta = Math.acos(JITTER + (1.0 - 2.0 * JITTER) * cosTheta);
                k[i][j] = s * angular(theta) * Math.pow(den[i], order) * Math.pow(den2[j], order);
            }
        }
        return k;
    }

    @Override
    protected double[] computeKdiag(double[][] x) {
        double[] w = weightVariances.broadcast(getInputDim());
        double b = biasVariance.value();
        double s = variance.value() / Math.PI * angular(0.0);
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = s * Math.pow(weightedProduct(x[i], x[i], w, b), order);
        }
        return out;
    }

    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        double[] w = weightVariances.broadcast(getInputDim());
        double b = biasVariance.value();
        T den = weightedProduct(x, x, w, b).sqrt();
        T den2 = weightedProduct(x2, x2, w, b).sqrt();
        T cosTheta = weightedProduct(x, x2, w, b).divide(den).divide(den2);
        T theta = cosTheta.multiply(1.0 - 2.0 * JITTER).add(JITTER).acos();
        return angular(theta).multiply(variance.value() / Math.PI).multiply(den.pow(order)).multiply(den2.pow(order));
    }

    private static double weightedProduct(double[] a, double[] c, double[] w, double b) {
        double s = b;
        for (int d = 0; d < w.length; d++) {
            s += w[d] * a[d] * c[d];
        }
        return s;
    }

    private static <T extends RealFieldElement<T>> T weightedProduct(T[] a, T[] c, double[] w, double b) {
        T s = a[0].getField().getZero().add(b);
        for (int d = 0; d < w.length; d++) {
            s = s.add(a[d].multiply(c[d]).multiply(w[d]));
        }
        return s;
    }

    private double angular(double theta) {
        switch (order) {
            case 0:
                return Math.PI - theta;
            case 1:
                return Math.sin(theta) + (Math.PI - theta) * Math.cos(theta);
            default:
                double c = Math.cos(theta);
                return 3.0 * Math.sin(theta) * c + (Math.PI - theta) * (1.0 + 2.0 * c * c);
        }
    }

    private <T extends RealFieldElement<T>> T angular(T theta) {
        T remaining = theta.negate().add(Math.PI);
        switch (order) {
            case 0:
                return remaining;
            case 1:
                return theta.sin().add(remaining.multiply(theta.cos()));
            default:
                T c = theta.cos();
                return theta.sin().multiply(c).multiply(3.0)
                    .add(remaining.multiply(c.multiply(c).multiply(2.0).add(1.0)));
        }
    }
}
