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
import io.nosqlbench.gpkernels.param.Parameter;
import org.apache.commons.math3.RealFieldElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A kernel combining an ordered list of child kernels with an elementwise
/// reduction.
///
/// ## Construction
///
/// - `input_dim` is inferred as one past the largest column any child touches.
/// - Children that are combinations of the same concrete type are absorbed, so
///   `Add([Add([a, b]), c])` holds three children, never two.
/// - Each child is named by [KernelNames], e.g. `matern32_1`, `matern32_2`.
///
/// ## Evaluation
///
/// Children see the caller's columns and slice them with their own
/// [ActiveDims]. Results are reduced left to right in child order, so
/// floating-point rounding is reproducible.
public abstract class Combination extends Kernel {

    private final List<Kernel> kernels;
    private final Map<String, Kernel> named;

    protected Combination(List<? extends Kernel> kernels) {
        super(inferInputDim(kernels), null);
        List<Kernel> flat = new ArrayList<>();
        for (Kernel kernel : kernels) {
            if (kernel.getClass() == getClass()) {
                flat.addAll(((Combination) kernel).kernels);
            } else {
                flat.add(kernel);
            }
        }
        this.kernels = Collections.unmodifiableList(flat);
        Map<String, Kernel> byName = new LinkedHashMap<>();
        List<String> names = KernelNames.make(flat);
        for (int i = 0; i < flat.size(); i++) {
            byName.put(names.get(i), flat.get(i));
        }
        this.named = Collections.unmodifiableMap(byName);
    }

    private static int inferInputDim(List<? extends Kernel> kernels) {
        if (kernels == null || kernels.isEmpty()) {
            throw new KernelInvariantException("A kernel combination needs at least one kernel");
        }
        int max = 0;
        for (int i = 0; i < kernels.size(); i++) {
            Kernel kernel = kernels.get(i);
            if (kernel == null) {
                throw new KernelInvariantException("Can only combine Kernel instances, element " + i + " is null");
            }
            max = Math.max(max, kernel.getActiveDims().maxIndex() + 1);
        }
        return max;
    }

    /// @return the flattened children in order
    public List<Kernel> kernels() {
        return kernels;
    }

    /// @return the child names in order
    public List<String> names() {
        return List.copyOf(named.keySet());
    }

    /// Looks up a child by its generated name.
    ///
    /// @param name e.g. "rbf_1"
    /// @return the child
    /// @throws IllegalArgumentException if no child has that name
    public Kernel kernel(String name) {
        Kernel kernel = named.get(name);
        if (kernel == null) {
            throw new IllegalArgumentException("No kernel named '" + name + "' in " + named.keySet());
        }
        return kernel;
    }

    /// Children's parameters, keyed `childName.parameterName`.
    @Override
    public Map<String, Parameter> parameters() {
        Map<String, Parameter> all = new LinkedHashMap<>();
        named.forEach((name, kernel) ->
            kernel.parameters().forEach((p, parameter) -> all.put(name + "." + p, parameter)));
        return Collections.unmodifiableMap(all);
    }

    /// Whether the children act on mutually disjoint columns.
    ///
    /// Overlap between range selectors is not computed; if any child uses one,
    /// the answer is false.
    ///
    /// @return true only if every child uses explicit, pairwise disjoint columns
    public boolean isOnSeparateDimensions() {
        Set<Integer> seen = new HashSet<>();
        for (Kernel kernel : kernels) {
            if (kernel.getActiveDims().isRange()) {
                return false;
            }
        }
        for (Kernel kernel : kernels) {
            Set<Integer> own = new HashSet<>();
            for (int index : kernel.getActiveDims().indices()) {
                own.add(index);
            }
            for (Integer index : own) {
                if (!seen.add(index)) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    protected double[][] computeK(double[][] x, double[][] x2) {
        double[][] acc = null;
        for (Kernel kernel : kernels) {
            double[][] k = kernel.K(x, x2);
            if (acc == null) {
                acc = k;
                continue;
            }
            for (int i = 0; i < acc.length; i++) {
                for (int j = 0; j < acc[i].length; j++) {
                    acc[i][j] = reduce(acc[i][j], k[i][j]);
                }
            }
        }
        return acc;
    }

    @Override
    protected double[] computeKdiag(double[][] x) {
        double[] acc = null;
        for (Kernel kernel : kernels) {
            double[] k = kernel.Kdiag(x);
            if (acc == null) {
                acc = k;
                continue;
            }
            for (int i = 0; i < acc.length; i++) {
                acc[i] = reduce(acc[i], k[i]);
            }
        }
        return acc;
    }

    @Override
    protected <T extends RealFieldElement<T>> T evaluate(T[] x, T[] x2) {
        T acc = null;
        for (Kernel kernel : kernels) {
            T k = kernel.covariance(x, x2);
            acc = acc == null ? k : reduce(acc, k);
        }
        return acc;
    }

    /// Combines an accumulated value with the next child's value.
    protected abstract double reduce(double acc, double value);

    /// Field form of [#reduce(double, double)].
    protected abstract <T extends RealFieldElement<T>> T reduce(T acc, T value);

    @Override
    public String toString() {
        return getClass().getSimpleName() + named;
    }
}
