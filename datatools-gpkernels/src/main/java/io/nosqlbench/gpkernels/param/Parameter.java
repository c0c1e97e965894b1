package io.nosqlbench.gpkernels.param;

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

import java.util.Arrays;
import java.util.Objects;

/// A named, constrained numeric value owned by a kernel.
///
/// ## Shapes
///
/// | Shape | Factory | Example |
/// |-------|---------|---------|
/// | scalar | [#scalar] | variance |
/// | vector | [#vector] | ARD lengthscales, coregion kappa |
/// | matrix | [#matrix] | coregion W |
///
/// Values are stored row-major in a flat array. The shape is fixed at
/// construction; [#assign] replaces the values and validates them against the
/// shape and the [Constraint]. Readers take a snapshot of the current values,
/// so a concurrent writer never exposes a partially updated array.
public final class Parameter {

    private final String name;
    private final Constraint constraint;
    private final int rows;
    private final int cols;
    private final boolean scalar;
    private volatile double[] values;

    private Parameter(String name, Constraint constraint, int rows, int cols, boolean scalar, double[] values) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.constraint = Objects.requireNonNull(constraint, "constraint cannot be null");
        this.rows = rows;
        this.cols = cols;
        this.scalar = scalar;
        this.values = validate(values);
    }

    /// Creates a scalar parameter.
    ///
    /// @param name the parameter name
    /// @param value the initial value
    /// @param constraint the domain constraint
    /// @return the parameter
    public static Parameter scalar(String name, double value, Constraint constraint) {
        return new Parameter(name, constraint, 1, 1, true, new double[]{value});
    }

    /// Creates a vector parameter.
    ///
    /// @param name the parameter name
    /// @param values the initial values, copied
    /// @param constraint the domain constraint
    /// @return the parameter
    public static Parameter vector(String name, double[] values, Constraint constraint) {
        Objects.requireNonNull(values, "values cannot be null");
        return new Parameter(name, constraint, values.length, 1, false, values.clone());
    }

    /// Creates a matrix parameter.
    ///
    /// @param name the parameter name
    /// @param values the initial values as rows, copied
    /// @param constraint the domain constraint
    /// @return the parameter
    public static Parameter matrix(String name, double[][] values, Constraint constraint) {
        Objects.requireNonNull(values, "values cannot be null");
        int r = values.length;
        int c = r == 0 ? 0 : values[0].length;
        double[] flat = new double[r * c];
        for (int i = 0; i < r; i++) {
            if (values[i].length != c) {
                throw new KernelInvariantException("Parameter '" + name + "' has ragged rows: row " + i
                    + " has " + values[i].length + " columns, expected " + c);
            }
            System.arraycopy(values[i], 0, flat, i * c, c);
        }
        return new Parameter(name, constraint, r, c, false, flat);
    }

    public String getName() {
        return name;
    }

    public Constraint getConstraint() {
        return constraint;
    }

    /// @return true if this parameter holds a single scalar
    public boolean isScalar() {
        return scalar;
    }

    /// @return the number of stored values
    public int size() {
        return rows * cols;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /// Returns the scalar value.
    ///
    /// @return the single value held by this parameter
    /// @throws IllegalStateException if this parameter holds more than one value
    public double value() {
        double[] v = values;
        if (v.length != 1) {
            throw new IllegalStateException("Parameter '" + name + "' holds " + v.length + " values, not a scalar");
        }
        return v[0];
    }

    /// Returns a copy of the values in row-major order.
    ///
    /// @return the values
    public double[] values() {
        return values.clone();
    }

    /// Returns the values broadcast to the given length.
    ///
    /// A single value is repeated; otherwise the length must match.
    ///
    /// @param length the required length
    /// @return a fresh array of the given length
    public double[] broadcast(int length) {
        double[] v = values;
        if (v.length == 1) {
            double[] out = new double[length];
            Arrays.fill(out, v[0]);
            return out;
        }
        if (v.length != length) {
            throw new KernelInvariantException("Parameter '" + name + "' has " + v.length
                + " values and cannot be broadcast to " + length);
        }
        return v.clone();
    }

    /// Returns the values as a matrix.
    ///
    /// @return a fresh rows x cols array
    public double[][] matrix() {
        double[] v = values;
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            System.arraycopy(v, i * cols, out[i], 0, cols);
        }
        return out;
    }

    /// Replaces the current values.
    ///
    /// @param newValues the new values in row-major order
    /// @throws KernelInvariantException if the count differs from [#size()] or a
    ///     value violates the constraint
    public void assign(double... newValues) {
        Objects.requireNonNull(newValues, "values cannot be null");
        this.values = validate(newValues.clone());
    }

    /// Replaces the current values of a matrix parameter.
    ///
    /// @param newValues the new values as rows
    public void assign(double[][] newValues) {
        Objects.requireNonNull(newValues, "values cannot be null");
        if (newValues.length != rows) {
            throw new KernelInvariantException("Parameter '" + name + "' expects " + rows
                + " rows but got " + newValues.length);
        }
        double[] flat = new double[rows * cols];
        for (int i = 0; i < rows; i++) {
            if (newValues[i].length != cols) {
                throw new KernelInvariantException("Parameter '" + name + "' expects " + cols
                    + " columns but row " + i + " has " + newValues[i].length);
            }
            System.arraycopy(newValues[i], 0, flat, i * cols, cols);
        }
        this.values = validate(flat);
    }

    private double[] validate(double[] candidate) {
        if (candidate.length != rows * cols) {
            throw new KernelInvariantException("Parameter '" + name + "' expects " + (rows * cols)
                + " values but got " + candidate.length);
        }
        for (int i = 0; i < candidate.length; i++) {
            if (!constraint.admits(candidate[i])) {
                throw new KernelInvariantException("Parameter '" + name + "' value " + candidate[i]
                    + " at index " + i + " violates constraint " + constraint);
            }
        }
        return candidate;
    }

    @Override
    public String toString() {
        if (scalar) {
            return "Parameter[" + name + "=" + values[0] + ", " + constraint + "]";
        }
        return "Parameter[" + name + "=" + Arrays.toString(values) + ", " + rows + "x" + cols + ", " + constraint + "]";
    }
}
