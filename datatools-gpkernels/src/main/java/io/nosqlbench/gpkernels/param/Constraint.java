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

/// Domain constraint declared by a [Parameter] at construction time.
///
/// Kernels only read parameter values; the constraint is enforced whenever a
/// value is assigned, so formulas may rely on it without re-checking.
public enum Constraint {

    /// Any finite real value.
    UNCONSTRAINED {
        @Override
        public boolean admits(double value) {
            return Double.isFinite(value);
        }
    },

    /// Strictly positive finite values (variances, lengthscales, periods).
    POSITIVE {
        @Override
        public boolean admits(double value) {
            return Double.isFinite(value) && value > 0.0;
        }
    };

    /// Returns whether the given value lies in this constraint's domain.
    ///
    /// @param value the candidate value
    /// @return true if the value is admissible
    public abstract boolean admits(double value);
}
