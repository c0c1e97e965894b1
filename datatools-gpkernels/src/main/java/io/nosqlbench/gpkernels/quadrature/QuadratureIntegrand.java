package io.nosqlbench.gpkernels.quadrature;

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

/// A fixed-shape function evaluated at a batch of quadrature points.
///
/// Implementations receive every transformed grid point for one input row at
/// once, which lets kernel integrands use their matrix formulas.
@FunctionalInterface
public interface QuadratureIntegrand {

    /// Evaluates the integrand.
    ///
    /// @param points P x d points
    /// @return P x outputSize values, each row flattened row-major
    double[][] evaluate(double[][] points);
}
