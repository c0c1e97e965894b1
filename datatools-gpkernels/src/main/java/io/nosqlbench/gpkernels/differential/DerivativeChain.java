package io.nosqlbench.gpkernels.differential;

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

import io.nosqlbench.gpkernels.kernel.Kernel;
import org.apache.commons.math3.analysis.differentiation.DerivativeStructure;

/// Automatic differentiation of one covariance entry `k(x, x')`.
///
/// The coordinates of both points are lifted to [DerivativeStructure]s over the four
/// slots of [DerivativeCase]. Coordinate `c` of the left point is
///
/// ```
/// x[c] + s_left1·[c == firstDim] + s_left2·[c == secondDim]
/// ```
///
/// and likewise for the right point, so a repeated dimension carries two slots. The
/// kernel is evaluated once per pair and the resulting structure holds every mixed
/// partial up to the pair's total order. Lower-order branches of the same pair read
/// their values from it without reevaluation.
final class DerivativeChain {

    private final Kernel base;
    private final double[] left;
    private final double[] right;
    private final DerivativeDescriptor leftDescriptor;
    private final DerivativeDescriptor rightDescriptor;
    private final int order;
    private DerivativeStructure structure;

    DerivativeChain(Kernel base, double[] left, DerivativeDescriptor leftDescriptor,
                    double[] right, DerivativeDescriptor rightDescriptor) {
        this.base = base;
        this.left = left;
        this.right = right;
        this.leftDescriptor = leftDescriptor;
        this.rightDescriptor = rightDescriptor;
        this.order = leftDescriptor.count() + rightDescriptor.count();
    }

    /// @return the differentiated kernel value, built on first use
    DerivativeStructure structure() {
        if (structure == null) {
            DerivativeStructure[] l = lift(left, leftDescriptor, 0);
            DerivativeStructure[] r = lift(right, rightDescriptor, 2);
            structure = base.covariance(l, r);
        }
        return structure;
    }

    /// @param slotOrders derivative order per slot
    /// @return the mixed partial derivative
    double partial(int[] slotOrders) {
        return structure().getPartialDerivative(slotOrders);
    }

    int order() {
        return order;
    }

    private DerivativeStructure[] lift(double[] point, DerivativeDescriptor descriptor, int firstSlot) {
        DerivativeStructure[] out = new DerivativeStructure[point.length];
        for (int c = 0; c < point.length; c++) {
            DerivativeStructure v = new DerivativeStructure(DerivativeCase.SLOTS, order, point[c]);
            if (descriptor.firstDim() == c) {
                v = v.add(new DerivativeStructure(DerivativeCase.SLOTS, order, firstSlot, 0.0));
            }
            if (descriptor.secondDim() == c) {
                v = v.add(new DerivativeStructure(DerivativeCase.SLOTS, order, firstSlot + 1, 0.0));
            }
            out[c] = v;
        }
        return out;
    }
}
