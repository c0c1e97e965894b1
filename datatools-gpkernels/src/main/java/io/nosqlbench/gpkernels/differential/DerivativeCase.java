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

import io.nosqlbench.gpkernels.KernelConfigurationException;

/// Dispatch table of derivative branches, keyed by the derivative counts on each side.
///
/// Each pair is differentiated over four slots `[left1, left2, right1, right2]`; a case
/// selects the slots it takes one derivative along.
///
/// | case              | left | right | slots     |
/// |-------------------|------|-------|-----------|
/// | VALUE             | 0    | 0     | 0 0 0 0   |
/// | D_LEFT            | 1    | 0     | 1 0 0 0   |
/// | D_RIGHT           | 0    | 1     | 0 0 1 0   |
/// | D2_LEFT           | 2    | 0     | 1 1 0 0   |
/// | D_LEFT_D_RIGHT    | 1    | 1     | 1 0 1 0   |
/// | D2_RIGHT          | 0    | 2     | 0 0 1 1   |
/// | D2_LEFT_D_RIGHT   | 2    | 1     | 1 1 1 0   |
/// | D_LEFT_D2_RIGHT   | 1    | 2     | 1 0 1 1   |
/// | D2_LEFT_D2_RIGHT  | 2    | 2     | 1 1 1 1   |
public enum DerivativeCase {
    VALUE(0, 0),
    D_LEFT(1, 0),
    D_RIGHT(0, 1),
    D2_LEFT(2, 0),
    D_LEFT_D_RIGHT(1, 1),
    D2_RIGHT(0, 2),
    D2_LEFT_D_RIGHT(2, 1),
    D_LEFT_D2_RIGHT(1, 2),
    D2_LEFT_D2_RIGHT(2, 2);

    /// Number of differentiation slots in a chain.
    public static final int SLOTS = 4;

    private static final DerivativeCase[][] TABLE = new DerivativeCase[3][3];

    static {
        for (DerivativeCase c : values()) {
            TABLE[c.left][c.right] = c;
        }
    }

    private final int left;
    private final int right;
    private final int[] slotOrders;

    DerivativeCase(int left, int right) {
        this.left = left;
        this.right = right;
        this.slotOrders = new int[]{left >= 1 ? 1 : 0, left >= 2 ? 1 : 0, right >= 1 ? 1 : 0, right >= 2 ? 1 : 0};
    }

    /// @param left derivative count on the left point
    /// @param right derivative count on the right point
    /// @return the matching branch
    /// @throws KernelConfigurationException if either count is outside 0..2
    public static DerivativeCase of(int left, int right) {
        if (left < 0 || left > DerivativeDescriptor.MAX_ORDER || right < 0 || right > DerivativeDescriptor.MAX_ORDER) {
            throw new KernelConfigurationException("No derivative branch for orders (" + left + ", " + right
                + "); at most " + DerivativeDescriptor.MAX_ORDER + " derivatives per side");
        }
        return TABLE[left][right];
    }

    /// @param left descriptor of the left point
    /// @param right descriptor of the right point
    /// @return the matching branch
    public static DerivativeCase of(DerivativeDescriptor left, DerivativeDescriptor right) {
        return of(left.count(), right.count());
    }

    public int leftCount() {
        return left;
    }

    public int rightCount() {
        return right;
    }

    /// @return total derivative order of this branch
    public int order() {
        return left + right;
    }

    /// @return per-slot derivative orders, in `[left1, left2, right1, right2]` order
    public int[] slotOrders() {
        return slotOrders.clone();
    }

    /// Evaluates this branch for one pair.
    ///
    /// @param chain the pair's derivative chain
    /// @param raw the undifferentiated covariance of the pair
    /// @return the covariance between the two observations
    double apply(DerivativeChain chain, double raw) {
        if (this == VALUE) {
            return raw;
        }
        return chain.partial(slotOrders);
    }
}
