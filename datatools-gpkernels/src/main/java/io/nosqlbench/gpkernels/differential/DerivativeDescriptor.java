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
import io.nosqlbench.gpkernels.ShapeMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Which partial derivative of the latent function one observation records.
///
/// | count | firstDim | secondDim | observation            |
/// |-------|----------|-----------|------------------------|
/// | 0     | -1       | -1        | f(x)                   |
/// | 1     | a        | -1        | ∂f/∂x_a                |
/// | 2     | a        | b         | ∂²f/(∂x_a ∂x_b)        |
///
/// Slots beyond `count` are normalized to -1.
///
/// @param count number of derivatives taken, 0 to 2
/// @param firstDim dimension of the first derivative, or -1
/// @param secondDim dimension of the second derivative, or -1
public record DerivativeDescriptor(int count, int firstDim, int secondDim) {

    /// Highest derivative order supported on one side of a covariance.
    public static final int MAX_ORDER = 2;

    /// An undifferentiated observation.
    public static final DerivativeDescriptor VALUE = new DerivativeDescriptor(0, -1, -1);

    public DerivativeDescriptor {
        checkOrder(count);
        if (count < 1) {
            firstDim = -1;
        } else if (firstDim < 0) {
            throw new KernelConfigurationException("Derivative descriptor of order " + count
                + " needs a first dimension, was " + firstDim);
        }
        if (count < 2) {
            secondDim = -1;
        } else if (secondDim < 0) {
            throw new KernelConfigurationException("Derivative descriptor of order " + count
                + " needs a second dimension, was " + secondDim);
        }
    }

    /// @param dim the differentiated dimension
    /// @return a first derivative observation
    public static DerivativeDescriptor first(int dim) {
        return new DerivativeDescriptor(1, dim, -1);
    }

    /// @param dim1 first differentiated dimension
    /// @param dim2 second differentiated dimension, may equal dim1
    /// @return a second derivative observation
    public static DerivativeDescriptor second(int dim1, int dim2) {
        return new DerivativeDescriptor(2, dim1, dim2);
    }

    /// Parses a derivative information matrix.
    ///
    /// Each row is `[count, dim, dim]`; shorter rows are padded with -1.
    ///
    /// @param info one row per observation
    /// @return one descriptor per row
    /// @throws ShapeMismatchException if a row is empty or wider than 3
    public static List<DerivativeDescriptor> fromInfoMatrix(int[][] info) {
        Objects.requireNonNull(info, "info cannot be null");
        List<DerivativeDescriptor> out = new ArrayList<>(info.length);
        for (int i = 0; i < info.length; i++) {
            int[] row = info[i];
            if (row == null || row.length == 0 || row.length > 3) {
                throw new ShapeMismatchException("derivative info row " + i + " columns", 3,
                    row == null ? 0 : row.length);
            }
            int first = row.length > 1 ? row[1] : -1;
            int second = row.length > 2 ? row[2] : -1;
            out.add(new DerivativeDescriptor(row[0], first, second));
        }
        return Collections.unmodifiableList(out);
    }

    /// Decodes a gradient count mask.
    ///
    /// `mask[d]` is the number of times the observation was differentiated along d.
    /// The first slot is the first dimension with the largest count. The second is the
    /// first dimension with the largest count once the first slot is taken away.
    ///
    /// @param mask non-negative integral counts
    /// @return the descriptor
    /// @throws KernelConfigurationException if an entry is negative or non-integral, or the
    ///     counts sum above [#MAX_ORDER]
    public static DerivativeDescriptor fromMask(double[] mask) {
        Objects.requireNonNull(mask, "mask cannot be null");
        return fromMask(mask, 0, mask.length);
    }

    /// Decodes the gradient count mask stored in `row[offset, offset+length)`.
    ///
    /// @param row a row containing the mask
    /// @param offset first mask column
    /// @param length number of mask columns
    /// @return the descriptor, with dimensions relative to offset
    public static DerivativeDescriptor fromMask(double[] row, int offset, int length) {
        int[] counts = new int[length];
        int total = 0;
        for (int d = 0; d < length; d++) {
            double v = row[offset + d];
            if (v < 0 || v != Math.rint(v) || Double.isInfinite(v)) {
                throw new KernelConfigurationException("Derivative mask entries must be non-negative integers, found "
                    + v + " at column " + d);
            }
            counts[d] = (int) v;
            total += counts[d];
        }
        checkOrder(total);
        if (total == 0) {
            return VALUE;
        }
        int first = argmax(counts);
        counts[first]--;
        int second = argmax(counts);
        return new DerivativeDescriptor(total, first, second);
    }

    /// @return the wire form `[count, firstDim, secondDim]`
    public int[] toInfoRow() {
        return new int[]{count, firstDim, secondDim};
    }

    /// @return the largest dimension referenced, or -1
    public int maxDim() {
        return Math.max(firstDim, secondDim);
    }

    private static void checkOrder(int count) {
        if (count < 0) {
            throw new KernelConfigurationException("Derivative count cannot be negative, was " + count);
        }
        if (count > MAX_ORDER) {
            throw new KernelConfigurationException("Derivative order " + count
                + " is not supported; at most " + MAX_ORDER + " derivatives per observation");
        }
    }

    private static int argmax(int[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }
}
