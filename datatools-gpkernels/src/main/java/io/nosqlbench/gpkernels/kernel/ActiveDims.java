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

import java.util.Arrays;

/// The columns of a caller's data matrix that a kernel consumes.
///
/// Either a contiguous half-open range `[start, stop)`, which slices cheaply by
/// array copy, or an explicit ordered list of column indices, which is gathered.
/// A range is what a kernel gets when no explicit columns are supplied.
public final class ActiveDims {

    private final int start;
    private final int stop;
    private final int[] indices;

    private ActiveDims(int start, int stop, int[] indices) {
        this.start = start;
        this.stop = stop;
        this.indices = indices;
    }

    /// The first `count` columns.
    ///
    /// @param count number of leading columns
    /// @return a range selector `[0, count)`
    public static ActiveDims first(int count) {
        return range(0, count);
    }

    /// A contiguous half-open column range.
    ///
    /// @param start first column, inclusive
    /// @param stop last column, exclusive
    /// @return a range selector
    public static ActiveDims range(int start, int stop) {
        if (start < 0 || stop < start) {
            throw new KernelInvariantException("Invalid active dimension range [" + start + ", " + stop + ")");
        }
        return new ActiveDims(start, stop, null);
    }

    /// An explicit ordered list of columns.
    ///
    /// @param indices column indices, copied
    /// @return an index selector
    public static ActiveDims of(int... indices) {
        if (indices == null || indices.length == 0) {
            throw new KernelInvariantException("Explicit active dimensions cannot be empty");
        }
        for (int index : indices) {
            if (index < 0) {
                throw new KernelInvariantException("Active dimension index cannot be negative: " + index);
            }
        }
        return new ActiveDims(-1, -1, indices.clone());
    }

    /// @return true if this is a contiguous range selector
    public boolean isRange() {
        return indices == null;
    }

    /// @return number of columns selected
    public int size() {
        return isRange() ? stop - start : indices.length;
    }

    /// @return first column of a range selector
    public int start() {
        requireRange();
        return start;
    }

    /// @return exclusive end column of a range selector
    public int stop() {
        requireRange();
        return stop;
    }

    /// Returns the selected columns in order, materializing a range.
    ///
    /// @return a fresh array of column indices
    public int[] indices() {
        if (isRange()) {
            int[] out = new int[stop - start];
            for (int i = 0; i < out.length; i++) {
                out[i] = start + i;
            }
            return out;
        }
        return indices.clone();
    }

    /// @return the largest column index touched, or -1 for an empty range
    public int maxIndex() {
        if (isRange()) {
            return stop - 1;
        }
        int max = -1;
        for (int index : indices) {
            max = Math.max(max, index);
        }
        return max;
    }

    private void requireRange() {
        if (!isRange()) {
            throw new IllegalStateException("Explicit active dimensions have no range bounds");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveDims)) return false;
        ActiveDims that = (ActiveDims) o;
        return start == that.start && stop == that.stop && Arrays.equals(indices, that.indices);
    }

    @Override
    public int hashCode() {
        int result = 31 * start + stop;
        return 31 * result + Arrays.hashCode(indices);
    }

    @Override
    public String toString() {
        return isRange() ? "ActiveDims[" + start + ":" + stop + "]" : "ActiveDims" + Arrays.toString(indices);
    }
}
