package io.nosqlbench.gpkernels;

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

/// Thrown when an input matrix or tensor does not have the extent a kernel
/// requires along some axis.
public class ShapeMismatchException extends KernelException {

    private final String axis;
    private final int expected;
    private final int actual;

    public ShapeMismatchException(String axis, int expected, int actual) {
        super(String.format("Shape mismatch on %s: expected %d but was %d", axis, expected, actual));
        this.axis = axis;
        this.expected = expected;
        this.actual = actual;
    }

    public ShapeMismatchException(String axis, int expected, int actual, String detail) {
        super(String.format("Shape mismatch on %s: expected %d but was %d (%s)", axis, expected, actual, detail));
        this.axis = axis;
        this.expected = expected;
        this.actual = actual;
    }

    public String getAxis() {
        return axis;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
