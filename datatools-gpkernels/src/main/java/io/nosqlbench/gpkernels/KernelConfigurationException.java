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

/// Thrown when a requested feature is not available under the current
/// configuration: an unimplemented arc-cosine order, quadrature refused by
/// policy, or a derivative order beyond what the differential kernels support.
public class KernelConfigurationException extends KernelException {

    public KernelConfigurationException(String message) {
        super(message);
    }
}
