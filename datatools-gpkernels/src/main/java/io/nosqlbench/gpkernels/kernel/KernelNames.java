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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Generates unique, human readable names for the members of a kernel list.
///
/// Each name is the kernel's [Kernel#name()]. When a name repeats, every
/// occurrence gets a 1-based numeric suffix, including the first one:
///
/// ```
/// [RBF, Linear, RBF]  ──►  ["rbf_1", "linear", "rbf_2"]
/// ```
public final class KernelNames {

    private KernelNames() {
    }

    /// @param kernels the kernels to name, in order
    /// @return one unique name per kernel, in the same order
    public static List<String> make(List<? extends Kernel> kernels) {
        List<String> names = new ArrayList<>(kernels.size());
        Map<String, Integer> counts = new HashMap<>();
        for (Kernel kernel : kernels) {
            String raw = kernel.name();
            Integer seen = counts.get(raw);
            if (seen == null) {
                counts.put(raw, 1);
                names.add(raw);
                continue;
            }
            if (seen == 1) {
                names.set(names.indexOf(raw), raw + "_1");
            }
            int next = seen + 1;
            counts.put(raw, next);
            names.add(raw + "_" + next);
        }
        return names;
    }
}
