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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.gpkernels.KernelConfigurationException;

import java.util.Locale;

/// Global policy governing whether kernel expectations may fall back to
/// Gauss-Hermite quadrature.
public enum QuadraturePolicy {

    /// Proceed silently.
    @SerializedName("allow")
    ALLOW("allow"),

    /// Proceed, logging a warning naming the kernel type.
    @SerializedName("warn")
    WARN("warn"),

    /// Refuse with a [KernelConfigurationException].
    @SerializedName("error")
    ERROR("error");

    private final String settingName;

    QuadraturePolicy(String settingName) {
        this.settingName = settingName;
    }

    /// @return the name used in settings files and system properties
    public String settingName() {
        return settingName;
    }

    /// Parses a settings value.
    ///
    /// @param name one of "allow", "warn", "error" (case-insensitive)
    /// @return the policy
    /// @throws KernelConfigurationException if the name is not recognised
    public static QuadraturePolicy fromSettingName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (QuadraturePolicy policy : values()) {
                if (policy.settingName.equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new KernelConfigurationException("Unrecognised ekern_quadrature setting '" + name
            + "', expected one of allow, warn, error");
    }
}
