package io.nosqlbench.gpkernels.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.gpkernels.KernelConfigurationException;
import io.nosqlbench.gpkernels.quadrature.QuadraturePolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// Process-wide numerics settings for the kernel library.
///
/// ## Sources
///
/// Settings are resolved once, in increasing precedence:
///
/// 1. built-in defaults (`warn`, 20 points)
/// 2. the classpath resource [#RESOURCE]
/// 3. the system properties [#QUADRATURE_PROPERTY] and [#POINTS_PROPERTY]
///
/// ## JSON Schema
///
/// ```json
/// {
///   "numerics": {
///     "ekern_quadrature": "warn",
///     "num_gauss_hermite_points": 20
///   }
/// }
/// ```
///
/// ## Temporary overrides
///
/// ```java
/// try (KernelSettings.Scope ignored = KernelSettings.push(
///         KernelSettings.current().withQuadraturePolicy(QuadraturePolicy.ERROR))) {
///     kernel.eKdiag(mu, cov);   // refused
/// }
/// ```
///
/// Instances are immutable; the `with*` methods return modified copies.
public final class KernelSettings {

    private static final Logger logger = LogManager.getLogger(KernelSettings.class);

    /// Classpath resource holding the default settings.
    public static final String RESOURCE = "gpkernels.json";

    /// System property overriding the quadrature policy.
    public static final String QUADRATURE_PROPERTY = "gpkernels.numerics.ekern_quadrature";

    /// System property overriding the default number of Gauss-Hermite points.
    public static final String POINTS_PROPERTY = "gpkernels.numerics.num_gauss_hermite_points";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private static volatile KernelSettings current = load();

    @SerializedName("numerics")
    private Numerics numerics;

    /// Numeric behaviour section of the settings file.
    public static final class Numerics {

        @SerializedName("ekern_quadrature")
        private QuadraturePolicy ekernQuadrature = QuadraturePolicy.WARN;

        @SerializedName("num_gauss_hermite_points")
        private int numGaussHermitePoints = 20;

        public Numerics() {
        }

        private Numerics(QuadraturePolicy ekernQuadrature, int numGaussHermitePoints) {
            this.ekernQuadrature = ekernQuadrature;
            this.numGaussHermitePoints = numGaussHermitePoints;
        }
    }

    private KernelSettings() {
        this(new Numerics());
    }

    private KernelSettings(Numerics numerics) {
        this.numerics = numerics;
    }

    /// @return the built-in defaults
    public static KernelSettings defaults() {
        return new KernelSettings(new Numerics());
    }

    /// Returns the settings currently in effect.
    ///
    /// @return the current settings
    public static KernelSettings current() {
        return current;
    }

    /// Parses settings from JSON. Absent fields take their default values.
    ///
    /// @param reader JSON source
    /// @return the parsed settings
    /// @throws KernelConfigurationException if the JSON is malformed or holds an
    ///     unrecognised value
    public static KernelSettings fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        KernelSettings parsed;
        try {
            parsed = GSON.fromJson(reader, KernelSettings.class);
        } catch (JsonParseException e) {
            throw new KernelConfigurationException("Malformed kernel settings: " + e.getMessage());
        }
        if (parsed == null) {
            return defaults();
        }
        if (parsed.numerics == null) {
            parsed.numerics = new Numerics();
        }
        if (parsed.numerics.ekernQuadrature == null) {
            throw new KernelConfigurationException(
                "Unrecognised ekern_quadrature setting, expected one of allow, warn, error");
        }
        if (parsed.numerics.numGaussHermitePoints < 0) {
            throw new KernelConfigurationException("num_gauss_hermite_points must be non-negative, was "
                + parsed.numerics.numGaussHermitePoints);
        }
        return parsed;
    }

    /// Serializes these settings to JSON.
    ///
    /// @return the JSON text
    public String toJson() {
        return GSON.toJson(this);
    }

    /// @return the quadrature policy
    public QuadraturePolicy getQuadraturePolicy() {
        return numerics.ekernQuadrature;
    }

    /// @return the default number of Gauss-Hermite points per dimension for new kernels
    public int getNumGaussHermitePoints() {
        return numerics.numGaussHermitePoints;
    }

    /// Returns a copy with a different quadrature policy.
    ///
    /// @param policy the policy
    /// @return modified copy
    public KernelSettings withQuadraturePolicy(QuadraturePolicy policy) {
        Objects.requireNonNull(policy, "policy cannot be null");
        return new KernelSettings(new Numerics(policy, numerics.numGaussHermitePoints));
    }

    /// Returns a copy with a different default point count.
    ///
    /// @param points the number of points, 0 disables quadrature
    /// @return modified copy
    public KernelSettings withNumGaussHermitePoints(int points) {
        if (points < 0) {
            throw new KernelConfigurationException("num_gauss_hermite_points must be non-negative, was " + points);
        }
        return new KernelSettings(new Numerics(numerics.ekernQuadrature, points));
    }

    /// Installs settings until the returned scope is closed.
    ///
    /// Scopes must be closed in the reverse order they were opened.
    ///
    /// @param settings the settings to install
    /// @return a scope restoring the previous settings on close
    public static Scope push(KernelSettings settings) {
        Objects.requireNonNull(settings, "settings cannot be null");
        Scope scope = new Scope(current);
        current = settings;
        logger.debug("Pushed kernel settings: policy={}, points={}",
            settings.getQuadraturePolicy(), settings.getNumGaussHermitePoints());
        return scope;
    }

    /// Restores the settings that were in effect when it was opened.
    public static final class Scope implements AutoCloseable {
        private final KernelSettings previous;

        private Scope(KernelSettings previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            current = previous;
            logger.debug("Restored kernel settings: policy={}, points={}",
                previous.getQuadraturePolicy(), previous.getNumGaussHermitePoints());
        }
    }

    private static KernelSettings load() {
        KernelSettings settings = defaults();
        try (InputStream in = KernelSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    settings = fromJson(reader);
                }
                logger.debug("Loaded kernel settings from classpath resource {}", RESOURCE);
            } else {
                logger.debug("No {} on the classpath, using built-in kernel settings", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }

        String policy = System.getProperty(QUADRATURE_PROPERTY);
        if (policy != null) {
            settings = settings.withQuadraturePolicy(QuadraturePolicy.fromSettingName(policy));
            logger.debug("Quadrature policy overridden by {}={}", QUADRATURE_PROPERTY, policy);
        }
        String points = System.getProperty(POINTS_PROPERTY);
        if (points != null) {
            try {
                settings = settings.withNumGaussHermitePoints(Integer.parseInt(points.trim()));
            } catch (NumberFormatException e) {
                throw new KernelConfigurationException(POINTS_PROPERTY + " must be an integer, was '" + points + "'");
            }
            logger.debug("Gauss-Hermite point count overridden by {}={}", POINTS_PROPERTY, points);
        }
        return settings;
    }

    @Override
    public String toString() {
        return "KernelSettings[ekern_quadrature=" + numerics.ekernQuadrature.settingName()
            + ", num_gauss_hermite_points=" + numerics.numGaussHermitePoints + "]";
    }
}
