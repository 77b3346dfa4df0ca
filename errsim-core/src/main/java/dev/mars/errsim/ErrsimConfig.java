/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.errsim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for the error injection subsystem.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Derrsim.enabled=false})</li>
 *   <li>Environment variables (e.g., {@code ERRSIM_ENABLED})</li>
 *   <li>Properties file ({@code errsim.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>enabled</td><td>errsim.enabled</td><td>ERRSIM_ENABLED</td><td>JVM assertion status</td></tr>
 *   <tr><td>logFires</td><td>errsim.logFires</td><td>ERRSIM_LOG_FIRES</td><td>true</td></tr>
 *   <tr><td>strictNames</td><td>errsim.strictNames</td><td>ERRSIM_STRICT_NAMES</td><td>false</td></tr>
 * </table>
 * <p>
 * When {@code enabled} is not configured anywhere, injection is live exactly when
 * assertions are enabled ({@code -ea}), which is how Surefire runs tests. A plain
 * production launch therefore gets the no-op implementation.
 * <p>
 * The process-wide registry reads this once, on first use. Changing a property
 * afterwards has no effect on the running process.
 */
public final class ErrsimConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ErrsimConfig.class);

    private static final String PROPERTIES_FILE = "errsim.properties";

    // Property keys
    private static final String PROP_ENABLED = "errsim.enabled";
    private static final String PROP_LOG_FIRES = "errsim.logFires";
    private static final String PROP_STRICT_NAMES = "errsim.strictNames";

    // Environment variable keys
    private static final String ENV_ENABLED = "ERRSIM_ENABLED";
    private static final String ENV_LOG_FIRES = "ERRSIM_LOG_FIRES";
    private static final String ENV_STRICT_NAMES = "ERRSIM_STRICT_NAMES";

    // Defaults
    private static final boolean DEFAULT_LOG_FIRES = true;
    private static final boolean DEFAULT_STRICT_NAMES = false;

    private final boolean enabled;
    private final boolean logFires;
    private final boolean strictNames;

    private ErrsimConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.logFires = builder.logFires;
        this.strictNames = builder.strictNames;
    }

    /** Whether injection points are live (false selects the no-op implementation). */
    public boolean enabled() {
        return enabled;
    }

    /** Whether each firing is logged at INFO. */
    public boolean logFires() {
        return logFires;
    }

    /** Whether point names breaking the {@code EP_} convention are rejected instead of logged. */
    public boolean strictNames() {
        return strictNames;
    }

    @Override
    public String toString() {
        return "ErrsimConfig{" +
                "enabled=" + enabled +
                ", logFires=" + logFires +
                ", strictNames=" + strictNames +
                '}';
    }

    /**
     * Creates a new builder. Unset values are resolved from system properties,
     * environment variables, and the properties file at {@link Builder#build()}.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code ErrsimConfig.builder().build()}.
     */
    public static ErrsimConfig load() {
        return builder().build();
    }

    static boolean assertionsEnabled() {
        boolean enabled = false;
        assert enabled = true;
        return enabled;
    }

    /**
     * Builder for {@link ErrsimConfig}.
     */
    public static final class Builder {
        private Boolean enabled;
        private Boolean logFires;
        private Boolean strictNames;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Selects the live or the no-op implementation. */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /** Enables or disables the INFO line written on every firing (default: true). */
        public Builder logFires(boolean logFires) {
            this.logFires = logFires;
            return this;
        }

        /** Rejects unconventional point names when true (default: false). */
        public Builder strictNames(boolean strictNames) {
            this.strictNames = strictNames;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public ErrsimConfig build() {
            if (enabled == null) {
                enabled = resolveBoolean(PROP_ENABLED, ENV_ENABLED, assertionsEnabled());
            }
            if (logFires == null) {
                logFires = resolveBoolean(PROP_LOG_FIRES, ENV_LOG_FIRES, DEFAULT_LOG_FIRES);
            }
            if (strictNames == null) {
                strictNames = resolveBoolean(PROP_STRICT_NAMES, ENV_STRICT_NAMES, DEFAULT_STRICT_NAMES);
            }
            ErrsimConfig config = new ErrsimConfig(this);
            LOG.trace("Resolved {}", config);
            return config;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = firstNonBlank(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            String normalized = value.trim().toLowerCase();
            if (normalized.equals("true") || normalized.equals("false")) {
                return Boolean.parseBoolean(normalized);
            }
            LOG.debug("Ignoring unparseable boolean '{}' for {}, using {}", value, sysProp, defaultValue);
            return defaultValue;
        }

        private String firstNonBlank(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            return null;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = ErrsimConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.debug("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.debug("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
