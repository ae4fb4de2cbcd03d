package dev.mars.pgprojection.core.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.*;

/**
 * Configuration for the projection engine.
 *
 * Properties are layered, later sources winning:
 * <ol>
 *   <li>{@code /pgprojection-default.properties} on the classpath</li>
 *   <li>{@code /pgprojection-<profile>.properties} when a profile other than default is active</li>
 *   <li>{@code PGPROJECTION_*} environment variables, underscores mapped to dots</li>
 *   <li>{@code pgprojection.*} system properties</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class ProjectionConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionConfiguration.class);

    private final Properties properties;
    private final String profile;

    public ProjectionConfiguration() {
        this(getActiveProfile());
    }

    public ProjectionConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Constructor for programmatic configuration. The overrides win over every other source
     * without touching system properties, so concurrent tests do not interfere.
     *
     * @param profile the configuration profile to use
     * @param overrides properties applied last
     */
    public ProjectionConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded projection configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("pgprojection.profile",
               System.getenv("PGPROJECTION_PROFILE") != null ? System.getenv("PGPROJECTION_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgprojection-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgprojection-" + profile + ".properties");
        }

        // Environment first so that -D overrides from tests win
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("PGPROJECTION_")) {
                String propKey = key.toLowerCase().replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("pgprojection.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateDatabaseConfig(errors);
        validateBatchConfig(errors);
        validateHighWaterConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString("pgprojection.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt("pgprojection.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString("pgprojection.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getInt("pgprojection.database.pool.max-size", 16) < 1) {
            errors.add("Maximum pool size must be at least 1");
        }
    }

    private void validateBatchConfig(List<String> errors) {
        if (getInt("pgprojection.batch.update-size", 500) < 1) {
            errors.add("Batch update size must be at least 1");
        }

        if (getInt("pgprojection.aggregation.cache-limit-per-tenant", 0) < 0) {
            errors.add("Aggregate cache limit must be non-negative");
        }

        if (getInt("pgprojection.aggregation.slice-parallelism", 4) < 1) {
            errors.add("Slice parallelism must be at least 1");
        }
    }

    private void validateHighWaterConfig(List<String> errors) {
        if (getDuration("pgprojection.highwater.safe-zone", Duration.ofSeconds(3)).isNegative()) {
            errors.add("High water safe zone must not be negative");
        }

        if (getInt("pgprojection.highwater.scan-page-size", 1000) < 1) {
            errors.add("High water scan page size must be at least 1");
        }

        Duration polling = getDuration("pgprojection.highwater.polling-interval", Duration.ofSeconds(1));
        if (polling.isZero() || polling.isNegative()) {
            errors.add("High water polling interval must be positive");
        }
    }

    // Configuration getters with defaults and validation

    public String getProfile() {
        return profile;
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }

        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }

        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Specific configuration builders

    public DaemonSettings getDaemonSettings() {
        return new DaemonSettings.Builder()
            .updateBatchSize(getInt("pgprojection.batch.update-size", 500))
            .cacheLimitPerTenant(getInt("pgprojection.aggregation.cache-limit-per-tenant", 0))
            .sliceParallelism(getInt("pgprojection.aggregation.slice-parallelism", 4))
            .safeZone(getDuration("pgprojection.highwater.safe-zone", Duration.ofSeconds(3)))
            .scanPageSize(getInt("pgprojection.highwater.scan-page-size", 1000))
            .pollingInterval(getDuration("pgprojection.highwater.polling-interval", Duration.ofSeconds(1)))
            .staleThreshold(getDuration("pgprojection.highwater.stale-threshold", Duration.ofSeconds(3)))
            .build();
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("pgprojection.metrics.enabled", true),
            getString("pgprojection.metrics.instance-id", "pgprojection-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    // Configuration data classes

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }
}
