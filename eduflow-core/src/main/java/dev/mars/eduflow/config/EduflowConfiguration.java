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

package dev.mars.eduflow.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the EduFlow workflow engine.
 * Defaults are overlaid by the first readable {@code eduflow.properties} file
 * (or the classpath copy) and then by {@code -Deduflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class EduflowConfiguration {
    private static final Logger logger = Logger.getLogger(EduflowConfiguration.class.getName());

    public static final String BUILTIN_TEMPLATES_ENABLED = "eduflow.templates.builtin.enabled";
    public static final String TEMPLATES_DIRECTORY = "eduflow.templates.directory";
    public static final String COLLABORATOR_TIMEOUT_MS = "eduflow.collaborator.timeout.ms";
    public static final String LOCK_TIMEOUT_MS = "eduflow.lock.timeout.ms";
    public static final String BULK_MAX_CONCURRENT = "eduflow.bulk.max.concurrent";
    public static final String AUDIT_RETAINED_ENTRIES = "eduflow.audit.retained.entries";
    public static final String AUDIT_FILE = "eduflow.audit.file";
    public static final String NOTIFICATIONS_ENABLED = "eduflow.notifications.enabled";
    public static final String METRICS_ENABLED = "eduflow.metrics.enabled";

    private static final long DEFAULT_COLLABORATOR_TIMEOUT_MS = 5000;
    private static final long DEFAULT_LOCK_TIMEOUT_MS = 10000;
    private static final int DEFAULT_BULK_MAX_CONCURRENT = 5;
    private static final int DEFAULT_AUDIT_RETAINED_ENTRIES = 10000;

    private final Properties properties;

    public EduflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public EduflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Loads defaults overlaid by a single properties file, ignoring the standard
     * search locations and system properties.
     */
    public static EduflowConfiguration fromFile(Path configFile) throws IOException {
        Properties loaded = new Properties();
        try (InputStream input = Files.newInputStream(configFile)) {
            loaded.load(input);
        }
        logger.info("Loaded configuration from: " + configFile);
        return new EduflowConfiguration(loaded);
    }

    // Template loading
    public boolean isBuiltinTemplatesEnabled() {
        return getBooleanProperty(BUILTIN_TEMPLATES_ENABLED, true);
    }

    public Optional<Path> getTemplatesDirectory() {
        return getPathProperty(TEMPLATES_DIRECTORY);
    }

    // Engine timeouts and limits
    public Duration getCollaboratorTimeout() {
        return Duration.ofMillis(getPositiveLong(COLLABORATOR_TIMEOUT_MS, DEFAULT_COLLABORATOR_TIMEOUT_MS));
    }

    public Duration getLockTimeout() {
        return Duration.ofMillis(getPositiveLong(LOCK_TIMEOUT_MS, DEFAULT_LOCK_TIMEOUT_MS));
    }

    public int getBulkMaxConcurrent() {
        return getPositiveInt(BULK_MAX_CONCURRENT, DEFAULT_BULK_MAX_CONCURRENT);
    }

    // Audit
    public int getAuditRetainedEntries() {
        return getPositiveInt(AUDIT_RETAINED_ENTRIES, DEFAULT_AUDIT_RETAINED_ENTRIES);
    }

    public Optional<Path> getAuditFile() {
        return getPathProperty(AUDIT_FILE);
    }

    // Side effects
    public boolean isNotificationsEnabled() {
        return getBooleanProperty(NOTIFICATIONS_ENABLED, true);
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private Optional<Path> getPathProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(value.trim()));
    }

    private int getPositiveInt(String key, int defaultValue) {
        int value = getIntProperty(key, defaultValue);
        if (value <= 0) {
            logger.warning("Non-positive value for property " + key + ": " + value +
                         ". Using default: " + defaultValue);
            return defaultValue;
        }
        return value;
    }

    private long getPositiveLong(String key, long defaultValue) {
        long value = getLongProperty(key, defaultValue);
        if (value <= 0) {
            logger.warning("Non-positive value for property " + key + ": " + value +
                         ". Using default: " + defaultValue);
            return defaultValue;
        }
        return value;
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(BUILTIN_TEMPLATES_ENABLED, "true");
        properties.setProperty(COLLABORATOR_TIMEOUT_MS, String.valueOf(DEFAULT_COLLABORATOR_TIMEOUT_MS));
        properties.setProperty(LOCK_TIMEOUT_MS, String.valueOf(DEFAULT_LOCK_TIMEOUT_MS));
        properties.setProperty(BULK_MAX_CONCURRENT, String.valueOf(DEFAULT_BULK_MAX_CONCURRENT));
        properties.setProperty(AUDIT_RETAINED_ENTRIES, String.valueOf(DEFAULT_AUDIT_RETAINED_ENTRIES));
        properties.setProperty(NOTIFICATIONS_ENABLED, "true");
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "eduflow.properties",
                "config/eduflow.properties",
                System.getProperty("user.home") + "/.eduflow/eduflow.properties",
                "/etc/eduflow/eduflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("eduflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("eduflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "EduflowConfiguration{" +
                "builtinTemplates=" + isBuiltinTemplatesEnabled() +
                ", templatesDirectory=" + getTemplatesDirectory().map(Path::toString).orElse("none") +
                ", collaboratorTimeout=" + getCollaboratorTimeout() +
                ", lockTimeout=" + getLockTimeout() +
                ", bulkMaxConcurrent=" + getBulkMaxConcurrent() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
