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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for EduflowConfiguration.
 * Validates defaults, property overrides, type conversion and system property precedence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class EduflowConfigurationTest {

    private EduflowConfiguration config;

    @BeforeEach
    void setUp() {
        config = new EduflowConfiguration(null);
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(EduflowConfiguration.BULK_MAX_CONCURRENT);
        System.clearProperty(EduflowConfiguration.METRICS_ENABLED);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        assertTrue(config.isBuiltinTemplatesEnabled());
        assertEquals(Optional.empty(), config.getTemplatesDirectory());
        assertEquals(Duration.ofMillis(5000), config.getCollaboratorTimeout());
        assertEquals(Duration.ofMillis(10000), config.getLockTimeout());
        assertEquals(5, config.getBulkMaxConcurrent());
        assertEquals(10000, config.getAuditRetainedEntries());
        assertEquals(Optional.empty(), config.getAuditFile());
        assertTrue(config.isNotificationsEnabled());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Override Tests ==========

    @Test
    void testConstructorWithProperties() {
        Properties props = new Properties();
        props.setProperty(EduflowConfiguration.LOCK_TIMEOUT_MS, "250");
        props.setProperty(EduflowConfiguration.TEMPLATES_DIRECTORY, "/opt/templates");
        props.setProperty(EduflowConfiguration.NOTIFICATIONS_ENABLED, "false");

        EduflowConfiguration custom = new EduflowConfiguration(props);

        assertEquals(Duration.ofMillis(250), custom.getLockTimeout());
        assertEquals(Optional.of(Paths.get("/opt/templates")), custom.getTemplatesDirectory());
        assertFalse(custom.isNotificationsEnabled());
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        config.setProperty(EduflowConfiguration.BULK_MAX_CONCURRENT, "many");
        assertEquals(5, config.getBulkMaxConcurrent());
    }

    @Test
    void testNonPositiveNumberFallsBackToDefault() {
        config.setProperty(EduflowConfiguration.COLLABORATOR_TIMEOUT_MS, "0");
        assertEquals(Duration.ofMillis(5000), config.getCollaboratorTimeout());
    }

    @Test
    void testBlankPathIsUnset() {
        config.setProperty(EduflowConfiguration.AUDIT_FILE, "  ");
        assertTrue(config.getAuditFile().isEmpty());
    }

    @Test
    void testGetPropertyWithDefault() {
        assertNull(config.getProperty("nonexistent.property"));
        assertEquals("fallback", config.getProperty("nonexistent.property", "fallback"));
    }

    // ========== Source Precedence Tests ==========

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty(EduflowConfiguration.BULK_MAX_CONCURRENT, "12");
        System.setProperty(EduflowConfiguration.METRICS_ENABLED, "false");

        EduflowConfiguration fromSystem = new EduflowConfiguration();

        assertEquals(12, fromSystem.getBulkMaxConcurrent());
        assertFalse(fromSystem.isMetricsEnabled());
    }

    @Test
    void testFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("eduflow.properties");
        Files.writeString(file, "eduflow.audit.retained.entries=42\neduflow.templates.builtin.enabled=false\n");

        EduflowConfiguration fromFile = EduflowConfiguration.fromFile(file);

        assertEquals(42, fromFile.getAuditRetainedEntries());
        assertFalse(fromFile.isBuiltinTemplatesEnabled());
        assertEquals(5, fromFile.getBulkMaxConcurrent());
    }

    @Test
    void testToStringContainsKeySettings() {
        String text = config.toString();
        assertTrue(text.contains("lockTimeout"));
        assertTrue(text.contains("bulkMaxConcurrent=5"));
    }
}
