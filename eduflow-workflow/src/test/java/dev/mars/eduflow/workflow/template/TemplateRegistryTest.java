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

package dev.mars.eduflow.workflow.template;

import dev.mars.eduflow.config.EduflowConfiguration;
import dev.mars.eduflow.core.TemplateCategory;
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.exceptions.ErrorKind;
import dev.mars.eduflow.core.exceptions.StructuralValidationException;
import dev.mars.eduflow.core.exceptions.TemplateNotFoundException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import static dev.mars.eduflow.workflow.TestTemplates.threeStateReview;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TemplateRegistry assembly and lookups.
 */
class TemplateRegistryTest {

    @Nested
    class BuiltinTemplates {

        @Test
        void builtinsLoadAndAreStructurallyValid() throws Exception {
            TemplateRegistry registry = TemplateRegistry.builder().withBuiltinTemplates().build();

            assertEquals(2, registry.size());
            TemplateStructureValidator validator = new TemplateStructureValidator();
            for (String id : TemplateRegistry.BUILTIN_TEMPLATE_IDS) {
                WorkflowTemplate template = registry.getTemplate(id);
                assertTrue(validator.validate(template).isValid(), id);
            }
        }

        @Test
        void simpleReviewMatchesItsPublishedShape() throws Exception {
            WorkflowTemplate simple = TemplateRegistry.builder().withBuiltinTemplates().build()
                    .getTemplate("simple_review");

            assertEquals("draft", simple.getInitialState().orElseThrow().getId());
            assertEquals(List.of("published"), simple.getFinalStates().stream()
                    .map(s -> s.getId()).collect(Collectors.toList()));
            assertEquals(List.of("submit_for_review", "approve_content", "reject_to_draft"),
                    simple.getTransitions().stream().map(t -> t.getId()).collect(Collectors.toList()));
            assertTrue(simple.getTransition("approve_content").orElseThrow().getConditions().isCommentsRequired());
        }

        @Test
        void extendedReviewWarnsAboutConditionsItCannotEvaluate() throws Exception {
            TemplateRegistry registry = TemplateRegistry.builder().withBuiltinTemplates().build();

            assertTrue(registry.getValidationWarnings("extended_review").stream()
                    .anyMatch(w -> w.contains("publish_content")));
        }
    }

    @Nested
    class Lookups {

        @Test
        void unknownTemplateListsAvailableIds() throws Exception {
            TemplateRegistry registry = TemplateRegistry.builder().withBuiltinTemplates().build();

            TemplateNotFoundException e = assertThrows(TemplateNotFoundException.class,
                    () -> registry.getTemplate("missing"));
            assertEquals(ErrorKind.NOT_FOUND, e.getKind());
            assertTrue(e.getMessage().contains("simple_review"));
            assertTrue(registry.findTemplate("missing").isEmpty());
            assertTrue(registry.findTemplate(null).isEmpty());
        }

        @Test
        void listingIsOrderedAndFiltered() throws Exception {
            TemplateRegistry registry = TemplateRegistry.builder()
                    .withBuiltinTemplates()
                    .addTemplateFile(resource("valid/corporate_signoff.yaml"))
                    .build();

            assertEquals(List.of("corporate_signoff", "extended_review", "simple_review"),
                    registry.listTemplates(TemplateFilter.all()).stream()
                            .map(TemplateSummary::getId).collect(Collectors.toList()));

            List<TemplateSummary> educational = registry.listTemplates(
                    TemplateFilter.all().withCategory(TemplateCategory.EDUCATIONAL));
            assertEquals(2, educational.size());

            List<TemplateSummary> simpleEducational = registry.listTemplates(
                    TemplateFilter.all().withCategory(TemplateCategory.EDUCATIONAL).withComplexity("simple"));
            assertEquals(1, simpleEducational.size());
            TemplateSummary summary = simpleEducational.get(0);
            assertEquals("simple_review", summary.getId());
            assertEquals(3, summary.getStatesCount());
            assertEquals(3, summary.getTransitionsCount());
            assertEquals("1.0.0", summary.getVersion());

            assertEquals(3, registry.listTemplates(null).size());
        }

        @Test
        void templateIdsAreImmutable() throws Exception {
            TemplateRegistry registry = TemplateRegistry.builder().addTemplate(threeStateReview().build()).build();

            assertThrows(UnsupportedOperationException.class, () -> registry.getTemplateIds().add("other"));
        }
    }

    @Nested
    class FailFast {

        @Test
        void structurallyInvalidTemplateAbortsBuild() {
            StructuralValidationException e = assertThrows(StructuralValidationException.class,
                    () -> TemplateRegistry.builder()
                            .withBuiltinTemplates()
                            .addTemplateFile(resource("invalid/dead_end.yaml"))
                            .build());

            assertEquals(ErrorKind.STRUCTURAL_VALIDATION, e.getKind());
            assertTrue(e.getMessage().contains("dead_end"));
        }

        @Test
        void schemaViolationAbortsBuild() {
            TemplateParseException e = assertThrows(TemplateParseException.class,
                    () -> TemplateRegistry.builder().addTemplateFile(resource("invalid/bad_schema.yaml")).build());

            assertEquals("states[0].state_type", e.getFieldPath());
        }

        @Test
        void duplicateIdsAreRejected() {
            assertThrows(StructuralValidationException.class, () -> TemplateRegistry.builder()
                    .addTemplate(threeStateReview().build())
                    .addTemplate(threeStateReview().name("Another Copy").build())
                    .build());
        }

        @Test
        void programmaticTemplatesAreValidatedToo() {
            assertThrows(StructuralValidationException.class, () -> TemplateRegistry.builder()
                    .addTemplate(threeStateReview().version("latest").build())
                    .build());
        }

        @Test
        void missingDirectoryIsAParseException(@TempDir Path tempDir) {
            assertThrows(TemplateParseException.class, () -> TemplateRegistry.builder()
                    .addTemplateDirectory(tempDir.resolve("absent"))
                    .build());
        }
    }

    @Nested
    class Configuration {

        @Test
        void loadsDirectoryFromConfiguration(@TempDir Path tempDir) throws Exception {
            copyResource("valid/corporate_signoff.yaml", tempDir.resolve("corporate_signoff.yaml"));
            Files.writeString(tempDir.resolve("notes.txt"), "not a template");

            Properties properties = new Properties();
            properties.setProperty(EduflowConfiguration.TEMPLATES_DIRECTORY, tempDir.toString());
            TemplateRegistry registry = TemplateRegistry.fromConfiguration(new EduflowConfiguration(properties));

            assertEquals(3, registry.size());
            assertTrue(registry.findTemplate("corporate_signoff").isPresent());
        }

        @Test
        void builtinsCanBeDisabled(@TempDir Path tempDir) throws Exception {
            copyResource("valid/corporate_signoff.yaml", tempDir.resolve("corporate_signoff.yml"));

            Properties properties = new Properties();
            properties.setProperty(EduflowConfiguration.BUILTIN_TEMPLATES_ENABLED, "false");
            properties.setProperty(EduflowConfiguration.TEMPLATES_DIRECTORY, tempDir.toString());
            TemplateRegistry registry = TemplateRegistry.fromConfiguration(new EduflowConfiguration(properties));

            assertEquals(List.of("corporate_signoff"), List.copyOf(registry.getTemplateIds()));
        }
    }

    private static Path resource(String name) {
        try {
            return Path.of(TemplateRegistryTest.class.getResource("/templates/" + name).toURI());
        } catch (Exception e) {
            throw new IllegalStateException("Missing test resource " + name, e);
        }
    }

    private static void copyResource(String name, Path target) throws IOException {
        try (InputStream input = TemplateRegistryTest.class.getResourceAsStream("/templates/" + name)) {
            Files.copy(input, target);
        }
    }
}
