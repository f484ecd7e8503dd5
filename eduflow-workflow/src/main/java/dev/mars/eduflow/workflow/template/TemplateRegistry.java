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
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.exceptions.StructuralValidationException;
import dev.mars.eduflow.core.exceptions.TemplateNotFoundException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process-wide catalogue of validated workflow templates.
 *
 * <p>A registry is assembled once through its {@link Builder}: every template
 * source is parsed and structurally validated, and the first invalid template
 * aborts the build so that no partial registry is ever published. After
 * construction the registry is immutable and lookups take no locks.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TemplateRegistry {

    private static final Logger logger = Logger.getLogger(TemplateRegistry.class.getName());

    public static final String BUILTIN_TEMPLATE_LOCATION = "/templates/";
    public static final List<String> BUILTIN_TEMPLATE_IDS = List.of("simple_review", "extended_review");

    private final Map<String, WorkflowTemplate> templates;
    private final Map<String, ValidationResult> validationResults;

    private TemplateRegistry(Map<String, WorkflowTemplate> templates, Map<String, ValidationResult> validationResults) {
        this.templates = Collections.unmodifiableMap(new TreeMap<>(templates));
        this.validationResults = Map.copyOf(validationResults);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a registry from configuration: the built-in templates when enabled
     * plus every YAML file in the configured templates directory.
     */
    public static TemplateRegistry fromConfiguration(EduflowConfiguration configuration)
            throws TemplateParseException, StructuralValidationException {
        Builder builder = builder();
        if (configuration.isBuiltinTemplatesEnabled()) {
            builder.withBuiltinTemplates();
        }
        configuration.getTemplatesDirectory().ifPresent(builder::addTemplateDirectory);
        return builder.build();
    }

    public WorkflowTemplate getTemplate(String templateId) throws TemplateNotFoundException {
        WorkflowTemplate template = templates.get(templateId);
        if (template == null) {
            throw new TemplateNotFoundException(templateId, templates.keySet());
        }
        return template;
    }

    public Optional<WorkflowTemplate> findTemplate(String templateId) {
        return Optional.ofNullable(templateId == null ? null : templates.get(templateId));
    }

    /**
     * Summaries of the templates matching {@code filter}, ordered by id.
     */
    public List<TemplateSummary> listTemplates(TemplateFilter filter) {
        TemplateFilter effective = filter != null ? filter : TemplateFilter.all();
        return templates.values().stream()
                .filter(effective::matches)
                .map(TemplateSummary::of)
                .collect(Collectors.toList());
    }

    public List<String> getValidationWarnings(String templateId) {
        ValidationResult result = validationResults.get(templateId);
        return result != null ? result.getWarningMessages() : List.of();
    }

    public Set<String> getTemplateIds() {
        return templates.keySet();
    }

    public int size() {
        return templates.size();
    }

    @Override
    public String toString() {
        return "TemplateRegistry{templates=" + templates.keySet() + '}';
    }

    public static class Builder {
        private final TemplateParser parser;
        private boolean includeBuiltins;
        private final List<Path> templateFiles = new ArrayList<>();
        private final List<Path> templateDirectories = new ArrayList<>();
        private final List<WorkflowTemplate> programmaticTemplates = new ArrayList<>();

        private Builder() {
            this.parser = new YamlTemplateParser();
        }

        public Builder withBuiltinTemplates() {
            this.includeBuiltins = true;
            return this;
        }

        public Builder addTemplateFile(Path file) {
            templateFiles.add(Objects.requireNonNull(file, "Template file cannot be null"));
            return this;
        }

        public Builder addTemplateDirectory(Path directory) {
            templateDirectories.add(Objects.requireNonNull(directory, "Template directory cannot be null"));
            return this;
        }

        public Builder addTemplate(WorkflowTemplate template) {
            programmaticTemplates.add(Objects.requireNonNull(template, "Template cannot be null"));
            return this;
        }

        /**
         * Parses and validates every source.
         *
         * @return the immutable registry
         * @throws TemplateParseException if a source cannot be read or bound
         * @throws StructuralValidationException on the first structurally invalid
         *         template, or when two sources declare the same id
         */
        public TemplateRegistry build() throws TemplateParseException, StructuralValidationException {
            List<WorkflowTemplate> candidates = new ArrayList<>();
            if (includeBuiltins) {
                for (String id : BUILTIN_TEMPLATE_IDS) {
                    candidates.add(loadBuiltin(id));
                }
            }
            for (Path directory : templateDirectories) {
                for (Path file : listYamlFiles(directory)) {
                    candidates.add(parser.parse(file));
                }
            }
            for (Path file : templateFiles) {
                candidates.add(parser.parse(file));
            }
            candidates.addAll(programmaticTemplates);

            Map<String, WorkflowTemplate> templates = new LinkedHashMap<>();
            Map<String, ValidationResult> results = new HashMap<>();
            TemplateStructureValidator validator = new TemplateStructureValidator();

            for (WorkflowTemplate template : candidates) {
                ValidationResult result = validator.validate(template);
                if (!result.isValid()) {
                    logger.severe("Rejecting template '" + template.getId() + "': " + result.getErrorMessages());
                    throw new StructuralValidationException(template.getId(), result.getErrorMessages());
                }
                if (templates.containsKey(template.getId())) {
                    throw new StructuralValidationException(template.getId(),
                            List.of("Duplicate template id '" + template.getId() + "'"));
                }
                for (String warning : result.getWarningMessages()) {
                    logger.fine("Template '" + template.getId() + "' warning: " + warning);
                }
                templates.put(template.getId(), template);
                results.put(template.getId(), result);
            }

            logger.info("Template registry initialized with " + templates.size() + " templates: " + templates.keySet());
            return new TemplateRegistry(templates, results);
        }

        private WorkflowTemplate loadBuiltin(String id) throws TemplateParseException {
            String resource = BUILTIN_TEMPLATE_LOCATION + id + ".yaml";
            try (InputStream input = TemplateRegistry.class.getResourceAsStream(resource)) {
                if (input == null) {
                    throw new TemplateParseException(id, null, "Built-in template resource not found: " + resource);
                }
                return parser.parse(input, id);
            } catch (IOException e) {
                throw new TemplateParseException("Failed to read built-in template " + resource, e);
            }
        }

        private List<Path> listYamlFiles(Path directory) throws TemplateParseException {
            if (!Files.isDirectory(directory)) {
                throw new TemplateParseException("Template directory does not exist: " + directory);
            }
            try (Stream<Path> files = Files.list(directory)) {
                return files.filter(Files::isRegularFile)
                        .filter(p -> {
                            String name = p.getFileName().toString();
                            return name.endsWith(".yaml") || name.endsWith(".yml");
                        })
                        .sorted()
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new TemplateParseException("Failed to list template directory " + directory, e);
            }
        }
    }
}
