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

import dev.mars.eduflow.core.Role;
import dev.mars.eduflow.core.StatePermission;
import dev.mars.eduflow.core.StateType;
import dev.mars.eduflow.core.TemplateCategory;
import dev.mars.eduflow.core.WorkflowAction;
import dev.mars.eduflow.core.WorkflowState;
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.WorkflowTransition;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;

/**
 * YAML-based implementation of TemplateParser.
 * Parses workflow templates using SnakeYAML, checks them against the template
 * schema and binds them to the immutable model.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlTemplateParser implements TemplateParser {

    private final Yaml yaml;
    private final TemplateSchemaValidator schemaValidator;
    private final TemplateStructureValidator structureValidator;

    public YamlTemplateParser() {
        this(new TemplateSchemaValidator(), new TemplateStructureValidator());
    }

    public YamlTemplateParser(TemplateSchemaValidator schemaValidator, TemplateStructureValidator structureValidator) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.schemaValidator = Objects.requireNonNull(schemaValidator, "Schema validator cannot be null");
        this.structureValidator = Objects.requireNonNull(structureValidator, "Structure validator cannot be null");
    }

    @Override
    public WorkflowTemplate parse(Path templateFile) throws TemplateParseException {
        try {
            String content = Files.readString(templateFile);
            return parseDocument(content, templateFile.getFileName().toString());
        } catch (IOException e) {
            throw new TemplateParseException("Failed to read template file: " + templateFile, e);
        }
    }

    @Override
    public WorkflowTemplate parse(InputStream input, String sourceName) throws TemplateParseException {
        try {
            String content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            return parseDocument(content, sourceName);
        } catch (IOException e) {
            throw new TemplateParseException("Failed to read template from " + sourceName, e);
        }
    }

    @Override
    public WorkflowTemplate parseFromString(String content) throws TemplateParseException {
        return parseDocument(content, null);
    }

    @Override
    public ValidationResult validate(WorkflowTemplate template) {
        return structureValidator.validate(template);
    }

    @Override
    public ValidationResult validateSchema(String content) {
        ValidationResult result = new ValidationResult();
        try {
            Object loaded = yaml.load(content);
            if (!(loaded instanceof Map)) {
                result.addError("Empty or invalid YAML content");
                return result;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> data = (Map<String, Object>) loaded;
            result.merge(schemaValidator.validate(data));
        } catch (YAMLException e) {
            result.addError("YAML syntax error: " + e.getMessage());
        }
        return result;
    }

    private WorkflowTemplate parseDocument(String content, String sourceName) throws TemplateParseException {
        Map<String, Object> data = load(content, sourceName);
        String templateName = getStringValue(data, "id", sourceName);

        ValidationResult schemaResult = schemaValidator.validate(data);
        if (!schemaResult.isValid()) {
            ValidationResult.ValidationIssue first = schemaResult.getErrors().get(0);
            throw new TemplateParseException(templateName, first.getFieldPath(),
                    "Schema validation failed: " + String.join("; ", schemaResult.getErrorMessages()));
        }

        return bindTemplate(data, templateName);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> load(String content, String sourceName) throws TemplateParseException {
        try {
            Object loaded = yaml.load(content);
            if (!(loaded instanceof Map)) {
                throw new TemplateParseException(sourceName, null, "Empty or invalid YAML content");
            }
            return (Map<String, Object>) loaded;
        } catch (MarkedYAMLException e) {
            int line = e.getProblemMark() != null ? e.getProblemMark().getLine() + 1 : -1;
            throw new TemplateParseException(sourceName, line, null, "YAML parsing failed: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new TemplateParseException(sourceName, -1, null, "YAML parsing failed", e);
        }
    }

    private WorkflowTemplate bindTemplate(Map<String, Object> data, String templateName) throws TemplateParseException {
        WorkflowTemplate.Builder builder = WorkflowTemplate.builder()
                .id(requireString(data, "id", templateName, "id"))
                .name(requireString(data, "name", templateName, "name"))
                .description(getStringValue(data, "description", ""))
                .category(parseEnum(requireString(data, "category", templateName, "category"),
                        TemplateCategory::fromValue, templateName, "category"))
                .version(requireString(data, "version", templateName, "version"))
                .metadata(getMapValue(data, "metadata"));

        List<Map<String, Object>> states = getListValue(data, "states");
        for (int i = 0; i < states.size(); i++) {
            builder.state(bindState(states.get(i), templateName, "states[" + i + "]"));
        }

        List<Map<String, Object>> transitions = getListValue(data, "transitions");
        for (int i = 0; i < transitions.size(); i++) {
            builder.transition(bindTransition(transitions.get(i), templateName, "transitions[" + i + "]"));
        }

        Map<String, Object> defaults = getMapValue(data, "default_permissions");
        if (defaults != null) {
            for (Map.Entry<String, Object> entry : defaults.entrySet()) {
                String path = "default_permissions." + entry.getKey();
                Role role = parseEnum(entry.getKey(), Role::fromValue, templateName, path);
                builder.defaultPermission(role, parseActions(entry.getValue(), templateName, path)
                        .toArray(new WorkflowAction[0]));
            }
        }

        return builder.build();
    }

    private WorkflowState bindState(Map<String, Object> data, String templateName, String path)
            throws TemplateParseException {
        String id = requireString(data, "id", templateName, path + ".id");
        WorkflowState.Builder builder = WorkflowState.builder()
                .id(id)
                .title(getStringValue(data, "title", id))
                .description(getStringValue(data, "description", ""))
                .stateType(parseEnum(requireString(data, "state_type", templateName, path + ".state_type"),
                        StateType::fromValue, templateName, path + ".state_type"))
                .initial(getBooleanValue(data, "is_initial", false))
                .finalState(getBooleanValue(data, "is_final", false))
                .uiMetadata(getMapValue(data, "ui_metadata"));

        List<Map<String, Object>> permissions = getListValue(data, "permissions");
        for (int i = 0; i < permissions.size(); i++) {
            String permissionPath = path + ".permissions[" + i + "]";
            Map<String, Object> permission = permissions.get(i);
            Role role = parseEnum(requireString(permission, "role", templateName, permissionPath + ".role"),
                    Role::fromValue, templateName, permissionPath + ".role");
            Set<WorkflowAction> actions = parseActions(permission.get("actions"), templateName, permissionPath + ".actions");
            builder.permission(new StatePermission(role, actions));
        }
        return builder.build();
    }

    private WorkflowTransition bindTransition(Map<String, Object> data, String templateName, String path)
            throws TemplateParseException {
        String id = requireString(data, "id", templateName, path + ".id");
        return WorkflowTransition.builder()
                .id(id)
                .title(getStringValue(data, "title", id))
                .fromState(requireString(data, "from_state", templateName, path + ".from_state"))
                .toState(requireString(data, "to_state", templateName, path + ".to_state"))
                .requiredRole(parseEnum(requireString(data, "required_role", templateName, path + ".required_role"),
                        Role::fromValue, templateName, path + ".required_role"))
                .conditions(getMapValue(data, "conditions"))
                .build();
    }

    private Set<WorkflowAction> parseActions(Object value, String templateName, String path)
            throws TemplateParseException {
        Set<WorkflowAction> actions = EnumSet.noneOf(WorkflowAction.class);
        if (value == null) {
            return actions;
        }
        if (!(value instanceof List)) {
            throw new TemplateParseException(templateName, path, "Actions must be a list");
        }
        List<?> items = (List<?>) value;
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (item == null) {
                throw new TemplateParseException(templateName, path + "[" + i + "]", "Action cannot be null");
            }
            actions.add(parseEnum(item.toString(), WorkflowAction::fromValue, templateName, path + "[" + i + "]"));
        }
        return actions;
    }

    private <E> E parseEnum(String value, Function<String, E> parser, String templateName, String path)
            throws TemplateParseException {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new TemplateParseException(templateName, -1, path, e.getMessage(), e);
        }
    }

    // Utility methods for safe type conversion
    private String requireString(Map<String, Object> data, String key, String templateName, String path)
            throws TemplateParseException {
        String value = getStringValue(data, key, null);
        if (value == null) {
            throw new TemplateParseException(templateName, path, "Required field '" + key + "' is missing");
        }
        return value;
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key) {
        if (data == null) return List.of();
        Object value = data.get(key);
        return value instanceof List ? (List<Map<String, Object>>) value : List.of();
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }
}
