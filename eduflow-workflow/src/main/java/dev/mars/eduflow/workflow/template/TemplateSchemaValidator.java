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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates raw template documents against the bundled JSON Schema
 * ({@code schema/workflow-template-schema.json}, draft-07) before they are bound
 * to the typed model.
 *
 * <p>YAML trees produced by SnakeYAML are converted to Jackson nodes so the same
 * schema serves both YAML and JSON sources.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TemplateSchemaValidator {

    public static final String SCHEMA_RESOURCE = "/schema/workflow-template-schema.json";

    private final ObjectMapper objectMapper;
    private final JsonSchema schema;

    public TemplateSchemaValidator() {
        this.objectMapper = new ObjectMapper();
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (InputStream input = TemplateSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Template schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            this.schema = factory.getSchema(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load template schema " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Validates a document already loaded into maps and lists.
     */
    public ValidationResult validate(Map<String, Object> document) {
        ValidationResult result = new ValidationResult();
        if (document == null) {
            result.addError("Template document cannot be null");
            return result;
        }

        JsonNode node;
        try {
            node = objectMapper.valueToTree(document);
        } catch (IllegalArgumentException e) {
            result.addError("Template document cannot be represented as JSON: " + e.getMessage());
            return result;
        }

        Set<ValidationMessage> messages = schema.validate(node);
        List<String> sorted = messages.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .collect(Collectors.toList());
        for (String message : sorted) {
            result.addError(extractPath(message), message);
        }
        return result;
    }

    // Messages are formatted as "$.states[0].state_type: does not have a value in the enumeration [...]".
    private static String extractPath(String message) {
        int separator = message.indexOf(": ");
        if (message.startsWith("$") && separator > 0) {
            String path = message.substring(0, separator);
            if (path.equals("$")) {
                return null;
            }
            return path.startsWith("$.") ? path.substring(2) : path.substring(1);
        }
        return null;
    }
}
