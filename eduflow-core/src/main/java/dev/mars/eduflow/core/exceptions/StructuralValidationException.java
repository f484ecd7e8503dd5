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

package dev.mars.eduflow.core.exceptions;

import java.util.List;

/**
 * Thrown when a template fails structural validation and is refused by the registry.
 */
public class StructuralValidationException extends WorkflowException {

    private final String templateId;
    private final List<String> errors;

    public StructuralValidationException(String templateId, List<String> errors) {
        super(ErrorKind.STRUCTURAL_VALIDATION,
                String.format("Template '%s' failed structural validation: %s", templateId, String.join("; ", errors)),
                details("template_id", templateId, "errors", List.copyOf(errors)));
        this.templateId = templateId;
        this.errors = List.copyOf(errors);
    }

    public String getTemplateId() {
        return templateId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
