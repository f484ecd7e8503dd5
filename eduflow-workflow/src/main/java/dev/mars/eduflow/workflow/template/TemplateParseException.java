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

/**
 * Exception thrown when a template document cannot be read or bound to the model.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TemplateParseException extends Exception {

    private final String templateName;
    private final int lineNumber;
    private final String fieldPath;

    public TemplateParseException(String message) {
        this(null, -1, null, message, null);
    }

    public TemplateParseException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public TemplateParseException(String templateName, String fieldPath, String message) {
        this(templateName, -1, fieldPath, message, null);
    }

    public TemplateParseException(String templateName, int lineNumber, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.templateName = templateName;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    public String getTemplateName() {
        return templateName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (templateName != null) {
            sb.append("Template '").append(templateName).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
