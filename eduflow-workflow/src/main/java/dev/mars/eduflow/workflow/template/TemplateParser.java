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

import dev.mars.eduflow.core.WorkflowTemplate;

import java.io.InputStream;
import java.nio.file.Path;

public interface TemplateParser {

    WorkflowTemplate parse(Path templateFile) throws TemplateParseException;

    WorkflowTemplate parse(InputStream input, String sourceName) throws TemplateParseException;

    WorkflowTemplate parseFromString(String content) throws TemplateParseException;

    /**
     * Runs the structural checks on an already bound template.
     */
    ValidationResult validate(WorkflowTemplate template);

    /**
     * Validates a document against the template schema without building a model.
     *
     * @param content the raw template document
     * @return validation result
     */
    ValidationResult validateSchema(String content);
}
