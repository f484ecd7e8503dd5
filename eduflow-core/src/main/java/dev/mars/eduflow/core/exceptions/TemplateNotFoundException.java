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

import java.util.Collection;
import java.util.List;

public class TemplateNotFoundException extends WorkflowException {

    private final String templateId;
    private final List<String> availableTemplates;

    public TemplateNotFoundException(String templateId, Collection<String> availableTemplates) {
        super(ErrorKind.NOT_FOUND,
                String.format("Template '%s' not found. Available templates: %s", templateId, availableTemplates),
                details("template_id", templateId, "available_templates", List.copyOf(availableTemplates)));
        this.templateId = templateId;
        this.availableTemplates = List.copyOf(availableTemplates);
    }

    public String getTemplateId() {
        return templateId;
    }

    public List<String> getAvailableTemplates() {
        return availableTemplates;
    }
}
