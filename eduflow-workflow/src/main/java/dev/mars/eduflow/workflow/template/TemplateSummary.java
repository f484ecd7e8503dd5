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

import dev.mars.eduflow.core.TemplateCategory;
import dev.mars.eduflow.core.WorkflowTemplate;

import java.util.Objects;

/**
 * Listing view of a registered template.
 */
public class TemplateSummary {

    private final String id;
    private final String name;
    private final String description;
    private final TemplateCategory category;
    private final String version;
    private final String complexity;
    private final int statesCount;
    private final int transitionsCount;

    public TemplateSummary(String id, String name, String description, TemplateCategory category,
                           String version, String complexity, int statesCount, int transitionsCount) {
        this.id = Objects.requireNonNull(id, "Template id cannot be null");
        this.name = name;
        this.description = description;
        this.category = category;
        this.version = version;
        this.complexity = complexity;
        this.statesCount = statesCount;
        this.transitionsCount = transitionsCount;
    }

    public static TemplateSummary of(WorkflowTemplate template) {
        return new TemplateSummary(template.getId(), template.getName(), template.getDescription(),
                template.getCategory(), template.getVersion(), template.getComplexity(),
                template.getStates().size(), template.getTransitions().size());
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public TemplateCategory getCategory() { return category; }
    public String getVersion() { return version; }
    public String getComplexity() { return complexity; }
    public int getStatesCount() { return statesCount; }
    public int getTransitionsCount() { return transitionsCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemplateSummary that = (TemplateSummary) o;
        return statesCount == that.statesCount &&
               transitionsCount == that.transitionsCount &&
               Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               category == that.category &&
               Objects.equals(version, that.version) &&
               Objects.equals(complexity, that.complexity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, category, version, complexity, statesCount, transitionsCount);
    }

    @Override
    public String toString() {
        return "TemplateSummary{" +
               "id='" + id + '\'' +
               ", version='" + version + '\'' +
               ", complexity='" + complexity + '\'' +
               ", states=" + statesCount +
               ", transitions=" + transitionsCount +
               '}';
    }
}
