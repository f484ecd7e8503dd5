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
import java.util.Optional;

/**
 * Optional category and complexity criteria for listing templates. An empty
 * filter matches every template.
 */
public final class TemplateFilter {

    private static final TemplateFilter ALL = new TemplateFilter(null, null);

    private final TemplateCategory category;
    private final String complexity;

    private TemplateFilter(TemplateCategory category, String complexity) {
        this.category = category;
        this.complexity = complexity;
    }

    public static TemplateFilter all() {
        return ALL;
    }

    public TemplateFilter withCategory(TemplateCategory category) {
        return new TemplateFilter(category, complexity);
    }

    public TemplateFilter withComplexity(String complexity) {
        return new TemplateFilter(category, complexity);
    }

    public Optional<TemplateCategory> getCategory() {
        return Optional.ofNullable(category);
    }

    public Optional<String> getComplexity() {
        return Optional.ofNullable(complexity);
    }

    public boolean matches(WorkflowTemplate template) {
        if (category != null && template.getCategory() != category) {
            return false;
        }
        return complexity == null || complexity.equalsIgnoreCase(template.getComplexity());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemplateFilter that = (TemplateFilter) o;
        return category == that.category && Objects.equals(complexity, that.complexity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, complexity);
    }

    @Override
    public String toString() {
        return "TemplateFilter{category=" + category + ", complexity=" + complexity + '}';
    }
}
