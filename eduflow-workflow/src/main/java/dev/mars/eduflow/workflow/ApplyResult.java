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

package dev.mars.eduflow.workflow;

import dev.mars.eduflow.workflow.instance.WorkflowInstance;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a successful {@link WorkflowEngine#applyTemplate} call.
 */
public final class ApplyResult {

    private final WorkflowInstance instance;
    private final List<String> warnings;
    private final boolean backupCreated;
    private final String replacedTemplateId;

    public ApplyResult(WorkflowInstance instance, List<String> warnings, boolean backupCreated,
                       String replacedTemplateId) {
        this.instance = Objects.requireNonNull(instance, "Instance cannot be null");
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
        this.backupCreated = backupCreated;
        this.replacedTemplateId = replacedTemplateId;
    }

    public WorkflowInstance getInstance() { return instance; }
    public String getContentUid() { return instance.getContentUid(); }
    public String getTemplateId() { return instance.getTemplateId(); }
    public String getCurrentState() { return instance.getCurrentState(); }
    public List<String> getWarnings() { return warnings; }
    public boolean isBackupCreated() { return backupCreated; }

    /**
     * The template of the instance this one replaced, when applied with force.
     */
    public Optional<String> getReplacedTemplateId() {
        return Optional.ofNullable(replacedTemplateId);
    }

    @Override
    public String toString() {
        return "ApplyResult{" +
               "contentUid='" + getContentUid() + '\'' +
               ", templateId='" + getTemplateId() + '\'' +
               ", currentState='" + getCurrentState() + '\'' +
               ", warnings=" + warnings.size() +
               ", backupCreated=" + backupCreated +
               '}';
    }
}
