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

import dev.mars.eduflow.core.Role;
import dev.mars.eduflow.core.StateType;
import dev.mars.eduflow.core.WorkflowAction;
import dev.mars.eduflow.core.WorkflowState;
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.WorkflowTransition;
import dev.mars.eduflow.workflow.instance.HistoryEntry;
import dev.mars.eduflow.workflow.instance.WorkflowInstance;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only view of a content item's workflow position as seen by one role.
 *
 * <p>Built from a single instance snapshot, so the current state and the
 * history always agree.</p>
 */
public final class WorkflowStateView {

    private final WorkflowInstance instance;
    private final String templateName;
    private final WorkflowState currentState;
    private final Role requestingRole;
    private final Set<WorkflowAction> availableActions;
    private final List<WorkflowTransition> availableTransitions;

    public WorkflowStateView(WorkflowInstance instance, WorkflowTemplate template, WorkflowState currentState,
                             Role requestingRole, Set<WorkflowAction> availableActions,
                             List<WorkflowTransition> availableTransitions) {
        this.instance = Objects.requireNonNull(instance, "Instance cannot be null");
        this.templateName = Objects.requireNonNull(template, "Template cannot be null").getName();
        this.currentState = Objects.requireNonNull(currentState, "Current state cannot be null");
        this.requestingRole = requestingRole;
        this.availableActions = Set.copyOf(availableActions);
        this.availableTransitions = List.copyOf(availableTransitions);
    }

    public String getContentUid() { return instance.getContentUid(); }
    public String getTemplateId() { return instance.getTemplateId(); }
    public String getTemplateName() { return templateName; }
    public String getTemplateVersion() { return instance.getTemplateVersion(); }
    public String getCurrentState() { return currentState.getId(); }
    public String getCurrentStateTitle() { return currentState.getTitle(); }
    public StateType getCurrentStateType() { return currentState.getStateType(); }
    public boolean isFinal() { return currentState.isFinal(); }
    public Role getRequestingRole() { return requestingRole; }
    public Set<WorkflowAction> getAvailableActions() { return availableActions; }
    public List<WorkflowTransition> getAvailableTransitions() { return availableTransitions; }
    public List<HistoryEntry> getHistory() { return instance.getHistory(); }
    public Map<Role, List<String>> getRoleAssignments() { return instance.getRoleAssignments(); }
    public String getAppliedBy() { return instance.getAppliedBy(); }
    public Instant getAppliedAt() { return instance.getAppliedAt(); }
    public Instant getUpdatedAt() { return instance.getUpdatedAt(); }
    public boolean hasBackup() { return instance.getBackup().isPresent(); }
    public long getVersion() { return instance.getVersion(); }

    public List<String> getAvailableTransitionIds() {
        return availableTransitions.stream().map(WorkflowTransition::getId).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "WorkflowStateView{" +
               "contentUid='" + getContentUid() + '\'' +
               ", templateId='" + getTemplateId() + '\'' +
               ", currentState='" + getCurrentState() + '\'' +
               ", role=" + requestingRole +
               ", availableTransitions=" + getAvailableTransitionIds() +
               ", history=" + getHistory().size() +
               '}';
    }
}
