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

package dev.mars.eduflow.workflow.instance;

import dev.mars.eduflow.core.Role;

import java.time.Instant;
import java.util.*;

/**
 * Immutable snapshot of one content item's position in an applied template.
 *
 * <p>Every change produces a new snapshot whose {@link #getVersion() version} is
 * one higher, so readers holding a snapshot always see a consistent pairing of
 * current state and history.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowInstance {

    private final String contentUid;
    private final String templateId;
    private final String templateVersion;
    private final String currentState;
    private final Map<Role, List<String>> roleAssignments;
    private final List<HistoryEntry> history;
    private final WorkflowBackup backup;
    private final String appliedBy;
    private final Instant appliedAt;
    private final Instant updatedAt;
    private final long version;

    private WorkflowInstance(Builder builder) {
        this.contentUid = Objects.requireNonNull(builder.contentUid, "Content uid cannot be null");
        this.templateId = Objects.requireNonNull(builder.templateId, "Template id cannot be null");
        this.templateVersion = builder.templateVersion;
        this.currentState = Objects.requireNonNull(builder.currentState, "Current state cannot be null");
        Map<Role, List<String>> assignments = new EnumMap<>(Role.class);
        builder.roleAssignments.forEach((role, users) -> assignments.put(role, List.copyOf(users)));
        this.roleAssignments = Collections.unmodifiableMap(assignments);
        this.history = List.copyOf(builder.history);
        this.backup = builder.backup;
        this.appliedBy = builder.appliedBy;
        this.appliedAt = Objects.requireNonNull(builder.appliedAt, "Applied-at cannot be null");
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.appliedAt;
        this.version = builder.version;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .contentUid(contentUid)
                .templateId(templateId)
                .templateVersion(templateVersion)
                .currentState(currentState)
                .roleAssignments(roleAssignments)
                .history(history)
                .backup(backup)
                .appliedBy(appliedBy)
                .appliedAt(appliedAt)
                .updatedAt(updatedAt)
                .version(version);
    }

    /**
     * Returns the snapshot that results from executing a transition.
     */
    public WorkflowInstance withTransition(HistoryEntry entry) {
        List<HistoryEntry> extended = new ArrayList<>(history);
        extended.add(entry);
        return toBuilder()
                .currentState(entry.getToState())
                .history(extended)
                .updatedAt(entry.getTimestamp())
                .version(version + 1)
                .build();
    }

    WorkflowInstance withoutBackup() {
        return backup == null ? this : toBuilder().backup(null).build();
    }

    public String getContentUid() { return contentUid; }
    public String getTemplateId() { return templateId; }
    public String getTemplateVersion() { return templateVersion; }
    public String getCurrentState() { return currentState; }
    public Map<Role, List<String>> getRoleAssignments() { return roleAssignments; }
    public List<HistoryEntry> getHistory() { return history; }
    public Optional<WorkflowBackup> getBackup() { return Optional.ofNullable(backup); }
    public String getAppliedBy() { return appliedBy; }
    public Instant getAppliedAt() { return appliedAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }

    public List<String> getUsersForRole(Role role) {
        return roleAssignments.getOrDefault(role, List.of());
    }

    /**
     * Distinct users assigned to any of {@code roles}, in assignment order.
     */
    public Set<String> getUsersForRoles(Collection<Role> roles) {
        Set<String> users = new LinkedHashSet<>();
        for (Role role : roles) {
            users.addAll(getUsersForRole(role));
        }
        return users;
    }

    public Set<String> getAllAssignedUsers() {
        return getUsersForRoles(roleAssignments.keySet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowInstance that = (WorkflowInstance) o;
        return version == that.version &&
               Objects.equals(contentUid, that.contentUid) &&
               Objects.equals(templateId, that.templateId) &&
               Objects.equals(templateVersion, that.templateVersion) &&
               Objects.equals(currentState, that.currentState) &&
               Objects.equals(roleAssignments, that.roleAssignments) &&
               Objects.equals(history, that.history) &&
               Objects.equals(backup, that.backup) &&
               Objects.equals(appliedBy, that.appliedBy) &&
               Objects.equals(appliedAt, that.appliedAt) &&
               Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentUid, templateId, templateVersion, currentState, roleAssignments,
                history, backup, appliedBy, appliedAt, updatedAt, version);
    }

    @Override
    public String toString() {
        return "WorkflowInstance{" +
               "contentUid='" + contentUid + '\'' +
               ", templateId='" + templateId + '\'' +
               ", currentState='" + currentState + '\'' +
               ", history=" + history.size() +
               ", version=" + version +
               '}';
    }

    public static class Builder {
        private String contentUid;
        private String templateId;
        private String templateVersion;
        private String currentState;
        private final Map<Role, List<String>> roleAssignments = new EnumMap<>(Role.class);
        private final List<HistoryEntry> history = new ArrayList<>();
        private WorkflowBackup backup;
        private String appliedBy;
        private Instant appliedAt;
        private Instant updatedAt;
        private long version = 1;

        public Builder contentUid(String contentUid) { this.contentUid = contentUid; return this; }
        public Builder templateId(String templateId) { this.templateId = templateId; return this; }
        public Builder templateVersion(String templateVersion) { this.templateVersion = templateVersion; return this; }
        public Builder currentState(String currentState) { this.currentState = currentState; return this; }

        public Builder roleAssignments(Map<Role, List<String>> assignments) {
            this.roleAssignments.clear();
            if (assignments != null) {
                this.roleAssignments.putAll(assignments);
            }
            return this;
        }

        public Builder history(List<HistoryEntry> history) {
            this.history.clear();
            if (history != null) {
                this.history.addAll(history);
            }
            return this;
        }

        public Builder backup(WorkflowBackup backup) { this.backup = backup; return this; }
        public Builder appliedBy(String appliedBy) { this.appliedBy = appliedBy; return this; }
        public Builder appliedAt(Instant appliedAt) { this.appliedAt = appliedAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder version(long version) { this.version = version; return this; }

        public WorkflowInstance build() {
            return new WorkflowInstance(this);
        }
    }
}
