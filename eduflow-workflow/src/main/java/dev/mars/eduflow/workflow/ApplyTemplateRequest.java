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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of {@link WorkflowEngine#applyTemplate}.
 */
public final class ApplyTemplateRequest {

    private final String templateId;
    private final String contentUid;
    private final Map<Role, List<String>> roleAssignments;
    private final boolean force;
    private final boolean backupExisting;
    private final String actingUserId;

    private ApplyTemplateRequest(Builder builder) {
        this.templateId = Objects.requireNonNull(builder.templateId, "Template id cannot be null");
        this.contentUid = Objects.requireNonNull(builder.contentUid, "Content uid cannot be null");
        Map<Role, List<String>> assignments = new EnumMap<>(Role.class);
        builder.roleAssignments.forEach((role, users) ->
                assignments.put(role, users == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(users))));
        this.roleAssignments = Collections.unmodifiableMap(assignments);
        this.force = builder.force;
        this.backupExisting = builder.backupExisting;
        this.actingUserId = builder.actingUserId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTemplateId() { return templateId; }
    public String getContentUid() { return contentUid; }
    public Map<Role, List<String>> getRoleAssignments() { return roleAssignments; }
    public boolean isForce() { return force; }
    public boolean isBackupExisting() { return backupExisting; }
    public String getActingUserId() { return actingUserId; }

    @Override
    public String toString() {
        return "ApplyTemplateRequest{" +
               "templateId='" + templateId + '\'' +
               ", contentUid='" + contentUid + '\'' +
               ", roles=" + roleAssignments.keySet() +
               ", force=" + force +
               ", backupExisting=" + backupExisting +
               '}';
    }

    public static class Builder {
        private String templateId;
        private String contentUid;
        private final Map<Role, List<String>> roleAssignments = new EnumMap<>(Role.class);
        private boolean force;
        private boolean backupExisting;
        private String actingUserId;

        public Builder templateId(String templateId) { this.templateId = templateId; return this; }
        public Builder contentUid(String contentUid) { this.contentUid = contentUid; return this; }

        public Builder assign(Role role, String... userIds) {
            roleAssignments.put(Objects.requireNonNull(role, "Role cannot be null"), List.of(userIds));
            return this;
        }

        public Builder roleAssignments(Map<Role, List<String>> assignments) {
            this.roleAssignments.clear();
            if (assignments != null) {
                this.roleAssignments.putAll(assignments);
            }
            return this;
        }

        public Builder force(boolean force) { this.force = force; return this; }
        public Builder backupExisting(boolean backupExisting) { this.backupExisting = backupExisting; return this; }
        public Builder actingUserId(String actingUserId) { this.actingUserId = actingUserId; return this; }

        public ApplyTemplateRequest build() {
            return new ApplyTemplateRequest(this);
        }
    }
}
