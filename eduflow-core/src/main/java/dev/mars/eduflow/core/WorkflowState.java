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

package dev.mars.eduflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One state of a workflow template.
 *
 * <p>Instances are immutable. The constructor does not enforce template-level
 * rules such as id length or uniqueness; those are reported by the structural
 * validator so that a malformed template can still be described.</p>
 */
public class WorkflowState {

    private final String id;
    private final String title;
    private final String description;
    private final StateType stateType;
    private final List<StatePermission> permissions;
    private final boolean initial;
    private final boolean finalState;
    private final Map<String, Object> uiMetadata;

    private WorkflowState(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "State id cannot be null");
        this.title = builder.title != null ? builder.title : builder.id;
        this.description = builder.description;
        this.stateType = Objects.requireNonNull(builder.stateType, "State type cannot be null");
        this.permissions = List.copyOf(builder.permissions);
        this.initial = builder.initial;
        this.finalState = builder.finalState;
        this.uiMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.uiMetadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public StateType getStateType() { return stateType; }
    public List<StatePermission> getPermissions() { return permissions; }
    public boolean isInitial() { return initial; }
    public boolean isFinal() { return finalState; }
    public Map<String, Object> getUiMetadata() { return uiMetadata; }

    /**
     * Returns the actions explicitly granted to {@code role} in this state.
     * Multiple entries for the same role are merged. An empty optional means the
     * state has no entry for the role at all, which is different from an entry
     * granting nothing.
     */
    public Optional<Set<WorkflowAction>> getExplicitActions(Role role) {
        Set<WorkflowAction> merged = null;
        for (StatePermission permission : permissions) {
            if (permission.getRole() == role) {
                if (merged == null) {
                    merged = EnumSet.noneOf(WorkflowAction.class);
                }
                merged.addAll(permission.getActions());
            }
        }
        return merged == null ? Optional.empty() : Optional.of(Collections.unmodifiableSet(merged));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowState that = (WorkflowState) o;
        return initial == that.initial &&
               finalState == that.finalState &&
               Objects.equals(id, that.id) &&
               Objects.equals(title, that.title) &&
               Objects.equals(description, that.description) &&
               stateType == that.stateType &&
               Objects.equals(permissions, that.permissions) &&
               Objects.equals(uiMetadata, that.uiMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, description, stateType, permissions, initial, finalState, uiMetadata);
    }

    @Override
    public String toString() {
        return "WorkflowState{" +
               "id='" + id + '\'' +
               ", stateType=" + stateType +
               ", initial=" + initial +
               ", final=" + finalState +
               ", permissions=" + permissions.size() +
               '}';
    }

    public static class Builder {
        private String id;
        private String title;
        private String description;
        private StateType stateType;
        private final List<StatePermission> permissions = new ArrayList<>();
        private boolean initial;
        private boolean finalState;
        private final Map<String, Object> uiMetadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder stateType(StateType stateType) {
            this.stateType = stateType;
            return this;
        }

        public Builder permission(StatePermission permission) {
            this.permissions.add(Objects.requireNonNull(permission, "Permission cannot be null"));
            return this;
        }

        public Builder permission(Role role, WorkflowAction... actions) {
            return permission(StatePermission.of(role, actions));
        }

        public Builder permissions(List<StatePermission> permissions) {
            this.permissions.clear();
            if (permissions != null) {
                permissions.forEach(this::permission);
            }
            return this;
        }

        public Builder initial(boolean initial) {
            this.initial = initial;
            return this;
        }

        public Builder finalState(boolean finalState) {
            this.finalState = finalState;
            return this;
        }

        public Builder uiMetadata(Map<String, Object> uiMetadata) {
            this.uiMetadata.clear();
            if (uiMetadata != null) {
                this.uiMetadata.putAll(uiMetadata);
            }
            return this;
        }

        public WorkflowState build() {
            return new WorkflowState(this);
        }
    }
}
