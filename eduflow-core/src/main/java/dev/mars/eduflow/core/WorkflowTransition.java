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

import java.util.Objects;

/**
 * A directed, role-gated edge between two states of a template.
 */
public class WorkflowTransition {

    private final String id;
    private final String title;
    private final String fromState;
    private final String toState;
    private final Role requiredRole;
    private final TransitionConditions conditions;

    private WorkflowTransition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Transition id cannot be null");
        this.title = builder.title != null ? builder.title : builder.id;
        this.fromState = Objects.requireNonNull(builder.fromState, "From state cannot be null");
        this.toState = Objects.requireNonNull(builder.toState, "To state cannot be null");
        this.requiredRole = Objects.requireNonNull(builder.requiredRole, "Required role cannot be null");
        this.conditions = builder.conditions != null ? builder.conditions : TransitionConditions.none();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getFromState() { return fromState; }
    public String getToState() { return toState; }
    public Role getRequiredRole() { return requiredRole; }
    public TransitionConditions getConditions() { return conditions; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowTransition that = (WorkflowTransition) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(title, that.title) &&
               Objects.equals(fromState, that.fromState) &&
               Objects.equals(toState, that.toState) &&
               requiredRole == that.requiredRole &&
               Objects.equals(conditions, that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, fromState, toState, requiredRole, conditions);
    }

    @Override
    public String toString() {
        return "WorkflowTransition{" +
               "id='" + id + '\'' +
               ", " + fromState + " -> " + toState +
               ", requiredRole=" + requiredRole +
               ", conditions=" + conditions.asMap() +
               '}';
    }

    public static class Builder {
        private String id;
        private String title;
        private String fromState;
        private String toState;
        private Role requiredRole;
        private TransitionConditions conditions;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder fromState(String fromState) {
            this.fromState = fromState;
            return this;
        }

        public Builder toState(String toState) {
            this.toState = toState;
            return this;
        }

        public Builder requiredRole(Role requiredRole) {
            this.requiredRole = requiredRole;
            return this;
        }

        public Builder conditions(TransitionConditions conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder conditions(java.util.Map<String, Object> conditions) {
            this.conditions = new TransitionConditions(conditions);
            return this;
        }

        public WorkflowTransition build() {
            return new WorkflowTransition(this);
        }
    }
}
