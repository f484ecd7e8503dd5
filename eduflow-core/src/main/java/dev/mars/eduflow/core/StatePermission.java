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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Actions granted to one role while content sits in a particular state.
 */
public class StatePermission {

    private final Role role;
    private final Set<WorkflowAction> actions;

    public StatePermission(Role role, Set<WorkflowAction> actions) {
        this.role = Objects.requireNonNull(role, "Role cannot be null");
        this.actions = actions == null || actions.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(WorkflowAction.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(actions));
    }

    public static StatePermission of(Role role, WorkflowAction... actions) {
        Set<WorkflowAction> set = EnumSet.noneOf(WorkflowAction.class);
        Collections.addAll(set, actions);
        return new StatePermission(role, set);
    }

    public Role getRole() {
        return role;
    }

    public Set<WorkflowAction> getActions() {
        return actions;
    }

    public boolean allows(WorkflowAction action) {
        return actions.contains(action);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StatePermission that = (StatePermission) o;
        return role == that.role && Objects.equals(actions, that.actions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, actions);
    }

    @Override
    public String toString() {
        return "StatePermission{" +
               "role=" + role +
               ", actions=" + actions +
               '}';
    }
}
