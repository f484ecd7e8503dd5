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

package dev.mars.eduflow.workflow.permission;

import dev.mars.eduflow.core.Role;
import dev.mars.eduflow.core.WorkflowAction;
import dev.mars.eduflow.core.WorkflowState;
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.WorkflowTransition;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves what a role may do while content is in a given state.
 *
 * <p>Lookup order for {@link #availableActions}: the state's explicit entry for
 * the role, then the template's default permissions for the role, then nothing.
 * A role holding {@code manage_workflow} in the current state may execute any
 * transition leaving it, regardless of the transition's required role.</p>
 *
 * <p>All methods are pure reads over immutable templates and may be called
 * concurrently.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PermissionEvaluator {

    public Set<WorkflowAction> availableActions(WorkflowTemplate template, String stateId, Role role) {
        Optional<WorkflowState> state = template.getState(stateId);
        if (state.isPresent()) {
            Optional<Set<WorkflowAction>> explicit = state.get().getExplicitActions(role);
            if (explicit.isPresent()) {
                return explicit.get();
            }
        }
        Set<WorkflowAction> defaults = template.getDefaultPermissions().get(role);
        if (defaults != null) {
            return defaults;
        }
        return Collections.unmodifiableSet(EnumSet.noneOf(WorkflowAction.class));
    }

    public List<WorkflowTransition> transitionsFrom(WorkflowTemplate template, String stateId) {
        return template.getTransitionsFrom(stateId);
    }

    public boolean hasAdministrativeOverride(WorkflowTemplate template, String stateId, Role role) {
        return availableActions(template, stateId, role).contains(WorkflowAction.MANAGE_WORKFLOW);
    }

    /**
     * True when {@code role} is the transition's required role or holds the
     * administrative override in {@code stateId}. Does not check that the
     * transition actually leaves {@code stateId}.
     */
    public boolean canExecute(WorkflowTemplate template, String stateId, Role role, WorkflowTransition transition) {
        return transition.getRequiredRole() == role || hasAdministrativeOverride(template, stateId, role);
    }

    public List<WorkflowTransition> executableTransitions(WorkflowTemplate template, String stateId, Role role) {
        return transitionsFrom(template, stateId).stream()
                .filter(transition -> canExecute(template, stateId, role, transition))
                .collect(Collectors.toList());
    }

    /**
     * Roles that can act on content sitting in {@code stateId}: the required
     * roles of its outgoing transitions plus any role with the override there.
     */
    public Set<Role> rolesAbleToAct(WorkflowTemplate template, String stateId) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        List<WorkflowTransition> outgoing = transitionsFrom(template, stateId);
        if (outgoing.isEmpty()) {
            return roles;
        }
        for (WorkflowTransition transition : outgoing) {
            roles.add(transition.getRequiredRole());
        }
        for (Role role : Role.values()) {
            if (hasAdministrativeOverride(template, stateId, role)) {
                roles.add(role);
            }
        }
        return roles;
    }
}
