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

import dev.mars.eduflow.core.Role;
import dev.mars.eduflow.core.StatePermission;
import dev.mars.eduflow.core.WorkflowAction;
import dev.mars.eduflow.core.WorkflowState;
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.WorkflowTransition;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks the internal consistency of a workflow template: naming rules, the
 * single initial state, final states, state references and graph reachability.
 *
 * <p>Each error is recorded against the field path of the rule it breaks, one of
 * the {@code RULE_*} constants, so callers can tell which rule failed without
 * parsing messages. The validator is stateless and safe to share between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TemplateStructureValidator {

    public static final String RULE_TEMPLATE_ID = "id";
    public static final String RULE_TEMPLATE_NAME = "name";
    public static final String RULE_VERSION = "version";
    public static final String RULE_STATE_COUNT = "states";
    public static final String RULE_TRANSITION_COUNT = "transitions";
    public static final String RULE_STATE_ID = "states.id";
    public static final String RULE_DUPLICATE_STATE = "states.id.unique";
    public static final String RULE_DUPLICATE_TRANSITION = "transitions.id.unique";
    public static final String RULE_INITIAL_STATE = "states.is_initial";
    public static final String RULE_FINAL_STATE = "states.is_final";
    public static final String RULE_STATE_REFERENCE = "transitions.state_reference";
    public static final String RULE_FINAL_OUTGOING = "transitions.from_final_state";
    public static final String RULE_REACHABILITY = "states.reachable";
    public static final String RULE_PATH_TO_FINAL = "states.path_to_final";

    public static final String WARNING_PRIVILEGED_GRANT = "permissions.privileged";
    public static final String WARNING_UNSUPPORTED_CONDITION = "transitions.conditions";
    public static final String WARNING_INITIAL_AND_FINAL = "states.initial_and_final";

    private static final Pattern VERSION_PATTERN = Pattern.compile("\\d+\\.\\d+\\.\\d+");
    private static final Pattern STATE_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    public ValidationResult validate(WorkflowTemplate template) {
        ValidationResult result = new ValidationResult();

        validateIdentity(template, result);
        validateStates(template, result);
        validateTransitions(template, result);
        validateGraph(template, result);
        checkPrivilegedGrants(template, result);

        return result;
    }

    private void validateIdentity(WorkflowTemplate template, ValidationResult result) {
        if (template.getId().trim().length() < 2) {
            result.addError(RULE_TEMPLATE_ID, "Template id must be at least 2 characters");
        }
        if (template.getName().trim().length() < 3) {
            result.addError(RULE_TEMPLATE_NAME, "Workflow name must be at least 3 characters");
        }
        if (!VERSION_PATTERN.matcher(template.getVersion()).matches()) {
            result.addError(RULE_VERSION,
                    "Version must follow semantic versioning (x.y.z) with integer parts: '" + template.getVersion() + "'");
        }
    }

    private void validateStates(WorkflowTemplate template, ValidationResult result) {
        List<WorkflowState> states = template.getStates();
        if (states.size() < 2) {
            result.addError(RULE_STATE_COUNT, "Workflow must have at least 2 states, found " + states.size());
        }

        Set<String> seen = new HashSet<>();
        for (WorkflowState state : states) {
            String id = state.getId();
            if (id.length() < 2) {
                result.addError(RULE_STATE_ID, "State id '" + id + "' must be at least 2 characters");
            } else if (!STATE_ID_PATTERN.matcher(id).matches()) {
                result.addError(RULE_STATE_ID, "State id '" + id + "' must be alphanumeric with underscores/hyphens");
            }
            if (!seen.add(id)) {
                result.addError(RULE_DUPLICATE_STATE, "Duplicate state id '" + id + "'");
            }
            if (state.isInitial() && state.isFinal()) {
                result.addWarning(WARNING_INITIAL_AND_FINAL,
                        "State '" + id + "' is both initial and final; content starts in a terminal state");
            }
        }

        List<String> initial = states.stream().filter(WorkflowState::isInitial)
                .map(WorkflowState::getId).collect(Collectors.toList());
        if (initial.size() != 1) {
            result.addError(RULE_INITIAL_STATE,
                    "Workflow must have exactly one initial state, found " + initial.size() + " " + initial);
        }
        if (states.stream().noneMatch(WorkflowState::isFinal)) {
            result.addError(RULE_FINAL_STATE, "Workflow must have at least one final state");
        }
    }

    private void validateTransitions(WorkflowTemplate template, ValidationResult result) {
        List<WorkflowTransition> transitions = template.getTransitions();
        if (transitions.isEmpty()) {
            result.addError(RULE_TRANSITION_COUNT, "Workflow must have at least 1 transition");
        }

        Set<String> stateIds = template.getStateIds();
        Set<String> finalIds = template.getFinalStates().stream()
                .map(WorkflowState::getId).collect(Collectors.toSet());
        Set<String> seen = new HashSet<>();

        for (WorkflowTransition transition : transitions) {
            String id = transition.getId();
            if (!seen.add(id)) {
                result.addError(RULE_DUPLICATE_TRANSITION, "Duplicate transition id '" + id + "'");
            }
            if (!stateIds.contains(transition.getFromState())) {
                result.addError(RULE_STATE_REFERENCE,
                        "Transition '" + id + "' references unknown from_state: " + transition.getFromState());
            }
            if (!stateIds.contains(transition.getToState())) {
                result.addError(RULE_STATE_REFERENCE,
                        "Transition '" + id + "' references unknown to_state: " + transition.getToState());
            }
            if (finalIds.contains(transition.getFromState())) {
                result.addError(RULE_FINAL_OUTGOING,
                        "Final state " + transition.getFromState() + " cannot have outgoing transitions ('" + id + "')");
            }
            Set<String> unsupported = transition.getConditions().getUnsupportedKeys();
            if (!unsupported.isEmpty()) {
                result.addWarning(WARNING_UNSUPPORTED_CONDITION,
                        "Transition '" + id + "' has conditions the engine does not evaluate: " + unsupported);
            }
        }
    }

    private void validateGraph(WorkflowTemplate template, ValidationResult result) {
        List<WorkflowState> initial = template.getStates().stream()
                .filter(WorkflowState::isInitial).collect(Collectors.toList());
        if (initial.size() != 1) {
            // Reachability is undefined without a single source.
            return;
        }

        TransitionGraph graph = new TransitionGraph(template);
        String initialId = initial.get(0).getId();

        List<String> unreachable = graph.findUnreachable(initialId);
        if (!unreachable.isEmpty()) {
            result.addError(RULE_REACHABILITY, "Unreachable states detected: " + unreachable);
        }

        List<String> finalIds = template.getFinalStates().stream()
                .map(WorkflowState::getId).collect(Collectors.toList());
        if (!finalIds.isEmpty()) {
            List<String> deadEnds = graph.findDeadEnds(initialId, finalIds);
            if (!deadEnds.isEmpty()) {
                result.addError(RULE_PATH_TO_FINAL, "States with no path to a final state: " + deadEnds);
            }
        }
    }

    private void checkPrivilegedGrants(WorkflowTemplate template, ValidationResult result) {
        for (WorkflowState state : template.getStates()) {
            for (StatePermission permission : state.getPermissions()) {
                warnIfPrivileged(permission.getRole(), permission.getActions(),
                        "state '" + state.getId() + "'", result);
            }
        }
        for (Map.Entry<Role, Set<WorkflowAction>> entry : template.getDefaultPermissions().entrySet()) {
            warnIfPrivileged(entry.getKey(), entry.getValue(), "default permissions", result);
        }
    }

    private void warnIfPrivileged(Role role, Set<WorkflowAction> actions, String where, ValidationResult result) {
        if (role == Role.ADMINISTRATOR) {
            return;
        }
        Set<WorkflowAction> granted = actions.stream()
                .filter(WorkflowAction::isAdministrative)
                .collect(Collectors.toSet());
        if (!granted.isEmpty()) {
            result.addWarning(WARNING_PRIVILEGED_GRANT,
                    "Role '" + role + "' is granted " + granted.stream().map(WorkflowAction::getValue).sorted()
                            .collect(Collectors.toList()) + " in " + where + "; restrict these to administrator");
        }
    }
}
