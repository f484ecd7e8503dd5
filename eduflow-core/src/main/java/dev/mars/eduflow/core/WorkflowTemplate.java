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
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable definition of a content workflow: its states, the role-gated
 * transitions between them and the permissions that apply in each state.
 *
 * <p>States are indexed by id and transitions by id and by source state when the
 * template is built, so lookups during execution never scan the lists. Duplicate
 * ids keep their first occurrence in the index; the structural validator reports
 * them as errors.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowTemplate {

    public static final String COMPLEXITY_KEY = "complexity";
    public static final String UNKNOWN_COMPLEXITY = "unknown";

    private final String id;
    private final String name;
    private final String description;
    private final TemplateCategory category;
    private final String version;
    private final List<WorkflowState> states;
    private final List<WorkflowTransition> transitions;
    private final Map<Role, Set<WorkflowAction>> defaultPermissions;
    private final Map<String, Object> metadata;

    private final Map<String, WorkflowState> statesById;
    private final Map<String, WorkflowTransition> transitionsById;
    private final Map<String, List<WorkflowTransition>> transitionsByFromState;

    private WorkflowTemplate(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Template id cannot be null");
        this.name = Objects.requireNonNull(builder.name, "Template name cannot be null");
        this.description = builder.description != null ? builder.description : "";
        this.category = Objects.requireNonNull(builder.category, "Template category cannot be null");
        this.version = Objects.requireNonNull(builder.version, "Template version cannot be null");
        this.states = List.copyOf(builder.states);
        this.transitions = List.copyOf(builder.transitions);

        Map<Role, Set<WorkflowAction>> defaults = new EnumMap<>(Role.class);
        builder.defaultPermissions.forEach((role, actions) ->
                defaults.put(role, actions.isEmpty()
                        ? Collections.unmodifiableSet(EnumSet.noneOf(WorkflowAction.class))
                        : Collections.unmodifiableSet(EnumSet.copyOf(actions))));
        this.defaultPermissions = Collections.unmodifiableMap(defaults);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));

        Map<String, WorkflowState> byId = new LinkedHashMap<>();
        for (WorkflowState state : states) {
            byId.putIfAbsent(state.getId(), state);
        }
        this.statesById = Collections.unmodifiableMap(byId);

        Map<String, WorkflowTransition> transitionIndex = new LinkedHashMap<>();
        Map<String, List<WorkflowTransition>> fromIndex = new LinkedHashMap<>();
        for (WorkflowTransition transition : transitions) {
            transitionIndex.putIfAbsent(transition.getId(), transition);
            fromIndex.computeIfAbsent(transition.getFromState(), k -> new ArrayList<>()).add(transition);
        }
        this.transitionsById = Collections.unmodifiableMap(transitionIndex);
        Map<String, List<WorkflowTransition>> frozen = new LinkedHashMap<>();
        fromIndex.forEach((stateId, list) -> frozen.put(stateId, List.copyOf(list)));
        this.transitionsByFromState = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public TemplateCategory getCategory() { return category; }
    public String getVersion() { return version; }
    public List<WorkflowState> getStates() { return states; }
    public List<WorkflowTransition> getTransitions() { return transitions; }
    public Map<Role, Set<WorkflowAction>> getDefaultPermissions() { return defaultPermissions; }
    public Map<String, Object> getMetadata() { return metadata; }

    /**
     * Returns the first state flagged as initial. A valid template has exactly one.
     */
    public Optional<WorkflowState> getInitialState() {
        return states.stream().filter(WorkflowState::isInitial).findFirst();
    }

    public List<WorkflowState> getFinalStates() {
        return states.stream().filter(WorkflowState::isFinal).collect(Collectors.toList());
    }

    public Optional<WorkflowState> getState(String stateId) {
        return Optional.ofNullable(statesById.get(stateId));
    }

    public Optional<WorkflowTransition> getTransition(String transitionId) {
        return Optional.ofNullable(transitionsById.get(transitionId));
    }

    public List<WorkflowTransition> getTransitionsFrom(String stateId) {
        return transitionsByFromState.getOrDefault(stateId, List.of());
    }

    public Set<String> getStateIds() {
        return statesById.keySet();
    }

    public Set<String> getTransitionIds() {
        return transitionsById.keySet();
    }

    /**
     * Every role named anywhere in the template: state permissions, default
     * permissions and transition {@code required_role} fields.
     */
    public Set<Role> getReferencedRoles() {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        for (WorkflowState state : states) {
            for (StatePermission permission : state.getPermissions()) {
                roles.add(permission.getRole());
            }
        }
        roles.addAll(defaultPermissions.keySet());
        roles.addAll(getRequiredRoles());
        return Collections.unmodifiableSet(roles);
    }

    /**
     * Roles that must act for content to move through the workflow, i.e. the
     * {@code required_role} of every transition.
     */
    public Set<Role> getRequiredRoles() {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        for (WorkflowTransition transition : transitions) {
            roles.add(transition.getRequiredRole());
        }
        return Collections.unmodifiableSet(roles);
    }

    public String getComplexity() {
        Object complexity = metadata.get(COMPLEXITY_KEY);
        return complexity != null ? complexity.toString() : UNKNOWN_COMPLEXITY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowTemplate that = (WorkflowTemplate) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               category == that.category &&
               Objects.equals(version, that.version) &&
               Objects.equals(states, that.states) &&
               Objects.equals(transitions, that.transitions) &&
               Objects.equals(defaultPermissions, that.defaultPermissions) &&
               Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, category, version, states, transitions,
                defaultPermissions, metadata);
    }

    @Override
    public String toString() {
        return "WorkflowTemplate{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", category=" + category +
               ", version='" + version + '\'' +
               ", states=" + states.size() +
               ", transitions=" + transitions.size() +
               '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private TemplateCategory category;
        private String version;
        private final List<WorkflowState> states = new ArrayList<>();
        private final List<WorkflowTransition> transitions = new ArrayList<>();
        private final Map<Role, Set<WorkflowAction>> defaultPermissions = new EnumMap<>(Role.class);
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(TemplateCategory category) {
            this.category = category;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder state(WorkflowState state) {
            this.states.add(Objects.requireNonNull(state, "State cannot be null"));
            return this;
        }

        public Builder states(List<WorkflowState> states) {
            this.states.clear();
            if (states != null) {
                states.forEach(this::state);
            }
            return this;
        }

        public Builder transition(WorkflowTransition transition) {
            this.transitions.add(Objects.requireNonNull(transition, "Transition cannot be null"));
            return this;
        }

        public Builder transitions(List<WorkflowTransition> transitions) {
            this.transitions.clear();
            if (transitions != null) {
                transitions.forEach(this::transition);
            }
            return this;
        }

        public Builder defaultPermission(Role role, WorkflowAction... actions) {
            Set<WorkflowAction> set = defaultPermissions.computeIfAbsent(
                    Objects.requireNonNull(role, "Role cannot be null"),
                    r -> EnumSet.noneOf(WorkflowAction.class));
            Collections.addAll(set, actions);
            return this;
        }

        public Builder defaultPermissions(Map<Role, Set<WorkflowAction>> defaults) {
            this.defaultPermissions.clear();
            if (defaults != null) {
                defaults.forEach((role, actions) ->
                        defaultPermission(role, actions.toArray(new WorkflowAction[0])));
            }
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public WorkflowTemplate build() {
            return new WorkflowTemplate(this);
        }
    }
}
