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

import dev.mars.eduflow.core.WorkflowState;
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.WorkflowTransition;

import java.util.*;

/**
 * Directed graph of a template's states with forward and reverse adjacency.
 * Provides the reachability walks used by structural validation.
 */
public class TransitionGraph {

    private final Set<String> nodes;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    /**
     * Builds the graph from a template. Transitions that reference unknown states
     * are ignored here; they are reported separately.
     *
     * @param template the template whose states and transitions form the graph
     */
    public TransitionGraph(WorkflowTemplate template) {
        Objects.requireNonNull(template, "Template cannot be null");
        this.nodes = new LinkedHashSet<>();
        this.successors = new HashMap<>();
        this.predecessors = new HashMap<>();

        for (WorkflowState state : template.getStates()) {
            nodes.add(state.getId());
        }
        for (WorkflowTransition transition : template.getTransitions()) {
            String from = transition.getFromState();
            String to = transition.getToState();
            if (nodes.contains(from) && nodes.contains(to)) {
                successors.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
                predecessors.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
            }
        }
    }

    public Set<String> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public Set<String> getSuccessors(String stateId) {
        return successors.getOrDefault(stateId, Set.of());
    }

    public Set<String> getPredecessors(String stateId) {
        return predecessors.getOrDefault(stateId, Set.of());
    }

    /**
     * Breadth-first walk along transitions from a single source state.
     *
     * @param source the state to start from
     * @return ids of every state reachable from {@code source}, including it
     */
    public Set<String> reachableFrom(String source) {
        return walk(List.of(source), successors);
    }

    /**
     * Breadth-first walk against the direction of transitions from the given states.
     *
     * @param targets the states to walk back from, typically the final states
     * @return ids of every state that has a path to one of {@code targets}, including them
     */
    public Set<String> canReach(Collection<String> targets) {
        return walk(targets, predecessors);
    }

    /**
     * States not reachable from {@code initialStateId}, in declaration order.
     */
    public List<String> findUnreachable(String initialStateId) {
        Set<String> reachable = reachableFrom(initialStateId);
        List<String> unreachable = new ArrayList<>();
        for (String node : nodes) {
            if (!reachable.contains(node)) {
                unreachable.add(node);
            }
        }
        return unreachable;
    }

    /**
     * Reachable states from which no final state can be reached, in declaration order.
     */
    public List<String> findDeadEnds(String initialStateId, Collection<String> finalStateIds) {
        Set<String> reachable = reachableFrom(initialStateId);
        Set<String> leadsToFinal = canReach(finalStateIds);
        List<String> deadEnds = new ArrayList<>();
        for (String node : nodes) {
            if (reachable.contains(node) && !leadsToFinal.contains(node)) {
                deadEnds.add(node);
            }
        }
        return deadEnds;
    }

    private Set<String> walk(Collection<String> sources, Map<String, Set<String>> edges) {
        Set<String> visited = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        for (String source : sources) {
            if (nodes.contains(source) && visited.add(source)) {
                queue.offer(source);
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : edges.getOrDefault(current, Set.of())) {
                if (visited.add(next)) {
                    queue.offer(next);
                }
            }
        }
        return visited;
    }

    @Override
    public String toString() {
        return "TransitionGraph{" +
               "states=" + nodes +
               ", edges=" + successors +
               '}';
    }
}
