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
import dev.mars.eduflow.core.StateType;
import dev.mars.eduflow.core.WorkflowTemplate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static dev.mars.eduflow.workflow.TestTemplates.state;
import static dev.mars.eduflow.workflow.TestTemplates.threeStateReview;
import static dev.mars.eduflow.workflow.TestTemplates.transition;
import static org.junit.jupiter.api.Assertions.*;

class TransitionGraphTest {

    @Test
    void buildsForwardAndReverseAdjacency() {
        TransitionGraph graph = new TransitionGraph(threeStateReview().build());

        assertEquals(Set.of("draft", "review", "published"), graph.getNodes());
        assertEquals(Set.of("review"), graph.getSuccessors("draft"));
        assertEquals(Set.of("published", "draft"), graph.getSuccessors("review"));
        assertEquals(Set.of("review"), graph.getPredecessors("published"));
        assertTrue(graph.getSuccessors("published").isEmpty());
    }

    @Test
    void wellFormedTemplateHasNoUnreachableStatesOrDeadEnds() {
        TransitionGraph graph = new TransitionGraph(threeStateReview().build());

        assertEquals(Set.of("draft", "review", "published"), graph.reachableFrom("draft"));
        assertTrue(graph.findUnreachable("draft").isEmpty());
        assertTrue(graph.findDeadEnds("draft", List.of("published")).isEmpty());
    }

    @Test
    void detectsIslandAndDeadEnd() {
        WorkflowTemplate template = threeStateReview()
                .state(state("orphan", StateType.ARCHIVED, false, false))
                .state(state("limbo", StateType.REVISION, false, false))
                .transition(transition("to_limbo", "review", "limbo", Role.EDITOR))
                .build();
        TransitionGraph graph = new TransitionGraph(template);

        assertEquals(List.of("orphan"), graph.findUnreachable("draft"));
        assertEquals(List.of("limbo"), graph.findDeadEnds("draft", List.of("published")));
    }

    @Test
    void ignoresEdgesToUnknownStates() {
        WorkflowTemplate template = threeStateReview()
                .transition(transition("nowhere", "draft", "missing", Role.AUTHOR))
                .build();
        TransitionGraph graph = new TransitionGraph(template);

        assertFalse(graph.reachableFrom("draft").contains("missing"));
        assertTrue(graph.reachableFrom("missing").isEmpty());
    }
}
