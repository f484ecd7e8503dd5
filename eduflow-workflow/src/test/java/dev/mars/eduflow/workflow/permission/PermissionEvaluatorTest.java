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
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.WorkflowTransition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static dev.mars.eduflow.workflow.TestTemplates.threeStateReview;
import static org.junit.jupiter.api.Assertions.*;

class PermissionEvaluatorTest {

    private PermissionEvaluator evaluator;
    private WorkflowTemplate template;

    @BeforeEach
    void setUp() {
        evaluator = new PermissionEvaluator();
        template = threeStateReview().build();
    }

    @Test
    void explicitStateEntryWins() {
        assertEquals(EnumSet.of(WorkflowAction.VIEW, WorkflowAction.EDIT, WorkflowAction.SUBMIT),
                evaluator.availableActions(template, "draft", Role.AUTHOR));
    }

    @Test
    void fallsBackToDefaultPermissions() {
        assertEquals(EnumSet.of(WorkflowAction.VIEW), evaluator.availableActions(template, "draft", Role.VIEWER));
    }

    @Test
    void noEntryAndNoDefaultIsEmpty() {
        assertTrue(evaluator.availableActions(template, "draft", Role.PUBLISHER).isEmpty());
        assertTrue(evaluator.availableActions(template, "no_such_state", Role.PUBLISHER).isEmpty());
    }

    @Test
    void transitionsFromFinalStateAreEmpty() {
        assertTrue(evaluator.transitionsFrom(template, "published").isEmpty());
        assertEquals(List.of("approve_content", "reject_to_draft"), ids(evaluator.transitionsFrom(template, "review")));
    }

    @Test
    void requiredRoleMayExecute() {
        WorkflowTransition submit = template.getTransition("submit_for_review").orElseThrow();

        assertTrue(evaluator.canExecute(template, "draft", Role.AUTHOR, submit));
        assertFalse(evaluator.canExecute(template, "draft", Role.EDITOR, submit));
    }

    @Test
    void manageWorkflowGrantsAdministrativeOverride() {
        WorkflowTransition approve = template.getTransition("approve_content").orElseThrow();

        assertTrue(evaluator.hasAdministrativeOverride(template, "review", Role.ADMINISTRATOR));
        assertTrue(evaluator.canExecute(template, "review", Role.ADMINISTRATOR, approve));
        assertFalse(evaluator.hasAdministrativeOverride(template, "published", Role.ADMINISTRATOR));
    }

    @Test
    void executableTransitionsDependOnRole() {
        assertEquals(List.of("approve_content", "reject_to_draft"),
                ids(evaluator.executableTransitions(template, "review", Role.EDITOR)));
        assertEquals(List.of("approve_content", "reject_to_draft"),
                ids(evaluator.executableTransitions(template, "review", Role.ADMINISTRATOR)));
        assertTrue(evaluator.executableTransitions(template, "review", Role.AUTHOR).isEmpty());
    }

    @Test
    void rolesAbleToActIncludeOverrideHolders() {
        assertEquals(EnumSet.of(Role.EDITOR, Role.ADMINISTRATOR), evaluator.rolesAbleToAct(template, "review"));
        assertTrue(evaluator.rolesAbleToAct(template, "published").isEmpty());
    }

    private static List<String> ids(List<WorkflowTransition> transitions) {
        return transitions.stream().map(WorkflowTransition::getId).collect(Collectors.toList());
    }
}
