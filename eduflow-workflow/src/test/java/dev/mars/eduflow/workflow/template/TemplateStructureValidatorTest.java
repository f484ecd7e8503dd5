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
import dev.mars.eduflow.core.WorkflowAction;
import dev.mars.eduflow.core.WorkflowState;
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.WorkflowTransition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static dev.mars.eduflow.workflow.TestTemplates.state;
import static dev.mars.eduflow.workflow.TestTemplates.threeStateReview;
import static dev.mars.eduflow.workflow.TestTemplates.transition;
import static dev.mars.eduflow.workflow.template.TemplateStructureValidator.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TemplateStructureValidator: every rule is broken once and must be
 * reported under its own field path.
 */
class TemplateStructureValidatorTest {

    private final TemplateStructureValidator validator = new TemplateStructureValidator();

    @Test
    @DisplayName("A well-formed template is valid")
    void validTemplate() {
        ValidationResult result = validator.validate(threeStateReview().build());

        assertTrue(result.isValid(), () -> result.getErrorMessages().toString());
        assertFalse(result.hasWarnings(), () -> result.getWarningMessages().toString());
    }

    @Nested
    @DisplayName("Identity rules")
    class Identity {

        @Test
        void shortTemplateId() {
            ValidationResult result = validator.validate(threeStateReview().id("x").build());
            assertTrue(result.hasErrorAt(RULE_TEMPLATE_ID));
        }

        @Test
        void shortName() {
            ValidationResult result = validator.validate(threeStateReview().name("  ab ").build());
            assertTrue(result.hasErrorAt(RULE_TEMPLATE_NAME));
        }

        @ParameterizedTest
        @ValueSource(strings = {"1.0", "1.0.0-beta", "v1.0.0", "1.a.0", ""})
        void versionMustBeThreeIntegers(String version) {
            ValidationResult result = validator.validate(threeStateReview().version(version).build());
            assertTrue(result.hasErrorAt(RULE_VERSION), version);
        }
    }

    @Nested
    @DisplayName("State rules")
    class States {

        @Test
        void needsAtLeastTwoStates() {
            WorkflowTemplate template = threeStateReview()
                    .states(List.of(state("only", StateType.DRAFT, true, true)))
                    .transitions(List.of())
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.hasErrorAt(RULE_STATE_COUNT));
            assertTrue(result.hasErrorAt(RULE_TRANSITION_COUNT));
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "has space", "dot.ted"})
        void stateIdFormat(String badId) {
            WorkflowTemplate template = threeStateReview()
                    .state(state(badId, StateType.REVISION, false, false))
                    .transition(transition("to_bad", "draft", badId, Role.AUTHOR))
                    .transition(transition("from_bad", badId, "review", Role.AUTHOR))
                    .build();
            assertTrue(validator.validate(template).hasErrorAt(RULE_STATE_ID), badId);
        }

        @Test
        void duplicateStateIds() {
            WorkflowTemplate template = threeStateReview()
                    .state(state("review", StateType.REVIEW, false, false))
                    .build();
            assertTrue(validator.validate(template).hasErrorAt(RULE_DUPLICATE_STATE));
        }

        @Test
        void noInitialState() {
            WorkflowTemplate template = threeStateReview()
                    .states(List.of(
                            state("draft", StateType.DRAFT, false, false),
                            state("review", StateType.REVIEW, false, false),
                            state("published", StateType.PUBLISHED, false, true)))
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.hasErrorAt(RULE_INITIAL_STATE));
            assertFalse(result.hasErrorAt(RULE_REACHABILITY), "reachability needs a single initial state");
        }

        @Test
        void twoInitialStates() {
            WorkflowTemplate template = threeStateReview()
                    .states(List.of(
                            state("draft", StateType.DRAFT, true, false),
                            state("review", StateType.REVIEW, true, false),
                            state("published", StateType.PUBLISHED, false, true)))
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.hasErrorAt(RULE_INITIAL_STATE));
            assertTrue(result.getErrorMessages().stream().anyMatch(m -> m.contains("found 2")));
        }

        @Test
        void noFinalState() {
            WorkflowTemplate template = threeStateReview()
                    .states(List.of(
                            state("draft", StateType.DRAFT, true, false),
                            state("review", StateType.REVIEW, false, false),
                            state("published", StateType.PUBLISHED, false, false)))
                    .build();
            assertTrue(validator.validate(template).hasErrorAt(RULE_FINAL_STATE));
        }
    }

    @Nested
    @DisplayName("Transition rules")
    class Transitions {

        @Test
        void duplicateTransitionIds() {
            WorkflowTemplate template = threeStateReview()
                    .transition(transition("submit_for_review", "draft", "review", Role.AUTHOR))
                    .build();
            assertTrue(validator.validate(template).hasErrorAt(RULE_DUPLICATE_TRANSITION));
        }

        @Test
        void unknownStateReference() {
            WorkflowTemplate template = threeStateReview()
                    .transition(transition("to_nowhere", "review", "nowhere", Role.EDITOR))
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.hasErrorAt(RULE_STATE_REFERENCE));
            assertTrue(result.getErrorMessages().stream().anyMatch(m -> m.contains("nowhere")));
        }

        @Test
        void transitionLeavingFinalState() {
            WorkflowTemplate template = threeStateReview()
                    .transition(transition("retract", "published", "draft", Role.ADMINISTRATOR))
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.hasErrorAt(RULE_FINAL_OUTGOING));
            assertTrue(result.getErrorMessages().stream()
                    .anyMatch(m -> m.contains("Final state published cannot have outgoing transitions")));
        }

        @Test
        void unsupportedConditionIsOnlyAWarning() {
            WorkflowTemplate template = threeStateReview()
                    .transitions(List.of(
                            transition("submit_for_review", "draft", "review", Role.AUTHOR),
                            WorkflowTransition.builder().id("approve_content").fromState("review")
                                    .toState("published").requiredRole(Role.EDITOR)
                                    .conditions(Map.of("min_peer_reviews", 2)).build()))
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.isValid());
            assertTrue(result.getWarnings().stream()
                    .anyMatch(w -> WARNING_UNSUPPORTED_CONDITION.equals(w.getFieldPath())
                            && w.getMessage().contains("min_peer_reviews")));
        }
    }

    @Nested
    @DisplayName("Reachability rules")
    class Reachability {

        @Test
        void unreachableState() {
            WorkflowTemplate template = threeStateReview()
                    .state(state("island", StateType.ARCHIVED, false, true))
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.hasErrorAt(RULE_REACHABILITY));
            assertTrue(result.getErrorMessages().stream().anyMatch(m -> m.contains("[island]")));
        }

        @Test
        void reachableStateWithoutPathToFinal() {
            WorkflowTemplate template = threeStateReview()
                    .state(state("stuck", StateType.REVISION, false, false))
                    .transition(transition("park", "review", "stuck", Role.EDITOR))
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.hasErrorAt(RULE_PATH_TO_FINAL));
            assertFalse(result.hasErrorAt(RULE_REACHABILITY));
        }

        @Test
        void cycleWithExitIsFine() {
            WorkflowTemplate template = threeStateReview()
                    .state(state("revision", StateType.REVISION, false, false))
                    .transition(transition("request_changes", "review", "revision", Role.EDITOR))
                    .transition(transition("resubmit", "revision", "review", Role.AUTHOR))
                    .build();
            assertTrue(validator.validate(template).isValid());
        }
    }

    @Nested
    @DisplayName("Warnings")
    class Warnings {

        @Test
        void privilegedActionGrantedToNonAdministrator() {
            WorkflowTemplate template = threeStateReview()
                    .state(WorkflowState.builder().id("approved").stateType(StateType.APPROVED)
                            .permission(Role.EDITOR, WorkflowAction.VIEW, WorkflowAction.ASSIGN_ROLES)
                            .build())
                    .transition(transition("pre_approve", "review", "approved", Role.EDITOR))
                    .transition(transition("publish", "approved", "published", Role.PUBLISHER))
                    .defaultPermission(Role.PUBLISHER, WorkflowAction.MANAGE_WORKFLOW)
                    .build();
            ValidationResult result = validator.validate(template);

            assertTrue(result.isValid());
            long privileged = result.getWarnings().stream()
                    .filter(w -> WARNING_PRIVILEGED_GRANT.equals(w.getFieldPath()))
                    .count();
            assertEquals(2, privileged);
        }

        @Test
        void administratorMayHoldPrivilegedActions() {
            WorkflowTemplate template = threeStateReview()
                    .defaultPermission(Role.ADMINISTRATOR, WorkflowAction.MANAGE_WORKFLOW, WorkflowAction.ASSIGN_ROLES)
                    .build();
            assertFalse(validator.validate(template).hasWarnings());
        }
    }

    @Test
    void reportsEveryBrokenRuleAtOnce() {
        WorkflowTemplate template = threeStateReview()
                .id("x")
                .version("one")
                .transition(transition("retract", "published", "ghost", Role.ADMINISTRATOR))
                .build();
        ValidationResult result = validator.validate(template);

        assertTrue(result.hasErrorAt(RULE_TEMPLATE_ID));
        assertTrue(result.hasErrorAt(RULE_VERSION));
        assertTrue(result.hasErrorAt(RULE_STATE_REFERENCE));
        assertTrue(result.hasErrorAt(RULE_FINAL_OUTGOING));
        assertTrue(result.getErrorCount() >= 4);
    }
}
