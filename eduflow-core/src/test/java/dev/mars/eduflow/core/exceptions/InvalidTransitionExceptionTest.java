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

package dev.mars.eduflow.core.exceptions;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InvalidTransitionException.
 */
class InvalidTransitionExceptionTest {

    @Test
    void constructor_withFullContext_formatsMessage() {
        InvalidTransitionException ex = new InvalidTransitionException(
                "content-123", "approve_content", "review", "published", List.of("retract"));

        assertTrue(ex.getMessage().contains("content-123"));
        assertTrue(ex.getMessage().contains("approve_content"));
        assertTrue(ex.getMessage().contains("'review'"));
        assertTrue(ex.getMessage().contains("'published'"));
        assertTrue(ex.getMessage().contains("[retract]"));
        assertEquals("review", ex.getExpectedState());
        assertEquals("published", ex.getActualState());
        assertEquals(List.of("retract"), ex.getValidTransitions());
    }

    @Test
    void constructor_withNoTransitions_formatsEmptyList() {
        InvalidTransitionException ex = new InvalidTransitionException(
                "content-456", "submit_for_review", "draft", "published", List.of());

        assertTrue(ex.getMessage().contains("[]"));
        assertTrue(ex.getValidTransitions().isEmpty());
    }

    @Test
    void carriesKindAndDetails() {
        InvalidTransitionException ex = new InvalidTransitionException(
                "content-1", "t1", "a", "b", null);

        assertEquals(ErrorKind.INVALID_TRANSITION, ex.getKind());
        assertEquals("a", ex.getDetails().get("expected_state"));
        assertEquals("b", ex.getDetails().get("actual_state"));
        assertEquals(List.of(), ex.getDetails().get("valid_transitions"));
    }

    @Test
    void extendsEduflowException() {
        InvalidTransitionException ex = new InvalidTransitionException(
                "content-1", "t1", "a", "b", List.of());

        assertInstanceOf(WorkflowException.class, ex);
        assertInstanceOf(EduflowException.class, ex);
        assertInstanceOf(Exception.class, ex);
    }
}
