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

import java.util.List;

/**
 * Thrown when a transition is requested from a state the content is not in.
 *
 * <p>This exception captures the state the transition expects, the state the
 * content actually occupies and the transitions that are valid from there, so
 * the caller can correct the request.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InvalidTransitionException extends WorkflowException {

    private final String contentUid;
    private final String transitionId;
    private final String expectedState;
    private final String actualState;
    private final List<String> validTransitions;

    /**
     * Constructs an InvalidTransitionException with full context.
     *
     * @param contentUid       the content whose transition was rejected
     * @param transitionId     the transition that was requested
     * @param expectedState    the transition's {@code from_state}
     * @param actualState      the state the content is currently in
     * @param validTransitions ids of the transitions leaving the current state
     */
    public InvalidTransitionException(String contentUid, String transitionId, String expectedState,
                                      String actualState, List<String> validTransitions) {
        super(ErrorKind.INVALID_TRANSITION,
                String.format("Invalid transition '%s' for '%s': requires state '%s' but current state is '%s'. Valid transitions: %s",
                        transitionId, contentUid, expectedState, actualState, formatTransitions(validTransitions)),
                details("content_uid", contentUid,
                        "transition_id", transitionId,
                        "expected_state", expectedState,
                        "actual_state", actualState,
                        "valid_transitions", validTransitions == null ? List.of() : List.copyOf(validTransitions)));
        this.contentUid = contentUid;
        this.transitionId = transitionId;
        this.expectedState = expectedState;
        this.actualState = actualState;
        this.validTransitions = validTransitions == null ? List.of() : List.copyOf(validTransitions);
    }

    public String getContentUid() {
        return contentUid;
    }

    public String getTransitionId() {
        return transitionId;
    }

    public String getExpectedState() {
        return expectedState;
    }

    public String getActualState() {
        return actualState;
    }

    public List<String> getValidTransitions() {
        return validTransitions;
    }

    private static String formatTransitions(List<String> transitions) {
        if (transitions == null || transitions.isEmpty()) {
            return "[]";
        }
        return "[" + String.join(", ", transitions) + "]";
    }
}
