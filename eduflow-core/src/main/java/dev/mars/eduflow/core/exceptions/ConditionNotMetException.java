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

/**
 * Thrown when a transition precondition such as a required comment or a minimum
 * content length is not satisfied.
 */
public class ConditionNotMetException extends WorkflowException {

    private final String conditionKey;
    private final String requirement;

    public ConditionNotMetException(String contentUid, String transitionId, String conditionKey, String requirement) {
        super(ErrorKind.CONDITION_NOT_MET,
                String.format("Condition '%s' not met for transition '%s' on content '%s': %s",
                        conditionKey, transitionId, contentUid, requirement),
                details("content_uid", contentUid,
                        "transition_id", transitionId,
                        "condition", conditionKey,
                        "requirement", requirement));
        this.conditionKey = conditionKey;
        this.requirement = requirement;
    }

    public String getConditionKey() {
        return conditionKey;
    }

    public String getRequirement() {
        return requirement;
    }
}
