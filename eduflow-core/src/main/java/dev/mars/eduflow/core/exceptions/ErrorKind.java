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
 * Classifies every failure a workflow operation can report to its caller.
 */
public enum ErrorKind {
    STRUCTURAL_VALIDATION("structural_validation"),
    NOT_FOUND("not_found"),
    CONFLICT("conflict"),
    VALIDATION("validation"),
    PERMISSION_DENIED("permission_denied"),
    INVALID_TRANSITION("invalid_transition"),
    CONDITION_NOT_MET("condition_not_met"),
    COLLABORATOR("collaborator");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
