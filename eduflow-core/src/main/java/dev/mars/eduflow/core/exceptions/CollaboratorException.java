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
 * Thrown when an external collaborator (content store, notifier, audit sink)
 * fails or does not answer within its timeout while the engine depends on its result.
 */
public class CollaboratorException extends WorkflowException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(ErrorKind.COLLABORATOR,
                String.format("%s failure: %s", collaborator, message),
                details("collaborator", collaborator),
                cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
