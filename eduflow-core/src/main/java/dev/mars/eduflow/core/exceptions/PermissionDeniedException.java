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

import dev.mars.eduflow.core.Role;

public class PermissionDeniedException extends WorkflowException {

    private final Role actingRole;
    private final Role requiredRole;

    public PermissionDeniedException(String contentUid, String transitionId, Role actingRole, Role requiredRole) {
        super(ErrorKind.PERMISSION_DENIED,
                String.format("Role '%s' cannot execute transition '%s' on content '%s'; requires '%s'",
                        actingRole, transitionId, contentUid, requiredRole),
                details("content_uid", contentUid,
                        "transition_id", transitionId,
                        "acting_role", String.valueOf(actingRole),
                        "required_role", String.valueOf(requiredRole)));
        this.actingRole = actingRole;
        this.requiredRole = requiredRole;
    }

    public Role getActingRole() {
        return actingRole;
    }

    public Role getRequiredRole() {
        return requiredRole;
    }
}
