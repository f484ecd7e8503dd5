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

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thrown when the role assignments passed to an apply request do not cover the
 * roles the template needs, or contain empty user lists.
 */
public class RoleAssignmentException extends WorkflowException {

    private final String templateId;
    private final Set<Role> missingRoles;
    private final List<String> errors;

    public RoleAssignmentException(String templateId, Set<Role> missingRoles, List<String> errors) {
        super(ErrorKind.VALIDATION,
                String.format("Invalid role assignments for template '%s': %s", templateId, String.join("; ", errors)),
                details("template_id", templateId,
                        "missing_roles", missingRoles.stream().map(Role::getValue).collect(Collectors.toList()),
                        "errors", List.copyOf(errors)));
        this.templateId = templateId;
        this.missingRoles = missingRoles.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(missingRoles));
        this.errors = List.copyOf(errors);
    }

    public String getTemplateId() {
        return templateId;
    }

    public Set<Role> getMissingRoles() {
        return missingRoles;
    }

    public List<String> getErrors() {
        return errors;
    }
}
