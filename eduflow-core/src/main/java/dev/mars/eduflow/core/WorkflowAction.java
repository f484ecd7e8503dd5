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

package dev.mars.eduflow.core;

import java.util.Locale;

/**
 * Closed set of actions a role may perform on content while it sits in a workflow state.
 *
 * <p>Content actions ({@code view}, {@code edit}, {@code delete}) and workflow actions
 * ({@code submit} through {@code retract}) are granted per state. The two administrative
 * actions, {@link #MANAGE_WORKFLOW} and {@link #ASSIGN_ROLES}, carry extra weight:
 * holding {@code manage_workflow} in a state lets a role execute any transition leaving
 * that state regardless of the transition's required role.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum WorkflowAction {
    VIEW("view"),
    EDIT("edit"),
    DELETE("delete"),
    SUBMIT("submit"),
    REVIEW("review"),
    APPROVE("approve"),
    PUBLISH("publish"),
    REJECT("reject"),
    RETRACT("retract"),
    MANAGE_WORKFLOW("manage_workflow"),
    ASSIGN_ROLES("assign_roles");

    private final String value;

    WorkflowAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isAdministrative() {
        return this == MANAGE_WORKFLOW || this == ASSIGN_ROLES;
    }

    /**
     * Resolves an action from its wire value.
     *
     * @param value the wire value, e.g. {@code "manage_workflow"}
     * @return the matching action
     * @throws IllegalArgumentException if the value does not name a known action
     */
    public static WorkflowAction fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Action value cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (WorkflowAction action : values()) {
            if (action.value.equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown action: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
