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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RoleTest {

    @ParameterizedTest
    @EnumSource(Role.class)
    void fromValueRoundTripsWireValue(Role role) {
        assertEquals(role, Role.fromValue(role.getValue()));
        assertEquals(role.getValue(), role.toString());
    }

    @Test
    void fromValueNormalizesCaseAndWhitespace() {
        assertEquals(Role.PEER_REVIEWER, Role.fromValue("  Peer_Reviewer "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "owner", "peer-reviewer"})
    void fromValueRejectsUnknownRoles(String value) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Role.fromValue(value));
        assertTrue(ex.getMessage().contains("Unknown role"));
    }

    @Test
    void onlyAuthorAndViewerAreUnprivileged() {
        for (Role role : Role.values()) {
            boolean expected = role != Role.AUTHOR && role != Role.VIEWER;
            assertEquals(expected, role.isPrivileged(), role.getValue());
        }
    }

    @Test
    void administrativeActions() {
        assertTrue(WorkflowAction.MANAGE_WORKFLOW.isAdministrative());
        assertTrue(WorkflowAction.ASSIGN_ROLES.isAdministrative());
        assertFalse(WorkflowAction.APPROVE.isAdministrative());
        assertEquals(WorkflowAction.MANAGE_WORKFLOW, WorkflowAction.fromValue("manage_workflow"));
    }
}
