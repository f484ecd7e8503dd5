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
 * Closed set of roles that can participate in a content workflow.
 *
 * <p>Roles are granted to users by the external identity provider; the engine
 * only ever receives a role alongside the acting user id. Template documents
 * use the lowercase wire value ({@code peer_reviewer}) rather than the enum
 * constant name.</p>
 *
 * <h3>Privileged roles:</h3>
 * <p>Every role except {@link #AUTHOR} and {@link #VIEWER} is considered
 * privileged. Templates that lean on privileged roles receive a hygiene
 * warning at load time so template authors can double-check access control.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see WorkflowAction
 */
public enum Role {
    AUTHOR("author", false),
    PEER_REVIEWER("peer_reviewer", true),
    EDITOR("editor", true),
    SUBJECT_EXPERT("subject_expert", true),
    PUBLISHER("publisher", true),
    ADMINISTRATOR("administrator", true),
    VIEWER("viewer", false);

    private final String value;
    private final boolean privileged;

    Role(String value, boolean privileged) {
        this.value = value;
        this.privileged = privileged;
    }

    public String getValue() {
        return value;
    }

    public boolean isPrivileged() {
        return privileged;
    }

    /**
     * Resolves a role from its wire value. Matching ignores case and surrounding whitespace.
     *
     * @param value the wire value, e.g. {@code "subject_expert"}
     * @return the matching role
     * @throws IllegalArgumentException if the value does not name a known role
     */
    public static Role fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role value cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
