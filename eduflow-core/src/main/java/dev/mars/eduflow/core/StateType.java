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
 * Semantic type of a workflow state, used by presentation layers and reporting.
 * The type carries no transition rules of its own; those come from the template.
 */
public enum StateType {
    DRAFT("draft"),
    REVIEW("review"),
    REVISION("revision"),
    APPROVED("approved"),
    PUBLISHED("published"),
    ARCHIVED("archived"),
    REJECTED("rejected");

    private final String value;

    StateType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static StateType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("State type value cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StateType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown state type: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
