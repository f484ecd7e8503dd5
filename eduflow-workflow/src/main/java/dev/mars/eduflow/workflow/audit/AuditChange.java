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

package dev.mars.eduflow.workflow.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One change descriptor inside an audit entry, such as a state change or a role
 * added to an item's assignments.
 */
public final class AuditChange {

    public static final String STATE_CHANGE = "state_change";
    public static final String TEMPLATE_APPLIED = "template_applied";
    public static final String TEMPLATE_REMOVED = "template_removed";
    public static final String ROLE_ADDED = "role_added";
    public static final String ROLE_REMOVED = "role_removed";
    public static final String BACKUP_CREATED = "backup_created";
    public static final String BACKUP_RESTORED = "backup_restored";

    private final String type;
    private final Map<String, Object> attributes;

    public AuditChange(String type, Map<String, Object> attributes) {
        this.type = Objects.requireNonNull(type, "Change type cannot be null");
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static AuditChange of(String type, Object... keyValues) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            attributes.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new AuditChange(type, attributes);
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AuditChange that = (AuditChange) o;
        return type.equals(that.type) && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, attributes);
    }

    @Override
    public String toString() {
        return type + attributes;
    }
}
