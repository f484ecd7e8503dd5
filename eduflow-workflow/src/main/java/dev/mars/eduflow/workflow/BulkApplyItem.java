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

package dev.mars.eduflow.workflow;

import dev.mars.eduflow.core.Role;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One content item of a bulk application, with its own role assignments.
 */
public final class BulkApplyItem {

    private final String contentUid;
    private final Map<Role, List<String>> roleAssignments;
    private final boolean force;

    public BulkApplyItem(String contentUid, Map<Role, List<String>> roleAssignments) {
        this(contentUid, roleAssignments, false);
    }

    public BulkApplyItem(String contentUid, Map<Role, List<String>> roleAssignments, boolean force) {
        this.contentUid = Objects.requireNonNull(contentUid, "Content uid cannot be null");
        this.roleAssignments = roleAssignments != null ? Map.copyOf(roleAssignments) : Map.of();
        this.force = force;
    }

    public String getContentUid() { return contentUid; }
    public Map<Role, List<String>> getRoleAssignments() { return roleAssignments; }
    public boolean isForce() { return force; }

    @Override
    public String toString() {
        return "BulkApplyItem{contentUid='" + contentUid + "', force=" + force + '}';
    }
}
