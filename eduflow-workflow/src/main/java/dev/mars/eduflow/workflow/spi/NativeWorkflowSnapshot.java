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

package dev.mars.eduflow.workflow.spi;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque copy of the workflow state a content store keeps natively for an item,
 * captured before a template is applied so it can be restored later.
 */
public final class NativeWorkflowSnapshot {

    private final String contentUid;
    private final String workflowId;
    private final String state;
    private final Map<String, Object> attributes;
    private final Instant capturedAt;

    public NativeWorkflowSnapshot(String contentUid, String workflowId, String state,
                                  Map<String, Object> attributes, Instant capturedAt) {
        this.contentUid = Objects.requireNonNull(contentUid, "Content uid cannot be null");
        this.workflowId = workflowId;
        this.state = state;
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.capturedAt = capturedAt != null ? capturedAt : Instant.now();
    }

    public String getContentUid() { return contentUid; }
    public String getWorkflowId() { return workflowId; }
    public String getState() { return state; }
    public Map<String, Object> getAttributes() { return attributes; }
    public Instant getCapturedAt() { return capturedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NativeWorkflowSnapshot that = (NativeWorkflowSnapshot) o;
        return Objects.equals(contentUid, that.contentUid) &&
               Objects.equals(workflowId, that.workflowId) &&
               Objects.equals(state, that.state) &&
               Objects.equals(attributes, that.attributes) &&
               Objects.equals(capturedAt, that.capturedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentUid, workflowId, state, attributes, capturedAt);
    }

    @Override
    public String toString() {
        return "NativeWorkflowSnapshot{" +
               "contentUid='" + contentUid + '\'' +
               ", workflowId='" + workflowId + '\'' +
               ", state='" + state + '\'' +
               '}';
    }
}
