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
import java.util.Objects;

/**
 * Notification payload describing a committed state change.
 */
public final class WorkflowEvent {

    public enum Type {
        TEMPLATE_APPLIED,
        STATE_CHANGED,
        TEMPLATE_REMOVED
    }

    private final Type type;
    private final String contentUid;
    private final String templateId;
    private final String fromState;
    private final String toState;
    private final String transitionId;
    private final String actingUserId;
    private final String comments;
    private final Instant timestamp;

    private WorkflowEvent(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "Event type cannot be null");
        this.contentUid = Objects.requireNonNull(builder.contentUid, "Content uid cannot be null");
        this.templateId = builder.templateId;
        this.fromState = builder.fromState;
        this.toState = builder.toState;
        this.transitionId = builder.transitionId;
        this.actingUserId = builder.actingUserId;
        this.comments = builder.comments;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Type getType() { return type; }
    public String getContentUid() { return contentUid; }
    public String getTemplateId() { return templateId; }
    public String getFromState() { return fromState; }
    public String getToState() { return toState; }
    public String getTransitionId() { return transitionId; }
    public String getActingUserId() { return actingUserId; }
    public String getComments() { return comments; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "WorkflowEvent{" +
               "type=" + type +
               ", contentUid='" + contentUid + '\'' +
               ", templateId='" + templateId + '\'' +
               ", " + fromState + " -> " + toState +
               ", transitionId='" + transitionId + '\'' +
               '}';
    }

    public static class Builder {
        private Type type;
        private String contentUid;
        private String templateId;
        private String fromState;
        private String toState;
        private String transitionId;
        private String actingUserId;
        private String comments;
        private Instant timestamp;

        public Builder type(Type type) { this.type = type; return this; }
        public Builder contentUid(String contentUid) { this.contentUid = contentUid; return this; }
        public Builder templateId(String templateId) { this.templateId = templateId; return this; }
        public Builder fromState(String fromState) { this.fromState = fromState; return this; }
        public Builder toState(String toState) { this.toState = toState; return this; }
        public Builder transitionId(String transitionId) { this.transitionId = transitionId; return this; }
        public Builder actingUserId(String actingUserId) { this.actingUserId = actingUserId; return this; }
        public Builder comments(String comments) { this.comments = comments; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }

        public WorkflowEvent build() {
            return new WorkflowEvent(this);
        }
    }
}
