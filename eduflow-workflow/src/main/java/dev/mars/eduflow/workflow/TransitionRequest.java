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

import java.util.Objects;

/**
 * Parameters of {@link WorkflowEngine#executeTransition}. The acting user and
 * role come from the caller's identity source; the engine trusts them.
 */
public final class TransitionRequest {

    private final String contentUid;
    private final String transitionId;
    private final String actingUserId;
    private final Role actingRole;
    private final String comments;

    private TransitionRequest(Builder builder) {
        this.contentUid = Objects.requireNonNull(builder.contentUid, "Content uid cannot be null");
        this.transitionId = Objects.requireNonNull(builder.transitionId, "Transition id cannot be null");
        this.actingUserId = Objects.requireNonNull(builder.actingUserId, "Acting user cannot be null");
        this.actingRole = Objects.requireNonNull(builder.actingRole, "Acting role cannot be null");
        this.comments = builder.comments;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getContentUid() { return contentUid; }
    public String getTransitionId() { return transitionId; }
    public String getActingUserId() { return actingUserId; }
    public Role getActingRole() { return actingRole; }
    public String getComments() { return comments; }

    public boolean hasComments() {
        return comments != null && !comments.isBlank();
    }

    @Override
    public String toString() {
        return "TransitionRequest{" +
               "contentUid='" + contentUid + '\'' +
               ", transitionId='" + transitionId + '\'' +
               ", actingUserId='" + actingUserId + '\'' +
               ", actingRole=" + actingRole +
               '}';
    }

    public static class Builder {
        private String contentUid;
        private String transitionId;
        private String actingUserId;
        private Role actingRole;
        private String comments;

        public Builder contentUid(String contentUid) { this.contentUid = contentUid; return this; }
        public Builder transitionId(String transitionId) { this.transitionId = transitionId; return this; }
        public Builder actingUserId(String actingUserId) { this.actingUserId = actingUserId; return this; }
        public Builder actingRole(Role actingRole) { this.actingRole = actingRole; return this; }
        public Builder comments(String comments) { this.comments = comments; return this; }

        public TransitionRequest build() {
            return new TransitionRequest(this);
        }
    }
}
