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

import java.time.Instant;
import java.util.Objects;

/**
 * Filter over the audit journal. Unset criteria match everything; time bounds
 * are inclusive.
 */
public final class AuditQuery {

    public static final int DEFAULT_LIMIT = 100;

    private final String userId;
    private final String contentUid;
    private final String templateId;
    private final AuditOperation operation;
    private final Boolean success;
    private final Instant from;
    private final Instant to;
    private final int limit;

    private AuditQuery(Builder builder) {
        this.userId = builder.userId;
        this.contentUid = builder.contentUid;
        this.templateId = builder.templateId;
        this.operation = builder.operation;
        this.success = builder.success;
        this.from = builder.from;
        this.to = builder.to;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AuditQuery all() {
        return builder().limit(Integer.MAX_VALUE).build();
    }

    public int getLimit() {
        return limit;
    }

    public boolean matches(AuditEntry entry) {
        if (userId != null && !userId.equals(entry.getUserId())) return false;
        if (contentUid != null && !contentUid.equals(entry.getContentUid())) return false;
        if (templateId != null && !templateId.equals(entry.getTemplateId())) return false;
        if (operation != null && operation != entry.getOperation()) return false;
        if (success != null && success != entry.isSuccess()) return false;
        if (from != null && entry.getTimestamp().isBefore(from)) return false;
        return to == null || !entry.getTimestamp().isAfter(to);
    }

    @Override
    public String toString() {
        return "AuditQuery{" +
               "userId=" + userId +
               ", contentUid=" + contentUid +
               ", templateId=" + templateId +
               ", operation=" + operation +
               ", success=" + success +
               ", from=" + from +
               ", to=" + to +
               ", limit=" + limit +
               '}';
    }

    public static class Builder {
        private String userId;
        private String contentUid;
        private String templateId;
        private AuditOperation operation;
        private Boolean success;
        private Instant from;
        private Instant to;
        private int limit = DEFAULT_LIMIT;

        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder contentUid(String contentUid) { this.contentUid = contentUid; return this; }
        public Builder templateId(String templateId) { this.templateId = templateId; return this; }
        public Builder operation(AuditOperation operation) { this.operation = operation; return this; }
        public Builder success(Boolean success) { this.success = success; return this; }
        public Builder from(Instant from) { this.from = from; return this; }
        public Builder to(Instant to) { this.to = to; return this; }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("Limit must be positive: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public AuditQuery build() {
            if (from != null && to != null && from.isAfter(to)) {
                throw new IllegalArgumentException("Query start " + from + " is after end " + to);
            }
            return new AuditQuery(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AuditQuery that = (AuditQuery) o;
        return limit == that.limit &&
               Objects.equals(userId, that.userId) &&
               Objects.equals(contentUid, that.contentUid) &&
               Objects.equals(templateId, that.templateId) &&
               operation == that.operation &&
               Objects.equals(success, that.success) &&
               Objects.equals(from, that.from) &&
               Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, contentUid, templateId, operation, success, from, to, limit);
    }
}
