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

import dev.mars.eduflow.core.exceptions.ErrorKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one state-changing operation, successful or not.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class AuditEntry {

    private final String id;
    private final Instant timestamp;
    private final AuditOperation operation;
    private final String userId;
    private final String contentUid;
    private final String templateId;
    private final boolean success;
    private final List<AuditChange> changes;
    private final String error;
    private final ErrorKind errorKind;
    private final Map<String, Object> metadata;

    private AuditEntry(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.operation = Objects.requireNonNull(builder.operation, "Operation cannot be null");
        this.userId = builder.userId;
        this.contentUid = builder.contentUid;
        this.templateId = builder.templateId;
        this.success = builder.success;
        this.changes = List.copyOf(builder.changes);
        this.error = builder.error;
        this.errorKind = builder.errorKind;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() { return id; }
    public Instant getTimestamp() { return timestamp; }
    public AuditOperation getOperation() { return operation; }
    public String getUserId() { return userId; }
    public String getContentUid() { return contentUid; }
    public String getTemplateId() { return templateId; }
    public boolean isSuccess() { return success; }
    public List<AuditChange> getChanges() { return changes; }
    public String getError() { return error; }
    public ErrorKind getErrorKind() { return errorKind; }
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((AuditEntry) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AuditEntry{" +
               "operation=" + operation +
               ", userId='" + userId + '\'' +
               ", contentUid='" + contentUid + '\'' +
               ", templateId='" + templateId + '\'' +
               ", success=" + success +
               (error != null ? ", error='" + error + '\'' : "") +
               '}';
    }

    public static class Builder {
        private String id;
        private Instant timestamp;
        private AuditOperation operation;
        private String userId;
        private String contentUid;
        private String templateId;
        private boolean success;
        private final List<AuditChange> changes = new ArrayList<>();
        private String error;
        private ErrorKind errorKind;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) { this.id = id; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder operation(AuditOperation operation) { this.operation = operation; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder contentUid(String contentUid) { this.contentUid = contentUid; return this; }
        public Builder templateId(String templateId) { this.templateId = templateId; return this; }
        public Builder success(boolean success) { this.success = success; return this; }
        public Builder error(String error) { this.error = error; return this; }
        public Builder errorKind(ErrorKind errorKind) { this.errorKind = errorKind; return this; }

        public Builder change(AuditChange change) {
            this.changes.add(Objects.requireNonNull(change, "Change cannot be null"));
            return this;
        }

        public Builder changes(List<AuditChange> changes) {
            if (changes != null) {
                changes.forEach(this::change);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(this);
        }
    }
}
