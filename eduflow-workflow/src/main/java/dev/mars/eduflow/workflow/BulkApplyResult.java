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

import dev.mars.eduflow.core.exceptions.ErrorKind;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Per-item outcome of {@link WorkflowEngine#bulkApplyTemplate}. Items fail
 * independently; one failure never stops the others.
 */
public final class BulkApplyResult {

    private final String templateId;
    private final String userId;
    private final List<ApplyResult> successes;
    private final List<Failure> failures;
    private final Instant completedAt;

    public BulkApplyResult(String templateId, String userId, List<ApplyResult> successes,
                           List<Failure> failures, Instant completedAt) {
        this.templateId = Objects.requireNonNull(templateId, "Template id cannot be null");
        this.userId = userId;
        this.successes = List.copyOf(successes);
        this.failures = List.copyOf(failures);
        this.completedAt = completedAt;
    }

    public String getTemplateId() { return templateId; }
    public String getUserId() { return userId; }
    public List<ApplyResult> getSuccesses() { return successes; }
    public List<Failure> getFailures() { return failures; }
    public Instant getCompletedAt() { return completedAt; }

    public int getTotalItems() {
        return successes.size() + failures.size();
    }

    public double getSuccessRate() {
        int total = getTotalItems();
        return total == 0 ? 0.0 : (double) successes.size() / total;
    }

    @Override
    public String toString() {
        return "BulkApplyResult{" +
               "templateId='" + templateId + '\'' +
               ", successful=" + successes.size() +
               ", failed=" + failures.size() +
               '}';
    }

    public static final class Failure {
        private final String contentUid;
        private final ErrorKind errorKind;
        private final String message;

        public Failure(String contentUid, ErrorKind errorKind, String message) {
            this.contentUid = Objects.requireNonNull(contentUid, "Content uid cannot be null");
            this.errorKind = errorKind;
            this.message = message;
        }

        public String getContentUid() { return contentUid; }

        /**
         * Kind of the workflow error, or null when the item failed for another reason.
         */
        public ErrorKind getErrorKind() { return errorKind; }

        public String getMessage() { return message; }

        @Override
        public String toString() {
            return contentUid + ": [" + errorKind + "] " + message;
        }
    }
}
