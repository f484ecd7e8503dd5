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

package dev.mars.eduflow.core.exceptions;

import java.time.Instant;

/**
 * Thrown when a mutating operation collides with existing state: a workflow is
 * already applied and {@code force} was not requested, or another operation on
 * the same content still holds its exclusive section.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ConflictException extends WorkflowException {

    private final String contentUid;
    private final String existingTemplateId;
    private final Instant appliedAt;

    public ConflictException(String contentUid, String existingTemplateId, Instant appliedAt) {
        super(ErrorKind.CONFLICT,
                String.format("Workflow '%s' already applied to content '%s' at %s; use force to replace it",
                        existingTemplateId, contentUid, appliedAt),
                details("content_uid", contentUid,
                        "existing_template_id", existingTemplateId,
                        "applied_at", String.valueOf(appliedAt)));
        this.contentUid = contentUid;
        this.existingTemplateId = existingTemplateId;
        this.appliedAt = appliedAt;
    }

    /**
     * Creates a conflict for an operation that could not enter the content's
     * exclusive section in time.
     */
    public ConflictException(String contentUid, String message) {
        super(ErrorKind.CONFLICT, message, details("content_uid", contentUid));
        this.contentUid = contentUid;
        this.existingTemplateId = null;
        this.appliedAt = null;
    }

    public String getContentUid() {
        return contentUid;
    }

    public String getExistingTemplateId() {
        return existingTemplateId;
    }

    public Instant getAppliedAt() {
        return appliedAt;
    }
}
