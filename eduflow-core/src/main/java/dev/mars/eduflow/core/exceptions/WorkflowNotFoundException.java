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

/**
 * Thrown when no workflow instance is tracked for a content item.
 */
public class WorkflowNotFoundException extends WorkflowException {

    private final String contentUid;

    public WorkflowNotFoundException(String contentUid) {
        super(ErrorKind.NOT_FOUND,
                String.format("No workflow applied to content '%s'", contentUid),
                details("content_uid", contentUid));
        this.contentUid = contentUid;
    }

    public String getContentUid() {
        return contentUid;
    }
}
