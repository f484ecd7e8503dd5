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

import dev.mars.eduflow.workflow.instance.WorkflowInstance;

import java.util.Objects;
import java.util.Optional;

public final class RemovalResult {

    private final String contentUid;
    private final String removedTemplateId;
    private final String finalState;
    private final boolean backupRestored;
    private final WorkflowInstance restoredInstance;

    public RemovalResult(String contentUid, String removedTemplateId, String finalState,
                         boolean backupRestored, WorkflowInstance restoredInstance) {
        this.contentUid = Objects.requireNonNull(contentUid, "Content uid cannot be null");
        this.removedTemplateId = Objects.requireNonNull(removedTemplateId, "Template id cannot be null");
        this.finalState = finalState;
        this.backupRestored = backupRestored;
        this.restoredInstance = restoredInstance;
    }

    public String getContentUid() { return contentUid; }
    public String getRemovedTemplateId() { return removedTemplateId; }

    /**
     * State the removed instance was in when it stopped being tracked.
     */
    public String getFinalState() { return finalState; }

    public boolean isBackupRestored() { return backupRestored; }

    /**
     * The instance re-created from the backup, if the backup held one.
     */
    public Optional<WorkflowInstance> getRestoredInstance() {
        return Optional.ofNullable(restoredInstance);
    }

    @Override
    public String toString() {
        return "RemovalResult{" +
               "contentUid='" + contentUid + '\'' +
               ", removedTemplateId='" + removedTemplateId + '\'' +
               ", backupRestored=" + backupRestored +
               ", restoredTemplateId=" + (restoredInstance != null ? restoredInstance.getTemplateId() : null) +
               '}';
    }
}
