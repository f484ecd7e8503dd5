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
import dev.mars.eduflow.core.WorkflowTemplate;
import dev.mars.eduflow.core.exceptions.TemplateNotFoundException;
import dev.mars.eduflow.core.exceptions.WorkflowException;
import dev.mars.eduflow.workflow.template.TemplateFilter;
import dev.mars.eduflow.workflow.template.TemplateSummary;

import java.util.List;

/**
 * Applies workflow templates to content items and moves them through their
 * states. All calls are synchronous and in-process.
 *
 * <p>Every state-changing call writes exactly one audit entry, whether it
 * succeeds or fails. Mutations of one content item are serialized; calls for
 * different items run in parallel.</p>
 */
public interface WorkflowEngine {

    /**
     * Summaries of the registered templates matching the filter, ordered by id.
     *
     * @param filter category and complexity criteria; null matches every template
     * @return the matching summaries
     */
    List<TemplateSummary> listTemplates(TemplateFilter filter);

    /**
     * Gets a registered template.
     *
     * @param templateId the template id
     * @return the template
     * @throws TemplateNotFoundException if no template has that id
     */
    WorkflowTemplate getTemplate(String templateId) throws TemplateNotFoundException;

    /**
     * Applies a template to a content item, placing it in the template's initial state.
     *
     * @param request the template, content item, role assignments and options
     * @return the new instance and any role-assignment warnings
     * @throws WorkflowException    for an unknown template, invalid role assignments,
     *                              an existing instance without {@code force}, or a
     *                              content store failure while taking a backup
     * @throws InterruptedException if interrupted while waiting for the content item
     */
    ApplyResult applyTemplate(ApplyTemplateRequest request) throws WorkflowException, InterruptedException;

    /**
     * Executes one transition of a content item's workflow.
     *
     * @param request the content item, transition, acting user and role, and comments
     * @return the committed move and the transitions now open to the acting role
     * @throws WorkflowException    if the item or transition is unknown, the transition
     *                              does not leave the current state, the role may not
     *                              execute it, a condition is unmet, or the content
     *                              store cannot answer a condition check
     * @throws InterruptedException if interrupted while waiting for the content item
     */
    TransitionResult executeTransition(TransitionRequest request) throws WorkflowException, InterruptedException;

    /**
     * Stops tracking a content item, optionally restoring the backup taken when
     * its template was applied.
     *
     * @param contentUid    the content item
     * @param restoreBackup whether to restore the backup, when one exists
     * @param actingUserId  the user performing the removal
     * @return what was removed and restored
     * @throws WorkflowException    if the item has no instance, or the native
     *                              workflow state cannot be restored
     * @throws InterruptedException if interrupted while waiting for the content item
     */
    RemovalResult removeTemplate(String contentUid, boolean restoreBackup, String actingUserId)
            throws WorkflowException, InterruptedException;

    /**
     * Reads a content item's workflow state. Never blocks on writers and writes
     * no audit entry.
     *
     * @param contentUid     the content item
     * @param requestingRole the role whose actions and transitions are reported
     * @return a consistent view of the item's instance
     * @throws WorkflowException if the item has no instance
     */
    WorkflowStateView getState(String contentUid, Role requestingRole) throws WorkflowException;

    /**
     * Applies one template to many content items with bounded concurrency. Each
     * item is applied and audited independently.
     *
     * @param templateId the template to apply
     * @param items      the content items and their role assignments
     * @param userId     the user performing the operation
     * @return successes and failures per item
     * @throws TemplateNotFoundException if the template is unknown; nothing is applied
     */
    BulkApplyResult bulkApplyTemplate(String templateId, List<BulkApplyItem> items, String userId)
            throws TemplateNotFoundException;

    /**
     * Shuts down the engine and releases its threads.
     */
    void shutdown();
}
