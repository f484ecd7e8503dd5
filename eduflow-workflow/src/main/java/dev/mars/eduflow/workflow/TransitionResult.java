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

import dev.mars.eduflow.core.WorkflowTransition;
import dev.mars.eduflow.workflow.instance.HistoryEntry;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a committed transition: where the content moved and what the
 * acting role can do next.
 */
public final class TransitionResult {

    private final String contentUid;
    private final String templateId;
    private final HistoryEntry historyEntry;
    private final List<WorkflowTransition> availableTransitions;
    private final long instanceVersion;

    public TransitionResult(String contentUid, String templateId, HistoryEntry historyEntry,
                            List<WorkflowTransition> availableTransitions, long instanceVersion) {
        this.contentUid = Objects.requireNonNull(contentUid, "Content uid cannot be null");
        this.templateId = Objects.requireNonNull(templateId, "Template id cannot be null");
        this.historyEntry = Objects.requireNonNull(historyEntry, "History entry cannot be null");
        this.availableTransitions = List.copyOf(availableTransitions);
        this.instanceVersion = instanceVersion;
    }

    public String getContentUid() { return contentUid; }
    public String getTemplateId() { return templateId; }
    public String getFromState() { return historyEntry.getFromState(); }
    public String getToState() { return historyEntry.getToState(); }
    public HistoryEntry getHistoryEntry() { return historyEntry; }
    public List<WorkflowTransition> getAvailableTransitions() { return availableTransitions; }
    public long getInstanceVersion() { return instanceVersion; }

    public List<String> getAvailableTransitionIds() {
        return availableTransitions.stream().map(WorkflowTransition::getId).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "TransitionResult{" +
               "contentUid='" + contentUid + '\'' +
               ", " + getFromState() + " -> " + getToState() +
               ", available=" + getAvailableTransitionIds() +
               '}';
    }
}
