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

package dev.mars.eduflow.workflow.instance;

import dev.mars.eduflow.workflow.spi.NativeWorkflowSnapshot;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * What an item looked like before a template was applied over it: the engine's
 * previous instance, if any, and the content store's native workflow state, if any.
 */
public final class WorkflowBackup {

    private final WorkflowInstance priorInstance;
    private final NativeWorkflowSnapshot nativeSnapshot;
    private final Instant capturedAt;

    public WorkflowBackup(WorkflowInstance priorInstance, NativeWorkflowSnapshot nativeSnapshot, Instant capturedAt) {
        // Nested backups are dropped so history does not chain indefinitely.
        this.priorInstance = priorInstance != null ? priorInstance.withoutBackup() : null;
        this.nativeSnapshot = nativeSnapshot;
        this.capturedAt = Objects.requireNonNull(capturedAt, "Captured-at cannot be null");
    }

    public Optional<WorkflowInstance> getPriorInstance() {
        return Optional.ofNullable(priorInstance);
    }

    public Optional<NativeWorkflowSnapshot> getNativeSnapshot() {
        return Optional.ofNullable(nativeSnapshot);
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public boolean isEmpty() {
        return priorInstance == null && nativeSnapshot == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowBackup that = (WorkflowBackup) o;
        return Objects.equals(priorInstance, that.priorInstance) &&
               Objects.equals(nativeSnapshot, that.nativeSnapshot) &&
               Objects.equals(capturedAt, that.capturedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(priorInstance, nativeSnapshot, capturedAt);
    }

    @Override
    public String toString() {
        return "WorkflowBackup{" +
               "priorTemplate=" + (priorInstance != null ? priorInstance.getTemplateId() : "none") +
               ", nativeSnapshot=" + (nativeSnapshot != null) +
               ", capturedAt=" + capturedAt +
               '}';
    }
}
