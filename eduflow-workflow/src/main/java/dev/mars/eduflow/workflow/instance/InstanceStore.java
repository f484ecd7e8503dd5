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

import dev.mars.eduflow.core.exceptions.WorkflowException;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the single live {@link WorkflowInstance} of each content item.
 *
 * <p>Reads return immutable snapshots and never block. Writes are only legal
 * inside {@link #withExclusiveAccess}, which admits one mutating operation per
 * content uid at a time; operations on different uids do not contend.</p>
 */
public interface InstanceStore {

    Optional<WorkflowInstance> get(String contentUid);

    /**
     * Runs {@code action} while holding the content item's exclusive section.
     *
     * @param contentUid the item to lock
     * @param timeout    how long to wait for the section before giving up
     * @param action     the work to perform; may call {@link #put} and {@link #remove}
     * @return whatever {@code action} returns
     * @throws dev.mars.eduflow.core.exceptions.ConflictException if the section is not
     *         acquired within {@code timeout}
     * @throws WorkflowException    if {@code action} fails
     * @throws InterruptedException if the caller is interrupted while waiting; nothing has changed
     */
    <T> T withExclusiveAccess(String contentUid, Duration timeout, ExclusiveAction<T> action)
            throws WorkflowException, InterruptedException;

    void put(WorkflowInstance instance);

    Optional<WorkflowInstance> remove(String contentUid);

    Set<String> contentUids();

    int size();

    @FunctionalInterface
    interface ExclusiveAction<T> {
        T execute() throws WorkflowException;
    }
}
