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

package dev.mars.eduflow.workflow.spi;

import dev.mars.eduflow.workflow.audit.AuditEntry;

import java.util.concurrent.CompletableFuture;

/**
 * Append-only destination for audit entries. The engine does not retry failed
 * appends; it logs them and moves on.
 *
 * <p>{@code append} is called from a single delivery thread, never
 * concurrently, in the order entries were recorded. It may block; the wait
 * for it is bounded by the collaborator timeout.</p>
 */
public interface AuditSink {

    CompletableFuture<Void> append(AuditEntry entry);
}
