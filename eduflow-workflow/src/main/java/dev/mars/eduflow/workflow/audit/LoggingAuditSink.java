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

import dev.mars.eduflow.workflow.spi.AuditSink;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Writes audit entries to the {@code dev.mars.eduflow.audit} logger. Used when no
 * audit file is configured.
 */
public class LoggingAuditSink implements AuditSink {

    private static final Logger logger = Logger.getLogger("dev.mars.eduflow.audit");

    @Override
    public CompletableFuture<Void> append(AuditEntry entry) {
        StringBuilder line = new StringBuilder()
                .append("AUDIT ").append(entry.getOperation())
                .append(" user=").append(entry.getUserId())
                .append(" content=").append(entry.getContentUid())
                .append(" template=").append(entry.getTemplateId())
                .append(" success=").append(entry.isSuccess());
        if (!entry.getChanges().isEmpty()) {
            line.append(" changes=").append(entry.getChanges());
        }
        if (entry.getError() != null) {
            line.append(" error=[").append(entry.getErrorKind()).append("] ").append(entry.getError());
        }
        logger.info(line.toString());
        return CompletableFuture.completedFuture(null);
    }
}
