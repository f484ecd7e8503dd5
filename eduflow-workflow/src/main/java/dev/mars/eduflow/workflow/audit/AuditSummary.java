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

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate statistics over the audit entries of a period.
 */
public final class AuditSummary {

    private final Instant from;
    private final Instant to;
    private final long totalOperations;
    private final long successfulOperations;
    private final Map<AuditOperation, Long> operationsByType;
    private final int uniqueUsers;
    private final int uniqueTemplates;

    public AuditSummary(Instant from, Instant to, long totalOperations, long successfulOperations,
                        Map<AuditOperation, Long> operationsByType, int uniqueUsers, int uniqueTemplates) {
        this.from = from;
        this.to = to;
        this.totalOperations = totalOperations;
        this.successfulOperations = successfulOperations;
        this.operationsByType = operationsByType.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(operationsByType));
        this.uniqueUsers = uniqueUsers;
        this.uniqueTemplates = uniqueTemplates;
    }

    public Instant getFrom() { return from; }
    public Instant getTo() { return to; }
    public long getTotalOperations() { return totalOperations; }
    public long getSuccessfulOperations() { return successfulOperations; }
    public long getFailedOperations() { return totalOperations - successfulOperations; }
    public Map<AuditOperation, Long> getOperationsByType() { return operationsByType; }
    public int getUniqueUsers() { return uniqueUsers; }
    public int getUniqueTemplates() { return uniqueTemplates; }

    public double getSuccessRate() {
        return totalOperations == 0 ? 0.0 : (double) successfulOperations / totalOperations;
    }

    @Override
    public String toString() {
        return "AuditSummary{" +
               "total=" + totalOperations +
               ", successful=" + successfulOperations +
               ", byType=" + operationsByType +
               ", uniqueUsers=" + uniqueUsers +
               ", uniqueTemplates=" + uniqueTemplates +
               '}';
    }
}
