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

import dev.mars.eduflow.workflow.observability.WorkflowMetrics;
import dev.mars.eduflow.workflow.spi.AuditSink;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the audit trail of the engine.
 *
 * <p>Every entry is appended to a bounded in-memory journal, oldest entries
 * dropping off first, and forwarded to the {@link AuditSink}. The sink is
 * called on the recorder's own delivery thread, one entry at a time in record
 * order, so a sink that blocks inside {@code append} never holds up the caller.
 * Each delivery is given the collaborator timeout; failures are logged and
 * counted but never reach the operation that produced the entry.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class AuditRecorder {

    private static final Logger logger = Logger.getLogger(AuditRecorder.class.getName());

    private final AuditSink sink;
    private final int retainedEntries;
    private final Duration sinkTimeout;
    private final WorkflowMetrics metrics;
    private final Deque<AuditEntry> journal = new ArrayDeque<>();
    private final ExecutorService deliveryExecutor;

    public AuditRecorder(AuditSink sink, int retainedEntries, Duration sinkTimeout, WorkflowMetrics metrics) {
        if (retainedEntries <= 0) {
            throw new IllegalArgumentException("Retained entries must be positive: " + retainedEntries);
        }
        this.sink = Objects.requireNonNull(sink, "Audit sink cannot be null");
        this.retainedEntries = retainedEntries;
        this.sinkTimeout = Objects.requireNonNull(sinkTimeout, "Sink timeout cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.deliveryExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "eduflow-audit-delivery");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void record(AuditEntry entry) {
        Objects.requireNonNull(entry, "Audit entry cannot be null");
        synchronized (journal) {
            journal.addLast(entry);
            while (journal.size() > retainedEntries) {
                journal.removeFirst();
            }
        }

        try {
            CompletableFuture.supplyAsync(() -> sink.append(entry), deliveryExecutor)
                    .thenCompose(delivery -> delivery != null ? delivery : CompletableFuture.<Void>completedFuture(null))
                    .orTimeout(sinkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            sinkFailed(entry, error);
                        }
                    });
        } catch (RejectedExecutionException e) {
            sinkFailed(entry, e);
        }
    }

    /**
     * Stops the delivery thread after the entries already recorded are handed
     * to the sink. The journal stays readable.
     */
    public void shutdown() {
        deliveryExecutor.shutdown();
    }

    /**
     * Entries matching {@code query}, newest first, at most {@code query.getLimit()}.
     */
    public List<AuditEntry> query(AuditQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        List<AuditEntry> matches = new ArrayList<>();
        synchronized (journal) {
            Iterator<AuditEntry> newestFirst = journal.descendingIterator();
            while (newestFirst.hasNext() && matches.size() < query.getLimit()) {
                AuditEntry entry = newestFirst.next();
                if (query.matches(entry)) {
                    matches.add(entry);
                }
            }
        }
        return matches;
    }

    /**
     * Aggregates the journal entries whose timestamp falls in {@code [from, to]}.
     * Either bound may be null for an open interval.
     */
    public AuditSummary summarize(Instant from, Instant to) {
        List<AuditEntry> entries = query(AuditQuery.builder()
                .from(from)
                .to(to)
                .limit(Integer.MAX_VALUE)
                .build());

        long successful = 0;
        Map<AuditOperation, Long> byType = new EnumMap<>(AuditOperation.class);
        Set<String> users = new HashSet<>();
        Set<String> templates = new HashSet<>();
        for (AuditEntry entry : entries) {
            if (entry.isSuccess()) {
                successful++;
            }
            byType.merge(entry.getOperation(), 1L, Long::sum);
            if (entry.getUserId() != null) {
                users.add(entry.getUserId());
            }
            if (entry.getTemplateId() != null) {
                templates.add(entry.getTemplateId());
            }
        }
        return new AuditSummary(from, to, entries.size(), successful, byType, users.size(), templates.size());
    }

    public int size() {
        synchronized (journal) {
            return journal.size();
        }
    }

    private void sinkFailed(AuditEntry entry, Throwable error) {
        metrics.recordAuditSinkFailure();
        logger.warning("Audit sink rejected entry " + entry.getId() + " (" + entry.getOperation()
                + " on " + entry.getContentUid() + "): " + error);
        logger.log(Level.FINE, "Audit sink failure detail", error);
    }
}
