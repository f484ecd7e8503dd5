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

import dev.mars.eduflow.config.EduflowConfiguration;
import dev.mars.eduflow.core.Role;
import dev.mars.eduflow.core.exceptions.InvalidTransitionException;
import dev.mars.eduflow.workflow.audit.AuditEntry;
import dev.mars.eduflow.workflow.audit.AuditOperation;
import dev.mars.eduflow.workflow.audit.AuditQuery;
import dev.mars.eduflow.workflow.instance.HistoryEntry;
import dev.mars.eduflow.workflow.instance.InMemoryInstanceStore;
import dev.mars.eduflow.workflow.observability.WorkflowMetrics;
import dev.mars.eduflow.workflow.spi.AuditSink;
import dev.mars.eduflow.workflow.spi.ContentStore;
import dev.mars.eduflow.workflow.spi.NoOpNotifier;
import dev.mars.eduflow.workflow.template.TemplateRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Concurrent transitions against the same and different content items.
 */
class WorkflowEngineConcurrencyTest {

    private static final int THREADS = 8;

    @Mock
    private ContentStore contentStore;

    @Mock
    private AuditSink auditSink;

    private InMemoryInstanceStore store;
    private DefaultWorkflowEngine engine;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(contentStore.getContentLength(anyString())).thenReturn(CompletableFuture.completedFuture(500));
        when(auditSink.append(any())).thenReturn(CompletableFuture.completedFuture(null));

        Properties properties = new Properties();
        properties.setProperty(EduflowConfiguration.LOCK_TIMEOUT_MS, "5000");
        properties.setProperty(EduflowConfiguration.NOTIFICATIONS_ENABLED, "false");

        store = new InMemoryInstanceStore();
        engine = new DefaultWorkflowEngine(TemplateRegistry.builder().withBuiltinTemplates().build(), store,
                contentStore, new NoOpNotifier(), auditSink, new EduflowConfiguration(properties),
                WorkflowMetrics.noop());
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        engine.shutdown();
    }

    @Test
    void testOnlyOneRacingTransitionWins() throws Exception {
        apply("content-1");
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger invalid = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    engine.executeTransition(TransitionRequest.builder()
                            .contentUid("content-1")
                            .transitionId("submit_for_review")
                            .actingUserId("u1")
                            .actingRole(Role.AUTHOR)
                            .build());
                    successes.incrementAndGet();
                } catch (InvalidTransitionException e) {
                    invalid.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertEquals(1, successes.get());
        assertEquals(THREADS - 1, invalid.get());
        assertEquals("review", store.get("content-1").orElseThrow().getCurrentState());
        assertEquals(1, store.get("content-1").orElseThrow().getHistory().size());
        assertEquals(THREADS + 1, engine.getAuditRecorder().size());
    }

    @Test
    void testDifferentItemsProceedIndependently() throws Exception {
        for (int i = 0; i < THREADS; i++) {
            apply("content-" + i);
        }
        CountDownLatch start = new CountDownLatch(1);

        List<Future<TransitionResult>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            String contentUid = "content-" + i;
            futures.add(executor.submit(() -> {
                start.await();
                return engine.executeTransition(TransitionRequest.builder()
                        .contentUid(contentUid)
                        .transitionId("submit_for_review")
                        .actingUserId("u1")
                        .actingRole(Role.AUTHOR)
                        .build());
            }));
        }
        start.countDown();

        for (Future<TransitionResult> future : futures) {
            assertEquals("review", future.get(10, TimeUnit.SECONDS).getToState());
        }
        for (int i = 0; i < THREADS; i++) {
            assertEquals(2L, store.get("content-" + i).orElseThrow().getVersion());
        }
    }

    @Test
    void testJournalFollowsCommitOrder() throws Exception {
        apply("content-1");
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            boolean author = i % 2 == 0;
            futures.add(executor.submit(() -> {
                start.await();
                for (int round = 0; round < 25; round++) {
                    try {
                        engine.executeTransition(TransitionRequest.builder()
                                .contentUid("content-1")
                                .transitionId(author ? "submit_for_review" : "reject_to_draft")
                                .actingUserId(author ? "u1" : "u2")
                                .actingRole(author ? Role.AUTHOR : Role.EDITOR)
                                .comments(author ? null : "Needs work")
                                .build());
                    } catch (InvalidTransitionException e) {
                        // lost the race for this state
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        List<String> committed = store.get("content-1").orElseThrow().getHistory().stream()
                .map(HistoryEntry::getTransitionId)
                .collect(Collectors.toList());
        List<AuditEntry> journal = new ArrayList<>(engine.getAuditRecorder().query(AuditQuery.builder()
                .contentUid("content-1")
                .operation(AuditOperation.EXECUTE_TRANSITION)
                .success(true)
                .limit(Integer.MAX_VALUE)
                .build()));
        Collections.reverse(journal);

        assertFalse(committed.isEmpty());
        assertEquals(committed, journal.stream()
                .map(entry -> (String) entry.getMetadata().get("transition_id"))
                .collect(Collectors.toList()));
        for (int i = 1; i < journal.size(); i++) {
            assertFalse(journal.get(i).getTimestamp().isBefore(journal.get(i - 1).getTimestamp()));
        }
    }

    private void apply(String contentUid) throws Exception {
        engine.applyTemplate(ApplyTemplateRequest.builder()
                .templateId("simple_review")
                .contentUid(contentUid)
                .assign(Role.AUTHOR, "u1")
                .assign(Role.EDITOR, "u2")
                .actingUserId("admin")
                .build());
    }
}
