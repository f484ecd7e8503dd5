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

import dev.mars.eduflow.core.exceptions.ErrorKind;
import dev.mars.eduflow.workflow.observability.WorkflowMetrics;
import dev.mars.eduflow.workflow.spi.AuditSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for AuditRecorder: journal bounds, sink forwarding, query and summary.
 */
class AuditRecorderTest {

    private static final Instant BASE = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private AuditSink sink;

    private AuditRecorder recorder;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(sink.append(any())).thenReturn(CompletableFuture.completedFuture(null));
        recorder = new AuditRecorder(sink, 100, Duration.ofSeconds(1), WorkflowMetrics.noop());
    }

    @AfterEach
    void tearDown() {
        recorder.shutdown();
    }

    @Test
    void forwardsEveryEntryToSink() {
        AuditEntry entry = entry(AuditOperation.APPLY_TEMPLATE, "u1", "content-1", "simple_review", true, 0);

        recorder.record(entry);

        verify(sink, timeout(1000)).append(entry);
        assertEquals(1, recorder.size());
    }

    @Test
    void sinkFailureIsNotPropagated() {
        when(sink.append(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")))
                .thenThrow(new IllegalStateException("sink closed"));

        assertDoesNotThrow(() -> recorder.record(entry(AuditOperation.APPLY_TEMPLATE, "u1", "c1", "t", true, 0)));
        assertDoesNotThrow(() -> recorder.record(entry(AuditOperation.APPLY_TEMPLATE, "u1", "c2", "t", true, 1)));
        assertEquals(2, recorder.size(), "journal keeps entries the sink rejected");
    }

    @Test
    void blockingSinkDoesNotHoldUpCaller() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(sink.append(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(null);
        });
        AuditRecorder shortTimeout = new AuditRecorder(sink, 100, Duration.ofMillis(100), WorkflowMetrics.noop());
        try {
            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
                shortTimeout.record(entry(AuditOperation.APPLY_TEMPLATE, "u1", "c1", "t", true, 0));
                shortTimeout.record(entry(AuditOperation.APPLY_TEMPLATE, "u1", "c2", "t", true, 1));
            });
            assertEquals(2, shortTimeout.size());
        } finally {
            release.countDown();
            shortTimeout.shutdown();
        }
        verify(sink, timeout(2000).times(2)).append(any());
    }

    @Test
    void deliversInRecordOrder() {
        AuditEntry first = entry(AuditOperation.APPLY_TEMPLATE, "u1", "c1", "t", true, 0);
        AuditEntry second = entry(AuditOperation.EXECUTE_TRANSITION, "u1", "c1", "t", true, 1);

        recorder.record(first);
        recorder.record(second);

        InOrder inOrder = inOrder(sink);
        inOrder.verify(sink, timeout(1000)).append(first);
        inOrder.verify(sink, timeout(1000)).append(second);
    }

    @Test
    void journalDropsOldestEntries() {
        AuditRecorder small = new AuditRecorder(sink, 3, Duration.ofSeconds(1), WorkflowMetrics.noop());
        try {
            for (int i = 0; i < 5; i++) {
                small.record(entry(AuditOperation.EXECUTE_TRANSITION, "u1", "content-" + i, "simple_review", true, i));
            }

            assertEquals(3, small.size());
            assertEquals(List.of("content-4", "content-3", "content-2"), contentUids(small.query(AuditQuery.all())));
        } finally {
            small.shutdown();
        }
    }

    @Test
    void queryFiltersAndLimits() {
        recorder.record(entry(AuditOperation.APPLY_TEMPLATE, "admin", "content-1", "simple_review", true, 0));
        recorder.record(entry(AuditOperation.EXECUTE_TRANSITION, "u1", "content-1", "simple_review", true, 1));
        recorder.record(entry(AuditOperation.EXECUTE_TRANSITION, "u3", "content-1", "simple_review", false, 2));
        recorder.record(entry(AuditOperation.APPLY_TEMPLATE, "admin", "content-2", "extended_review", true, 3));

        assertEquals(2, recorder.query(AuditQuery.builder().userId("admin").build()).size());
        assertEquals(3, recorder.query(AuditQuery.builder().contentUid("content-1").build()).size());
        assertEquals(1, recorder.query(AuditQuery.builder().templateId("extended_review").build()).size());
        assertEquals(1, recorder.query(AuditQuery.builder().success(false).build()).size());

        List<AuditEntry> transitions = recorder.query(AuditQuery.builder()
                .operation(AuditOperation.EXECUTE_TRANSITION).success(true).build());
        assertEquals(1, transitions.size());
        assertEquals("u1", transitions.get(0).getUserId());

        List<AuditEntry> window = recorder.query(AuditQuery.builder()
                .from(BASE.plusSeconds(60)).to(BASE.plusSeconds(120)).build());
        assertEquals(List.of("content-1", "content-1"), contentUids(window));

        List<AuditEntry> newest = recorder.query(AuditQuery.builder().limit(1).build());
        assertEquals("content-2", newest.get(0).getContentUid());
    }

    @Test
    void invalidQueriesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> AuditQuery.builder().limit(0));
        assertThrows(IllegalArgumentException.class,
                () -> AuditQuery.builder().from(BASE.plusSeconds(10)).to(BASE).build());
    }

    @Test
    void summarizesPeriod() {
        recorder.record(entry(AuditOperation.APPLY_TEMPLATE, "admin", "content-1", "simple_review", true, 0));
        recorder.record(entry(AuditOperation.EXECUTE_TRANSITION, "u1", "content-1", "simple_review", true, 1));
        recorder.record(entry(AuditOperation.EXECUTE_TRANSITION, "u2", "content-1", "simple_review", false, 2));
        recorder.record(entry(AuditOperation.REMOVE_TEMPLATE, "admin", "content-2", "extended_review", true, 3));

        AuditSummary summary = recorder.summarize(BASE, BASE.plusSeconds(150));

        assertEquals(3, summary.getTotalOperations());
        assertEquals(2, summary.getSuccessfulOperations());
        assertEquals(1, summary.getFailedOperations());
        assertEquals(2.0 / 3.0, summary.getSuccessRate(), 1e-9);
        assertEquals(1L, summary.getOperationsByType().get(AuditOperation.APPLY_TEMPLATE));
        assertEquals(2L, summary.getOperationsByType().get(AuditOperation.EXECUTE_TRANSITION));
        assertNull(summary.getOperationsByType().get(AuditOperation.REMOVE_TEMPLATE));
        assertEquals(3, summary.getUniqueUsers());
        assertEquals(1, summary.getUniqueTemplates());

        AuditSummary everything = recorder.summarize(null, null);
        assertEquals(4, everything.getTotalOperations());
        assertEquals(2, everything.getUniqueTemplates());
    }

    @Test
    void emptySummaryHasZeroRate() {
        AuditSummary summary = recorder.summarize(BASE, BASE.plusSeconds(1));

        assertEquals(0, summary.getTotalOperations());
        assertEquals(0.0, summary.getSuccessRate());
        assertTrue(summary.getOperationsByType().isEmpty());
    }

    private static AuditEntry entry(AuditOperation operation, String userId, String contentUid, String templateId,
                                    boolean success, int minutes) {
        AuditEntry.Builder builder = AuditEntry.builder()
                .timestamp(BASE.plusSeconds(60L * minutes))
                .operation(operation)
                .userId(userId)
                .contentUid(contentUid)
                .templateId(templateId)
                .success(success);
        if (!success) {
            builder.error("Role 'author' cannot execute this transition").errorKind(ErrorKind.PERMISSION_DENIED);
        }
        return builder.build();
    }

    private static List<String> contentUids(List<AuditEntry> entries) {
        return entries.stream().map(AuditEntry::getContentUid).collect(Collectors.toList());
    }
}
