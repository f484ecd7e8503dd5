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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.eduflow.core.exceptions.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesAuditSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsOneJsonObjectPerLine() throws Exception {
        Path file = tempDir.resolve("audit/eduflow-audit.jsonl");
        JsonLinesAuditSink sink = new JsonLinesAuditSink(file);

        sink.append(AuditEntry.builder()
                .timestamp(Instant.parse("2025-03-01T10:00:00Z"))
                .operation(AuditOperation.EXECUTE_TRANSITION)
                .userId("u1")
                .contentUid("content-123")
                .templateId("simple_review")
                .success(true)
                .change(AuditChange.of(AuditChange.STATE_CHANGE, "from_state", "draft", "to_state", "review"))
                .metadata("transition_id", "submit_for_review")
                .build()).get();
        sink.append(AuditEntry.builder()
                .operation(AuditOperation.EXECUTE_TRANSITION)
                .userId("u3")
                .contentUid("content-123")
                .templateId("simple_review")
                .success(false)
                .error("denied")
                .errorKind(ErrorKind.PERMISSION_DENIED)
                .build()).get();

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());

        ObjectMapper mapper = new ObjectMapper();
        JsonNode first = mapper.readTree(lines.get(0));
        assertEquals("execute_transition", first.get("operation").asText());
        assertEquals("content-123", first.get("content_uid").asText());
        assertEquals("2025-03-01T10:00:00Z", first.get("timestamp").asText());
        assertTrue(first.get("success").asBoolean());
        assertEquals("state_change", first.get("changes").get(0).get("type").asText());
        assertEquals("review", first.get("changes").get(0).get("attributes").get("to_state").asText());
        assertEquals("submit_for_review", first.get("metadata").get("transition_id").asText());

        JsonNode second = mapper.readTree(lines.get(1));
        assertFalse(second.get("success").asBoolean());
        assertEquals("permission_denied", second.get("error_kind").asText());
        assertEquals("denied", second.get("error").asText());
    }

    @Test
    void unwritableFileFailsTheFuture() throws Exception {
        Path directory = Files.createDirectory(tempDir.resolve("not-a-file"));
        JsonLinesAuditSink sink = new JsonLinesAuditSink(directory);

        CompletableFuture<Void> result = sink.append(AuditEntry.builder()
                .operation(AuditOperation.REMOVE_TEMPLATE)
                .contentUid("content-1")
                .build());

        assertTrue(result.isCompletedExceptionally());
    }
}
