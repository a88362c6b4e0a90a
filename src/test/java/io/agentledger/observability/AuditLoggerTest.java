package io.agentledger.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreHashChainedAndSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("agentledger-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
            AuditLogger logger = new AuditLogger(file, clock);
            logger.log(AuditLogger.AuditEvent.of("task.submit", "manager", "TASK-000001", "submitted", Map.of("payload_chars", 10)));
            logger.log(AuditLogger.AuditEvent.of("task.delegate", "librarian", "TASK-000001", "delegated", null));

            AuditLogger reopened = new AuditLogger(file, clock);
            Assertions.assertEquals(logger.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("task.complete", "librarian", "TASK-000001", "completed", Map.of()));

            List<JsonNode> rows = reopened.tail(10);
            Assertions.assertEquals(3, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), rows.get(2).path("prev_hash").asText());
            Assertions.assertEquals("2026-01-01T00:00:00Z", rows.get(0).path("timestamp").asText());
            Assertions.assertEquals(10, rows.get(0).path("details").path("payload_chars").asInt());
            Assertions.assertEquals(List.of("task.delegate", "task.complete"),
                    reopened.tail(2).stream().map(r -> r.path("action").asText()).toList());
            Assertions.assertTrue(reopened.verify());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksVerification() throws Exception {
        Path root = Files.createTempDirectory("agentledger-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file);
            logger.log(AuditLogger.AuditEvent.of("task.failed", "librarian", "TASK-000001", "failed", Map.of("error", "boom")));
            logger.log(AuditLogger.AuditEvent.of("task.submit", "manager", "TASK-000002", "submitted", Map.of()));
            Assertions.assertTrue(logger.verify());

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, content.replace("\"failed\"", "\"completed\""), StandardCharsets.UTF_8);

            Assertions.assertFalse(logger.verify());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
