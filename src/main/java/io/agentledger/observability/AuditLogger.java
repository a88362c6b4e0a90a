package io.agentledger.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentledger.util.Hashing;
import io.agentledger.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL log of coordination events. Each row carries the hash of the previous row
 * so a truncated or edited log is detectable with {@link #verify()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this(auditFile, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path file() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("task_id", event.taskId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(0, limit));
        return List.copyOf(rows.subList(from, rows.size()));
    }

    /**
     * @return {@code true} when every row's hash matches its content and links to its predecessor
     */
    public synchronized boolean verify() {
        String expectedPrev = "";
        for (JsonNode row : readRows()) {
            if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                return false;
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            row.fields().forEachRemaining(e -> {
                if (!"hash".equals(e.getKey())) {
                    copy.put(e.getKey(), e.getValue());
                }
            });
            String actual = Hashing.sha256Hex(Jsons.toCompactJson(copy));
            if (!actual.equals(row.path("hash").asText(""))) {
                return false;
            }
            expectedPrev = actual;
        }
        return true;
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    private List<JsonNode> readRows() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8).stream()
                    .filter(line -> line != null && !line.isBlank())
                    .map(Jsons::readTree)
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String taskId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String taskId, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, taskId, result, details == null ? Map.of() : details);
        }
    }
}
