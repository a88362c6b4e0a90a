package io.agentledger.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentledger.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public record CoordinatorSettings(
        long delegationTimeoutMs,
        long ledgerRetryBackoffMs,
        long scriptTimeoutMs
) {
    public static final long DEFAULT_DELEGATION_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_LEDGER_RETRY_BACKOFF_MS = 100L;
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 30_000L;

    public CoordinatorSettings {
        delegationTimeoutMs = Math.max(1L, delegationTimeoutMs);
        ledgerRetryBackoffMs = Math.max(0L, ledgerRetryBackoffMs);
        scriptTimeoutMs = Math.max(1_000L, scriptTimeoutMs);
    }

    public static CoordinatorSettings defaults() {
        return new CoordinatorSettings(
                DEFAULT_DELEGATION_TIMEOUT_MS,
                DEFAULT_LEDGER_RETRY_BACKOFF_MS,
                DEFAULT_SCRIPT_TIMEOUT_MS
        );
    }

    public static CoordinatorSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            JsonNode root = Jsons.mapper().readTree(file.toFile());
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Settings file must hold a JSON object: " + file);
            }
            return new CoordinatorSettings(
                    root.path("delegation_timeout_ms").asLong(DEFAULT_DELEGATION_TIMEOUT_MS),
                    root.path("ledger_retry_backoff_ms").asLong(DEFAULT_LEDGER_RETRY_BACKOFF_MS),
                    root.path("script_timeout_ms").asLong(DEFAULT_SCRIPT_TIMEOUT_MS)
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings: " + file, e);
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("delegation_timeout_ms", delegationTimeoutMs);
        out.put("ledger_retry_backoff_ms", ledgerRetryBackoffMs);
        out.put("script_timeout_ms", scriptTimeoutMs);
        return out;
    }
}
