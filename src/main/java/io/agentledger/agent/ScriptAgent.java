package io.agentledger.agent;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Worker backed by an external command. The payload is written to stdin; stdout becomes the
 * spec artifact when the process exits with status 0 inside the timeout.
 */
public final class ScriptAgent implements Agent {
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptAgent(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script agent id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public AgentResult execute(AgentContext context) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.environment().put("AGENT_ID", id);
        pb.environment().put("TASK_ID", context.taskId());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return AgentResult.fail("script spawn failed: " + e.getMessage());
        }

        try {
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            byte[] input = context.payload() == null
                    ? new byte[0]
                    : context.payload().getBytes(StandardCharsets.UTF_8);
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input);
            } catch (IOException e) {
                // a script may exit without reading its input; the exit status decides
                if (process.isAlive()) {
                    throw e;
                }
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return AgentResult.fail("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = output.get(1, TimeUnit.SECONDS);
            if (process.exitValue() == 0) {
                return AgentResult.ok(combined.strip());
            }
            return AgentResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return AgentResult.fail("script interrupted");
        } catch (Exception e) {
            process.destroyForcibly();
            return AgentResult.fail("script execution failed: " + e.getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read script output", e);
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
