package io.agentledger.model;

public record TaskView(
        String taskId,
        String payload,
        TaskStatus status,
        String ownerAgent,
        String lastError,
        long createdAtMs,
        long updatedAtMs
) {
}
