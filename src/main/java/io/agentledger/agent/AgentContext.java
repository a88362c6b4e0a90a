package io.agentledger.agent;

public record AgentContext(
        String agentId,
        String taskId,
        String payload
) {
}
