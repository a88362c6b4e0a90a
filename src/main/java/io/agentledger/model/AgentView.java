package io.agentledger.model;

import java.util.Collection;
import java.util.List;

public record AgentView(
        String agentId,
        List<String> capabilities,
        AgentStatus status
) {
    public static AgentView of(String agentId, Collection<String> capabilities, AgentStatus status) {
        return new AgentView(agentId, capabilities.stream().sorted().toList(), status);
    }
}
