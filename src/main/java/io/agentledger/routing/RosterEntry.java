package io.agentledger.routing;

import java.util.List;
import java.util.Set;

/**
 * One agent of the roster. {@code command} is only set for agents backed by an external script.
 */
public record RosterEntry(
        String agentId,
        Set<String> capabilities,
        List<String> command,
        long timeoutMs
) {
    public RosterEntry {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("roster agent id cannot be empty");
        }
        agentId = agentId.trim();
        capabilities = CapabilityTags.normalizeAll(capabilities);
        command = command == null ? List.of() : List.copyOf(command);
        timeoutMs = Math.max(0L, timeoutMs);
    }

    public static RosterEntry of(String agentId, String... capabilities) {
        return new RosterEntry(agentId, Set.of(capabilities), List.of(), 0L);
    }

    public boolean scripted() {
        return !command.isEmpty();
    }
}
