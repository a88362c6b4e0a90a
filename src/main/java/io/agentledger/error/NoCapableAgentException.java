package io.agentledger.error;

import java.util.Set;

public final class NoCapableAgentException extends CoordinationException {
    public static final String CODE = "no_capable_agent";

    private final Set<String> requiredCapabilities;

    public NoCapableAgentException(String taskId, Set<String> requiredCapabilities) {
        super(CODE, requiredCapabilities.isEmpty()
                ? "task " + taskId + " names no known capability"
                : "no agent declares " + requiredCapabilities + " for task " + taskId);
        this.requiredCapabilities = Set.copyOf(requiredCapabilities);
    }

    public Set<String> requiredCapabilities() {
        return requiredCapabilities;
    }
}
