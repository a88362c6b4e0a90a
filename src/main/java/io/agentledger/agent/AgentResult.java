package io.agentledger.agent;

/**
 * Outcome of one delegated task. On success {@code output} becomes the spec artifact.
 */
public record AgentResult(
        boolean success,
        String output,
        String error
) {
    public static AgentResult ok(String output) {
        return new AgentResult(true, output == null ? "" : output, null);
    }

    public static AgentResult fail(String error) {
        return new AgentResult(false, null, error);
    }
}
