package io.agentledger.agent;

/**
 * Validation worker: proves routing and file-based state work by returning a fixed report.
 */
public final class ProbeAgent implements Agent {
    public static final String ID = "probe";
    static final String REPORT = """
            # Probe Agent Report

            The framework routed this task correctly.
            Event signaling works.
            File-based state works.
            """;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public AgentResult execute(AgentContext context) {
        return AgentResult.ok(REPORT);
    }
}
