package io.agentledger.agent;

public final class FailAgent implements Agent {
    public static final String ID = "fail";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public AgentResult execute(AgentContext context) {
        return AgentResult.fail("intentional failure from fail agent for " + context.taskId());
    }
}
