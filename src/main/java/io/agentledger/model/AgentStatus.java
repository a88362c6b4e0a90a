package io.agentledger.model;

public enum AgentStatus {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
