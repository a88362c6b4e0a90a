package io.agentledger.agent;

import io.agentledger.bus.EventBus;
import io.agentledger.config.CoordinatorConfig;
import io.agentledger.model.Message;
import io.agentledger.model.MessageType;
import io.agentledger.observability.AuditLogger;
import io.agentledger.storage.StateStore;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Runs an {@link Agent} for every task delegated to it. The agent's output is written to the
 * task's spec artifact before {@code TASK_COMPLETE} is published; any failure, thrown or
 * returned, is reported as {@code TASK_FAILED} instead of escaping through the bus.
 */
public final class WorkerHost {
    private final Agent agent;
    private final StateStore store;
    private final CoordinatorConfig config;
    private final AuditLogger auditLogger;
    private final EventBus bus;
    private final AgentRuntime runtime;

    public WorkerHost(Agent agent, Set<String> capabilities, EventBus bus, StateStore store,
                      CoordinatorConfig config, AuditLogger auditLogger) {
        this.agent = agent;
        this.store = store;
        this.config = config;
        this.auditLogger = auditLogger;
        this.bus = bus;
        this.runtime = AgentRuntime.builder(agent.id(), bus)
                .capabilities(capabilities)
                .on(MessageType.DELEGATED_TASK, this::onDelegatedTask)
                .build();
    }

    public AgentRuntime runtime() {
        return runtime;
    }

    private void onDelegatedTask(Message message) {
        String taskId = message.taskId();
        AgentResult result;
        try {
            result = agent.execute(new AgentContext(agent.id(), taskId, message.payload()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = AgentResult.fail("worker interrupted");
        } catch (Exception e) {
            result = AgentResult.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (result == null) {
            result = AgentResult.fail("worker returned no result");
        }

        if (result.success()) {
            Path artifact = config.artifactPath(agent.id(), taskId);
            try {
                store.write(artifact, result.output());
            } catch (RuntimeException e) {
                result = AgentResult.fail("artifact write failed: " + e.getMessage());
            }
        }

        if (result.success()) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "worker.complete", agent.id(), taskId, "ok",
                    Map.of("artifact", config.artifactPath(agent.id(), taskId).toString())
            ));
            bus.publish(Message.taskComplete(agent.id(), taskId, message.fromAgent()));
        } else {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "worker.failed", agent.id(), taskId, "failed",
                    Map.of("reason", result.error() == null ? "" : result.error())
            ));
            bus.publish(Message.taskFailed(agent.id(), taskId, result.error(), message.fromAgent()));
        }
    }
}
