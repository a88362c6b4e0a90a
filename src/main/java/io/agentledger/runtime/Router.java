package io.agentledger.runtime;

import io.agentledger.agent.AgentRuntime;
import io.agentledger.bus.EventBus;
import io.agentledger.config.CoordinatorConfig;
import io.agentledger.config.CoordinatorSettings;
import io.agentledger.error.ArtifactMissingException;
import io.agentledger.error.CoordinationException;
import io.agentledger.error.LedgerWriteException;
import io.agentledger.error.NoCapableAgentException;
import io.agentledger.error.StateNotFoundException;
import io.agentledger.error.StateStoreException;
import io.agentledger.model.Message;
import io.agentledger.model.MessageType;
import io.agentledger.model.TaskStatus;
import io.agentledger.model.TaskView;
import io.agentledger.observability.AuditLogger;
import io.agentledger.routing.CapabilityMatcher;
import io.agentledger.routing.Roster;
import io.agentledger.routing.RosterEntry;
import io.agentledger.storage.Ledger;
import io.agentledger.storage.StateStore;
import io.agentledger.storage.TaskRegistry;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Coordinating agent. Routes new tasks by capability, hands each worker one task at a time and
 * folds finished artifacts into the ledger.
 *
 * <p>Consolidation of a task (read artifact, append ledger, delete artifact, mark completed) runs
 * under a lock scoped to that task id, so a repeated completion signal or a recovery pass can
 * never produce a second ledger entry.
 */
public final class Router {
    public static final String DEFAULT_ID = "librarian";
    static final Set<String> DEFAULT_CAPABILITIES = Set.of("task_routing", "spec_consolidation", "coordination");
    private static final int CONSOLIDATION_ATTEMPTS = 2;
    private static final String ROUTER_ERROR = "router_error";

    private final String routerId;
    private final EventBus bus;
    private final TaskRegistry registry;
    private final StateStore store;
    private final Ledger ledger;
    private final CoordinatorConfig config;
    private final CoordinatorSettings settings;
    private final CapabilityMatcher matcher;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final AgentRuntime runtime;
    private final Object dispatchLock = new Object();
    private final Map<String, Deque<Message>> pendingByAgent = new HashMap<>();
    private final Map<String, InFlight> inFlightByAgent = new HashMap<>();
    private final ConcurrentMap<String, Object> taskLocks = new ConcurrentHashMap<>();

    public Router(
            String routerId,
            Roster roster,
            EventBus bus,
            TaskRegistry registry,
            StateStore store,
            Ledger ledger,
            CoordinatorConfig config,
            CoordinatorSettings settings,
            AuditLogger auditLogger,
            Clock clock
    ) {
        this.routerId = routerId;
        this.bus = bus;
        this.registry = registry;
        this.store = store;
        this.ledger = ledger;
        this.config = config;
        this.settings = settings;
        this.matcher = new CapabilityMatcher(roster, routerId);
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.runtime = AgentRuntime.builder(routerId, bus)
                .capabilities(roster.find(routerId).map(RosterEntry::capabilities).orElse(DEFAULT_CAPABILITIES))
                .on(MessageType.NEW_TASK, this::onNewTask)
                .on(MessageType.TASK_COMPLETE, this::onTaskComplete)
                .on(MessageType.TASK_FAILED, this::onTaskFailed)
                .build();
    }

    public String routerId() {
        return routerId;
    }

    public AgentRuntime runtime() {
        return runtime;
    }

    void onNewTask(Message message) {
        guard(message.taskId(), "route", () -> {
            Optional<TaskView> task = registry.get(message.taskId());
            if (task.isEmpty() || task.get().status() != TaskStatus.SUBMITTED) {
                audit("task.route_ignored", message.taskId(), "ignored", Map.of(
                        "status", task.map(t -> t.status().name()).orElse("unknown")
                ));
                return;
            }
            route(task.get());
        });
    }

    void onTaskComplete(Message message) {
        guard(message.taskId(), "consolidate", () -> consolidate(message.taskId(), message.fromAgent()));
    }

    void onTaskFailed(Message message) {
        String taskId = message.taskId();
        String agentId = message.fromAgent();
        try {
            guard(taskId, "worker_failure", () -> withTaskLock(taskId, () -> {
                Optional<TaskView> task = registry.get(taskId);
                if (!isOwnedDelegation(task, agentId)) {
                    audit("task.failure_ignored", taskId, "ignored", Map.of(
                            "agent", String.valueOf(agentId),
                            "status", task.map(t -> t.status().name()).orElse("unknown")
                    ));
                    return;
                }
                String error = "worker_failed: " + message.reason();
                registry.tryFail(taskId, error, clock.millis());
                audit("task.failed", taskId, "failed", Map.of(
                        "agent", agentId,
                        "error", error,
                        "artifact_present", store.exists(config.artifactPath(agentId, taskId))
                ));
            }));
        } finally {
            release(agentId, taskId);
        }
    }

    /**
     * Fails every dispatched task whose worker has been silent for longer than the delegation
     * timeout and frees the worker for its next queued task.
     *
     * @return number of tasks failed
     */
    public int expireOverdue(long nowMs) {
        List<Map.Entry<String, InFlight>> overdue = new ArrayList<>();
        synchronized (dispatchLock) {
            for (Map.Entry<String, InFlight> entry : inFlightByAgent.entrySet()) {
                if (nowMs - entry.getValue().dispatchedAtMs() >= settings.delegationTimeoutMs()) {
                    overdue.add(Map.entry(entry.getKey(), entry.getValue()));
                }
            }
        }
        int expired = 0;
        for (Map.Entry<String, InFlight> entry : overdue) {
            String agentId = entry.getKey();
            String taskId = entry.getValue().taskId();
            try {
                if (expire(agentId, taskId, nowMs)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                failAfterRouterError(taskId, "timeout", e);
            } finally {
                release(agentId, taskId);
            }
        }
        return expired;
    }

    private boolean expire(String agentId, String taskId, long nowMs) {
        boolean[] failed = {false};
        withTaskLock(taskId, () -> {
            Optional<TaskView> task = registry.get(taskId);
            if (task.isEmpty() || task.get().status() != TaskStatus.DELEGATED) {
                return;
            }
            String error = "delegation_timeout: no completion from " + agentId
                    + " within " + settings.delegationTimeoutMs() + "ms";
            if (registry.tryFail(taskId, error, nowMs)) {
                failed[0] = true;
                audit("task.timeout", taskId, "failed", Map.of("agent", agentId, "error", error));
            }
        });
        return failed[0];
    }

    public RecoveryReport recover() {
        int consolidated = 0;
        int redelegated = 0;
        int rerouted = 0;
        int artifactsCleaned = 0;
        List<String> ledgerGaps = new ArrayList<>();

        for (TaskView task : registry.listByStatus(TaskStatus.DELEGATED)) {
            String taskId = task.taskId();
            Path artifact = config.artifactPath(task.ownerAgent(), taskId);
            if (ledger.contains(taskId) || store.exists(artifact)) {
                guard(taskId, "recover", () -> consolidate(taskId, task.ownerAgent()));
                if (hasStatus(taskId, TaskStatus.COMPLETED)) {
                    consolidated++;
                }
            } else {
                guard(taskId, "recover", () -> enqueue(
                        task.ownerAgent(), Message.delegated(taskId, task.payload(), routerId, task.ownerAgent())));
                redelegated++;
            }
        }
        for (TaskView task : registry.listByStatus(TaskStatus.SUBMITTED)) {
            guard(task.taskId(), "recover", () -> route(task));
            rerouted++;
        }
        for (TaskView task : registry.listByStatus(TaskStatus.COMPLETED)) {
            if (!ledger.contains(task.taskId())) {
                ledgerGaps.add(task.taskId());
                continue;
            }
            if (task.ownerAgent() != null && deleteArtifact(task.taskId(), config.artifactPath(task.ownerAgent(), task.taskId()))) {
                artifactsCleaned++;
            }
        }

        RecoveryReport report = new RecoveryReport(consolidated, redelegated, rerouted, artifactsCleaned, ledgerGaps);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("consolidated", consolidated);
        details.put("redelegated", redelegated);
        details.put("rerouted", rerouted);
        details.put("artifacts_cleaned", artifactsCleaned);
        details.put("ledger_gaps", ledgerGaps);
        audit("recovery.complete", null, ledgerGaps.isEmpty() ? "ok" : "gaps", details);
        return report;
    }

    /**
     * Agent id to the task it is currently working on.
     */
    public Map<String, String> activeDelegations() {
        synchronized (dispatchLock) {
            Map<String, String> out = new TreeMap<>();
            inFlightByAgent.forEach((agent, inFlight) -> out.put(agent, inFlight.taskId()));
            return out;
        }
    }

    int lockedTaskCount() {
        return taskLocks.size();
    }

    public List<String> queuedTasks(String agentId) {
        synchronized (dispatchLock) {
            Deque<Message> queue = pendingByAgent.get(agentId);
            return queue == null ? List.of() : queue.stream().map(Message::taskId).toList();
        }
    }

    private void route(TaskView task) {
        String taskId = task.taskId();
        Set<String> required = matcher.requiredCapabilities(task.payload());
        Optional<String> chosen = matcher.select(required);
        long now = clock.millis();
        if (chosen.isEmpty()) {
            NoCapableAgentException error = new NoCapableAgentException(taskId, required);
            registry.tryFail(taskId, error.describe(), now);
            audit("task.route_failed", taskId, "failed", Map.of(
                    "required", List.copyOf(required),
                    "error", error.describe()
            ));
            return;
        }
        String agentId = chosen.get();
        if (!registry.tryDelegate(taskId, agentId, now)) {
            audit("task.route_ignored", taskId, "ignored", Map.of("agent", agentId));
            return;
        }
        audit("task.delegate", taskId, "delegated", Map.of(
                "agent", agentId,
                "required", List.copyOf(required)
        ));
        enqueue(agentId, Message.delegated(taskId, task.payload(), routerId, agentId));
    }

    private void enqueue(String agentId, Message delegated) {
        synchronized (dispatchLock) {
            pendingByAgent.computeIfAbsent(agentId, ignored -> new ArrayDeque<>()).addLast(delegated);
        }
        dispatchNext(agentId);
    }

    private void dispatchNext(String agentId) {
        Message next;
        synchronized (dispatchLock) {
            if (inFlightByAgent.containsKey(agentId)) {
                return;
            }
            Deque<Message> queue = pendingByAgent.get(agentId);
            if (queue == null || queue.isEmpty()) {
                return;
            }
            next = queue.pollFirst();
            inFlightByAgent.put(agentId, new InFlight(next.taskId(), clock.millis()));
        }
        // Delivery may complete the task re-entrantly and dispatch the following one.
        int delivered = bus.publish(next);
        if (delivered == 0) {
            audit("bus.undelivered", next.taskId(), "dropped", Map.of(
                    "type", next.type().name(),
                    "agent", agentId
            ));
        }
    }

    private void release(String agentId, String taskId) {
        if (agentId == null) {
            return;
        }
        synchronized (dispatchLock) {
            InFlight current = inFlightByAgent.get(agentId);
            if (current == null || !current.taskId().equals(taskId)) {
                return;
            }
            inFlightByAgent.remove(agentId);
        }
        dispatchNext(agentId);
    }

    private void consolidate(String taskId, String agentId) {
        try {
            withTaskLock(taskId, () -> {
                Optional<TaskView> task = registry.get(taskId);
                if (task.isPresent() && task.get().status() == TaskStatus.COMPLETED) {
                    if (agentId != null && agentId.equals(task.get().ownerAgent()) && ledger.contains(taskId)) {
                        deleteArtifact(taskId, config.artifactPath(agentId, taskId));
                    }
                    audit("consolidation.duplicate", taskId, "ignored", Map.of("agent", String.valueOf(agentId)));
                } else if (!isOwnedDelegation(task, agentId)) {
                    audit("consolidation.ignored", taskId, "ignored", Map.of(
                            "agent", String.valueOf(agentId),
                            "status", task.map(t -> t.status().name()).orElse("unknown")
                    ));
                } else {
                    runConsolidation(taskId, agentId);
                }
            });
        } finally {
            release(agentId, taskId);
        }
    }

    private void runConsolidation(String taskId, String agentId) {
        CoordinationException lastError = null;
        for (int attempt = 1; attempt <= CONSOLIDATION_ATTEMPTS; attempt++) {
            try {
                consolidateOnce(taskId, agentId);
                lastError = null;
                break;
            } catch (CoordinationException e) {
                lastError = e;
                audit("consolidation.retry", taskId, attempt < CONSOLIDATION_ATTEMPTS ? "retrying" : "exhausted", Map.of(
                        "agent", agentId,
                        "attempt", attempt,
                        "error", e.describe()
                ));
                if (attempt < CONSOLIDATION_ATTEMPTS && !backoff(e, attempt)) {
                    break;
                }
            }
        }
        if (lastError != null) {
            registry.tryFail(taskId, lastError.describe(), clock.millis());
            audit("task.failed", taskId, "failed", Map.of(
                    "agent", agentId,
                    "error", lastError.describe(),
                    "artifact", config.artifactPath(agentId, taskId).toString()
            ));
            return;
        }
        audit("task.complete", taskId, "completed", Map.of("agent", agentId));
    }

    private void consolidateOnce(String taskId, String agentId) {
        Path artifact = config.artifactPath(agentId, taskId);
        if (ledger.contains(taskId)) {
            audit("ledger.duplicate_skipped", taskId, "skipped", Map.of("agent", agentId));
        } else {
            String content;
            try {
                content = store.read(artifact);
            } catch (StateNotFoundException e) {
                throw new ArtifactMissingException(taskId, artifact, e);
            }
            boolean appended = ledger.append(taskId, agentId, content);
            audit(appended ? "ledger.append" : "ledger.duplicate_skipped", taskId, appended ? "ok" : "skipped", Map.of(
                    "agent", agentId,
                    "ledger", ledger.path().toString()
            ));
        }
        deleteArtifact(taskId, artifact);
        if (!registry.tryComplete(taskId, clock.millis())) {
            throw new CoordinationException("transition_rejected", "task " + taskId + " is no longer DELEGATED");
        }
    }

    /**
     * The ledger already holds the content, so a failed delete is only audited; the leftover is
     * removed by the next recovery pass.
     */
    private boolean deleteArtifact(String taskId, Path artifact) {
        try {
            return store.delete(artifact);
        } catch (StateStoreException e) {
            audit("artifact.delete_failed", taskId, "failed", Map.of(
                    "artifact", artifact.toString(),
                    "error", e.describe()
            ));
            return false;
        }
    }

    private boolean backoff(CoordinationException error, int attempt) {
        if (!(error instanceof LedgerWriteException) || settings.ledgerRetryBackoffMs() <= 0L) {
            return true;
        }
        long delay = settings.ledgerRetryBackoffMs() * (1L << (attempt - 1));
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean isOwnedDelegation(Optional<TaskView> task, String agentId) {
        return task.isPresent()
                && task.get().status() == TaskStatus.DELEGATED
                && agentId != null
                && agentId.equals(task.get().ownerAgent());
    }

    /**
     * Runs {@code action} under the monitor of one task. The monitor is dropped once the task is
     * terminal; a caller that was waiting on a dropped monitor retries with the current one.
     */
    private void withTaskLock(String taskId, Runnable action) {
        while (true) {
            Object lock = taskLocks.computeIfAbsent(taskId, ignored -> new Object());
            synchronized (lock) {
                if (taskLocks.get(taskId) != lock) {
                    continue;
                }
                action.run();
                if (registry.get(taskId).map(t -> t.status().isTerminal()).orElse(true)) {
                    taskLocks.remove(taskId, lock);
                }
                return;
            }
        }
    }

    private boolean hasStatus(String taskId, TaskStatus status) {
        return registry.get(taskId).map(t -> t.status() == status).orElse(false);
    }

    /**
     * Handler errors never cross the bus: they are audited and the task is failed when the
     * registry still accepts the transition.
     */
    private void guard(String taskId, String stage, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            failAfterRouterError(taskId, stage, e);
        }
    }

    private void failAfterRouterError(String taskId, String stage, RuntimeException error) {
        String reason = ROUTER_ERROR + ": " + stage + " failed: " + error.getMessage();
        audit("router.error", taskId, "failed", Map.of("stage", stage, "error", String.valueOf(error)));
        try {
            withTaskLock(taskId, () -> {
                if (registry.tryFail(taskId, reason, clock.millis())) {
                    audit("task.failed", taskId, "failed", Map.of("error", reason));
                }
            });
        } catch (RuntimeException failError) {
            audit("router.error", taskId, "fail_unrecorded", Map.of(
                    "stage", stage,
                    "error", String.valueOf(failError)
            ));
        }
    }

    private void audit(String action, String taskId, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, routerId, taskId, result, details));
    }

    private record InFlight(String taskId, long dispatchedAtMs) {
    }

    public record RecoveryReport(
            int consolidated,
            int redelegated,
            int rerouted,
            int artifactsCleaned,
            List<String> ledgerGaps
    ) {
        public RecoveryReport {
            ledgerGaps = List.copyOf(ledgerGaps);
        }
    }
}
