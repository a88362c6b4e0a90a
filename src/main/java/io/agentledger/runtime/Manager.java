package io.agentledger.runtime;

import io.agentledger.agent.Agent;
import io.agentledger.agent.AgentRegistry;
import io.agentledger.agent.AgentRuntime;
import io.agentledger.agent.FailAgent;
import io.agentledger.agent.ProbeAgent;
import io.agentledger.agent.ScriptAgent;
import io.agentledger.agent.WorkerHost;
import io.agentledger.bus.EventBus;
import io.agentledger.config.CoordinatorConfig;
import io.agentledger.config.CoordinatorSettings;
import io.agentledger.model.AgentView;
import io.agentledger.model.Message;
import io.agentledger.model.TaskStatus;
import io.agentledger.model.TaskView;
import io.agentledger.observability.AuditLogger;
import io.agentledger.routing.MatchPolicy;
import io.agentledger.routing.Roster;
import io.agentledger.routing.RosterEntry;
import io.agentledger.routing.RosterLoader;
import io.agentledger.storage.Database;
import io.agentledger.storage.FileStateStore;
import io.agentledger.storage.Ledger;
import io.agentledger.storage.StateStore;
import io.agentledger.storage.TaskRegistry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns one workspace: bootstraps storage, starts the router and the roster's workers on a
 * shared bus, allocates task ids and exposes the durable status snapshot.
 */
public final class Manager {
    public static final String MANAGER_ID = "manager";

    private final CoordinatorConfig config;
    private final AgentRegistry agentRegistry;
    private final Roster rosterOverride;
    private final CoordinatorSettings settingsOverride;
    private final StateStore store;
    private final Clock clock;
    private final Database database;
    private final TaskRegistry registry;
    private final Ledger ledger;
    private final EventBus bus;
    private final AuditLogger auditLogger;
    private final Object lifecycleLock = new Object();
    private final List<AgentRuntime> workerRuntimes = new ArrayList<>();
    private volatile boolean initialized;
    private volatile boolean running;
    private volatile Roster roster;
    private volatile CoordinatorSettings settings;
    private volatile Router router;
    private volatile Router.RecoveryReport lastRecovery;

    public Manager(CoordinatorConfig config) {
        this(config, AgentRegistry.withDefaults());
    }

    public Manager(CoordinatorConfig config, AgentRegistry agentRegistry) {
        this(config, agentRegistry, null, new FileStateStore(), Clock.systemUTC(), null);
    }

    /**
     * @param roster   roster to route with; {@code null} reads the workspace roster file on init
     * @param settings tunables; {@code null} reads {@code agentledger-settings.json} on init
     */
    public Manager(
            CoordinatorConfig config,
            AgentRegistry agentRegistry,
            Roster roster,
            StateStore store,
            Clock clock,
            CoordinatorSettings settings
    ) {
        this.config = config;
        this.agentRegistry = agentRegistry;
        this.rosterOverride = roster;
        this.settingsOverride = settings;
        this.store = store;
        this.clock = clock;
        this.database = new Database(config);
        this.registry = new TaskRegistry(database);
        this.ledger = new Ledger(store, config.ledgerFile());
        this.bus = new EventBus();
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.roster = Roster.empty();
        this.settings = CoordinatorSettings.defaults();
    }

    /**
     * Roster written by {@code agentledger init} when the workspace has none.
     */
    public static Roster defaultRoster() {
        return new Roster(
                List.of(
                        new RosterEntry(Router.DEFAULT_ID, Router.DEFAULT_CAPABILITIES, List.of(), 0L),
                        new RosterEntry(ProbeAgent.ID, Set.of("probe", "testing"), List.of(), 0L),
                        new RosterEntry(FailAgent.ID, Set.of("failure_injection"), List.of(), 0L)
                ),
                List.of(),
                MatchPolicy.ANY
        );
    }

    public void init() {
        synchronized (lifecycleLock) {
            database.init();
            ledger.initialize();
            settings = settingsOverride != null ? settingsOverride : CoordinatorSettings.load(config.settingsFile());
            roster = rosterOverride != null ? rosterOverride : RosterLoader.load(config.rosterFile());
            initialized = true;
        }
    }

    /**
     * Starts the router and every roster agent that has an implementation, then replays
     * unfinished work left by a previous run.
     *
     * @return {@code false} when already running
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (running) {
                return false;
            }
            init();
            Router created = new Router(
                    Router.DEFAULT_ID, roster, bus, registry, store, ledger, config, settings, auditLogger, clock
            );
            created.runtime().start();
            auditAgent("agent.start", created.runtime());

            for (RosterEntry entry : roster.entries()) {
                if (entry.agentId().equals(created.routerId())) {
                    continue;
                }
                Optional<Agent> agent = resolveAgent(entry);
                if (agent.isEmpty()) {
                    auditLogger.log(AuditLogger.AuditEvent.of(
                            "agent.skipped", MANAGER_ID, null, "no_implementation",
                            Map.of("agent", entry.agentId())
                    ));
                    continue;
                }
                WorkerHost host = new WorkerHost(agent.get(), entry.capabilities(), bus, store, config, auditLogger);
                host.runtime().start();
                workerRuntimes.add(host.runtime());
                auditAgent("agent.start", host.runtime());
            }
            router = created;
            running = true;
            lastRecovery = created.recover();
            return true;
        }
    }

    /**
     * @return {@code false} when nothing was running
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return false;
            }
            running = false;
            for (int i = workerRuntimes.size() - 1; i >= 0; i--) {
                AgentRuntime runtime = workerRuntimes.get(i);
                if (runtime.stop()) {
                    auditAgent("agent.stop", runtime);
                }
            }
            workerRuntimes.clear();
            Router current = router;
            if (current != null && current.runtime().stop()) {
                auditAgent("agent.stop", current.runtime());
            }
            router = null;
            bus.clear();
            return true;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Registers the task and hands it to the router. Delivery is synchronous, so with in-process
     * workers the task has usually reached a terminal state when this returns.
     */
    public String submitTask(String payload) {
        Router current = router;
        if (!running || current == null) {
            throw new IllegalStateException("manager is not running");
        }
        TaskView task = registry.create(payload, clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "task.submit", MANAGER_ID, task.taskId(), "submitted",
                Map.of("payload_chars", task.payload().length())
        ));
        int delivered = bus.publish(Message.newTask(task.taskId(), task.payload(), MANAGER_ID, current.routerId()));
        if (delivered == 0) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "bus.undelivered", MANAGER_ID, task.taskId(), "dropped",
                    Map.of("type", "NEW_TASK", "agent", current.routerId())
            ));
        }
        return task.taskId();
    }

    public Map<String, TaskStatus> getStatus() {
        ensureInitialized();
        return registry.snapshot();
    }

    public Optional<TaskView> task(String taskId) {
        ensureInitialized();
        return registry.get(taskId);
    }

    public List<TaskRegistry.Transition> history(String taskId) {
        ensureInitialized();
        return registry.history(taskId);
    }

    public List<AgentView> agents() {
        List<AgentView> out = new ArrayList<>();
        Router current = router;
        if (current != null) {
            out.add(current.runtime().view());
        }
        synchronized (lifecycleLock) {
            for (AgentRuntime runtime : workerRuntimes) {
                out.add(runtime.view());
            }
        }
        out.sort(Comparator.comparing(AgentView::agentId));
        return out;
    }

    public MaintenanceOutcome runMaintenance() {
        Router current = router;
        if (current == null) {
            return new MaintenanceOutcome(0, Map.of(), bus.droppedCount());
        }
        int expired = current.expireOverdue(clock.millis());
        return new MaintenanceOutcome(expired, current.activeDelegations(), bus.droppedCount());
    }

    public List<String> ledgerTaskIds() {
        return ledger.taskIds();
    }

    public Optional<Router.RecoveryReport> lastRecovery() {
        return Optional.ofNullable(lastRecovery);
    }

    public CoordinatorConfig config() {
        return config;
    }

    public CoordinatorSettings settings() {
        return settings;
    }

    public Roster roster() {
        ensureInitialized();
        return roster;
    }

    public AgentRegistry agentRegistry() {
        return agentRegistry;
    }

    public EventBus bus() {
        return bus;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private Optional<Agent> resolveAgent(RosterEntry entry) {
        Optional<Agent> registered = agentRegistry.findById(entry.agentId());
        if (registered.isPresent() || !entry.scripted()) {
            return registered;
        }
        long timeoutMs = entry.timeoutMs() > 0L ? entry.timeoutMs() : settings.scriptTimeoutMs();
        return Optional.of(new ScriptAgent(entry.agentId(), entry.command(), timeoutMs));
    }

    private void ensureInitialized() {
        if (!initialized) {
            init();
        }
    }

    private void auditAgent(String action, AgentRuntime runtime) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                action, MANAGER_ID, null, runtime.status().name().toLowerCase(Locale.ROOT),
                Map.of("agent", runtime.agentId(), "capabilities", List.copyOf(runtime.capabilities()))
        ));
    }

    public record MaintenanceOutcome(
            int expiredTasks,
            Map<String, String> activeDelegations,
            long droppedMessages
    ) {
    }
}
