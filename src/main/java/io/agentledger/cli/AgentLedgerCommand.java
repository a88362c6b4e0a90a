package io.agentledger.cli;

import io.agentledger.config.CoordinatorConfig;
import io.agentledger.error.DuplicateTaskIdentifierException;
import io.agentledger.model.TaskStatus;
import io.agentledger.model.TaskView;
import io.agentledger.routing.Roster;
import io.agentledger.routing.RosterEntry;
import io.agentledger.routing.RosterLoader;
import io.agentledger.runtime.Manager;
import io.agentledger.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "agentledger",
        mixinStandardHelpOptions = true,
        description = "Event-driven agent coordination with a consolidated spec ledger",
        subcommands = {
                AgentLedgerCommand.InitCommand.class,
                AgentLedgerCommand.RunCommand.class,
                AgentLedgerCommand.StatusCommand.class,
                AgentLedgerCommand.RosterCommand.class,
                AgentLedgerCommand.AuditTailCommand.class,
                AgentLedgerCommand.AuditVerifyCommand.class
        }
)
public final class AgentLedgerCommand implements Runnable {
    static final int EXIT_COMPLETED = 0;
    static final int EXIT_NOT_COMPLETED = 1;
    static final int EXIT_FATAL = 2;

    @Option(names = {"--root"}, description = "Workspace root directory", defaultValue = CoordinatorConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | status | roster | audit-tail | audit-verify");
    }

    CoordinatorConfig config() {
        return CoordinatorConfig.fromRoot(root);
    }

    Manager manager() {
        return new Manager(config());
    }

    @Command(name = "init", description = "Create the workspace layout, registry schema, ledger and default roster")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentLedgerCommand parent;

        @Override
        public Integer call() throws Exception {
            CoordinatorConfig config = parent.config();
            Files.createDirectories(config.docsDir());
            Path rosterFile = config.rosterFile();
            boolean rosterWritten = false;
            if (!Files.exists(rosterFile)) {
                rosterFile = config.docsDir().resolve(CoordinatorConfig.ROSTER_JSON);
                RosterLoader.writeJson(rosterFile, Manager.defaultRoster());
                rosterWritten = true;
            }
            parent.manager().init();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", config.rootDir().toString());
            out.put("roster", rosterFile.toString());
            out.put("roster_written", rosterWritten);
            out.put("ledger", config.ledgerFile().toString());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "run", description = "Start the agents, submit one task and wait for its outcome")
    static final class RunCommand implements Callable<Integer> {
        private static final long POLL_INTERVAL_MS = 50L;

        @ParentCommand
        AgentLedgerCommand parent;

        @Option(names = {"--task"}, required = true, description = "Task payload text")
        String task;

        @Option(names = {"--wait-ms"}, defaultValue = "5000", description = "Max time to wait for a terminal state")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            Manager manager = parent.manager();
            try {
                manager.start();
                String taskId = manager.submitTask(task);
                long deadline = System.currentTimeMillis() + Math.max(0L, waitMs);
                Optional<TaskView> view = manager.task(taskId);
                while (view.isPresent() && !view.get().status().isTerminal() && System.currentTimeMillis() < deadline) {
                    manager.runMaintenance();
                    Thread.sleep(POLL_INTERVAL_MS);
                    view = manager.task(taskId);
                }

                Map<String, Object> out = new LinkedHashMap<>();
                out.put("task_id", taskId);
                out.put("status", view.map(v -> v.status().name()).orElse("UNKNOWN"));
                out.put("owner_agent", view.map(TaskView::ownerAgent).orElse(null));
                out.put("last_error", view.map(TaskView::lastError).orElse(null));
                out.put("snapshot", manager.getStatus());
                out.put("ledger", manager.ledgerTaskIds());
                System.out.println(Jsons.toJson(out));
                return view.isPresent() && view.get().status() == TaskStatus.COMPLETED ? EXIT_COMPLETED : EXIT_NOT_COMPLETED;
            } catch (DuplicateTaskIdentifierException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.describe())));
                return EXIT_FATAL;
            } finally {
                manager.stop();
            }
        }
    }

    @Command(name = "status", description = "Show the task status snapshot and the ledger contents")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        AgentLedgerCommand parent;

        @Override
        public Integer call() {
            Manager manager = parent.manager();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("tasks", manager.getStatus());
            out.put("ledger", manager.ledgerTaskIds());
            out.put("settings", manager.settings().toMap());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "roster", description = "Show the capability roster used for routing")
    static final class RosterCommand implements Callable<Integer> {
        @ParentCommand
        AgentLedgerCommand parent;

        @Override
        public Integer call() {
            Manager manager = parent.manager();
            Roster roster = manager.roster();
            List<Map<String, Object>> agents = new ArrayList<>();
            for (RosterEntry entry : roster.entries()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("agent_id", entry.agentId());
                row.put("capabilities", entry.capabilities());
                row.put("scripted", entry.scripted());
                row.put("implemented", entry.scripted() || manager.agentRegistry().findById(entry.agentId()).isPresent());
                agents.add(row);
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("roster", parent.config().rosterFile().toString());
            out.put("match_policy", roster.matchPolicy().name());
            out.put("catalog", roster.catalog());
            out.put("agents", agents);
            out.put("registered_agents", manager.agentRegistry().listAgentIds());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the most recent audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        AgentLedgerCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.manager().auditLogger().tail(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentLedgerCommand parent;

        @Override
        public Integer call() {
            boolean valid = parent.manager().auditLogger().verify();
            System.out.println(Jsons.toJson(Map.of("valid", valid)));
            return valid ? 0 : 1;
        }
    }
}
