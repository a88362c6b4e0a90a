package io.agentledger.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class CoordinatorConfig {
    public static final String DEFAULT_ROOT = "workspace";
    public static final String LEDGER_FILE_NAME = "active_spec.md";
    public static final String ARTIFACT_SUFFIX = "_spec.md";
    public static final String ROSTER_JSON = "agent_roster.json";
    public static final String ROSTER_MARKDOWN = "agent_roster.md";
    public static final String SETTINGS_FILE = "agentledger-settings.json";

    private final Path rootDir;

    public CoordinatorConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static CoordinatorConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new CoordinatorConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path logsDir() {
        return rootDir.resolve("logs");
    }

    public Path docsDir() {
        return rootDir.resolve("docs");
    }

    public Path stateDir() {
        return rootDir.resolve("state");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path dbFile() {
        return stateDir().resolve("registry.db");
    }

    public Path ledgerFile() {
        return logsDir().resolve(LEDGER_FILE_NAME);
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    /**
     * JSON roster when present, otherwise the Markdown roster path (which may not exist either).
     */
    public Path rosterFile() {
        Path json = docsDir().resolve(ROSTER_JSON);
        if (Files.exists(json)) {
            return json;
        }
        return docsDir().resolve(ROSTER_MARKDOWN);
    }

    public Path artifactPath(String agentId, String taskId) {
        return logsDir().resolve(agentId + "_" + taskId + ARTIFACT_SUFFIX);
    }
}
