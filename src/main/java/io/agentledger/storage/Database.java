package io.agentledger.storage;

import io.agentledger.config.CoordinatorConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final CoordinatorConfig config;
    private final String jdbcUrl;

    public Database(CoordinatorConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.stateDir());
            Files.createDirectories(config.logsDir());
            Files.createDirectories(config.docsDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        seq INTEGER PRIMARY KEY,
                        task_id TEXT NOT NULL UNIQUE,
                        payload TEXT NOT NULL,
                        status TEXT NOT NULL,
                        owner_agent TEXT,
                        last_error TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_transitions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id TEXT NOT NULL,
                        from_status TEXT,
                        to_status TEXT NOT NULL,
                        agent_id TEXT,
                        detail TEXT,
                        at_ms INTEGER NOT NULL,
                        FOREIGN KEY(task_id) REFERENCES tasks(task_id)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_transitions_task ON task_transitions(task_id, id)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                String mode = rs.next() ? rs.getString(1) : "";
                if (!"wal".equalsIgnoreCase(mode)) {
                    throw new IllegalStateException("SQLite journal_mode is not WAL: " + mode);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }
}
