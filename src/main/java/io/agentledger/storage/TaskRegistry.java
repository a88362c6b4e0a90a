package io.agentledger.storage;

import io.agentledger.error.DuplicateTaskIdentifierException;
import io.agentledger.model.TaskStatus;
import io.agentledger.model.TaskView;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task lifecycle records. {@code tasks} holds the current state of each task,
 * {@code task_transitions} is the append-only history every state change goes through.
 */
public final class TaskRegistry {
    public static final String TASK_ID_PREFIX = "TASK-";
    private static final int SQLITE_CONSTRAINT = 19;

    private final Database database;

    public TaskRegistry(Database database) {
        this.database = database;
    }

    public static String formatTaskId(long seq) {
        return TASK_ID_PREFIX + String.format("%06d", seq);
    }

    /**
     * Allocates the next identifier and records the task in one {@code BEGIN IMMEDIATE}
     * transaction, so registries in other processes sharing the database never hand out the
     * same id.
     */
    public synchronized TaskView create(String payload, long nowMs) {
        String safePayload = payload == null ? "" : payload;
        String taskId = null;
        try (Connection c = database.openConnection(); Statement tx = c.createStatement()) {
            tx.execute("BEGIN IMMEDIATE");
            try {
                long seq = readMaxSequence(c) + 1L;
                taskId = formatTaskId(seq);
                try (PreparedStatement t = c.prepareStatement(
                        "INSERT INTO tasks(seq,task_id,payload,status,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?)")) {
                    t.setLong(1, seq);
                    t.setString(2, taskId);
                    t.setString(3, safePayload);
                    t.setString(4, TaskStatus.SUBMITTED.name());
                    t.setLong(5, nowMs);
                    t.setLong(6, nowMs);
                    t.executeUpdate();
                }
                recordTransition(c, taskId, null, TaskStatus.SUBMITTED, null, null, nowMs);
                tx.execute("COMMIT");
            } catch (SQLException e) {
                try {
                    tx.execute("ROLLBACK");
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                if (taskId != null && isConstraintViolation(e)) {
                    throw new DuplicateTaskIdentifierException(taskId, e);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create task", e);
        }
        return new TaskView(taskId, safePayload, TaskStatus.SUBMITTED, null, null, nowMs, nowMs);
    }

    public boolean tryDelegate(String taskId, String agentId, long nowMs) {
        return tryTransition(taskId, TaskStatus.SUBMITTED, TaskStatus.DELEGATED, agentId, null, nowMs);
    }

    public boolean tryComplete(String taskId, long nowMs) {
        return tryTransition(taskId, TaskStatus.DELEGATED, TaskStatus.COMPLETED, null, null, nowMs);
    }

    /**
     * Fails a task that is still {@code SUBMITTED} or {@code DELEGATED}.
     */
    public boolean tryFail(String taskId, String error, long nowMs) {
        Optional<TaskView> current = get(taskId);
        if (current.isEmpty() || current.get().status().isTerminal()) {
            return false;
        }
        return tryTransition(taskId, current.get().status(), TaskStatus.FAILED, null, error, nowMs);
    }

    public Optional<TaskView> get(String taskId) {
        String sql = "SELECT task_id,payload,status,owner_agent,last_error,created_at_ms,updated_at_ms FROM tasks WHERE task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readTask(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task", e);
        }
    }

    public List<TaskView> listByStatus(TaskStatus status) {
        String sql = "SELECT task_id,payload,status,owner_agent,last_error,created_at_ms,updated_at_ms FROM tasks WHERE status=? ORDER BY seq";
        List<TaskView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readTask(rs));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
        return out;
    }

    public Map<String, TaskStatus> snapshot() {
        Map<String, TaskStatus> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT task_id,status FROM tasks ORDER BY seq")) {
            while (rs.next()) {
                out.put(rs.getString("task_id"), TaskStatus.valueOf(rs.getString("status")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to snapshot tasks", e);
        }
        return out;
    }

    public List<Transition> history(String taskId) {
        String sql = "SELECT from_status,to_status,agent_id,detail,at_ms FROM task_transitions WHERE task_id=? ORDER BY id";
        List<Transition> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String from = rs.getString("from_status");
                    out.add(new Transition(
                            taskId,
                            from == null ? null : TaskStatus.valueOf(from),
                            TaskStatus.valueOf(rs.getString("to_status")),
                            rs.getString("agent_id"),
                            rs.getString("detail"),
                            rs.getLong("at_ms")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task history", e);
        }
        return out;
    }

    public long maxSequence() {
        try (Connection c = database.openConnection()) {
            return readMaxSequence(c);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task sequence", e);
        }
    }

    private static long readMaxSequence(Connection c) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(seq),0) AS max_seq FROM tasks")) {
            return rs.next() ? rs.getLong("max_seq") : 0L;
        }
    }

    private boolean tryTransition(String taskId, TaskStatus from, TaskStatus to, String agentId, String error, long nowMs) {
        if (!from.canTransitionTo(to)) {
            return false;
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE tasks SET status=?,owner_agent=COALESCE(?,owner_agent),last_error=?,updated_at_ms=? WHERE task_id=? AND status=?")) {
                ps.setString(1, to.name());
                ps.setString(2, agentId);
                ps.setString(3, error);
                ps.setLong(4, nowMs);
                ps.setString(5, taskId);
                ps.setString(6, from.name());
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                recordTransition(c, taskId, from, to, agentId, error, nowMs);
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to transition task " + taskId + " to " + to, e);
        }
    }

    private static void recordTransition(Connection c, String taskId, TaskStatus from, TaskStatus to,
                                         String agentId, String detail, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO task_transitions(task_id,from_status,to_status,agent_id,detail,at_ms) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, taskId);
            ps.setString(2, from == null ? null : from.name());
            ps.setString(3, to.name());
            ps.setString(4, agentId);
            ps.setString(5, detail);
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        }
    }

    private static TaskView readTask(ResultSet rs) throws SQLException {
        return new TaskView(
                rs.getString("task_id"),
                rs.getString("payload"),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getString("owner_agent"),
                rs.getString("last_error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static boolean isConstraintViolation(SQLException e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        return e.getErrorCode() == SQLITE_CONSTRAINT
                || message.contains("SQLITE_CONSTRAINT")
                || message.contains("UNIQUE constraint failed");
    }

    public record Transition(
            String taskId,
            TaskStatus from,
            TaskStatus to,
            String agentId,
            String detail,
            long atMs
    ) {
    }
}
