package io.agentledger.error;

/**
 * The task sequence produced an identifier that already exists. The registry is corrupt;
 * callers must not retry.
 */
public final class DuplicateTaskIdentifierException extends CoordinationException {
    public static final String CODE = "duplicate_task_identifier";

    public DuplicateTaskIdentifierException(String taskId, Throwable cause) {
        super(CODE, "task identifier already allocated: " + taskId, cause);
    }
}
