package io.agentledger.model;

public enum TaskStatus {
    SUBMITTED,
    DELEGATED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case SUBMITTED -> next == DELEGATED || next == FAILED;
            case DELEGATED -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
