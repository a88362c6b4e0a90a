package io.agentledger.model;

public enum MessageType {
    NEW_TASK,
    DELEGATED_TASK,
    TASK_COMPLETE,
    TASK_FAILED;

    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Message type cannot be empty");
        }
        for (MessageType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}
