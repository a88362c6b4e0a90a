package io.agentledger.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentledger.util.Jsons;

/**
 * Immutable bus envelope.
 *
 * <p>{@code toAgent} addresses a single identity; {@code null} reaches every subscriber of the type.
 * The wire form produced by {@link #toWire()} only carries the fields that belong to the type.
 */
public record Message(
        MessageType type,
        String taskId,
        String fromAgent,
        String toAgent,
        String payload,
        String reason
) {
    public Message {
        if (type == null) {
            throw new IllegalArgumentException("message type is required");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("message task_id is required: " + type);
        }
    }

    public static Message newTask(String taskId, String payload, String fromAgent, String toAgent) {
        return new Message(MessageType.NEW_TASK, taskId, fromAgent, toAgent, nullToEmpty(payload), null);
    }

    public static Message delegated(String taskId, String payload, String fromAgent, String toAgent) {
        return new Message(MessageType.DELEGATED_TASK, taskId, fromAgent, toAgent, nullToEmpty(payload), null);
    }

    public static Message taskComplete(String agentId, String taskId, String toAgent) {
        return new Message(MessageType.TASK_COMPLETE, taskId, agentId, toAgent, null, null);
    }

    public static Message taskFailed(String agentId, String taskId, String reason, String toAgent) {
        return new Message(MessageType.TASK_FAILED, taskId, agentId, toAgent, null,
                reason == null || reason.isBlank() ? "unspecified failure" : reason);
    }

    public ObjectNode toWire() {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("type", type.name());
        switch (type) {
            case NEW_TASK, DELEGATED_TASK -> {
                node.put("task_id", taskId);
                node.put("payload", payload);
            }
            case TASK_COMPLETE -> {
                node.put("agent_id", fromAgent);
                node.put("task_id", taskId);
            }
            case TASK_FAILED -> {
                node.put("agent_id", fromAgent);
                node.put("task_id", taskId);
                node.put("reason", reason);
            }
        }
        return node;
    }

    public static Message fromWire(JsonNode node, String fromAgent, String toAgent) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("message must be a JSON object");
        }
        MessageType type = MessageType.fromString(node.path("type").asText(null));
        String taskId = node.path("task_id").asText(null);
        return switch (type) {
            case NEW_TASK -> newTask(taskId, node.path("payload").asText(""), fromAgent, toAgent);
            case DELEGATED_TASK -> delegated(taskId, node.path("payload").asText(""), fromAgent, toAgent);
            case TASK_COMPLETE -> taskComplete(node.path("agent_id").asText(fromAgent), taskId, toAgent);
            case TASK_FAILED -> taskFailed(node.path("agent_id").asText(fromAgent), taskId,
                    node.path("reason").asText(null), toAgent);
        };
    }

    private static String nullToEmpty(String raw) {
        return raw == null ? "" : raw;
    }
}
