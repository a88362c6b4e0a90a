package io.agentledger.agent;

import io.agentledger.bus.EventBus;
import io.agentledger.bus.MessageHandler;
import io.agentledger.model.AgentStatus;
import io.agentledger.model.AgentView;
import io.agentledger.model.MessageType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Binds one agent identity's handler table to the bus. Starting a running runtime or stopping
 * a stopped one does nothing.
 */
public final class AgentRuntime {
    private final String agentId;
    private final Set<String> capabilities;
    private final Map<MessageType, MessageHandler> handlers;
    private final EventBus bus;
    private volatile AgentStatus status = AgentStatus.STOPPED;

    private AgentRuntime(String agentId, Set<String> capabilities, Map<MessageType, MessageHandler> handlers, EventBus bus) {
        this.agentId = agentId;
        this.capabilities = capabilities;
        this.handlers = handlers;
        this.bus = bus;
    }

    public static Builder builder(String agentId, EventBus bus) {
        return new Builder(agentId, bus);
    }

    public String agentId() {
        return agentId;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    public AgentStatus status() {
        return status;
    }

    public AgentView view() {
        return AgentView.of(agentId, capabilities, status);
    }

    public synchronized boolean start() {
        if (status == AgentStatus.RUNNING) {
            return false;
        }
        status = AgentStatus.STARTING;
        handlers.forEach((type, handler) -> bus.subscribe(agentId, type, handler));
        status = AgentStatus.RUNNING;
        return true;
    }

    public synchronized boolean stop() {
        if (status == AgentStatus.STOPPED) {
            return false;
        }
        status = AgentStatus.STOPPING;
        bus.unsubscribeAll(agentId);
        status = AgentStatus.STOPPED;
        return true;
    }

    public static final class Builder {
        private final String agentId;
        private final EventBus bus;
        private final Set<String> capabilities = new TreeSet<>();
        private final Map<MessageType, MessageHandler> handlers = new LinkedHashMap<>();

        private Builder(String agentId, EventBus bus) {
            if (agentId == null || agentId.isBlank()) {
                throw new IllegalArgumentException("agent id cannot be empty");
            }
            this.agentId = agentId;
            this.bus = bus;
        }

        public Builder capabilities(Collection<String> tags) {
            capabilities.addAll(tags);
            return this;
        }

        public Builder on(MessageType type, MessageHandler handler) {
            if (handlers.putIfAbsent(type, handler) != null) {
                throw new IllegalArgumentException(agentId + " already handles " + type);
            }
            return this;
        }

        public AgentRuntime build() {
            return new AgentRuntime(
                    agentId,
                    Collections.unmodifiableSet(new TreeSet<>(capabilities)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(handlers)),
                    bus
            );
        }
    }
}
