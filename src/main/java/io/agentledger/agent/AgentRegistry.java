package io.agentledger.agent;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class AgentRegistry {
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    public static AgentRegistry withDefaults() {
        AgentRegistry registry = new AgentRegistry();
        registry.register(new ProbeAgent());
        registry.register(new FailAgent());
        return registry;
    }

    public void register(Agent agent) {
        agents.put(agent.id(), agent);
    }

    public Optional<Agent> findById(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Collection<String> listAgentIds() {
        return new TreeSet<>(agents.keySet());
    }
}
