package com.agentscheduler.core.agent;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of agents addressable by name.
 */
public class AgentRegistry {

    private final Map<String, AgentExecutor> executors = new ConcurrentHashMap<>();

    public AgentRegistry() {
    }

    public AgentRegistry(Map<String, AgentExecutor> executors) {
        this.executors.putAll(executors);
    }

    /**
     * Register an agent, replacing any agent with the same name.
     */
    public AgentRegistry register(String name, AgentExecutor executor) {
        executors.put(name, executor);
        return this;
    }

    public Optional<AgentExecutor> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(executors.get(name));
    }

    public boolean isKnown(String name) {
        return name != null && executors.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(executors.keySet());
    }
}
