package com.agentscheduler.core.agent;

/**
 * An {@link AgentExecutor} that knows the name it is registered under.
 * Lets a container collect agents into an {@link AgentRegistry}.
 */
public interface NamedAgent extends AgentExecutor {

    String name();
}
