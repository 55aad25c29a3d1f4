package com.agentscheduler.core.agent;

/**
 * An agent that can be run to completion by a scheduler backend.
 * 
 * Implementations may throw {@link AgentExecutionException} (or any runtime
 * exception); the durable backend retries such failures unless they are
 * declared non-retryable.
 */
@FunctionalInterface
public interface AgentExecutor {

    /**
     * Run the agent once.
     * 
     * @param input task input, with human input and checkpoint when resuming
     * @param listener phase hook for progress reporting
     * @return completed, suspended or failed outcome
     */
    AgentOutcome run(AgentInput input, AgentExecutionListener listener);
}
