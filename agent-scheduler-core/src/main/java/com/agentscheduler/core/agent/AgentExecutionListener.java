package com.agentscheduler.core.agent;

/**
 * Phase hook invoked by an agent while it runs.
 * Implementations must be cheap and must not fail the agent.
 */
public interface AgentExecutionListener {

    void onStepStarted(String step);

    void onToolStarted(String tool);

    /**
     * Listener that ignores every phase.
     */
    AgentExecutionListener NOOP = new AgentExecutionListener() {
        @Override
        public void onStepStarted(String step) {
        }

        @Override
        public void onToolStarted(String tool) {
        }
    };
}
