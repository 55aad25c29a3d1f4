package com.agentscheduler.core.interrupt;

/**
 * Strategy invoked when an agent pauses for human input.
 * The live strategy streams a notification to the caller; the durable
 * strategy reports through the workflow engine.
 */
public interface InterruptHandler {

    /**
     * Persist the checkpoint (best-effort) and notify the caller.
     * 
     * @throws com.agentscheduler.core.exception.InterruptContractException if the checkpoint is missing
     */
    void onInterrupt(InterruptContext context);
}
