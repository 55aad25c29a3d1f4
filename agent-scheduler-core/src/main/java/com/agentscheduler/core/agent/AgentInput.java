package com.agentscheduler.core.agent;

import com.agentscheduler.core.model.Checkpoint;
import com.agentscheduler.core.model.Task;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * What an agent receives for one run.
 * Also the durable workflow argument, so it must stay serializable.
 * 
 * @param humanInput present when resuming after an interrupt
 * @param checkpoint present when resuming after an interrupt
 */
public record AgentInput(
    String taskId,
    String targetAgent,
    String callerActor,
    JsonNode payload,
    JsonNode context,
    JsonNode humanInput,
    Checkpoint checkpoint
) {
    public static AgentInput from(Task task) {
        Task.ResumeDirective resume = task.resume();
        return new AgentInput(
            task.taskId(),
            task.targetAgent(),
            task.callerActor(),
            task.payload(),
            task.context(),
            resume != null ? resume.humanInput() : null,
            resume != null ? resume.checkpoint() : null
        );
    }

    /**
     * Check if this run re-enters a previously interrupted agent.
     */
    public boolean resuming() {
        return checkpoint != null;
    }
}
