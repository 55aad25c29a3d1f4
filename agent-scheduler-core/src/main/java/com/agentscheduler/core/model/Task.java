package com.agentscheduler.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One request to run an agent to completion. Immutable once submitted.
 * 
 * @param taskId unique per submission
 * @param targetAgent name of the agent to run
 * @param payload agent input (question, parameters)
 * @param context caller-supplied context references
 * @param callerActor who submitted the task, may be null
 * @param resume present only when re-entering a blocked task
 */
public record Task(
    String taskId,
    String targetAgent,
    JsonNode payload,
    JsonNode context,
    String callerActor,
    ResumeDirective resume
) {
    public static Task create(String taskId, String targetAgent, JsonNode payload, JsonNode context, String callerActor) {
        return new Task(taskId, targetAgent, payload, context, callerActor, null);
    }

    public boolean hasResume() {
        return resume != null;
    }

    public Task withResume(ResumeDirective directive) {
        return new Task(taskId, targetAgent, payload, context, callerActor, directive);
    }

    /**
     * Human response plus the checkpoint it resumes from.
     */
    public record ResumeDirective(
        String exchangeId,
        JsonNode humanInput,
        Checkpoint checkpoint
    ) {}
}
