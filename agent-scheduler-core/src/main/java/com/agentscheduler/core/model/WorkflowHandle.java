package com.agentscheduler.core.model;

/**
 * Opaque correlation returned by a backend for one submission.
 * 
 * @param workflowId backend-assigned, globally unique
 * @param runId disambiguates re-executions of the same workflow id; null for the in-process backend
 */
public record WorkflowHandle(String workflowId, String runId) {

    public static WorkflowHandle of(String workflowId) {
        return new WorkflowHandle(workflowId, null);
    }
}
