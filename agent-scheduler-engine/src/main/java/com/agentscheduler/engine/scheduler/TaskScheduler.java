package com.agentscheduler.engine.scheduler;

import com.agentscheduler.core.model.Task;
import com.agentscheduler.core.model.TaskProgress;
import com.agentscheduler.core.model.WorkflowHandle;

import java.util.concurrent.CompletableFuture;

/**
 * Submits agent tasks to an execution backend and queries their progress.
 * 
 * One instance is chosen by configuration at startup and injected where needed.
 * Terminal and blocked outcomes are published on the {@code TaskEventBus}.
 */
public interface TaskScheduler {

    String DEFAULT_PROGRESS_QUERY = "progress";

    /**
     * Submit a task. Completes on acceptance, not on task completion.
     */
    CompletableFuture<WorkflowHandle> startTask(Task task);

    /**
     * Read the latest known progress of a workflow. Never fails for an unknown id:
     * an unknown progress snapshot is returned instead.
     * 
     * @param runId may be null to address the latest run
     */
    CompletableFuture<TaskProgress> getProgress(String workflowId, String runId, String queryName);

    default CompletableFuture<TaskProgress> getProgress(String workflowId, String runId) {
        return getProgress(workflowId, runId, DEFAULT_PROGRESS_QUERY);
    }

    /**
     * Request cancellation of a workflow.
     * 
     * @return true if the backend knew the workflow and accepted the request
     */
    CompletableFuture<Boolean> cancel(String workflowId);

    /**
     * The workflow id this backend assigns to the task.
     */
    String workflowIdFor(String taskId);

    /**
     * Backend name for logs and metrics.
     */
    String backend();
}
