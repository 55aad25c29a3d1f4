package com.agentscheduler.temporal.client;

import com.agentscheduler.core.agent.AgentInput;
import com.agentscheduler.core.exception.SchedulerBackendException;
import com.agentscheduler.core.model.AgentTaskResult;
import com.agentscheduler.core.model.ProgressPayload;
import com.agentscheduler.core.model.ProgressState;
import com.agentscheduler.core.model.Task;
import com.agentscheduler.core.model.TaskEvent;
import com.agentscheduler.core.model.TaskProgress;
import com.agentscheduler.core.model.WorkflowHandle;
import com.agentscheduler.engine.eventbus.TaskEventBus;
import com.agentscheduler.engine.logging.LoggingContext;
import com.agentscheduler.engine.scheduler.TaskScheduler;
import com.agentscheduler.temporal.workflow.AgentWorkflow;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.api.enums.v1.WorkflowIdReusePolicy;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowExecutionAlreadyStarted;
import io.temporal.client.WorkflowNotFoundException;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Durable backend: each task runs as a Temporal workflow on a worker.
 *
 * <p>The workflow id is derived from the task id, so a repeated submission of a
 * running task returns the existing execution instead of starting a second one.
 * A watcher per started run publishes the workflow result on the event bus.
 * Started runs are remembered by workflow id so a progress call without a
 * run id addresses the run this process started last.</p>
 */
public class TemporalTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TemporalTaskScheduler.class);

    public static final String BACKEND = "temporal";

    private final WorkflowClient client;
    private final String taskQueue;
    private final String workflowIdPrefix;
    private final TaskEventBus eventBus;
    private final HeartbeatInspector heartbeatInspector;
    private final Executor executor;
    private final Map<String, WorkflowHandle> handles = new ConcurrentHashMap<>();

    public TemporalTaskScheduler(
            WorkflowClient client,
            String taskQueue,
            String workflowIdPrefix,
            TaskEventBus eventBus,
            Executor executor) {
        this.client = client;
        this.taskQueue = taskQueue;
        this.workflowIdPrefix = workflowIdPrefix;
        this.eventBus = eventBus;
        this.heartbeatInspector = new HeartbeatInspector(client);
        this.executor = executor;
    }

    @Override
    public CompletableFuture<WorkflowHandle> startTask(Task task) {
        return CompletableFuture.supplyAsync(() -> start(task), executor);
    }

    private WorkflowHandle start(Task task) {
        String workflowId = workflowIdFor(task.taskId());
        WorkflowOptions options = WorkflowOptions.newBuilder()
            .setWorkflowId(workflowId)
            .setTaskQueue(taskQueue)
            // a resume starts a new run under the id of the finished blocked run
            .setWorkflowIdReusePolicy(task.hasResume()
                ? WorkflowIdReusePolicy.WORKFLOW_ID_REUSE_POLICY_ALLOW_DUPLICATE
                : WorkflowIdReusePolicy.WORKFLOW_ID_REUSE_POLICY_REJECT_DUPLICATE)
            .build();

        try (LoggingContext ctx = LoggingContext.forTask(task.taskId())) {
            AgentWorkflow workflow = client.newWorkflowStub(AgentWorkflow.class, options);
            WorkflowExecution execution;
            try {
                execution = WorkflowClient.start(workflow::run, AgentInput.from(task));
                log.info("Started workflow {} run {} for task {}",
                    execution.getWorkflowId(), execution.getRunId(), task.taskId());
            } catch (WorkflowExecutionAlreadyStarted e) {
                execution = e.getExecution();
                log.info("Workflow {} already started for task {}, reusing run {}",
                    workflowId, task.taskId(), execution.getRunId());
            } catch (RuntimeException e) {
                throw new SchedulerBackendException("Failed to start workflow " + workflowId, e);
            }
            watch(task.taskId(), execution);
            WorkflowHandle handle = new WorkflowHandle(execution.getWorkflowId(), execution.getRunId());
            handles.put(workflowId, handle);
            return handle;
        }
    }

    private void watch(String taskId, WorkflowExecution execution) {
        WorkflowStub stub = client.newUntypedWorkflowStub(execution, Optional.empty());
        stub.getResultAsync(AgentTaskResult.class).whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
                log.warn("Workflow {} for task {} ended without a result: {}",
                    execution.getWorkflowId(), taskId, cause.getMessage());
                eventBus.publish(TaskEvent.failed(taskId, AgentTaskResult.summarize("Workflow failed:", cause)));
            } else {
                log.info("Workflow {} for task {} returned {}", execution.getWorkflowId(), taskId, result.status());
                eventBus.publish(result.toEvent(taskId));
            }
        });
    }

    @Override
    public CompletableFuture<TaskProgress> getProgress(String workflowId, String runId, String queryName) {
        return CompletableFuture.supplyAsync(() -> queryProgress(workflowId, runId, queryName), executor);
    }

    /**
     * The latest run started by this process for the workflow id.
     */
    public Optional<WorkflowHandle> handleFor(String workflowId) {
        return Optional.ofNullable(handles.get(workflowId));
    }

    private TaskProgress queryProgress(String workflowId, String requestedRunId, String queryName) {
        String runId = requestedRunId != null
            ? requestedRunId
            : handleFor(workflowId).map(WorkflowHandle::runId).orElse(null);
        WorkflowStub stub = client.newUntypedWorkflowStub(workflowId, Optional.ofNullable(runId), Optional.empty());
        TaskProgress progress;
        try {
            progress = stub.query(queryName, TaskProgress.class);
        } catch (WorkflowNotFoundException e) {
            return TaskProgress.unknown("workflow not found");
        } catch (RuntimeException e) {
            throw new SchedulerBackendException("Progress query failed for workflow " + workflowId, e);
        }
        if (progress == null) {
            return TaskProgress.unknown();
        }
        // the workflow only knows the activity started; its heartbeat is fresher
        if (progress.state() == ProgressState.RUNNING) {
            return heartbeatInspector.latest(workflowId, runId)
                .map(ProgressPayload::toProgress)
                .orElse(progress);
        }
        return progress;
    }

    @Override
    public CompletableFuture<Boolean> cancel(String workflowId) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                client.newUntypedWorkflowStub(workflowId, Optional.empty(), Optional.empty()).cancel();
                log.info("Requested cancellation of workflow {}", workflowId);
                return true;
            } catch (WorkflowNotFoundException e) {
                log.info("Workflow {} not found or already closed, nothing to cancel", workflowId);
                return false;
            } catch (RuntimeException e) {
                throw new SchedulerBackendException("Failed to cancel workflow " + workflowId, e);
            }
        }, executor);
    }

    @Override
    public String workflowIdFor(String taskId) {
        return workflowIdPrefix + "-" + taskId;
    }

    @Override
    public String backend() {
        return BACKEND;
    }
}
