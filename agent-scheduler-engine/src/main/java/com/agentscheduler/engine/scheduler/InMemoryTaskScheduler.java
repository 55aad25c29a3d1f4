package com.agentscheduler.engine.scheduler;

import com.agentscheduler.core.agent.AgentInput;
import com.agentscheduler.core.model.AgentTaskResult;
import com.agentscheduler.core.model.Task;
import com.agentscheduler.core.model.TaskProgress;
import com.agentscheduler.core.model.WorkflowHandle;
import com.agentscheduler.core.repository.CheckpointRepository;
import com.agentscheduler.engine.eventbus.TaskEventBus;
import com.agentscheduler.engine.interrupt.EventBusNotificationTransport;
import com.agentscheduler.engine.interrupt.StreamingInterruptHandler;
import com.agentscheduler.engine.logging.LoggingContext;
import com.agentscheduler.engine.runner.AgentTaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Development backend: runs the agent to its first stop (completion, failure
 * or interrupt) before {@link #startTask} completes.
 * 
 * Progress is a pure lookup in a local map keyed by workflow id, so it is lost on
 * restart. Starting the same task twice runs it twice.
 */
public class InMemoryTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskScheduler.class);

    public static final String BACKEND = "in-memory";
    public static final String WORKFLOW_ID_PREFIX = "in-memory-";

    private final AgentTaskRunner runner;
    private final TaskEventBus eventBus;
    private final StreamingInterruptHandler interruptHandler;
    private final Executor executor;
    private final Map<String, TaskProgress> progressByWorkflow = new ConcurrentHashMap<>();

    public InMemoryTaskScheduler(
            AgentTaskRunner runner,
            TaskEventBus eventBus,
            CheckpointRepository checkpointRepository,
            Executor executor) {
        this.runner = runner;
        this.eventBus = eventBus;
        this.interruptHandler = new StreamingInterruptHandler(
            checkpointRepository, new EventBusNotificationTransport(eventBus));
        this.executor = executor;
    }

    @Override
    public CompletableFuture<WorkflowHandle> startTask(Task task) {
        return CompletableFuture.supplyAsync(() -> runInline(task), executor);
    }

    private WorkflowHandle runInline(Task task) {
        String workflowId = workflowIdFor(task.taskId());
        progressByWorkflow.put(workflowId, TaskProgress.running(0, "accepted"));

        AgentTaskResult result;
        try (LoggingContext ctx = LoggingContext.forTask(task.taskId(), workflowId, null)) {
            EventBusProgressListener listener = new EventBusProgressListener(
                eventBus, task.taskId(), progress -> progressByWorkflow.put(workflowId, progress));
            try {
                result = runner.run(AgentInput.from(task), listener, interruptHandler);
            } catch (RuntimeException e) {
                log.error("Agent {} failed for task {}", task.targetAgent(), task.taskId(), e);
                result = AgentTaskResult.failed(AgentTaskResult.summarize("Agent failed:", e));
            }
            log.info("In-memory run finished for task {} with status {}", task.taskId(), result.status());
        }

        progressByWorkflow.put(workflowId, result.toProgress());
        // Blocked runs were already announced by the interrupt handler
        if (result.status() != AgentTaskResult.ResultStatus.BLOCKED) {
            eventBus.publish(result.toEvent(task.taskId()));
        }
        return WorkflowHandle.of(workflowId);
    }

    @Override
    public CompletableFuture<TaskProgress> getProgress(String workflowId, String runId, String queryName) {
        TaskProgress progress = progressByWorkflow.get(workflowId);
        return CompletableFuture.completedFuture(progress != null ? progress : TaskProgress.unknown());
    }

    /**
     * Inline runs cannot be interrupted; cancellation only drops the bookkeeping.
     */
    @Override
    public CompletableFuture<Boolean> cancel(String workflowId) {
        return CompletableFuture.completedFuture(progressByWorkflow.remove(workflowId) != null);
    }

    @Override
    public String workflowIdFor(String taskId) {
        return WORKFLOW_ID_PREFIX + taskId;
    }

    @Override
    public String backend() {
        return BACKEND;
    }
}
