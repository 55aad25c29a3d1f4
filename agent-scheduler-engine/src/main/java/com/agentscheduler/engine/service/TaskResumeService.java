package com.agentscheduler.engine.service;

import com.agentscheduler.core.exception.InvalidStateTransitionException;
import com.agentscheduler.core.exception.SchedulerException;
import com.agentscheduler.core.exception.TaskNotFoundException;
import com.agentscheduler.core.exception.TaskValidationException;
import com.agentscheduler.core.model.Checkpoint;
import com.agentscheduler.core.model.Task;
import com.agentscheduler.core.model.TaskRecord;
import com.agentscheduler.core.model.WorkflowHandle;
import com.agentscheduler.core.repository.CheckpointRepository;
import com.agentscheduler.engine.logging.LoggingContext;
import com.agentscheduler.engine.metrics.SchedulerMetrics;
import com.agentscheduler.engine.scheduler.TaskScheduler;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resume entry point for tasks blocked on human input.
 * 
 * The task is re-submitted with the human response and the checkpoint saved
 * when it blocked; the agent continues from that checkpoint.
 */
public class TaskResumeService {

    private static final Logger log = LoggerFactory.getLogger(TaskResumeService.class);

    private final TaskLifecycleService lifecycleService;
    private final CheckpointRepository checkpointRepository;
    private final TaskScheduler scheduler;
    private final SchedulerMetrics metrics;

    public TaskResumeService(
            TaskLifecycleService lifecycleService,
            CheckpointRepository checkpointRepository,
            TaskScheduler scheduler,
            SchedulerMetrics metrics) {
        this.lifecycleService = lifecycleService;
        this.checkpointRepository = checkpointRepository;
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    /**
     * Resume a blocked task with the user's response.
     * 
     * @param exchangeId the exchange the response answers
     * @param userResponse the human input handed to the agent
     * @return the record after the backend accepted the resumed run
     * @throws InvalidStateTransitionException if the task is not BLOCKED
     * @throws TaskNotFoundException if the task or its checkpoint does not exist
     * @throws TaskValidationException if the exchange is not the one the task waits on
     */
    public TaskRecord resume(String userId, String taskId, String exchangeId, JsonNode userResponse) {
        TaskRecord record = lifecycleService.get(userId, taskId);
        try (LoggingContext ctx = LoggingContext.forTask(taskId, record.workflowId(), record.runId())) {
            // Fail fast on the snapshot before touching the checkpoint store
            record.markResumed(exchangeId);

            // Session ids are task ids
            Checkpoint checkpoint = checkpointRepository.load(taskId, exchangeId)
                .orElseThrow(() -> new TaskNotFoundException("Checkpoint", taskId + "/" + exchangeId));

            // Re-checked on the current version: of two concurrent resumes only one leaves BLOCKED
            lifecycleService.mutate(taskId, r -> r.markResumed(exchangeId));
            lifecycleService.ensureTracked(taskId);

            Task task = TaskLifecycleService.toTask(record)
                .withResume(new Task.ResumeDirective(exchangeId, userResponse, checkpoint));
            WorkflowHandle handle;
            try {
                handle = TaskLifecycleService.await(scheduler.startTask(task));
            } catch (SchedulerException e) {
                log.error("Backend {} rejected resume of task {}", scheduler.backend(), taskId, e);
                lifecycleService.mutate(taskId, r -> r.isTerminal() ? r : r.markFailed("Resume failed: " + e.getMessage()));
                throw e;
            }
            TaskRecord updated = lifecycleService.mutate(taskId, r -> TaskLifecycleService.acceptHandle(r, handle));

            metrics.taskResumed(scheduler.backend(), record.targetAgent());
            log.info("Task {} resumed from exchange {} (run {})", taskId, exchangeId, handle.runId());
            return updated;
        }
    }
}
