package com.agentscheduler.engine.service;

import com.agentscheduler.core.agent.AgentRegistry;
import com.agentscheduler.core.exception.InvalidStateTransitionException;
import com.agentscheduler.core.exception.OptimisticLockException;
import com.agentscheduler.core.exception.SchedulerBackendException;
import com.agentscheduler.core.exception.SchedulerException;
import com.agentscheduler.core.exception.TaskForbiddenException;
import com.agentscheduler.core.exception.TaskNotFoundException;
import com.agentscheduler.core.exception.TaskValidationException;
import com.agentscheduler.core.model.Task;
import com.agentscheduler.core.model.TaskEvent;
import com.agentscheduler.core.model.TaskProgress;
import com.agentscheduler.core.model.TaskRecord;
import com.agentscheduler.core.model.TaskStatus;
import com.agentscheduler.core.model.WorkflowHandle;
import com.agentscheduler.core.repository.TaskRecordRepository;
import com.agentscheduler.engine.eventbus.TaskEventBus;
import com.agentscheduler.engine.eventbus.TaskSubscription;
import com.agentscheduler.engine.logging.LoggingContext;
import com.agentscheduler.engine.metrics.SchedulerMetrics;
import com.agentscheduler.engine.scheduler.TaskScheduler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * Caller-side task lifecycle: submission, record updates from task events,
 * reads and cancellation.
 * 
 * The task record is the source of truth for status. It is updated from the
 * event stream of each tracked task with optimistic-lock retries.
 */
public class TaskLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleService.class);

    static final String PAYLOAD_REQUEST_TEXT = "request_text";
    static final String PAYLOAD_PARAMETERS = "parameters";
    private static final int MAX_UPDATE_ATTEMPTS = 5;

    private final TaskRecordRepository repository;
    private final TaskScheduler scheduler;
    private final TaskEventBus eventBus;
    private final AgentRegistry agentRegistry;
    private final SchedulerMetrics metrics;
    private final Executor eventConsumerExecutor;
    private final Map<String, TaskSubscription> tracked = new ConcurrentHashMap<>();

    public TaskLifecycleService(
            TaskRecordRepository repository,
            TaskScheduler scheduler,
            TaskEventBus eventBus,
            AgentRegistry agentRegistry,
            SchedulerMetrics metrics,
            Executor eventConsumerExecutor) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.agentRegistry = agentRegistry;
        this.metrics = metrics;
        this.eventConsumerExecutor = eventConsumerExecutor;
    }

    /**
     * Validate, record and start a task.
     * Resubmitting an existing task id returns the stored record without starting it again.
     * 
     * @return the record, RUNNING once the backend accepted it
     * @throws TaskValidationException if the request text is blank or the agent is unknown
     * @throws SchedulerBackendException if the backend rejected the submission
     */
    public TaskRecord submit(TaskSubmission submission) {
        validate(submission);
        String taskId = submission.taskId() != null ? submission.taskId() : UUID.randomUUID().toString();
        String workflowId = scheduler.workflowIdFor(taskId);

        try (LoggingContext ctx = LoggingContext.forTask(taskId, workflowId, null)) {
            TaskRecord created = repository.create(TaskRecord.create(
                taskId,
                submission.userId(),
                submission.targetAgent(),
                submission.requestText(),
                submission.context(),
                submission.parameters(),
                workflowId));
            if (created.status() != TaskStatus.QUEUED || tracked.containsKey(taskId)) {
                log.info("Task {} already submitted, status {}", taskId, created.status());
                return created;
            }

            // Subscribe before starting so no event of an inline run is missed
            TaskSubscription subscription = eventBus.subscribe(taskId);
            WorkflowHandle handle;
            try {
                handle = await(scheduler.startTask(toTask(created)));
            } catch (SchedulerException e) {
                subscription.close();
                log.error("Backend {} rejected task {}", scheduler.backend(), taskId, e);
                mutate(taskId, r -> r.isTerminal() ? r : r.markFailed("Submission failed: " + e.getMessage()));
                throw e;
            }

            TaskRecord running = mutate(taskId, r -> acceptHandle(r, handle));
            metrics.taskSubmitted(scheduler.backend(), submission.targetAgent());
            log.info("Task {} started on {} as {} (run {})",
                taskId, scheduler.backend(), handle.workflowId(), handle.runId());
            consume(subscription);
            return running;
        }
    }

    /**
     * Fetch a record owned by the user.
     * 
     * @throws TaskNotFoundException if the task does not exist
     * @throws TaskForbiddenException if the task belongs to another user
     */
    public TaskRecord get(String userId, String taskId) {
        TaskRecord record = repository.findById(taskId)
            .orElseThrow(() -> new TaskNotFoundException("Task", taskId));
        if (!record.userId().equals(userId)) {
            throw new TaskForbiddenException(taskId, userId);
        }
        return record;
    }

    public List<TaskRecord> list(String userId, Set<TaskStatus> statuses, String targetAgent, int limit) {
        return repository.listForUser(userId, statuses, targetAgent, limit);
    }

    /**
     * Live progress from the backend for a task the user owns.
     */
    public TaskProgress progress(String userId, String taskId) {
        TaskRecord record = get(userId, taskId);
        return await(scheduler.getProgress(record.workflowId(), record.runId()));
    }

    /**
     * Cancel a non-terminal task. The record is canceled even if the backend
     * no longer knows the workflow.
     */
    public TaskRecord cancel(String userId, String taskId) {
        TaskRecord record = get(userId, taskId);
        try (LoggingContext ctx = LoggingContext.forTask(taskId, record.workflowId(), record.runId())) {
            TaskRecord canceled = mutate(taskId, r -> r.markCanceled("Canceled by " + userId));
            boolean accepted = await(scheduler.cancel(record.workflowId()));
            log.info("Task {} canceled (backend accepted: {})", taskId, accepted);
            metrics.taskCanceled(scheduler.backend(), record.targetAgent(), record.status());
            TaskSubscription subscription = tracked.remove(taskId);
            if (subscription != null) {
                subscription.close();
            }
            return canceled;
        }
    }

    /**
     * Number of tasks whose events are currently being applied.
     */
    public int trackedTaskCount() {
        return tracked.size();
    }

    /**
     * Apply one task event to the record. Events for terminal records are ignored.
     */
    void apply(TaskEvent event) {
        TaskRecord before = repository.findById(event.taskId()).orElse(null);
        if (before == null) {
            log.warn("Dropping {} event for unknown task {}", event.type(), event.taskId());
            return;
        }
        TaskRecord after = mutate(event.taskId(), r -> transition(r, event));
        if (after.status() == before.status()) {
            return;
        }
        Duration elapsed = Duration.between(after.createdAt(), Instant.now());
        switch (after.status()) {
            case BLOCKED -> metrics.taskBlocked(scheduler.backend(), after.targetAgent());
            case COMPLETED -> metrics.taskCompleted(scheduler.backend(), after.targetAgent(), elapsed);
            case FAILED -> metrics.taskFailed(scheduler.backend(), after.targetAgent(), elapsed);
            default -> {
                // resumed or progressing
            }
        }
    }

    private TaskRecord transition(TaskRecord record, TaskEvent event) {
        if (record.isTerminal()) {
            log.debug("Ignoring {} event for terminal task {}", event.type(), record.taskId());
            return record;
        }
        return switch (event.type()) {
            case PROGRESS -> event.isBlocked()
                ? record.markBlocked(event.progress().message(), event.details())
                : record.withProgress(event.progress().message(), event.progress().percent());
            case COMPLETED -> record.markCompleted(event.summary(), event.artifacts());
            case FAILED -> record.markFailed(event.summary());
        };
    }

    /**
     * Make sure the task's events are being applied, subscribing if needed.
     * Must be called before the backend is asked to run the task.
     */
    void ensureTracked(String taskId) {
        if (tracked.containsKey(taskId)) {
            return;
        }
        consume(eventBus.subscribe(taskId));
    }

    private void consume(TaskSubscription subscription) {
        String taskId = subscription.taskId();
        TaskSubscription previous = tracked.putIfAbsent(taskId, subscription);
        if (previous != null) {
            subscription.close();
            return;
        }
        eventConsumerExecutor.execute(() -> {
            try (subscription) {
                for (TaskEvent event : subscription) {
                    try (LoggingContext ctx = LoggingContext.forTask(taskId)) {
                        apply(event);
                    } catch (InvalidStateTransitionException e) {
                        log.warn("Event {} does not apply to task {}: {}", event.type(), taskId, e.getMessage());
                    }
                }
            } catch (RuntimeException e) {
                log.error("Event consumer for task {} stopped", taskId, e);
            } finally {
                tracked.remove(taskId, subscription);
            }
        });
    }

    /**
     * Read-modify-write with optimistic-lock retries.
     * The function returning its argument unchanged means nothing to write.
     */
    TaskRecord mutate(String taskId, UnaryOperator<TaskRecord> change) {
        OptimisticLockException last = null;
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            TaskRecord current = repository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException("Task", taskId));
            TaskRecord updated = change.apply(current);
            if (updated == current) {
                return current;
            }
            try {
                repository.update(updated);
                return updated;
            } catch (OptimisticLockException e) {
                log.debug("Concurrent update of task {} (attempt {}), retrying", taskId, attempt);
                last = e;
            }
        }
        throw last;
    }

    /**
     * Record the backend's handle on a freshly started or resumed task.
     */
    static TaskRecord acceptHandle(TaskRecord record, WorkflowHandle handle) {
        if (record.status() == TaskStatus.QUEUED) {
            return record.markRunning(handle.runId(), "accepted");
        }
        if (record.isTerminal() || handle.runId() == null || handle.runId().equals(record.runId())) {
            return record;
        }
        return record.toBuilder().runId(handle.runId()).build();
    }

    static Task toTask(TaskRecord record) {
        return Task.create(record.taskId(), record.targetAgent(), requestPayload(record), record.context(), record.userId());
    }

    private void validate(TaskSubmission submission) {
        if (submission.userId() == null || submission.userId().isBlank()) {
            throw new TaskValidationException("A user id is required");
        }
        if (submission.requestText() == null || submission.requestText().isBlank()) {
            throw new TaskValidationException("Request text must not be blank");
        }
        if (!agentRegistry.isKnown(submission.targetAgent())) {
            throw new TaskValidationException("Unknown target agent: " + submission.targetAgent());
        }
        if (submission.parameters() != null && !submission.parameters().isObject()) {
            throw new TaskValidationException("Parameters must be a JSON object");
        }
    }

    /**
     * Wait for a backend call, translating its failure into a scheduler exception.
     */
    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulerBackendException("Interrupted while waiting for the scheduler backend", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SchedulerException) {
                throw (SchedulerException) cause;
            }
            throw new SchedulerBackendException("Scheduler backend call failed: " + cause.getMessage(), cause);
        }
    }

    static JsonNode requestPayload(TaskRecord record) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put(PAYLOAD_REQUEST_TEXT, record.requestText());
        payload.set(PAYLOAD_PARAMETERS, record.parameters());
        return payload;
    }
}
