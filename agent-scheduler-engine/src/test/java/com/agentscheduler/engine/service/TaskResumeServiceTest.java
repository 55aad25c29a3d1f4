package com.agentscheduler.engine.service;

import com.agentscheduler.core.exception.InvalidStateTransitionException;
import com.agentscheduler.core.exception.TaskNotFoundException;
import com.agentscheduler.core.exception.TaskValidationException;
import com.agentscheduler.core.model.Checkpoint;
import com.agentscheduler.core.model.TaskEvent;
import com.agentscheduler.core.model.TaskRecord;
import com.agentscheduler.core.model.TaskStatus;
import com.agentscheduler.core.repository.CheckpointRepository;
import com.agentscheduler.engine.eventbus.TaskEventBus;
import com.agentscheduler.engine.metrics.SchedulerMetrics;
import com.agentscheduler.engine.persistence.InMemoryCheckpointRepository;
import com.agentscheduler.engine.persistence.InMemoryTaskRecordRepository;
import com.agentscheduler.engine.runner.AgentTaskRunner;
import com.agentscheduler.engine.scheduler.InMemoryTaskScheduler;
import com.agentscheduler.engine.support.Polling;
import com.agentscheduler.engine.support.TestAgents;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskResumeServiceTest {

    private final ExecutorService backendExecutor = Executors.newFixedThreadPool(2);
    private final ExecutorService consumerExecutor = Executors.newCachedThreadPool();
    private final InMemoryTaskRecordRepository repository = new InMemoryTaskRecordRepository();
    private final InMemoryCheckpointRepository checkpoints = new InMemoryCheckpointRepository();
    private final TaskEventBus eventBus = new TaskEventBus();
    private final SchedulerMetrics metrics = new SchedulerMetrics();
    private final InMemoryTaskScheduler scheduler = new InMemoryTaskScheduler(
        new AgentTaskRunner(TestAgents.registry()), eventBus, checkpoints, backendExecutor);
    private final TaskLifecycleService lifecycle = new TaskLifecycleService(
        repository, scheduler, eventBus, TestAgents.registry(), metrics, consumerExecutor);
    private final TaskResumeService resumeService = new TaskResumeService(lifecycle, checkpoints, scheduler, metrics);

    @AfterEach
    void shutdown() {
        backendExecutor.shutdownNow();
        consumerExecutor.shutdownNow();
    }

    private TaskRecord awaitStatus(String taskId, TaskStatus status) throws InterruptedException {
        Polling.awaitTrue(() -> repository.findById(taskId).map(r -> r.status() == status).orElse(false),
            Duration.ofSeconds(5));
        return repository.findById(taskId).orElseThrow();
    }

    private String blockTask(String taskId) throws InterruptedException {
        lifecycle.submit(new TaskSubmission("alice", taskId, TestAgents.APPROVAL, "send the report", null, null));
        TaskRecord blocked = awaitStatus(taskId, TaskStatus.BLOCKED);
        return blocked.blockedDetails().get(TaskEvent.DETAIL_EXCHANGE_ID).asText();
    }

    @Test
    @DisplayName("Resuming with the human response completes the task")
    void resumeCompletes() throws Exception {
        String exchangeId = blockTask("t1");

        resumeService.resume("alice", "t1", exchangeId, JsonNodeFactory.instance.textNode("yes"));

        TaskRecord completed = awaitStatus("t1", TaskStatus.COMPLETED);
        assertThat(completed.lastMessage()).isEqualTo("approved: yes");
        assertThat(completed.blockedDetails()).isNull();
        assertThat(metrics.count(SchedulerMetrics.TASKS_RESUMED, "in-memory", TestAgents.APPROVAL)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Only blocked tasks can be resumed")
    void resumeRequiresBlocked() throws Exception {
        lifecycle.submit(new TaskSubmission("alice", "t2", TestAgents.ECHO, "hi", null, null));
        awaitStatus("t2", TaskStatus.COMPLETED);

        assertThatThrownBy(() -> resumeService.resume("alice", "t2", "x1", JsonNodeFactory.instance.textNode("yes")))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("The response must answer the pending exchange")
    void resumeRequiresPendingExchange() throws Exception {
        blockTask("t3");

        assertThatThrownBy(() -> resumeService.resume("alice", "t3", "other", JsonNodeFactory.instance.textNode("yes")))
            .isInstanceOf(TaskValidationException.class);
        assertThat(repository.findById("t3").orElseThrow().status()).isEqualTo(TaskStatus.BLOCKED);
    }

    @Test
    @DisplayName("A missing checkpoint is a not-found error and leaves the task blocked")
    void resumeRequiresCheckpoint() throws Exception {
        String exchangeId = blockTask("t4");
        InMemoryCheckpointRepository empty = new InMemoryCheckpointRepository();
        TaskResumeService withoutCheckpoints = new TaskResumeService(lifecycle, empty, scheduler, metrics);

        assertThatThrownBy(() -> withoutCheckpoints.resume("alice", "t4", exchangeId, JsonNodeFactory.instance.textNode("yes")))
            .isInstanceOf(TaskNotFoundException.class);
        assertThat(repository.findById("t4").orElseThrow().status()).isEqualTo(TaskStatus.BLOCKED);
    }

    @Test
    @DisplayName("Two concurrent resumes of one blocked task start a single run")
    void concurrentResumeRunsOnce() throws Exception {
        String exchangeId = blockTask("t5");
        // Both callers read the BLOCKED snapshot before either one moves the record on
        CyclicBarrier bothValidated = new CyclicBarrier(2);
        CheckpointRepository gated = new CheckpointRepository() {
            @Override
            public void save(Checkpoint checkpoint) {
                checkpoints.save(checkpoint);
            }

            @Override
            public Optional<Checkpoint> load(String sessionId, String exchange) {
                try {
                    bothValidated.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException("Resumes did not meet at the checkpoint load", e);
                }
                return checkpoints.load(sessionId, exchange);
            }
        };
        TaskResumeService racingService = new TaskResumeService(lifecycle, gated, scheduler, metrics);
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Callable<TaskRecord> resumeCall = () ->
                racingService.resume("alice", "t5", exchangeId, JsonNodeFactory.instance.textNode("yes"));
            List<Future<TaskRecord>> calls = callers.invokeAll(List.of(resumeCall, resumeCall), 10, TimeUnit.SECONDS);

            int accepted = 0;
            int rejected = 0;
            for (Future<TaskRecord> call : calls) {
                try {
                    call.get();
                    accepted++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InvalidStateTransitionException.class);
                    rejected++;
                }
            }

            assertThat(accepted).isEqualTo(1);
            assertThat(rejected).isEqualTo(1);
            awaitStatus("t5", TaskStatus.COMPLETED);
            assertThat(metrics.count(SchedulerMetrics.TASKS_RESUMED, "in-memory", TestAgents.APPROVAL)).isEqualTo(1.0);
        } finally {
            callers.shutdownNow();
        }
    }
}
