package com.agentscheduler.temporal.client;

import com.agentscheduler.core.agent.AgentOutcome;
import com.agentscheduler.core.agent.AgentRegistry;
import com.agentscheduler.core.model.ProgressState;
import com.agentscheduler.core.model.RetrySettings;
import com.agentscheduler.core.model.Task;
import com.agentscheduler.core.model.TaskEvent;
import com.agentscheduler.core.model.TaskEventType;
import com.agentscheduler.core.model.TaskProgress;
import com.agentscheduler.core.model.WorkflowHandle;
import com.agentscheduler.engine.eventbus.TaskEventBus;
import com.agentscheduler.engine.eventbus.TaskSubscription;
import com.agentscheduler.engine.persistence.InMemoryCheckpointRepository;
import com.agentscheduler.engine.runner.AgentTaskRunner;
import com.agentscheduler.temporal.activity.AgentActivitiesImpl;
import com.agentscheduler.temporal.worker.AgentWorkers;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.temporal.testing.TestEnvironmentOptions;
import io.temporal.testing.TestWorkflowEnvironment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TemporalTaskSchedulerTest {

    private static final String TASK_QUEUE = "scheduler-test";

    private TestWorkflowEnvironment testEnv;
    private TaskEventBus eventBus;
    private ExecutorService executor;
    private TemporalTaskScheduler scheduler;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        testEnv = TestWorkflowEnvironment.newInstance(
            TestEnvironmentOptions.newBuilder().setUseTimeskipping(false).build());
        AgentRegistry registry = new AgentRegistry()
            .register("echo", (input, listener) ->
                AgentOutcome.completed("echo: " + input.payload().path("request_text").asText(), List.of()))
            .register("waiting", (input, listener) -> {
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return AgentOutcome.completed("released", List.of());
            });
        AgentWorkers.register(
            testEnv.getWorkerFactory(),
            TASK_QUEUE,
            AgentWorkers.activityOptions(Duration.ofMinutes(1), Duration.ofMinutes(1),
                RetrySettings.builder().maxAttempts(1).build()),
            new AgentActivitiesImpl(new AgentTaskRunner(registry), new InMemoryCheckpointRepository()));
        testEnv.start();

        eventBus = new TaskEventBus();
        executor = Executors.newCachedThreadPool();
        scheduler = new TemporalTaskScheduler(testEnv.getWorkflowClient(), TASK_QUEUE, "agent-task", eventBus, executor);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        testEnv.close();
        executor.shutdownNow();
    }

    @Test
    void startedTaskPublishesCompletion() throws Exception {
        try (TaskSubscription subscription = eventBus.subscribe("t1")) {
            WorkflowHandle handle = scheduler.startTask(task("t1", "echo")).get(10, TimeUnit.SECONDS);

            assertThat(handle.workflowId()).isEqualTo("agent-task-t1");
            assertThat(handle.runId()).isNotBlank();

            Optional<TaskEvent> event = subscription.poll(Duration.ofSeconds(10));
            assertThat(event).isPresent();
            assertThat(event.get().type()).isEqualTo(TaskEventType.COMPLETED);
            assertThat(event.get().summary()).isEqualTo("echo: hello");
        }

        TaskProgress progress = scheduler.getProgress("agent-task-t1", null).get(10, TimeUnit.SECONDS);
        assertThat(progress.state()).isEqualTo(ProgressState.COMPLETED);
        assertThat(progress.percent()).isEqualTo(100);
    }

    @Test
    void duplicateStartReturnsRunningExecution() throws Exception {
        WorkflowHandle first = scheduler.startTask(task("t2", "waiting")).get(10, TimeUnit.SECONDS);
        WorkflowHandle second = scheduler.startTask(task("t2", "waiting")).get(10, TimeUnit.SECONDS);

        assertThat(second).isEqualTo(first);
        assertThat(scheduler.handleFor("agent-task-t2")).contains(first);
    }

    @Test
    void unknownWorkflowHasUnknownProgress() throws Exception {
        TaskProgress progress = scheduler.getProgress("agent-task-missing", null).get(10, TimeUnit.SECONDS);

        assertThat(progress.state()).isEqualTo(ProgressState.UNKNOWN);
    }

    @Test
    void cancelRunningWorkflowEndsTask() throws Exception {
        try (TaskSubscription subscription = eventBus.subscribe("t3")) {
            scheduler.startTask(task("t3", "waiting")).get(10, TimeUnit.SECONDS);

            assertThat(scheduler.cancel("agent-task-t3").get(10, TimeUnit.SECONDS)).isTrue();

            Optional<TaskEvent> event = subscription.poll(Duration.ofSeconds(10));
            assertThat(event).isPresent();
            assertThat(event.get().type()).isEqualTo(TaskEventType.FAILED);
            assertThat(event.get().summary()).containsIgnoringCase("canceled");
        }
    }

    @Test
    void cancelUnknownWorkflowReturnsFalse() throws Exception {
        assertThat(scheduler.cancel("agent-task-missing").get(10, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    void workflowIdUsesPrefix() {
        assertThat(scheduler.workflowIdFor("abc")).isEqualTo("agent-task-abc");
        assertThat(scheduler.backend()).isEqualTo("temporal");
    }

    private static Task task(String taskId, String agent) {
        return Task.create(taskId, agent,
            JsonNodeFactory.instance.objectNode().put("request_text", "hello"),
            JsonNodeFactory.instance.objectNode(), "user-1");
    }
}
