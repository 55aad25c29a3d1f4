package com.agentscheduler.engine.metrics;

import com.agentscheduler.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the agent task scheduler.
 * 
 * Metrics exposed:
 * - Submitted, completed, failed, blocked and canceled task counts by backend and agent
 * - Resume counts
 * - Time from submission to a terminal outcome
 * - Active task gauge by status
 */
public class SchedulerMetrics implements MeterBinder {

    public static final String TASKS_SUBMITTED = "agent.tasks.submitted";
    public static final String TASKS_COMPLETED = "agent.tasks.completed";
    public static final String TASKS_FAILED = "agent.tasks.failed";
    public static final String TASKS_BLOCKED = "agent.tasks.blocked";
    public static final String TASKS_CANCELED = "agent.tasks.canceled";
    public static final String TASKS_RESUMED = "agent.tasks.resumed";
    public static final String TASK_DURATION = "agent.task.duration";
    public static final String TASKS_ACTIVE = "agent.tasks.active";

    // Unbound metrics record into a private registry so services work outside Spring
    private MeterRegistry registry = new SimpleMeterRegistry();

    private final Map<TaskStatus, AtomicInteger> activeGauges = new EnumMap<>(TaskStatus.class);

    public SchedulerMetrics() {
        for (TaskStatus status : new TaskStatus[]{TaskStatus.QUEUED, TaskStatus.RUNNING, TaskStatus.BLOCKED}) {
            activeGauges.put(status, new AtomicInteger(0));
        }
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        activeGauges.forEach((status, gauge) ->
            Gauge.builder(TASKS_ACTIVE, gauge, AtomicInteger::get)
                .tag("status", status.name())
                .description("Number of tasks in " + status + " status")
                .register(registry));
    }

    public void taskSubmitted(String backend, String agent) {
        counter(TASKS_SUBMITTED, backend, agent, "Total tasks submitted").increment();
        activeGauges.get(TaskStatus.RUNNING).incrementAndGet();
    }

    public void taskCompleted(String backend, String agent, Duration elapsed) {
        counter(TASKS_COMPLETED, backend, agent, "Total tasks completed successfully").increment();
        recordDuration(backend, agent, "success", elapsed);
        decrement(TaskStatus.RUNNING);
    }

    public void taskFailed(String backend, String agent, Duration elapsed) {
        counter(TASKS_FAILED, backend, agent, "Total tasks failed").increment();
        recordDuration(backend, agent, "failure", elapsed);
        decrement(TaskStatus.RUNNING);
    }

    public void taskBlocked(String backend, String agent) {
        counter(TASKS_BLOCKED, backend, agent, "Total interrupts awaiting human input").increment();
        activeGauges.get(TaskStatus.BLOCKED).incrementAndGet();
        decrement(TaskStatus.RUNNING);
    }

    public void taskResumed(String backend, String agent) {
        counter(TASKS_RESUMED, backend, agent, "Total blocked tasks resumed").increment();
        activeGauges.get(TaskStatus.RUNNING).incrementAndGet();
        decrement(TaskStatus.BLOCKED);
    }

    public void taskCanceled(String backend, String agent, TaskStatus previous) {
        counter(TASKS_CANCELED, backend, agent, "Total tasks canceled").increment();
        decrement(previous);
    }

    public double count(String name, String backend, String agent) {
        Counter counter = registry.find(name).tag("backend", backend).tag("agent", agent).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private Counter counter(String name, String backend, String agent, String description) {
        return Counter.builder(name)
            .tag("backend", backend)
            .tag("agent", agent)
            .description(description)
            .register(registry);
    }

    private void recordDuration(String backend, String agent, String outcome, Duration elapsed) {
        if (elapsed == null) {
            return;
        }
        Timer.builder(TASK_DURATION)
            .tag("backend", backend)
            .tag("agent", agent)
            .tag("outcome", outcome)
            .description("Time from submission to a terminal outcome")
            .register(registry)
            .record(elapsed);
    }

    private void decrement(TaskStatus status) {
        AtomicInteger gauge = activeGauges.get(status);
        if (gauge != null) {
            gauge.updateAndGet(v -> Math.max(0, v - 1));
        }
    }
}
