package com.agentscheduler.temporal.worker;

import com.agentscheduler.core.model.RetrySettings;
import com.agentscheduler.temporal.activity.AgentActivities;
import com.agentscheduler.temporal.workflow.AgentWorkflow;
import com.agentscheduler.temporal.workflow.AgentWorkflowImpl;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;

import java.time.Duration;

/**
 * Registration of the agent workflow and activity on a task queue.
 */
public final class AgentWorkers {

    private AgentWorkers() {
    }

    public static ActivityOptions activityOptions(
            Duration startToCloseTimeout, Duration heartbeatTimeout, RetrySettings retry) {
        return ActivityOptions.newBuilder()
            .setStartToCloseTimeout(startToCloseTimeout)
            .setHeartbeatTimeout(heartbeatTimeout)
            .setRetryOptions(RetryOptions.newBuilder()
                .setMaximumAttempts(retry.maxAttempts())
                .setInitialInterval(retry.initialInterval())
                .setBackoffCoefficient(retry.backoffCoefficient())
                .setMaximumInterval(retry.maximumInterval())
                .setDoNotRetry(retry.nonRetryableErrors().toArray(new String[0]))
                .build())
            .build();
    }

    public static Worker register(
            WorkerFactory factory, String taskQueue, ActivityOptions activityOptions, AgentActivities activities) {
        Worker worker = factory.newWorker(taskQueue);
        worker.registerWorkflowImplementationFactory(AgentWorkflow.class, () -> new AgentWorkflowImpl(activityOptions));
        worker.registerActivitiesImplementations(activities);
        return worker;
    }
}
