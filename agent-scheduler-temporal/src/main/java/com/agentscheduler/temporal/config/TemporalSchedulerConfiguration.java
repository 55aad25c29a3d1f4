package com.agentscheduler.temporal.config;

import com.agentscheduler.core.repository.CheckpointRepository;
import com.agentscheduler.engine.config.SchedulerProperties;
import com.agentscheduler.engine.eventbus.TaskEventBus;
import com.agentscheduler.engine.runner.AgentTaskRunner;
import com.agentscheduler.engine.scheduler.TaskScheduler;
import com.agentscheduler.temporal.activity.AgentActivitiesImpl;
import com.agentscheduler.temporal.client.TemporalTaskScheduler;
import com.agentscheduler.temporal.worker.AgentWorkerLifecycle;
import com.agentscheduler.temporal.worker.AgentWorkers;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.WorkerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wiring for the durable backend, active with {@code agent.scheduler.backend=temporal}.
 */
@Configuration
@ConditionalOnProperty(prefix = "agent.scheduler", name = "backend", havingValue = "temporal")
public class TemporalSchedulerConfiguration {

    @Bean(destroyMethod = "shutdown")
    public WorkflowServiceStubs workflowServiceStubs(SchedulerProperties properties) {
        return WorkflowServiceStubs.newServiceStubs(WorkflowServiceStubsOptions.newBuilder()
            .setTarget(properties.getTemporal().getTarget())
            .build());
    }

    @Bean
    public WorkflowClient workflowClient(WorkflowServiceStubs serviceStubs, SchedulerProperties properties) {
        return WorkflowClient.newInstance(serviceStubs, WorkflowClientOptions.newBuilder()
            .setNamespace(properties.getTemporal().getNamespace())
            .build());
    }

    @Bean
    public TaskScheduler temporalTaskScheduler(
            WorkflowClient workflowClient,
            SchedulerProperties properties,
            TaskEventBus eventBus,
            @Qualifier("schedulerExecutor") Executor schedulerExecutor) {
        SchedulerProperties.Temporal temporal = properties.getTemporal();
        return new TemporalTaskScheduler(
            workflowClient, temporal.getTaskQueue(), temporal.getWorkflowIdPrefix(), eventBus, schedulerExecutor);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "agent.scheduler.temporal", name = "worker-enabled", havingValue = "true")
    static class WorkerConfiguration {

        @Bean
        public WorkerFactory workerFactory(
                WorkflowClient workflowClient,
                SchedulerProperties properties,
                AgentTaskRunner runner,
                CheckpointRepository checkpointRepository) {
            SchedulerProperties.Temporal temporal = properties.getTemporal();
            WorkerFactory factory = WorkerFactory.newInstance(workflowClient);
            AgentWorkers.register(
                factory,
                temporal.getTaskQueue(),
                AgentWorkers.activityOptions(
                    temporal.getStartToCloseTimeout(), temporal.getHeartbeatTimeout(), temporal.retrySettings()),
                new AgentActivitiesImpl(runner, checkpointRepository));
            return factory;
        }

        @Bean
        public AgentWorkerLifecycle agentWorkerLifecycle(WorkerFactory workerFactory) {
            return new AgentWorkerLifecycle(workerFactory, 30);
        }
    }
}
