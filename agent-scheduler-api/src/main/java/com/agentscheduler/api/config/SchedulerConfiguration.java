package com.agentscheduler.api.config;

import com.agentscheduler.core.agent.AgentRegistry;
import com.agentscheduler.core.agent.NamedAgent;
import com.agentscheduler.core.repository.CheckpointRepository;
import com.agentscheduler.core.repository.TaskRecordRepository;
import com.agentscheduler.engine.config.SchedulerProperties;
import com.agentscheduler.engine.eventbus.TaskEventBus;
import com.agentscheduler.engine.health.SchedulerHealthIndicator;
import com.agentscheduler.engine.metrics.SchedulerMetrics;
import com.agentscheduler.engine.runner.AgentTaskRunner;
import com.agentscheduler.engine.scheduler.InMemoryTaskScheduler;
import com.agentscheduler.engine.scheduler.TaskScheduler;
import com.agentscheduler.engine.service.TaskLifecycleService;
import com.agentscheduler.engine.service.TaskResumeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core scheduler wiring. The durable backend lives in the temporal module and
 * replaces the in-memory scheduler when {@code agent.scheduler.backend=temporal}.
 */
@Configuration
public class SchedulerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfiguration.class);

    @Bean
    public TaskEventBus taskEventBus() {
        return new TaskEventBus();
    }

    @Bean
    public AgentRegistry agentRegistry(List<NamedAgent> agents) {
        AgentRegistry registry = new AgentRegistry();
        for (NamedAgent agent : agents) {
            registry.register(agent.name(), agent);
        }
        log.info("Registered agents: {}", registry.names());
        return registry;
    }

    @Bean
    public AgentTaskRunner agentTaskRunner(AgentRegistry agentRegistry) {
        return new AgentTaskRunner(agentRegistry);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService schedulerExecutor(SchedulerProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutorThreads());
    }

    /**
     * Unbounded: a blocked task keeps its consumer parked until it resumes.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService eventConsumerExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.scheduler", name = "backend", havingValue = "in-memory", matchIfMissing = true)
    public TaskScheduler inMemoryTaskScheduler(
            AgentTaskRunner runner,
            TaskEventBus eventBus,
            CheckpointRepository checkpointRepository,
            @Qualifier("schedulerExecutor") ExecutorService schedulerExecutor) {
        return new InMemoryTaskScheduler(runner, eventBus, checkpointRepository, schedulerExecutor);
    }

    @Bean
    public SchedulerMetrics schedulerMetrics() {
        return new SchedulerMetrics();
    }

    @Bean
    public TaskLifecycleService taskLifecycleService(
            TaskRecordRepository repository,
            TaskScheduler scheduler,
            TaskEventBus eventBus,
            AgentRegistry agentRegistry,
            SchedulerMetrics metrics,
            @Qualifier("eventConsumerExecutor") ExecutorService eventConsumerExecutor) {
        log.info("Task scheduler backend: {}", scheduler.backend());
        return new TaskLifecycleService(repository, scheduler, eventBus, agentRegistry, metrics, eventConsumerExecutor);
    }

    @Bean
    public TaskResumeService taskResumeService(
            TaskLifecycleService lifecycleService,
            CheckpointRepository checkpointRepository,
            TaskScheduler scheduler,
            SchedulerMetrics metrics) {
        return new TaskResumeService(lifecycleService, checkpointRepository, scheduler, metrics);
    }

    @Bean
    public SchedulerHealthIndicator schedulerHealthIndicator(
            TaskScheduler scheduler,
            TaskLifecycleService lifecycleService,
            ObjectProvider<JdbcTemplate> jdbcTemplate) {
        return new SchedulerHealthIndicator(scheduler, lifecycleService, jdbcTemplate.getIfAvailable());
    }
}
