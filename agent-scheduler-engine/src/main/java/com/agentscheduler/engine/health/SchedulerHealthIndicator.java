package com.agentscheduler.engine.health;

import com.agentscheduler.engine.scheduler.TaskScheduler;
import com.agentscheduler.engine.service.TaskLifecycleService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the scheduler: backend in use, tracked tasks and, for the JDBC
 * store, database connectivity.
 */
public class SchedulerHealthIndicator implements HealthIndicator {

    private final TaskScheduler scheduler;
    private final TaskLifecycleService lifecycleService;
    private final JdbcTemplate jdbcTemplate;

    /**
     * @param jdbcTemplate null when records are kept in memory
     */
    public SchedulerHealthIndicator(
            TaskScheduler scheduler,
            TaskLifecycleService lifecycleService,
            JdbcTemplate jdbcTemplate) {
        this.scheduler = scheduler;
        this.lifecycleService = lifecycleService;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("backend", scheduler.backend());
        details.put("trackedTasks", lifecycleService.trackedTaskCount());

        if (jdbcTemplate == null) {
            details.put("store", "memory");
            return Health.up().withDetails(details).build();
        }

        details.put("store", "jdbc");
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            boolean healthy = result != null && result == 1;
            details.put("database", healthy ? "connected" : "unexpected response");
            return (healthy ? Health.up() : Health.down()).withDetails(details).build();
        } catch (RuntimeException e) {
            details.put("database", "disconnected");
            return Health.down(e).withDetails(details).build();
        }
    }
}
