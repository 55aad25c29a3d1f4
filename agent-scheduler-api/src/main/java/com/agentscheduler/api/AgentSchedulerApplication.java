package com.agentscheduler.api;

import com.agentscheduler.engine.config.SchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application entry point for the agent scheduler.
 * The data source is only created when {@code agent.scheduler.store=jdbc}.
 */
@SpringBootApplication(
    scanBasePackages = {"com.agentscheduler.api", "com.agentscheduler.temporal"},
    exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(SchedulerProperties.class)
public class AgentSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentSchedulerApplication.class, args);
    }
}
