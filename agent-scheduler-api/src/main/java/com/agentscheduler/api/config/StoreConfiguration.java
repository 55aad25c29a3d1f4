package com.agentscheduler.api.config;

import com.agentscheduler.core.repository.CheckpointRepository;
import com.agentscheduler.core.repository.TaskRecordRepository;
import com.agentscheduler.engine.persistence.InMemoryCheckpointRepository;
import com.agentscheduler.engine.persistence.InMemoryTaskRecordRepository;
import com.agentscheduler.engine.persistence.jdbc.JdbcCheckpointRepository;
import com.agentscheduler.engine.persistence.jdbc.JdbcTaskRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Task record and checkpoint stores, selected by {@code agent.scheduler.store}.
 */
public class StoreConfiguration {

    private StoreConfiguration() {
    }

    @Configuration
    @ConditionalOnProperty(prefix = "agent.scheduler", name = "store", havingValue = "memory", matchIfMissing = true)
    static class MemoryStore {

        @Bean
        public TaskRecordRepository taskRecordRepository() {
            return new InMemoryTaskRecordRepository();
        }

        @Bean
        public CheckpointRepository checkpointRepository() {
            return new InMemoryCheckpointRepository();
        }
    }

    /**
     * PostgreSQL store. Connection settings come from {@code spring.datasource.*};
     * the schema is applied at startup and is idempotent.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "agent.scheduler", name = "store", havingValue = "jdbc")
    static class JdbcStore {

        @Bean
        @ConfigurationProperties("spring.datasource")
        public DataSourceProperties dataSourceProperties() {
            return new DataSourceProperties();
        }

        @Bean
        public DataSource dataSource(DataSourceProperties dataSourceProperties) {
            return dataSourceProperties.initializeDataSourceBuilder().build();
        }

        @Bean
        public DataSourceInitializer schemaInitializer(DataSource dataSource) {
            DataSourceInitializer initializer = new DataSourceInitializer();
            initializer.setDataSource(dataSource);
            initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource("schema-postgresql.sql")));
            return initializer;
        }

        @Bean
        public JdbcTemplate jdbcTemplate(DataSource dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean
        public TaskRecordRepository taskRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcTaskRecordRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public CheckpointRepository checkpointRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcCheckpointRepository(jdbcTemplate, objectMapper);
        }
    }
}
