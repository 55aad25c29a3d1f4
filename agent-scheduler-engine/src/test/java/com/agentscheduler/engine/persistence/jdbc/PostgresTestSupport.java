package com.agentscheduler.engine.persistence.jdbc;

import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container setup for JDBC store tests.
 */
final class PostgresTestSupport {

    private PostgresTestSupport() {
    }

    static PostgreSQLContainer<?> newContainer() {
        return new PostgreSQLContainer<>("postgres:15")
            .withDatabaseName("agent_scheduler_test")
            .withUsername("test")
            .withPassword("test");
    }

    static JdbcTemplate jdbcTemplate(PostgreSQLContainer<?> postgres) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema-postgresql.sql")).execute(dataSource);
        return new JdbcTemplate(dataSource);
    }
}
