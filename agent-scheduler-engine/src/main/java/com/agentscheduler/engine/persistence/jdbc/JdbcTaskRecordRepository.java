package com.agentscheduler.engine.persistence.jdbc;

import com.agentscheduler.core.exception.OptimisticLockException;
import com.agentscheduler.core.exception.TaskNotFoundException;
import com.agentscheduler.core.model.TaskRecord;
import com.agentscheduler.core.model.TaskStatus;
import com.agentscheduler.core.repository.TaskRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed implementation of TaskRecordRepository.
 * Supports optimistic locking via the version column for concurrent access.
 */
public class JdbcTaskRecordRepository implements TaskRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRecordRepository.class);
    
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRecordRowMapper rowMapper;

    public JdbcTaskRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TaskRecordRowMapper();
    }

    @Override
    public TaskRecord create(TaskRecord record) {
        String sql = """
            INSERT INTO agent_tasks (
                task_id, user_id, target_agent, status, request_text,
                context_json, parameters_json, workflow_id, run_id,
                last_message, percent_complete, artifacts_json, error_json, blocked_json,
                created_at, updated_at, version
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?)
            ON CONFLICT (task_id) DO NOTHING
            """;
        
        int rows = jdbcTemplate.update(sql,
            record.taskId(),
            record.userId(),
            record.targetAgent(),
            record.status().name(),
            record.requestText(),
            toJson(record.context()),
            toJson(record.parameters()),
            record.workflowId(),
            record.runId(),
            record.lastMessage(),
            record.percentComplete(),
            toJson(record.artifacts()),
            toJson(record.errorDetails()),
            toJson(record.blockedDetails()),
            toTimestamp(record.createdAt()),
            toTimestamp(record.updatedAt()),
            record.version()
        );
        
        if (rows == 0) {
            log.debug("Task record already exists: {}", record.taskId());
        }
        return findById(record.taskId())
            .orElseThrow(() -> new TaskNotFoundException("Task", record.taskId()));
    }

    @Override
    public Optional<TaskRecord> findById(String taskId) {
        String sql = "SELECT * FROM agent_tasks WHERE task_id = ?";
        List<TaskRecord> results = jdbcTemplate.query(sql, rowMapper, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public void update(TaskRecord record) {
        String sql = """
            UPDATE agent_tasks SET
                status = ?,
                run_id = ?,
                last_message = ?,
                percent_complete = ?,
                artifacts_json = ?::jsonb,
                error_json = ?::jsonb,
                blocked_json = ?::jsonb,
                updated_at = ?,
                version = ?
            WHERE task_id = ? AND version = ?
            """;
        
        int rows = jdbcTemplate.update(sql,
            record.status().name(),
            record.runId(),
            record.lastMessage(),
            record.percentComplete(),
            toJson(record.artifacts()),
            toJson(record.errorDetails()),
            toJson(record.blockedDetails()),
            toTimestamp(record.updatedAt()),
            record.version(),
            record.taskId(),
            record.version() - 1  // Expected previous version
        );
        
        if (rows == 0) {
            if (findById(record.taskId()).isEmpty()) {
                throw new TaskNotFoundException("Task", record.taskId());
            }
            throw new OptimisticLockException(record.taskId(), record.version() - 1);
        }
    }

    @Override
    public List<TaskRecord> listForUser(String userId, Set<TaskStatus> statuses, String targetAgent, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM agent_tasks WHERE user_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(userId);
        if (statuses != null && !statuses.isEmpty()) {
            sql.append(" AND status IN (")
               .append(statuses.stream().map(s -> "?").collect(Collectors.joining(", ")))
               .append(")");
            statuses.forEach(s -> args.add(s.name()));
        }
        if (targetAgent != null) {
            sql.append(" AND target_agent = ?");
            args.add(targetAgent);
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
    }

    // ========== Helper Methods ==========

    private String toJson(Object obj) {
        if (obj == null) return null;
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class TaskRecordRowMapper implements RowMapper<TaskRecord> {
        @Override
        public TaskRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new TaskRecord(
                    rs.getString("task_id"),
                    rs.getString("user_id"),
                    rs.getString("target_agent"),
                    TaskStatus.valueOf(rs.getString("status")),
                    rs.getString("request_text"),
                    parseJsonNode(rs.getString("context_json")),
                    parseJsonNode(rs.getString("parameters_json")),
                    rs.getString("workflow_id"),
                    rs.getString("run_id"),
                    rs.getString("last_message"),
                    rs.getDouble("percent_complete"),
                    parseStringList(rs.getString("artifacts_json")),
                    parseJsonNode(rs.getString("error_json")),
                    parseJsonNode(rs.getString("blocked_json")),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map task record row", e);
            }
        }

        private List<String> parseStringList(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return List.of();
            return objectMapper.readValue(json,
                objectMapper.getTypeFactory().constructCollectionType(List.class, String.class));
        }

        private JsonNode parseJsonNode(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return null;
            return objectMapper.readTree(json);
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
