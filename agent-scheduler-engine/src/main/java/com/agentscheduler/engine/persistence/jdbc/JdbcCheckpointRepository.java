package com.agentscheduler.engine.persistence.jdbc;

import com.agentscheduler.core.model.Checkpoint;
import com.agentscheduler.core.repository.CheckpointRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed checkpoint store. Saving an existing key overwrites it.
 */
public class JdbcCheckpointRepository implements CheckpointRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(Checkpoint checkpoint) {
        String sql = """
            INSERT INTO agent_checkpoints (session_id, exchange_id, state_json, created_at)
            VALUES (?, ?, ?::jsonb, ?)
            ON CONFLICT (session_id, exchange_id)
            DO UPDATE SET state_json = EXCLUDED.state_json, created_at = EXCLUDED.created_at
            """;
        try {
            jdbcTemplate.update(sql,
                checkpoint.sessionId(),
                checkpoint.exchangeId(),
                checkpoint.state() == null ? null : objectMapper.writeValueAsString(checkpoint.state()),
                Timestamp.from(checkpoint.createdAt()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint state", e);
        }
    }

    @Override
    public Optional<Checkpoint> load(String sessionId, String exchangeId) {
        String sql = """
            SELECT session_id, exchange_id, state_json, created_at
            FROM agent_checkpoints
            WHERE session_id = ? AND exchange_id = ?
            """;
        List<Checkpoint> results = jdbcTemplate.query(sql, (rs, rowNum) -> {
            String state = rs.getString("state_json");
            try {
                return new Checkpoint(
                    rs.getString("session_id"),
                    rs.getString("exchange_id"),
                    state == null ? null : objectMapper.readTree(state),
                    rs.getTimestamp("created_at").toInstant());
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map checkpoint row", e);
            }
        }, sessionId, exchangeId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
