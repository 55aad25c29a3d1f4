package com.agentscheduler.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Opaque snapshot of paused agent state, sufficient to resume execution.
 * Only the agent collaborator interprets {@code state}.
 * 
 * Key: (sessionId, exchangeId)
 */
public record Checkpoint(
    String sessionId,
    String exchangeId,
    JsonNode state,
    Instant createdAt
) {
    public static Checkpoint of(String sessionId, String exchangeId, JsonNode state) {
        return new Checkpoint(sessionId, exchangeId, state, Instant.now());
    }

    /**
     * Re-key an agent-produced snapshot to the exchange it belongs to.
     */
    public Checkpoint forExchange(String sessionId, String exchangeId) {
        return new Checkpoint(sessionId, exchangeId, state, createdAt);
    }
}
