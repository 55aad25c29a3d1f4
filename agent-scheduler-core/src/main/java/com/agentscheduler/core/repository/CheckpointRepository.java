package com.agentscheduler.core.repository;

import com.agentscheduler.core.model.Checkpoint;

import java.util.Optional;

/**
 * Storage for paused agent state, keyed by (sessionId, exchangeId).
 */
public interface CheckpointRepository {

    /**
     * Save a checkpoint, replacing any existing one with the same key.
     */
    void save(Checkpoint checkpoint);

    Optional<Checkpoint> load(String sessionId, String exchangeId);
}
