package com.agentscheduler.engine.persistence;

import com.agentscheduler.core.model.Checkpoint;
import com.agentscheduler.core.repository.CheckpointRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CheckpointRepository.
 */
public class InMemoryCheckpointRepository implements CheckpointRepository {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(Checkpoint checkpoint) {
        checkpoints.put(key(checkpoint.sessionId(), checkpoint.exchangeId()), checkpoint);
    }

    @Override
    public Optional<Checkpoint> load(String sessionId, String exchangeId) {
        return Optional.ofNullable(checkpoints.get(key(sessionId, exchangeId)));
    }

    private static String key(String sessionId, String exchangeId) {
        return sessionId + ":" + exchangeId;
    }
}
