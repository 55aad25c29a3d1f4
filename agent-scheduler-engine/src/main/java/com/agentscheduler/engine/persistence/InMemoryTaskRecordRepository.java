package com.agentscheduler.engine.persistence;

import com.agentscheduler.core.exception.OptimisticLockException;
import com.agentscheduler.core.exception.TaskNotFoundException;
import com.agentscheduler.core.model.TaskRecord;
import com.agentscheduler.core.model.TaskStatus;
import com.agentscheduler.core.repository.TaskRecordRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRecordRepository.
 * For local development and testing.
 */
public class InMemoryTaskRecordRepository implements TaskRecordRepository {
    
    private final Map<String, TaskRecord> records = new ConcurrentHashMap<>();
    
    @Override
    public TaskRecord create(TaskRecord record) {
        TaskRecord existing = records.putIfAbsent(record.taskId(), record);
        return existing != null ? existing : record;
    }
    
    @Override
    public Optional<TaskRecord> findById(String taskId) {
        return Optional.ofNullable(records.get(taskId));
    }
    
    @Override
    public void update(TaskRecord record) {
        long expected = record.version() - 1;
        boolean[] replaced = {false};
        TaskRecord current = records.computeIfPresent(record.taskId(), (id, stored) -> {
            if (stored.version() != expected) {
                return stored;
            }
            replaced[0] = true;
            return record;
        });
        if (current == null) {
            throw new TaskNotFoundException("Task", record.taskId());
        }
        if (!replaced[0]) {
            throw new OptimisticLockException(record.taskId(), expected);
        }
    }
    
    @Override
    public List<TaskRecord> listForUser(String userId, Set<TaskStatus> statuses, String targetAgent, int limit) {
        return records.values().stream()
            .filter(r -> r.userId().equals(userId))
            .filter(r -> statuses == null || statuses.isEmpty() || statuses.contains(r.status()))
            .filter(r -> targetAgent == null || targetAgent.equals(r.targetAgent()))
            .sorted(Comparator.comparing(TaskRecord::createdAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }
}
