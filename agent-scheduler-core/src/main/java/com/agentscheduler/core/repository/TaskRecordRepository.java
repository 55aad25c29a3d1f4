package com.agentscheduler.core.repository;

import com.agentscheduler.core.model.TaskRecord;
import com.agentscheduler.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for task records.
 * Implementations must provide optimistic locking on the version field.
 */
public interface TaskRecordRepository {
    
    /**
     * Create a new record. Idempotent: if a record with the same taskId exists,
     * the existing record is returned unchanged.
     * 
     * @param record The record to create
     * @return The stored record
     */
    TaskRecord create(TaskRecord record);
    
    /**
     * Find a record by task ID.
     */
    Optional<TaskRecord> findById(String taskId);
    
    /**
     * Update a record with optimistic locking.
     * 
     * @param record The record with updated fields; its version is one past the stored version
     * @throws com.agentscheduler.core.exception.OptimisticLockException if the stored version differs
     * @throws com.agentscheduler.core.exception.TaskNotFoundException if the record does not exist
     */
    void update(TaskRecord record);
    
    /**
     * List a user's records, newest first.
     * 
     * @param userId owner
     * @param statuses restrict to these statuses; empty or null means all
     * @param targetAgent restrict to this agent; null means all
     * @param limit maximum number of records
     */
    List<TaskRecord> listForUser(String userId, Set<TaskStatus> statuses, String targetAgent, int limit);
}
