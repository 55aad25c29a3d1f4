package com.agentscheduler.core.exception;

/**
 * Thrown when a concurrent modification is detected on a task record.
 */
public class OptimisticLockException extends SchedulerException {
    
    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_FAILURE";
    
    public OptimisticLockException(String taskId, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "Task record %s was modified concurrently (expected version %d)",
            taskId, expectedVersion
        ));
    }
}
