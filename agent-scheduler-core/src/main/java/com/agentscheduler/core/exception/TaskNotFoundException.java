package com.agentscheduler.core.exception;

/**
 * Thrown when a task record or checkpoint is not found.
 */
public class TaskNotFoundException extends SchedulerException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public TaskNotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
