package com.agentscheduler.core.exception;

/**
 * Thrown when a caller accesses a task it does not own.
 */
public class TaskForbiddenException extends SchedulerException {
    
    public static final String ERROR_CODE = "FORBIDDEN";
    
    public TaskForbiddenException(String taskId, String userId) {
        super(ERROR_CODE, String.format(
            "Task %s is not owned by user %s",
            taskId, userId
        ));
    }
}
