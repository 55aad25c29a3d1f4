package com.agentscheduler.core.exception;

/**
 * Thrown when a task submission is malformed or targets an unknown agent.
 * Never retried: a provably invalid request fails on the first attempt.
 */
public class TaskValidationException extends SchedulerException {
    
    public static final String ERROR_CODE = "TASK_VALIDATION_ERROR";
    
    public TaskValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
