package com.agentscheduler.core.exception;

/**
 * Thrown when the execution backend cannot be reached or rejects a request.
 */
public class SchedulerBackendException extends SchedulerException {
    
    public static final String ERROR_CODE = "BACKEND_UNAVAILABLE";
    
    public SchedulerBackendException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
