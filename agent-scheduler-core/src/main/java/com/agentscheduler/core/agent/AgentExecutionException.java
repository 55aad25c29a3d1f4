package com.agentscheduler.core.agent;

import com.agentscheduler.core.exception.SchedulerException;

/**
 * Exception thrown by agent executors on failure.
 * Non-retryable failures are never re-attempted by the durable backend.
 */
public class AgentExecutionException extends SchedulerException {
    
    private final boolean retryable;
    
    public AgentExecutionException(String errorCode, String message) {
        this(errorCode, message, true);
    }
    
    public AgentExecutionException(String errorCode, String message, boolean retryable) {
        super(errorCode, message);
        this.retryable = retryable;
    }
    
    public AgentExecutionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(errorCode, message, cause);
        this.retryable = retryable;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
    
    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static AgentExecutionException permanent(String errorCode, String message) {
        return new AgentExecutionException(errorCode, message, false);
    }
    
    /**
     * Create a retryable exception (transient failure).
     */
    public static AgentExecutionException transientFailure(String errorCode, String message) {
        return new AgentExecutionException(errorCode, message, true);
    }
}
