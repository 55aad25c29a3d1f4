package com.agentscheduler.core.exception;

import com.agentscheduler.core.model.TaskStatus;

/**
 * Thrown when an invalid task status transition is attempted.
 */
public class InvalidStateTransitionException extends SchedulerException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(String taskId, TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition task %s from %s to %s",
            taskId, currentStatus, targetStatus
        ));
    }
}
