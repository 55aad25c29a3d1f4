package com.agentscheduler.core.exception;

/**
 * Thrown when an interrupt cannot be made resumable, e.g. it carries no checkpoint.
 */
public class InterruptContractException extends SchedulerException {
    
    public static final String ERROR_CODE = "INTERRUPT_CONTRACT_VIOLATION";
    
    public InterruptContractException(String message) {
        super(ERROR_CODE, message);
    }
}
