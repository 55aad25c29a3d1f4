package com.agentscheduler.core.model;

/**
 * Authoritative lifecycle of a task record.
 * Independent of the execution engine so it survives scheduler restarts
 * and reads the same for every backend.
 */
public enum TaskStatus {
    /**
     * Record created, not yet accepted by a backend.
     * Transitions: -> RUNNING, FAILED, CANCELED
     */
    QUEUED,

    /**
     * Accepted by a backend and executing.
     * Transitions: -> RUNNING (progress), BLOCKED, COMPLETED, FAILED, CANCELED
     */
    RUNNING,

    /**
     * Paused on an interrupt, awaiting human input.
     * Transitions: -> RUNNING (resume), FAILED, CANCELED
     */
    BLOCKED,

    /**
     * Agent finished successfully. Terminal state.
     */
    COMPLETED,

    /**
     * Agent failed or attempts were exhausted. Terminal state.
     */
    FAILED,

    /**
     * Canceled by the caller. Terminal state.
     */
    CANCELED;

    /**
     * Check if this status is terminal. Terminal records are immutable.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case QUEUED -> target == RUNNING || target == FAILED || target == CANCELED;
            case RUNNING -> target == RUNNING || target == BLOCKED || target == COMPLETED ||
                           target == FAILED || target == CANCELED;
            case BLOCKED -> target == RUNNING || target == FAILED || target == CANCELED;
            case COMPLETED, FAILED, CANCELED -> false;
        };
    }
}
