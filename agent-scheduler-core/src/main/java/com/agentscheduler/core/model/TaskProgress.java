package com.agentscheduler.core.model;

/**
 * Point-in-time progress snapshot of a task.
 * 
 * Percent is the last known value, not a monotone counter: the durable
 * engine resets it with every heartbeat.
 */
public record TaskProgress(
    ProgressState state,
    int percent,
    String message
) {
    public TaskProgress {
        if (state == null) {
            throw new IllegalArgumentException("Progress state is required");
        }
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("Percent must be within [0, 100]: " + percent);
        }
    }

    public static TaskProgress unknown() {
        return new TaskProgress(ProgressState.UNKNOWN, 0, null);
    }

    public static TaskProgress unknown(String message) {
        return new TaskProgress(ProgressState.UNKNOWN, 0, message);
    }

    public static TaskProgress running(int percent, String message) {
        return new TaskProgress(ProgressState.RUNNING, percent, message);
    }

    public static TaskProgress blocked(String message) {
        return new TaskProgress(ProgressState.BLOCKED, 0, message);
    }

    public static TaskProgress completed(String message) {
        return new TaskProgress(ProgressState.COMPLETED, 100, message);
    }

    public static TaskProgress failed(String message) {
        return new TaskProgress(ProgressState.FAILED, 0, message);
    }
}
