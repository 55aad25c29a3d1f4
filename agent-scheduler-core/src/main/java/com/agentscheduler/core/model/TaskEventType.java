package com.agentscheduler.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of events published for a task.
 * A blocked state travels as PROGRESS and is not terminal.
 */
public enum TaskEventType {
    PROGRESS("progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    TaskEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
