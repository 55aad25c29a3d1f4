package com.agentscheduler.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution state reported by a backend progress query.
 * Not the authoritative lifecycle; see {@link TaskStatus}.
 */
public enum ProgressState {
    RUNNING("running"),
    BLOCKED("blocked"),
    COMPLETED("completed"),
    FAILED("failed"),
    UNKNOWN("unknown");

    private final String wireName;

    ProgressState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
