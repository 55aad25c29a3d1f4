package com.agentscheduler.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;

/**
 * Immutable notification about a task, fanned out by the event bus.
 * 
 * Invariants:
 * - taskId is always set
 * - progress is set for every type
 * - details is set only for blocked progress events
 */
public record TaskEvent(
    TaskEventType type,
    String taskId,
    TaskProgress progress,
    String summary,
    List<String> artifacts,
    JsonNode details,
    Instant occurredAt
) {
    public static final String DETAIL_SESSION_ID = "session_id";
    public static final String DETAIL_EXCHANGE_ID = "exchange_id";
    public static final String DETAIL_PAYLOAD = "payload";

    public TaskEvent {
        if (taskId == null) {
            throw new IllegalArgumentException("Task events must carry a task id");
        }
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static TaskEvent progress(String taskId, TaskProgress progress) {
        return new TaskEvent(TaskEventType.PROGRESS, taskId, progress, null, List.of(), null, Instant.now());
    }

    public static TaskEvent blocked(String taskId, String message, String sessionId, String exchangeId, JsonNode payload) {
        ObjectNode details = JsonNodeFactory.instance.objectNode();
        details.put(DETAIL_SESSION_ID, sessionId);
        details.put(DETAIL_EXCHANGE_ID, exchangeId);
        details.set(DETAIL_PAYLOAD, payload);
        return new TaskEvent(TaskEventType.PROGRESS, taskId, TaskProgress.blocked(message),
            null, List.of(), details, Instant.now());
    }

    public static TaskEvent completed(String taskId, String summary, List<String> artifacts) {
        return new TaskEvent(TaskEventType.COMPLETED, taskId, TaskProgress.completed(summary),
            summary, artifacts, null, Instant.now());
    }

    public static TaskEvent failed(String taskId, String summary) {
        return new TaskEvent(TaskEventType.FAILED, taskId, TaskProgress.failed(summary),
            summary, List.of(), null, Instant.now());
    }

    /**
     * True for completed and failed events only. Blocked progress is not terminal:
     * the task may still complete or fail after a resume.
     */
    public boolean isTerminal() {
        return type.isTerminal();
    }

    public boolean isBlocked() {
        return type == TaskEventType.PROGRESS && progress.state() == ProgressState.BLOCKED;
    }
}
