package com.agentscheduler.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Outcome of a single agent run, as returned by the durable workflow
 * or produced inline by the in-process backend.
 * 
 * Invariants:
 * - sessionId and exchangeId are set iff status is BLOCKED
 * - finalSummary is short and safe to display; diagnostics stay in logs
 */
public record AgentTaskResult(
    ResultStatus status,
    String finalSummary,
    List<String> artifacts,
    String sessionId,
    String exchangeId,
    JsonNode blockedPayload
) {
    static final int MAX_SUMMARY_LENGTH = 500;

    public AgentTaskResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        finalSummary = truncate(finalSummary);
    }

    public enum ResultStatus {
        COMPLETED,
        BLOCKED,
        FAILED,
        CANCELED
    }

    public static AgentTaskResult completed(String summary, List<String> artifacts) {
        return new AgentTaskResult(ResultStatus.COMPLETED, summary, artifacts, null, null, null);
    }

    public static AgentTaskResult blocked(String sessionId, String exchangeId, JsonNode payload) {
        return new AgentTaskResult(ResultStatus.BLOCKED,
            "Agent is waiting for human input/approval.", List.of(), sessionId, exchangeId, payload);
    }

    public static AgentTaskResult failed(String summary) {
        return new AgentTaskResult(ResultStatus.FAILED, summary, List.of(), null, null, null);
    }

    public static AgentTaskResult canceled(String summary) {
        return new AgentTaskResult(ResultStatus.CANCELED, summary, List.of(), null, null, null);
    }

    /**
     * Build a display-safe failure summary from an exception.
     * Only the exception type and the first line of its message are kept.
     */
    public static String summarize(String prefix, Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message != null) {
            int newline = message.indexOf('\n');
            if (newline >= 0) {
                message = message.substring(0, newline);
            }
        }
        String detail = root.getClass().getSimpleName() + (message == null ? "" : ": " + message);
        return truncate(prefix + " " + detail);
    }

    /**
     * Progress snapshot corresponding to this result.
     */
    public TaskProgress toProgress() {
        return switch (status) {
            case COMPLETED -> TaskProgress.completed(finalSummary);
            case BLOCKED -> TaskProgress.blocked(finalSummary);
            case FAILED, CANCELED -> TaskProgress.failed(finalSummary);
        };
    }

    /**
     * Event to publish for this result. BLOCKED maps to a non-terminal progress event.
     */
    public TaskEvent toEvent(String taskId) {
        return switch (status) {
            case COMPLETED -> TaskEvent.completed(taskId, finalSummary, artifacts);
            case BLOCKED -> TaskEvent.blocked(taskId, finalSummary, sessionId, exchangeId, blockedPayload);
            case FAILED, CANCELED -> TaskEvent.failed(taskId, finalSummary);
        };
    }

    private static String truncate(String summary) {
        if (summary == null || summary.length() <= MAX_SUMMARY_LENGTH) {
            return summary;
        }
        return summary.substring(0, MAX_SUMMARY_LENGTH - 3) + "...";
    }
}
