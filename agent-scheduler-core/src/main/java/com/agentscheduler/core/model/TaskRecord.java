package com.agentscheduler.core.model;

import com.agentscheduler.core.exception.InvalidStateTransitionException;
import com.agentscheduler.core.exception.TaskValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.List;

/**
 * Durable, queryable record of a submitted task.
 * Primary source of truth for task status, independent of the execution engine.
 * 
 * Primary Key: taskId
 * 
 * Invariants:
 * - status transitions follow {@link TaskStatus#canTransitionTo}
 * - a terminal record is immutable
 * - errorDetails is set iff status is FAILED
 * - blockedDetails is set iff status is BLOCKED
 * - workflowId is set at creation and never changes; runId may change
 * - version is monotonically increasing (optimistic locking)
 */
public record TaskRecord(
    // Identity
    String taskId,
    String userId,
    String targetAgent,
    
    // State
    TaskStatus status,
    
    // Request
    String requestText,
    JsonNode context,
    JsonNode parameters,
    
    // Execution correlation
    String workflowId,
    String runId,
    
    // Progress and outcome
    String lastMessage,
    double percentComplete,
    List<String> artifacts,
    JsonNode errorDetails,
    JsonNode blockedDetails,
    
    // Timing
    Instant createdAt,
    Instant updatedAt,
    
    // Versioning (optimistic locking)
    long version
) {
    public TaskRecord {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    /**
     * Create a new record in QUEUED status.
     */
    public static TaskRecord create(
            String taskId,
            String userId,
            String targetAgent,
            String requestText,
            JsonNode context,
            JsonNode parameters,
            String workflowId) {
        Instant now = Instant.now();
        return new TaskRecord(
            taskId,
            userId,
            targetAgent,
            TaskStatus.QUEUED,
            requestText,
            context != null ? context : JsonNodeFactory.instance.objectNode(),
            parameters != null ? parameters : JsonNodeFactory.instance.objectNode(),
            workflowId,
            null,
            null,
            0.0,
            List.of(),
            null,
            null,
            now,
            now,
            0L
        );
    }

    /**
     * Check if the record is in a terminal status.
     */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Backend accepted the task, or a blocked task was resumed.
     */
    public TaskRecord markRunning(String newRunId, String message) {
        checkTransition(TaskStatus.RUNNING);
        return toBuilder()
            .status(TaskStatus.RUNNING)
            .runId(newRunId != null ? newRunId : runId)
            .lastMessage(message != null ? message : lastMessage)
            .blockedDetails(null)
            .build();
    }

    /**
     * Leave BLOCKED for a resumed run. Only a BLOCKED record can be resumed, and
     * only with the exchange it is waiting on.
     *
     * @throws InvalidStateTransitionException if the record is not BLOCKED
     * @throws TaskValidationException if the exchange is not the pending one
     */
    public TaskRecord markResumed(String exchangeId) {
        if (status != TaskStatus.BLOCKED) {
            throw new InvalidStateTransitionException(taskId, status, TaskStatus.RUNNING);
        }
        String pending = blockedDetails != null && blockedDetails.hasNonNull(TaskEvent.DETAIL_EXCHANGE_ID)
            ? blockedDetails.get(TaskEvent.DETAIL_EXCHANGE_ID).asText()
            : null;
        if (pending != null && !pending.equals(exchangeId)) {
            throw new TaskValidationException(
                "Task " + taskId + " is waiting on exchange " + pending + ", not " + exchangeId);
        }
        return markRunning(null, "resumed");
    }

    /**
     * Intermediate progress while running.
     */
    public TaskRecord withProgress(String message, double percent) {
        checkTransition(TaskStatus.RUNNING);
        return toBuilder()
            .status(TaskStatus.RUNNING)
            .lastMessage(message != null ? message : lastMessage)
            .percentComplete(percent)
            .blockedDetails(null)
            .build();
    }

    public TaskRecord markBlocked(String message, JsonNode details) {
        checkTransition(TaskStatus.BLOCKED);
        if (details == null) {
            throw new IllegalArgumentException("Blocked details are required for task " + taskId);
        }
        return toBuilder()
            .status(TaskStatus.BLOCKED)
            .lastMessage(message)
            .blockedDetails(details)
            .build();
    }

    public TaskRecord markCompleted(String message, List<String> resultArtifacts) {
        checkTransition(TaskStatus.COMPLETED);
        return toBuilder()
            .status(TaskStatus.COMPLETED)
            .lastMessage(message)
            .percentComplete(100.0)
            .artifacts(resultArtifacts)
            .blockedDetails(null)
            .build();
    }

    public TaskRecord markFailed(String summary) {
        checkTransition(TaskStatus.FAILED);
        return toBuilder()
            .status(TaskStatus.FAILED)
            .lastMessage(summary)
            .errorDetails(JsonNodeFactory.instance.objectNode().put("summary", summary))
            .blockedDetails(null)
            .build();
    }

    public TaskRecord markCanceled(String reason) {
        checkTransition(TaskStatus.CANCELED);
        return toBuilder()
            .status(TaskStatus.CANCELED)
            .lastMessage(reason)
            .blockedDetails(null)
            .build();
    }

    private void checkTransition(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(taskId, status, target);
        }
    }

    /**
     * Builder for creating modified copies. Every built copy bumps the version.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final TaskRecord source;
        private TaskStatus status;
        private String runId;
        private String lastMessage;
        private double percentComplete;
        private List<String> artifacts;
        private JsonNode errorDetails;
        private JsonNode blockedDetails;

        public Builder(TaskRecord record) {
            this.source = record;
            this.status = record.status();
            this.runId = record.runId();
            this.lastMessage = record.lastMessage();
            this.percentComplete = record.percentComplete();
            this.artifacts = record.artifacts();
            this.errorDetails = record.errorDetails();
            this.blockedDetails = record.blockedDetails();
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder lastMessage(String lastMessage) {
            this.lastMessage = lastMessage;
            return this;
        }

        public Builder percentComplete(double percentComplete) {
            this.percentComplete = percentComplete;
            return this;
        }

        public Builder artifacts(List<String> artifacts) {
            this.artifacts = artifacts;
            return this;
        }

        public Builder errorDetails(JsonNode errorDetails) {
            this.errorDetails = errorDetails;
            return this;
        }

        public Builder blockedDetails(JsonNode blockedDetails) {
            this.blockedDetails = blockedDetails;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(
                source.taskId(), source.userId(), source.targetAgent(), status,
                source.requestText(), source.context(), source.parameters(),
                source.workflowId(), runId, lastMessage, percentComplete, artifacts,
                errorDetails, blockedDetails, source.createdAt(), Instant.now(),
                source.version() + 1
            );
        }
    }
}
