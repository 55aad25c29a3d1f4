package com.agentscheduler.core.agent;

import com.agentscheduler.core.model.Checkpoint;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Result of {@link AgentExecutor#run}: the agent completed, suspended for
 * human input, or failed in a way it chose to report rather than throw.
 * 
 * Invariants:
 * - COMPLETED carries summary and artifacts
 * - SUSPENDED carries the interrupt payload and a checkpoint
 * - FAILED carries an error message
 */
public record AgentOutcome(
    Kind kind,
    String summary,
    List<String> artifacts,
    JsonNode interruptPayload,
    Checkpoint checkpoint,
    String error
) {
    public AgentOutcome {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public enum Kind {
        COMPLETED,
        SUSPENDED,
        FAILED
    }

    public static AgentOutcome completed(String summary, List<String> artifacts) {
        return new AgentOutcome(Kind.COMPLETED, summary, artifacts, null, null, null);
    }

    /**
     * The agent paused and needs a human response.
     * 
     * @param payload what to show the human (question, choices)
     * @param checkpoint state to resume from; required by the interrupt contract
     */
    public static AgentOutcome suspended(JsonNode payload, Checkpoint checkpoint) {
        return new AgentOutcome(Kind.SUSPENDED, null, List.of(), payload, checkpoint, null);
    }

    public static AgentOutcome failed(String error) {
        return new AgentOutcome(Kind.FAILED, null, List.of(), null, null, error);
    }
}
