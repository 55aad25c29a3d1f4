package com.agentscheduler.core.interrupt;

import com.agentscheduler.core.model.Checkpoint;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Everything needed to pause a run for human input and resume it later.
 * 
 * @param sessionId conversation or task scope of the checkpoint
 * @param exchangeId identifies this particular question/answer exchange
 * @param payload what to show the human
 * @param checkpoint snapshot to resume from; must not be null
 */
public record InterruptContext(
    String sessionId,
    String exchangeId,
    JsonNode payload,
    Checkpoint checkpoint
) {}
