package com.agentscheduler.core.interrupt;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Message delivered to the caller when an agent blocks.
 */
public record InterruptNotification(
    String taskId,
    String sessionId,
    String exchangeId,
    JsonNode payload
) {}
