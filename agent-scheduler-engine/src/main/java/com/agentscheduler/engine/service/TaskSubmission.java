package com.agentscheduler.engine.service;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A caller's request to run an agent.
 * 
 * @param taskId optional; generated when null
 * @param context optional caller context references
 * @param parameters optional agent parameters
 */
public record TaskSubmission(
    String userId,
    String taskId,
    String targetAgent,
    String requestText,
    JsonNode context,
    JsonNode parameters
) {}
