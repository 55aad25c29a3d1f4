package com.agentscheduler.temporal.activity;

import com.agentscheduler.core.model.ProgressPayload;
import io.temporal.activity.ActivityExecutionContext;
import io.temporal.client.ActivityCompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort activity heartbeat.
 * 
 * A failed heartbeat never fails the agent, with one exception: when the
 * engine reports the activity canceled or timed out through the heartbeat,
 * that signal is propagated so the agent stops.
 */
public class HeartbeatEmitter {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatEmitter.class);

    private final ActivityExecutionContext context;

    public HeartbeatEmitter(ActivityExecutionContext context) {
        this.context = context;
    }

    public void emit(ProgressPayload payload) {
        try {
            context.heartbeat(payload);
        } catch (ActivityCompletionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Heartbeat failed for {} '{}': {}", payload.phase(), payload.label(), e.getMessage());
        }
    }
}
