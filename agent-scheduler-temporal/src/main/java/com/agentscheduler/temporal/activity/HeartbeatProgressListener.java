package com.agentscheduler.temporal.activity;

import com.agentscheduler.core.agent.AgentExecutionListener;
import com.agentscheduler.core.model.ProgressPayload;

/**
 * Reports agent phases through the activity heartbeat.
 */
class HeartbeatProgressListener implements AgentExecutionListener {

    private final HeartbeatEmitter emitter;

    HeartbeatProgressListener(HeartbeatEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void onStepStarted(String step) {
        emitter.emit(ProgressPayload.of(step, ProgressPayload.PHASE_STEP));
    }

    @Override
    public void onToolStarted(String tool) {
        emitter.emit(ProgressPayload.of(tool, ProgressPayload.PHASE_TOOL));
    }
}
