package com.agentscheduler.temporal.activity;

import com.agentscheduler.core.interrupt.InterruptContext;
import com.agentscheduler.core.model.ProgressPayload;
import com.agentscheduler.core.repository.CheckpointRepository;
import com.agentscheduler.engine.interrupt.CheckpointingInterruptHandler;

/**
 * Interrupt strategy inside the durable activity. The caller learns about the
 * interrupt from the blocked heartbeat and then from the workflow result.
 */
class DurableInterruptHandler extends CheckpointingInterruptHandler {

    static final String BLOCKED_LABEL = "Agent is waiting for human input/approval.";

    private final HeartbeatEmitter emitter;

    DurableInterruptHandler(CheckpointRepository checkpointRepository, HeartbeatEmitter emitter) {
        super(checkpointRepository);
        this.emitter = emitter;
    }

    @Override
    protected void notifyCaller(InterruptContext context) {
        emitter.emit(ProgressPayload.of(BLOCKED_LABEL, ProgressPayload.PHASE_BLOCKED));
    }
}
