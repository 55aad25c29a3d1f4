package com.agentscheduler.engine.interrupt;

import com.agentscheduler.core.exception.InterruptContractException;
import com.agentscheduler.core.interrupt.InterruptContext;
import com.agentscheduler.core.interrupt.InterruptHandler;
import com.agentscheduler.core.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base interrupt strategy: validate, persist the checkpoint, then notify.
 * 
 * Persistence is best-effort. A failed save is logged and the caller is still
 * notified, since the durable engine keeps its own copy of the agent state.
 */
public abstract class CheckpointingInterruptHandler implements InterruptHandler {

    private static final Logger log = LoggerFactory.getLogger(CheckpointingInterruptHandler.class);

    private final CheckpointRepository checkpointRepository;

    /**
     * @param checkpointRepository may be null to skip persistence
     */
    protected CheckpointingInterruptHandler(CheckpointRepository checkpointRepository) {
        this.checkpointRepository = checkpointRepository;
    }

    @Override
    public final void onInterrupt(InterruptContext context) {
        if (context.checkpoint() == null) {
            throw new InterruptContractException(
                "Interrupt " + context.exchangeId() + " for session " + context.sessionId() + " carries no checkpoint");
        }
        if (checkpointRepository != null) {
            try {
                checkpointRepository.save(context.checkpoint());
            } catch (RuntimeException e) {
                log.error("Failed to persist checkpoint session={} exchange={}, notifying anyway",
                    context.sessionId(), context.exchangeId(), e);
            }
        }
        notifyCaller(context);
    }

    /**
     * Tell whoever is waiting on the task that it is blocked.
     */
    protected abstract void notifyCaller(InterruptContext context);
}
