package com.agentscheduler.engine.interrupt;

import com.agentscheduler.core.interrupt.InterruptContext;
import com.agentscheduler.core.interrupt.InterruptNotification;
import com.agentscheduler.core.interrupt.NotificationTransport;
import com.agentscheduler.core.repository.CheckpointRepository;

/**
 * Interrupt strategy for live execution: the caller is notified immediately
 * through a notification transport.
 */
public class StreamingInterruptHandler extends CheckpointingInterruptHandler {

    private final NotificationTransport transport;

    public StreamingInterruptHandler(CheckpointRepository checkpointRepository, NotificationTransport transport) {
        super(checkpointRepository);
        this.transport = transport;
    }

    @Override
    protected void notifyCaller(InterruptContext context) {
        // Session ids are task ids
        transport.emit(new InterruptNotification(
            context.sessionId(), context.sessionId(), context.exchangeId(), context.payload()));
    }
}
