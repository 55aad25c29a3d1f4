package com.agentscheduler.engine.interrupt;

import com.agentscheduler.core.interrupt.InterruptNotification;
import com.agentscheduler.core.interrupt.NotificationTransport;
import com.agentscheduler.core.model.TaskEvent;
import com.agentscheduler.engine.eventbus.TaskEventBus;

/**
 * Publishes interrupts as blocked progress events.
 */
public class EventBusNotificationTransport implements NotificationTransport {

    static final String BLOCKED_MESSAGE = "Agent is waiting for human input/approval.";

    private final TaskEventBus eventBus;

    public EventBusNotificationTransport(TaskEventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void emit(InterruptNotification notification) {
        eventBus.publish(TaskEvent.blocked(
            notification.taskId(),
            BLOCKED_MESSAGE,
            notification.sessionId(),
            notification.exchangeId(),
            notification.payload()));
    }
}
