package com.agentscheduler.core.interrupt;

/**
 * Delivers interrupt notifications to whoever is waiting on the task.
 */
@FunctionalInterface
public interface NotificationTransport {

    void emit(InterruptNotification notification);
}
