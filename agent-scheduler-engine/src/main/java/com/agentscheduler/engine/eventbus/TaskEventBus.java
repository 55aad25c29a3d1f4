package com.agentscheduler.engine.eventbus;

import com.agentscheduler.core.model.TaskEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process fan-out of task events to per-task subscribers.
 * 
 * Guarantees:
 * - A subscriber receives every event published after {@link #subscribe} returns
 * - Events published with no subscriber are dropped (no replay)
 * - Publish order is preserved per publishing thread
 * 
 * Publishers share the read lock; subscribing and unsubscribing take the write lock.
 */
public class TaskEventBus {

    private static final Logger log = LoggerFactory.getLogger(TaskEventBus.class);

    private final Map<String, Set<TaskSubscription.Channel>> channels = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Register a channel for the task. The channel exists as soon as this returns,
     * so events published before the caller starts iterating are buffered.
     *
     * The bus keeps no history: subscribing after the task's terminal event yields
     * no events, and the subscription stays open until it is closed. Callers that
     * may subscribe late check the task record first, or iterate with
     * {@link TaskSubscription#poll} and a timeout.
     */
    public TaskSubscription subscribe(String taskId) {
        TaskSubscription.Channel channel = new TaskSubscription.Channel();
        lock.writeLock().lock();
        try {
            channels.computeIfAbsent(taskId, id -> new LinkedHashSet<>()).add(channel);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Subscribed to task events: taskId={}", taskId);
        return new TaskSubscription(this, taskId, channel);
    }

    /**
     * Deliver the event to every current subscriber of its task.
     */
    public void publish(TaskEvent event) {
        lock.readLock().lock();
        try {
            Set<TaskSubscription.Channel> subscribers = channels.get(event.taskId());
            if (subscribers == null || subscribers.isEmpty()) {
                log.debug("No subscribers, dropping {} event for task {}", event.type(), event.taskId());
                return;
            }
            for (TaskSubscription.Channel channel : subscribers) {
                channel.offer(event);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    public int subscriberCount(String taskId) {
        lock.readLock().lock();
        try {
            Set<TaskSubscription.Channel> subscribers = channels.get(taskId);
            return subscribers == null ? 0 : subscribers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    void unregister(String taskId, TaskSubscription.Channel channel) {
        lock.writeLock().lock();
        try {
            Set<TaskSubscription.Channel> subscribers = channels.get(taskId);
            if (subscribers != null) {
                subscribers.remove(channel);
                if (subscribers.isEmpty()) {
                    channels.remove(taskId);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Unsubscribed from task events: taskId={}", taskId);
    }
}
