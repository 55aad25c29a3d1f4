package com.agentscheduler.engine.eventbus;

import com.agentscheduler.core.model.TaskEvent;
import com.agentscheduler.core.model.TaskProgress;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, blocking sequence of events for one task.
 * Ends after the first terminal event. Closing it, including abandoning a
 * stream early, unregisters the channel from the bus.
 * A subscription opened after the terminal event never sees one, so its
 * iterator blocks until {@link #close} is called.
 */
public class TaskSubscription implements Iterable<TaskEvent>, AutoCloseable {

    private final TaskEventBus bus;
    private final String taskId;
    private final Channel channel;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    TaskSubscription(TaskEventBus bus, String taskId, Channel channel) {
        this.bus = bus;
        this.taskId = taskId;
        this.channel = channel;
    }

    public String taskId() {
        return taskId;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Wait up to {@code timeout} for the next event.
     * 
     * @return the event, or empty on timeout or once the subscription is closed
     */
    public Optional<TaskEvent> poll(Duration timeout) throws InterruptedException {
        if (closed.get()) {
            return Optional.empty();
        }
        TaskEvent event = channel.queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (event == null || event == Channel.CLOSED) {
            return Optional.empty();
        }
        if (event.isTerminal()) {
            close();
        }
        return Optional.of(event);
    }

    @Override
    public Iterator<TaskEvent> iterator() {
        return new EventIterator();
    }

    /**
     * Stream view of the subscription. Closing the stream closes the subscription.
     */
    public Stream<TaskEvent> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false)
            .onClose(this::close);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            bus.unregister(taskId, channel);
            // Wake up a consumer blocked in the iterator
            channel.queue.offer(Channel.CLOSED);
        }
    }

    private class EventIterator implements Iterator<TaskEvent> {

        private TaskEvent buffered;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (buffered != null) {
                return true;
            }
            if (finished || closed.get()) {
                finished = true;
                return false;
            }
            try {
                TaskEvent event = channel.queue.take();
                if (event == Channel.CLOSED) {
                    finished = true;
                    return false;
                }
                buffered = event;
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finished = true;
                close();
                return false;
            }
        }

        @Override
        public TaskEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Subscription for task " + taskId + " has ended");
            }
            TaskEvent event = buffered;
            buffered = null;
            if (event.isTerminal()) {
                finished = true;
                close();
            }
            return event;
        }
    }

    static final class Channel {

        // Sentinel used to release a blocked consumer on close
        static final TaskEvent CLOSED = TaskEvent.progress("__closed__", TaskProgress.unknown());

        final BlockingQueue<TaskEvent> queue = new LinkedBlockingQueue<>();

        void offer(TaskEvent event) {
            queue.offer(event);
        }
    }
}
