package com.agentscheduler.engine.eventbus;

import com.agentscheduler.core.model.TaskEvent;
import com.agentscheduler.core.model.TaskEventType;
import com.agentscheduler.core.model.TaskProgress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class TaskEventBusTest {

    private final TaskEventBus bus = new TaskEventBus();

    @Test
    @DisplayName("Events published without subscribers are not replayed")
    void noReplay() throws Exception {
        bus.publish(TaskEvent.completed("t1", "done", List.of()));

        try (TaskSubscription subscription = bus.subscribe("t1")) {
            assertThat(subscription.poll(Duration.ofMillis(100))).isEmpty();
        }
    }

    @Test
    @DisplayName("A late subscriber stays open with no events until it is closed")
    void lateSubscriberEndsOnlyOnClose() throws Exception {
        bus.publish(TaskEvent.completed("t1", "done", List.of()));
        TaskSubscription subscription = bus.subscribe("t1");
        ExecutorService consumer = Executors.newSingleThreadExecutor();
        try {
            Future<List<TaskEvent>> drained = consumer.submit(() -> subscription.stream().toList());

            assertThat(subscription.poll(Duration.ofMillis(100))).isEmpty();
            assertThat(subscription.isClosed()).isFalse();
            assertThat(drained.isDone()).isFalse();

            subscription.close();

            assertThat(drained.get(5, TimeUnit.SECONDS)).isEmpty();
            assertThat(bus.subscriberCount("t1")).isZero();
        } finally {
            consumer.shutdownNow();
        }
    }

    @Test
    @DisplayName("Sequence ends after the first terminal event")
    void endsAfterTerminal() {
        TaskSubscription subscription = bus.subscribe("t1");
        bus.publish(TaskEvent.progress("t1", TaskProgress.running(10, "step: plan")));
        bus.publish(TaskEvent.completed("t1", "done", List.of()));
        bus.publish(TaskEvent.progress("t1", TaskProgress.running(99, "late")));

        List<TaskEventType> types = subscription.stream().map(TaskEvent::type).collect(Collectors.toList());

        assertThat(types).containsExactly(TaskEventType.PROGRESS, TaskEventType.COMPLETED);
        assertThat(subscription.isClosed()).isTrue();
        assertThat(bus.subscriberCount("t1")).isZero();
    }

    @Test
    @DisplayName("Blocked does not end the sequence; blocked then completed are both observed")
    void blockedThenCompleted() throws Exception {
        TaskSubscription subscription = bus.subscribe("t1");
        CompletableFuture<List<TaskEvent>> consumed = CompletableFuture.supplyAsync(() -> {
            try (subscription) {
                return subscription.stream().collect(Collectors.toList());
            }
        });

        bus.publish(TaskEvent.blocked("t1", "waiting", "t1", "x1", null));
        bus.publish(TaskEvent.completed("t1", "done", List.of()));

        List<TaskEvent> events = consumed.get(5, TimeUnit.SECONDS);
        assertThat(events).hasSize(2);
        assertThat(events.get(0).isBlocked()).isTrue();
        assertThat(events.get(1).type()).isEqualTo(TaskEventType.COMPLETED);
    }

    @Test
    @DisplayName("Every subscriber of a task receives the event; other tasks do not")
    void fanOut() throws Exception {
        try (TaskSubscription first = bus.subscribe("t1");
             TaskSubscription second = bus.subscribe("t1");
             TaskSubscription other = bus.subscribe("t2")) {
            assertThat(bus.subscriberCount("t1")).isEqualTo(2);

            bus.publish(TaskEvent.failed("t1", "boom"));

            assertThat(first.poll(Duration.ofSeconds(1))).isPresent();
            assertThat(second.poll(Duration.ofSeconds(1))).isPresent();
            assertThat(other.poll(Duration.ofMillis(50))).isEmpty();
        }
    }

    @Test
    @DisplayName("Closing a stream early unregisters the channel")
    void earlyCloseUnregisters() {
        TaskSubscription subscription = bus.subscribe("t1");
        bus.publish(TaskEvent.progress("t1", TaskProgress.running(5, "step: a")));

        try (var stream = subscription.stream()) {
            assertThat(stream.findFirst()).isPresent();
        }

        assertThat(subscription.isClosed()).isTrue();
        assertThat(bus.subscriberCount("t1")).isZero();
    }

    @Test
    @DisplayName("Closing from another thread releases a blocked consumer")
    void closeReleasesConsumer() throws Exception {
        TaskSubscription subscription = bus.subscribe("t1");
        CompletableFuture<Long> consumed = CompletableFuture.supplyAsync(() -> subscription.stream().count());

        Thread.sleep(50);
        subscription.close();

        assertThat(consumed.get(5, TimeUnit.SECONDS)).isZero();
    }
}
