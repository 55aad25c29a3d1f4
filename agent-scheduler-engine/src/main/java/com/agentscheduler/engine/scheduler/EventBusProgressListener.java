package com.agentscheduler.engine.scheduler;

import com.agentscheduler.core.agent.AgentExecutionListener;
import com.agentscheduler.core.model.ProgressPayload;
import com.agentscheduler.core.model.TaskEvent;
import com.agentscheduler.core.model.TaskProgress;
import com.agentscheduler.engine.eventbus.TaskEventBus;

import java.util.function.Consumer;

/**
 * Publishes each agent phase as a progress event and hands the snapshot
 * to the backend's bookkeeping.
 */
class EventBusProgressListener implements AgentExecutionListener {

    private final TaskEventBus eventBus;
    private final String taskId;
    private final Consumer<TaskProgress> snapshotSink;

    EventBusProgressListener(TaskEventBus eventBus, String taskId, Consumer<TaskProgress> snapshotSink) {
        this.eventBus = eventBus;
        this.taskId = taskId;
        this.snapshotSink = snapshotSink;
    }

    @Override
    public void onStepStarted(String step) {
        report(ProgressPayload.of(step, ProgressPayload.PHASE_STEP));
    }

    @Override
    public void onToolStarted(String tool) {
        report(ProgressPayload.of(tool, ProgressPayload.PHASE_TOOL));
    }

    private void report(ProgressPayload payload) {
        TaskProgress progress = payload.toProgress();
        snapshotSink.accept(progress);
        eventBus.publish(TaskEvent.progress(taskId, progress));
    }
}
