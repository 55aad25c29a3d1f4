package com.agentscheduler.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskProgressTest {

    @Test
    @DisplayName("Percent outside [0, 100] is rejected")
    void rejectsOutOfRangePercent() {
        assertThatThrownBy(() -> new TaskProgress(ProgressState.RUNNING, 101, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskProgress(ProgressState.RUNNING, -1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Completed progress is always at 100 percent")
    void completedIsFull() {
        TaskProgress progress = TaskProgress.completed("done");

        assertThat(progress.state()).isEqualTo(ProgressState.COMPLETED);
        assertThat(progress.percent()).isEqualTo(100);
    }

    @Test
    @DisplayName("Heartbeat payloads become running or blocked progress")
    void heartbeatPayloadConversion() {
        TaskProgress tool = new ProgressPayload("search", ProgressPayload.PHASE_TOOL, 140).toProgress();
        assertThat(tool.state()).isEqualTo(ProgressState.RUNNING);
        assertThat(tool.percent()).isEqualTo(100);
        assertThat(tool.message()).isEqualTo("tool: search");

        TaskProgress blocked = ProgressPayload.of("approve?", ProgressPayload.PHASE_BLOCKED).toProgress();
        assertThat(blocked.state()).isEqualTo(ProgressState.BLOCKED);
        assertThat(blocked.message()).isEqualTo("approve?");
    }

    @Test
    @DisplayName("Progress state uses lowercase wire names")
    void wireNames() {
        assertThat(ProgressState.UNKNOWN.wireName()).isEqualTo("unknown");
        assertThat(ProgressState.BLOCKED.wireName()).isEqualTo("blocked");
    }
}
