package com.agentscheduler.temporal.activity;

import com.agentscheduler.core.model.ProgressPayload;
import io.temporal.activity.ActivityExecutionContext;
import io.temporal.client.ActivityCanceledException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class HeartbeatEmitterTest {

    private final ActivityExecutionContext context = mock(ActivityExecutionContext.class);
    private final HeartbeatEmitter emitter = new HeartbeatEmitter(context);

    @Test
    void sendsPayloadAsHeartbeatDetails() {
        ProgressPayload payload = ProgressPayload.of("search", ProgressPayload.PHASE_TOOL);

        emitter.emit(payload);

        verify(context).heartbeat(payload);
    }

    @Test
    void heartbeatFailureDoesNotFailTheAgent() {
        doThrow(new IllegalStateException("connection reset")).when(context).heartbeat(any());

        assertThatCode(() -> emitter.emit(ProgressPayload.of("plan", ProgressPayload.PHASE_STEP)))
            .doesNotThrowAnyException();
    }

    @Test
    void cancellationIsPropagated() {
        doThrow(new ActivityCanceledException()).when(context).heartbeat(any());

        assertThatThrownBy(() -> emitter.emit(ProgressPayload.of("plan", ProgressPayload.PHASE_STEP)))
            .isInstanceOf(ActivityCanceledException.class);
    }
}
