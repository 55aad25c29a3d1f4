package com.agentscheduler.core.agent;

import com.agentscheduler.core.model.Checkpoint;
import com.agentscheduler.core.model.Task;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AgentRegistryTest {

    @Test
    @DisplayName("Agents are found by registered name")
    void lookup() {
        AgentExecutor echo = (input, listener) -> AgentOutcome.completed("echo", List.of());
        AgentRegistry registry = new AgentRegistry().register("echo", echo);

        assertThat(registry.find("echo")).containsSame(echo);
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.isKnown("echo")).isTrue();
        assertThat(registry.names()).containsExactly("echo");
    }

    @Test
    @DisplayName("Agent input carries resume data only for resumed tasks")
    void agentInputFromTask() {
        Task task = Task.create("t1", "echo", JsonNodeFactory.instance.objectNode(), null, "alice");

        AgentInput fresh = AgentInput.from(task);
        assertThat(fresh.resuming()).isFalse();
        assertThat(fresh.callerActor()).isEqualTo("alice");

        AgentInput resumed = AgentInput.from(task.withResume(new Task.ResumeDirective("x1",
            JsonNodeFactory.instance.textNode("yes"),
            Checkpoint.of("t1", "x1", JsonNodeFactory.instance.objectNode()))));
        assertThat(resumed.resuming()).isTrue();
        assertThat(resumed.humanInput().asText()).isEqualTo("yes");
    }
}
