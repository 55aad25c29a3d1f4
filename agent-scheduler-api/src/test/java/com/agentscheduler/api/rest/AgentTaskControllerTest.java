package com.agentscheduler.api.rest;

import com.agentscheduler.engine.metrics.SchedulerMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AgentTaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Demo task t1 runs in-process to completion")
    void submitDemoTask() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"taskId": "t1", "targetAgent": "demo", "requestText": "summarize the weekly report"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.taskId").value("t1"))
            .andExpect(jsonPath("$.workflowId").value("in-memory-t1"));

        mockMvc.perform(get("/api/v1/tasks/t1/progress").header("X-User-Id", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.workflowId").value("in-memory-t1"))
            .andExpect(jsonPath("$.progress.state").value("completed"))
            .andExpect(jsonPath("$.progress.percent").value(100));

        JsonNode task = awaitStatus("alice", "t1", "COMPLETED");
        assertThat(task.path("lastMessage").asText()).isEqualTo("Demo agent handled: summarize the weekly report");

        mockMvc.perform(get("/api/v1/tasks").header("X-User-Id", "alice").param("status", "COMPLETED"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items[?(@.taskId == 't1')]").exists());
    }

    @Test
    @DisplayName("Scheduler metrics carry the application tag exactly once")
    void metricsCarryApplicationTag() throws Exception {
        submit("carol", "t-metrics", "{}");

        Counter submitted = meterRegistry.get(SchedulerMetrics.TASKS_SUBMITTED).counter();
        assertThat(submitted.getId().getTags())
            .filteredOn(tag -> tag.getKey().equals("application"))
            .singleElement()
            .satisfies(tag -> assertThat(tag.getValue()).isEqualTo("agent-scheduler"));
    }

    @Test
    void unknownAgentIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"targetAgent": "nobody", "requestText": "hello"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("TASK_VALIDATION_ERROR"));
    }

    @Test
    void missingTaskIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/tasks/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void otherUsersTaskIsForbidden() throws Exception {
        submit("bob", "t-bob", "{}");

        mockMvc.perform(get("/api/v1/tasks/t-bob").header("X-User-Id", "mallory"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.errorCode").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("Approval round trip: blocked task resumes and completes")
    void approvalRoundTrip() throws Exception {
        submit("carol", "t-approval", "{\"require_approval\": true}");

        JsonNode blocked = awaitStatus("carol", "t-approval", "BLOCKED");
        String exchangeId = blocked.path("blockedDetails").path("exchange_id").asText();
        assertThat(exchangeId).isNotBlank();

        mockMvc.perform(post("/api/v1/tasks/t-approval/resume")
                .header("X-User-Id", "carol")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"exchangeId\": \"" + exchangeId + "\", \"userResponse\": \"yes\"}"))
            .andExpect(status().isOk());

        JsonNode completed = awaitStatus("carol", "t-approval", "COMPLETED");
        assertThat(completed.path("lastMessage").asText()).startsWith("Approved and handled");
    }

    @Test
    void resumingTaskThatIsNotBlockedConflicts() throws Exception {
        submit("dave", "t-done", "{}");
        awaitStatus("dave", "t-done", "COMPLETED");

        mockMvc.perform(post("/api/v1/tasks/t-done/resume")
                .header("X-User-Id", "dave")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"exchangeId\": \"x\", \"userResponse\": \"yes\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"));
    }

    @Test
    void cancelBlockedTask() throws Exception {
        submit("erin", "t-cancel", "{\"require_approval\": true}");
        awaitStatus("erin", "t-cancel", "BLOCKED");

        mockMvc.perform(post("/api/v1/tasks/t-cancel/cancel").header("X-User-Id", "erin"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELED"));
    }

    // ========== Helper Methods ==========

    private void submit(String userId, String taskId, String parameters) throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                .header("X-User-Id", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"taskId\": \"" + taskId + "\", \"targetAgent\": \"demo\", "
                    + "\"requestText\": \"send the report\", \"parameters\": " + parameters + "}"))
            .andExpect(status().isCreated());
    }

    private JsonNode awaitStatus(String userId, String taskId, String expected) throws Exception {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(5));
        JsonNode task;
        do {
            MvcResult result = mockMvc.perform(get("/api/v1/tasks/" + taskId).header("X-User-Id", userId))
                .andExpect(status().isOk())
                .andReturn();
            task = objectMapper.readTree(result.getResponse().getContentAsString());
            if (expected.equals(task.path("status").asText())) {
                return task;
            }
            Thread.sleep(20);
        } while (Instant.now().isBefore(deadline));
        throw new AssertionError("Task " + taskId + " did not reach " + expected + ", last seen " + task);
    }
}
