package com.agentscheduler.api.rest;

import com.agentscheduler.core.model.TaskProgress;
import com.agentscheduler.core.model.TaskRecord;
import com.agentscheduler.core.model.TaskStatus;
import com.agentscheduler.engine.config.SchedulerProperties;
import com.agentscheduler.engine.service.TaskLifecycleService;
import com.agentscheduler.engine.service.TaskResumeService;
import com.agentscheduler.engine.service.TaskSubmission;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * REST API for agent tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class AgentTaskController {

    static final String USER_HEADER = "X-User-Id";
    static final String DEFAULT_USER = "anonymous";

    private final TaskLifecycleService lifecycleService;
    private final TaskResumeService resumeService;
    private final SchedulerProperties properties;

    public AgentTaskController(
            TaskLifecycleService lifecycleService,
            TaskResumeService resumeService,
            SchedulerProperties properties) {
        this.lifecycleService = lifecycleService;
        this.resumeService = resumeService;
        this.properties = properties;
    }

    /**
     * Submit a task. Returns once the backend accepted it.
     */
    @PostMapping
    public ResponseEntity<SubmitTaskResponse> submit(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @RequestBody SubmitTaskRequest request) {

        TaskRecord record = lifecycleService.submit(new TaskSubmission(
            userId,
            request.taskId(),
            request.targetAgent(),
            request.requestText(),
            request.context(),
            request.parameters()));

        return ResponseEntity.status(HttpStatus.CREATED).body(new SubmitTaskResponse(
            record.taskId(), record.status(), record.workflowId(), record.runId()));
    }

    @GetMapping
    public ResponseEntity<TaskListResponse> list(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @RequestParam(value = "status", required = false) List<TaskStatus> statuses,
            @RequestParam(value = "targetAgent", required = false) String targetAgent,
            @RequestParam(value = "limit", required = false) Integer limit) {

        Set<TaskStatus> filter = statuses == null || statuses.isEmpty()
            ? EnumSet.allOf(TaskStatus.class)
            : EnumSet.copyOf(statuses);
        int effectiveLimit = limit == null ? properties.getListLimit() : Math.max(1, limit);

        List<TaskResponse> items = lifecycleService.list(userId, filter, targetAgent, effectiveLimit).stream()
            .map(TaskResponse::from)
            .toList();
        return ResponseEntity.ok(new TaskListResponse(items));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> get(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(lifecycleService.get(userId, taskId)));
    }

    /**
     * Live progress as reported by the execution backend.
     */
    @GetMapping("/{taskId}/progress")
    public ResponseEntity<ProgressResponse> progress(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String taskId) {

        TaskRecord record = lifecycleService.get(userId, taskId);
        TaskProgress progress = lifecycleService.progress(userId, taskId);
        return ResponseEntity.ok(new ProgressResponse(taskId, record.workflowId(), record.runId(), progress));
    }

    /**
     * Answer the question a blocked task is waiting on.
     */
    @PostMapping("/{taskId}/resume")
    public ResponseEntity<TaskResponse> resume(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String taskId,
            @RequestBody ResumeRequest request) {

        TaskRecord record = resumeService.resume(userId, taskId, request.exchangeId(), request.userResponse());
        return ResponseEntity.ok(TaskResponse.from(record));
    }

    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<TaskResponse> cancel(
            @RequestHeader(value = USER_HEADER, defaultValue = DEFAULT_USER) String userId,
            @PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(lifecycleService.cancel(userId, taskId)));
    }

    // ========== DTOs ==========

    public record SubmitTaskRequest(
        String taskId,
        String targetAgent,
        String requestText,
        JsonNode context,
        JsonNode parameters
    ) {}

    public record SubmitTaskResponse(
        String taskId,
        TaskStatus status,
        String workflowId,
        String runId
    ) {}

    public record ResumeRequest(String exchangeId, JsonNode userResponse) {}

    public record ProgressResponse(
        String taskId,
        String workflowId,
        String runId,
        TaskProgress progress
    ) {}

    public record TaskListResponse(List<TaskResponse> items) {}

    public record TaskResponse(
        String taskId,
        String targetAgent,
        TaskStatus status,
        String requestText,
        String workflowId,
        String runId,
        String lastMessage,
        double percentComplete,
        List<String> artifacts,
        JsonNode errorDetails,
        JsonNode blockedDetails,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static TaskResponse from(TaskRecord record) {
            return new TaskResponse(
                record.taskId(),
                record.targetAgent(),
                record.status(),
                record.requestText(),
                record.workflowId(),
                record.runId(),
                record.lastMessage(),
                record.percentComplete(),
                record.artifacts(),
                record.errorDetails(),
                record.blockedDetails(),
                record.createdAt(),
                record.updatedAt()
            );
        }
    }
}
