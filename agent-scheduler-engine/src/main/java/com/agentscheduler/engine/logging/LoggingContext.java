package com.agentscheduler.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the task and workflow ids for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId, workflowId, runId)) {
 *     log.info("Task accepted"); // Automatically includes taskId, workflowId, runId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String RUN_ID = "runId";
    public static final String AGENT = "agent";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for a task.
     */
    public static LoggingContext forTask(String taskId) {
        return forTask(taskId, null, null);
    }

    /**
     * Create a logging context for a task and its workflow execution.
     */
    public static LoggingContext forTask(String taskId, String workflowId, String runId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(TASK_ID, taskId);
        putIfPresent(WORKFLOW_ID, workflowId);
        putIfPresent(RUN_ID, runId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one activity attempt.
     */
    public static LoggingContext forActivity(String taskId, String agent, String workflowId, String runId, int attempt) {
        LoggingContext ctx = forTask(taskId, workflowId, runId);
        putIfPresent(AGENT, agent);
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(WORKFLOW_ID);
        MDC.remove(RUN_ID);
        MDC.remove(AGENT);
        MDC.remove(ATTEMPT);
        // Keep TRACE_ID for request-scoped tracing
    }
}
