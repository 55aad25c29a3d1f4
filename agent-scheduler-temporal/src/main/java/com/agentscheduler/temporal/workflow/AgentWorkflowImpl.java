package com.agentscheduler.temporal.workflow;

import com.agentscheduler.core.agent.AgentInput;
import com.agentscheduler.core.model.AgentTaskResult;
import com.agentscheduler.core.model.TaskProgress;
import com.agentscheduler.temporal.activity.AgentActivities;
import io.temporal.activity.ActivityOptions;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.failure.CanceledFailure;
import io.temporal.failure.TemporalFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

/**
 * Orchestration for {@link AgentWorkflow}. Deterministic: no I/O, and logging
 * only through the replay-safe workflow logger.
 */
public class AgentWorkflowImpl implements AgentWorkflow {

    private static final Logger log = Workflow.getLogger(AgentWorkflowImpl.class);

    private final AgentActivities activities;
    private TaskProgress progress = TaskProgress.unknown();

    public AgentWorkflowImpl(ActivityOptions activityOptions) {
        this.activities = Workflow.newActivityStub(AgentActivities.class, activityOptions);
    }

    @Override
    public AgentTaskResult run(AgentInput input) {
        progress = TaskProgress.running(0, "started");
        AgentTaskResult result;
        try {
            result = activities.runAgent(input);
        } catch (ActivityFailure e) {
            if (e.getCause() instanceof CanceledFailure) {
                log.info("Agent activity canceled for task {}", input.taskId());
                result = AgentTaskResult.canceled("Activity canceled");
            } else {
                log.warn("Agent activity failed for task {}: {}", input.taskId(), e.getMessage());
                result = AgentTaskResult.failed("Activity failed: " + describe(e));
            }
        } catch (CanceledFailure e) {
            log.info("Workflow canceled for task {}", input.taskId());
            result = AgentTaskResult.canceled("Workflow canceled");
        } catch (RuntimeException e) {
            log.error("Unexpected workflow failure for task {}", input.taskId(), e);
            result = AgentTaskResult.failed("Workflow failed: " + describe(e));
        }
        progress = result.toProgress();
        return result;
    }

    @Override
    public TaskProgress progress() {
        return progress;
    }

    /**
     * Short description of the root failure: exception type and original message.
     */
    static String describe(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root instanceof ApplicationFailure) {
            ApplicationFailure applicationFailure = (ApplicationFailure) root;
            String type = applicationFailure.getType();
            String shortType = type == null ? "ApplicationFailure" : type.substring(type.lastIndexOf('.') + 1);
            return firstLine(shortType + ": " + applicationFailure.getOriginalMessage());
        }
        if (root instanceof TemporalFailure) {
            return firstLine(root.getClass().getSimpleName() + ": " + ((TemporalFailure) root).getOriginalMessage());
        }
        return AgentTaskResult.summarize("", root).trim();
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline) : text;
    }
}
