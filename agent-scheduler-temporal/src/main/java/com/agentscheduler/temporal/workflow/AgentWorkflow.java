package com.agentscheduler.temporal.workflow;

import com.agentscheduler.core.agent.AgentInput;
import com.agentscheduler.core.model.AgentTaskResult;
import com.agentscheduler.core.model.TaskProgress;
import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Durable execution of one agent task.
 */
@WorkflowInterface
public interface AgentWorkflow {

    String WORKFLOW_TYPE = "AgentWorkflow";

    /**
     * Run the agent activity and return a terminal or blocked result.
     * Never fails: activity failures and cancellation are returned as results.
     */
    @WorkflowMethod(name = WORKFLOW_TYPE)
    AgentTaskResult run(AgentInput input);

    /**
     * Latest progress known to the workflow itself. Heartbeats of the running
     * activity are not visible here.
     */
    @QueryMethod(name = "progress")
    TaskProgress progress();
}
