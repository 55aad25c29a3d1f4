package com.agentscheduler.temporal.activity;

import com.agentscheduler.core.agent.AgentInput;
import com.agentscheduler.core.model.AgentTaskResult;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/**
 * The single activity of the agent workflow: run the agent once.
 */
@ActivityInterface
public interface AgentActivities {

    @ActivityMethod(name = "RunAgent")
    AgentTaskResult runAgent(AgentInput input);
}
