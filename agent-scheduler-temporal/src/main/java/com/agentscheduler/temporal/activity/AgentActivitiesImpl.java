package com.agentscheduler.temporal.activity;

import com.agentscheduler.core.agent.AgentExecutionException;
import com.agentscheduler.core.agent.AgentInput;
import com.agentscheduler.core.exception.InterruptContractException;
import com.agentscheduler.core.model.AgentTaskResult;
import com.agentscheduler.core.repository.CheckpointRepository;
import com.agentscheduler.engine.logging.LoggingContext;
import com.agentscheduler.engine.runner.AgentTaskRunner;
import io.temporal.activity.Activity;
import io.temporal.activity.ActivityExecutionContext;
import io.temporal.activity.ActivityInfo;
import io.temporal.failure.ApplicationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the agent inside the durable activity.
 * 
 * Exceptions are rethrown so the engine applies the retry policy. Agents
 * declare permanent failures with a non-retryable {@link AgentExecutionException};
 * an interrupt without a checkpoint is never retried.
 */
public class AgentActivitiesImpl implements AgentActivities {

    private static final Logger log = LoggerFactory.getLogger(AgentActivitiesImpl.class);

    private final AgentTaskRunner runner;
    private final CheckpointRepository checkpointRepository;

    public AgentActivitiesImpl(AgentTaskRunner runner, CheckpointRepository checkpointRepository) {
        this.runner = runner;
        this.checkpointRepository = checkpointRepository;
    }

    @Override
    public AgentTaskResult runAgent(AgentInput input) {
        ActivityExecutionContext context = Activity.getExecutionContext();
        ActivityInfo info = context.getInfo();
        try (LoggingContext ctx = LoggingContext.forActivity(
                input.taskId(), input.targetAgent(), info.getWorkflowId(), info.getRunId(), info.getAttempt())) {
            HeartbeatEmitter emitter = new HeartbeatEmitter(context);
            try {
                return runner.run(input,
                    new HeartbeatProgressListener(emitter),
                    new DurableInterruptHandler(checkpointRepository, emitter));
            } catch (AgentExecutionException e) {
                log.warn("Agent {} failed on attempt {} (retryable={}): {}",
                    input.targetAgent(), info.getAttempt(), e.isRetryable(), e.getMessage());
                if (!e.isRetryable()) {
                    throw ApplicationFailure.newNonRetryableFailure(e.getMessage(), e.getErrorCode());
                }
                throw e;
            } catch (InterruptContractException e) {
                // An agent that suspends without a checkpoint does so on every attempt
                log.error("Agent {} broke the interrupt contract: {}", input.targetAgent(), e.getMessage());
                throw ApplicationFailure.newNonRetryableFailure(e.getMessage(), InterruptContractException.class.getName());
            } catch (RuntimeException e) {
                log.warn("Agent {} failed on attempt {}", input.targetAgent(), info.getAttempt(), e);
                throw e;
            }
        }
    }
}
