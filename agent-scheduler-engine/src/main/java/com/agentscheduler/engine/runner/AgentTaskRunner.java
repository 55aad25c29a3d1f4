package com.agentscheduler.engine.runner;

import com.agentscheduler.core.agent.AgentExecutionListener;
import com.agentscheduler.core.agent.AgentExecutor;
import com.agentscheduler.core.agent.AgentInput;
import com.agentscheduler.core.agent.AgentOutcome;
import com.agentscheduler.core.agent.AgentRegistry;
import com.agentscheduler.core.exception.InterruptContractException;
import com.agentscheduler.core.exception.TaskValidationException;
import com.agentscheduler.core.interrupt.InterruptContext;
import com.agentscheduler.core.interrupt.InterruptHandler;
import com.agentscheduler.core.model.AgentTaskResult;
import com.agentscheduler.core.model.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Runs one agent invocation and maps its outcome to a task result.
 * Shared by the in-process backend and the durable activity.
 * 
 * Exceptions thrown by the agent are propagated unchanged so the caller
 * decides between retrying and failing the task.
 */
public class AgentTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentTaskRunner.class);

    private final AgentRegistry agentRegistry;

    public AgentTaskRunner(AgentRegistry agentRegistry) {
        this.agentRegistry = agentRegistry;
    }

    /**
     * Run the agent named by the input.
     * 
     * @param input agent input
     * @param listener phase hook, e.g. heartbeats or progress events
     * @param interruptHandler strategy used if the agent suspends
     * @return completed, blocked or failed result
     * @throws TaskValidationException if the agent is unknown
     * @throws InterruptContractException if the agent suspends without a checkpoint
     */
    public AgentTaskResult run(AgentInput input, AgentExecutionListener listener, InterruptHandler interruptHandler) {
        AgentExecutor executor = agentRegistry.find(input.targetAgent())
            .orElseThrow(() -> new TaskValidationException("Unknown target agent: " + input.targetAgent()));

        log.info("Running agent {} for task {} (resuming={})",
            input.targetAgent(), input.taskId(), input.resuming());

        AgentOutcome outcome = executor.run(input, listener);
        if (outcome == null) {
            throw new IllegalStateException("Agent " + input.targetAgent() + " returned no outcome");
        }

        return switch (outcome.kind()) {
            case COMPLETED -> {
                log.info("Agent {} completed task {}", input.targetAgent(), input.taskId());
                yield AgentTaskResult.completed(outcome.summary(), outcome.artifacts());
            }
            case SUSPENDED -> suspend(input, outcome, interruptHandler);
            case FAILED -> {
                log.warn("Agent {} reported failure for task {}: {}",
                    input.targetAgent(), input.taskId(), outcome.error());
                yield AgentTaskResult.failed(outcome.error());
            }
        };
    }

    private AgentTaskResult suspend(AgentInput input, AgentOutcome outcome, InterruptHandler interruptHandler) {
        if (outcome.checkpoint() == null) {
            throw new InterruptContractException(
                "Agent " + input.targetAgent() + " suspended task " + input.taskId() + " without a checkpoint");
        }
        String sessionId = input.taskId();
        String exchangeId = UUID.randomUUID().toString();
        Checkpoint checkpoint = outcome.checkpoint().forExchange(sessionId, exchangeId);

        log.info("Agent {} suspended task {} awaiting human input (exchangeId={})",
            input.targetAgent(), input.taskId(), exchangeId);
        interruptHandler.onInterrupt(new InterruptContext(sessionId, exchangeId, outcome.interruptPayload(), checkpoint));
        return AgentTaskResult.blocked(sessionId, exchangeId, outcome.interruptPayload());
    }
}
