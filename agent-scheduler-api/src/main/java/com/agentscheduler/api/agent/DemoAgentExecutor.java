package com.agentscheduler.api.agent;

import com.agentscheduler.core.agent.AgentExecutionListener;
import com.agentscheduler.core.agent.AgentInput;
import com.agentscheduler.core.agent.AgentOutcome;
import com.agentscheduler.core.agent.NamedAgent;
import com.agentscheduler.core.model.Checkpoint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Local development agent. Plans, looks the request up, and answers with a summary.
 * With the parameter {@code require_approval=true} it first asks for approval.
 */
@Component
public class DemoAgentExecutor implements NamedAgent {

    private static final Logger log = LoggerFactory.getLogger(DemoAgentExecutor.class);

    public static final String NAME = "demo";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AgentOutcome run(AgentInput input, AgentExecutionListener listener) {
        String requestText = input.payload().path("request_text").asText();
        JsonNode parameters = input.payload().path("parameters");

        if (input.resuming()) {
            listener.onStepStarted("apply decision");
            String decision = input.humanInput() == null ? "" : input.humanInput().asText();
            log.info("Demo agent resumed task {} with decision '{}'", input.taskId(), decision);
            if (!"yes".equalsIgnoreCase(decision) && !"approve".equalsIgnoreCase(decision)) {
                return AgentOutcome.failed("Request was not approved");
            }
            return AgentOutcome.completed("Approved and handled: " + requestText, List.of());
        }

        listener.onStepStarted("plan");
        listener.onToolStarted("lookup");

        if (parameters.path("require_approval").asBoolean(false)) {
            ObjectNode question = JsonNodeFactory.instance.objectNode()
                .put("question", "Proceed with: " + requestText + "?");
            ObjectNode state = JsonNodeFactory.instance.objectNode().put("request_text", requestText);
            return AgentOutcome.suspended(question, Checkpoint.of(input.taskId(), "pending", state));
        }

        return AgentOutcome.completed("Demo agent handled: " + requestText, List.of());
    }
}
