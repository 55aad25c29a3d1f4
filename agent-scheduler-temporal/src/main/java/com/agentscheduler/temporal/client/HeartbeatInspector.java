package com.agentscheduler.temporal.client;

import com.agentscheduler.core.model.ProgressPayload;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.api.workflow.v1.PendingActivityInfo;
import io.temporal.api.workflowservice.v1.DescribeWorkflowExecutionRequest;
import io.temporal.api.workflowservice.v1.DescribeWorkflowExecutionResponse;
import io.temporal.client.WorkflowClient;
import io.temporal.common.converter.DataConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads the latest heartbeat details of a workflow's pending agent activity.
 */
public class HeartbeatInspector {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatInspector.class);

    private final WorkflowClient client;

    public HeartbeatInspector(WorkflowClient client) {
        this.client = client;
    }

    /**
     * Empty when no activity is pending, it has not heartbeated yet, or the
     * describe call fails.
     */
    public Optional<ProgressPayload> latest(String workflowId, String runId) {
        DescribeWorkflowExecutionRequest request = DescribeWorkflowExecutionRequest.newBuilder()
            .setNamespace(client.getOptions().getNamespace())
            .setExecution(WorkflowExecution.newBuilder()
                .setWorkflowId(workflowId)
                .setRunId(runId == null ? "" : runId)
                .build())
            .build();
        try {
            DescribeWorkflowExecutionResponse response =
                client.getWorkflowServiceStubs().blockingStub().describeWorkflowExecution(request);
            DataConverter converter = client.getOptions().getDataConverter();
            for (PendingActivityInfo activity : response.getPendingActivitiesList()) {
                if (activity.hasHeartbeatDetails()) {
                    return Optional.ofNullable(converter.fromPayloads(
                        0, Optional.of(activity.getHeartbeatDetails()), ProgressPayload.class, ProgressPayload.class));
                }
            }
        } catch (RuntimeException e) {
            log.debug("Could not read heartbeat of workflow {}: {}", workflowId, e.getMessage());
        }
        return Optional.empty();
    }
}
