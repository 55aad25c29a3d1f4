package com.agentscheduler.engine.config;

import com.agentscheduler.core.model.RetrySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scheduler configuration, bound from {@code agent.scheduler.*}.
 */
@ConfigurationProperties(prefix = "agent.scheduler")
public class SchedulerProperties {

    /** Execution backend: in-memory or temporal. */
    private String backend = "in-memory";

    /** Task record and checkpoint store: memory or jdbc. */
    private String store = "memory";

    /** Threads for backend calls and lifecycle event consumption. */
    private int executorThreads = 8;

    /** Maximum number of records returned by a list call. */
    private int listLimit = 20;

    private final Temporal temporal = new Temporal();

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getListLimit() {
        return listLimit;
    }

    public void setListLimit(int listLimit) {
        this.listLimit = listLimit;
    }

    public Temporal getTemporal() {
        return temporal;
    }

    /**
     * Durable backend connection and activity policy.
     */
    public static class Temporal {

        private String target = "127.0.0.1:7233";
        private String namespace = "default";
        private String taskQueue = "agent-tasks";
        private String workflowIdPrefix = "agent-task";
        private boolean workerEnabled = false;
        private String progressQueryName = "progress";
        private Duration startToCloseTimeout = Duration.ofHours(1);
        private Duration heartbeatTimeout = Duration.ofMinutes(1);
        private int maxAttempts = 3;
        private Duration initialInterval = Duration.ofSeconds(1);
        private double backoffCoefficient = 2.0;
        private Duration maximumInterval = Duration.ofMinutes(1);
        private List<String> nonRetryableErrors = List.of(
            "java.lang.IllegalArgumentException",
            "com.agentscheduler.core.exception.TaskValidationException",
            "com.agentscheduler.core.exception.TaskForbiddenException"
        );

        /**
         * Activity retry settings assembled from the flat properties.
         */
        public RetrySettings retrySettings() {
            return RetrySettings.builder()
                .maxAttempts(maxAttempts)
                .initialInterval(initialInterval)
                .backoffCoefficient(backoffCoefficient)
                .maximumInterval(maximumInterval)
                .nonRetryableErrors(Set.copyOf(new LinkedHashSet<>(nonRetryableErrors)))
                .build();
        }

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getTaskQueue() {
            return taskQueue;
        }

        public void setTaskQueue(String taskQueue) {
            this.taskQueue = taskQueue;
        }

        public String getWorkflowIdPrefix() {
            return workflowIdPrefix;
        }

        public void setWorkflowIdPrefix(String workflowIdPrefix) {
            this.workflowIdPrefix = workflowIdPrefix;
        }

        public boolean isWorkerEnabled() {
            return workerEnabled;
        }

        public void setWorkerEnabled(boolean workerEnabled) {
            this.workerEnabled = workerEnabled;
        }

        public String getProgressQueryName() {
            return progressQueryName;
        }

        public void setProgressQueryName(String progressQueryName) {
            this.progressQueryName = progressQueryName;
        }

        public Duration getStartToCloseTimeout() {
            return startToCloseTimeout;
        }

        public void setStartToCloseTimeout(Duration startToCloseTimeout) {
            this.startToCloseTimeout = startToCloseTimeout;
        }

        public Duration getHeartbeatTimeout() {
            return heartbeatTimeout;
        }

        public void setHeartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialInterval() {
            return initialInterval;
        }

        public void setInitialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
        }

        public double getBackoffCoefficient() {
            return backoffCoefficient;
        }

        public void setBackoffCoefficient(double backoffCoefficient) {
            this.backoffCoefficient = backoffCoefficient;
        }

        public Duration getMaximumInterval() {
            return maximumInterval;
        }

        public void setMaximumInterval(Duration maximumInterval) {
            this.maximumInterval = maximumInterval;
        }

        public List<String> getNonRetryableErrors() {
            return nonRetryableErrors;
        }

        public void setNonRetryableErrors(List<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
        }
    }
}
