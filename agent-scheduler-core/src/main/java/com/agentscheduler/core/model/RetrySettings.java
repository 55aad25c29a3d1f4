package com.agentscheduler.core.model;

import java.time.Duration;
import java.util.Set;

/**
 * Retry behavior for the agent activity, as configured.
 * The durable backend maps it onto the engine's own retry options, which do the retrying.
 * 
 * Invariants:
 * - maxAttempts >= 1
 * - initialInterval > 0
 * - maximumInterval >= initialInterval
 * - backoffCoefficient >= 1.0
 * - nonRetryableErrors holds fully qualified exception type names
 */
public record RetrySettings(
    int maxAttempts,
    Duration initialInterval,
    Duration maximumInterval,
    double backoffCoefficient,
    Set<String> nonRetryableErrors
) {
    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialInterval == null || initialInterval.isNegative() || initialInterval.isZero()) {
            throw new IllegalArgumentException("initialInterval must be positive");
        }
        if (maximumInterval == null || maximumInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maximumInterval must be >= initialInterval");
        }
        if (backoffCoefficient < 1.0) {
            throw new IllegalArgumentException("backoffCoefficient must be >= 1.0");
        }
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default settings: 3 attempts, 1s initial interval doubling up to 1 minute.
     * Argument and authorization errors are never retried.
     */
    public static RetrySettings defaultSettings() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialInterval = Duration.ofSeconds(1);
        private Duration maximumInterval = Duration.ofMinutes(1);
        private double backoffCoefficient = 2.0;
        private Set<String> nonRetryableErrors = Set.of(
            "java.lang.IllegalArgumentException",
            "com.agentscheduler.core.exception.TaskValidationException",
            "com.agentscheduler.core.exception.TaskForbiddenException"
        );

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
            return this;
        }

        public Builder maximumInterval(Duration maximumInterval) {
            this.maximumInterval = maximumInterval;
            return this;
        }

        public Builder backoffCoefficient(double backoffCoefficient) {
            this.backoffCoefficient = backoffCoefficient;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetrySettings build() {
            return new RetrySettings(
                maxAttempts, initialInterval, maximumInterval,
                backoffCoefficient, nonRetryableErrors
            );
        }
    }
}
