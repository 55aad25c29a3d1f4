package com.agentscheduler.temporal.worker;

import io.temporal.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.util.concurrent.TimeUnit;

/**
 * Starts the in-process worker once the application is ready and drains it on shutdown.
 */
public class AgentWorkerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AgentWorkerLifecycle.class);

    private final WorkerFactory workerFactory;
    private final long shutdownTimeoutSeconds;

    public AgentWorkerLifecycle(WorkerFactory workerFactory, long shutdownTimeoutSeconds) {
        this.workerFactory = workerFactory;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        workerFactory.start();
        log.info("Temporal worker started");
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void shutdown() {
        if (!workerFactory.isStarted() || workerFactory.isShutdown()) {
            return;
        }
        log.info("Shutting down Temporal worker, waiting up to {}s for running activities", shutdownTimeoutSeconds);
        workerFactory.shutdown();
        workerFactory.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS);
        if (!workerFactory.isTerminated()) {
            log.warn("Temporal worker did not terminate in time, forcing shutdown");
            workerFactory.shutdownNow();
        }
    }
}
