package com.pipeline.api.lifecycle;

import com.pipeline.api.config.PipelineProperties;
import com.pipeline.engine.dispatcher.PipelineDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Manages graceful shutdown of the scheduler.
 *
 * On shutdown:
 * 1. Stops admitting tasks
 * 2. Signals running executions and waits for them (bounded by the grace period)
 * 3. Logs what was left behind
 *
 * Executions interrupted here return to pending; anything still running past the
 * grace period is reset by startup recovery on the next start.
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final PipelineDispatcher dispatcher;
    private final Duration gracePeriod;

    public GracefulShutdownHandler(PipelineDispatcher dispatcher, PipelineProperties properties) {
        this.dispatcher = dispatcher;
        this.gracePeriod = properties.getShutdownGracePeriod();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        log.info("Initiating graceful shutdown (grace period {}s)", gracePeriod.toSeconds());

        boolean drained = dispatcher.shutdown(gracePeriod);

        if (drained) {
            log.info("Graceful shutdown complete");
        } else {
            log.warn("Graceful shutdown timed out; unfinished tasks are recovered on next start");
        }
    }
}
