package com.pipeline.api.health;

import com.pipeline.core.model.QueueStats;
import com.pipeline.engine.dispatcher.PipelineDispatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the scheduler.
 * Reports DOWN when the dispatcher is not running or the task store cannot be read,
 * with queue depth, slot usage and the paused flag as details.
 */
@Component("pipeline")
public class PipelineHealthIndicator implements HealthIndicator {

    private final PipelineDispatcher dispatcher;

    public PipelineHealthIndicator(PipelineDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        try {
            QueueStats stats = dispatcher.getStats();
            Health.Builder builder = dispatcher.isRunning() ? Health.up() : Health.down();
            return builder
                .withDetail("running", dispatcher.isRunning())
                .withDetail("paused", dispatcher.getPaused())
                .withDetail("pending", stats.pending())
                .withDetail("processing", stats.processing())
                .withDetail("activeWorkers", stats.activeWorkers())
                .withDetail("activeProjects", stats.activeProjects())
                .withDetail("failedLast24h", stats.failedLast24h())
                .build();
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .build();
        }
    }
}
