package com.pipeline.api.config;

import com.pipeline.core.repository.TaskRepository;
import com.pipeline.engine.budget.ConcurrencyBudgetManager;
import com.pipeline.engine.event.PipelineEventBus;
import com.pipeline.engine.metrics.PipelineMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Prometheus metrics configuration for the pipeline scheduler.
 *
 * Configures:
 * - Common tags for all metrics
 * - The scheduler meter binder, subscribed to the event bus for outcome counters
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "content-pipeline-scheduler");
    }

    @Bean
    public PipelineMetrics pipelineMetrics(
            ConcurrencyBudgetManager budgetManager,
            TaskRepository taskRepository,
            PipelineEventBus eventBus) {
        PipelineMetrics metrics = new PipelineMetrics(budgetManager, taskRepository);
        eventBus.subscribe(metrics);
        return metrics;
    }
}
