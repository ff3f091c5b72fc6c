package com.pipeline.engine.metrics;

import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;
import com.pipeline.core.repository.TaskRepository;
import com.pipeline.engine.budget.ConcurrencyBudgetManager;
import com.pipeline.engine.event.PipelineEventListener;
import com.pipeline.engine.event.ProjectFinishedEvent;
import com.pipeline.engine.event.TaskStatusEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Metrics for the pipeline scheduler.
 *
 * Metrics exposed:
 * - Live slot usage (active tasks, active projects, per-stage workers, paused flag)
 * - Queue depth
 * - Task outcomes by stage
 * - Drains and finished projects
 *
 * Counters are fed from the event bus; subscribe an instance to receive them.
 */
public class PipelineMetrics implements MeterBinder, PipelineEventListener {

    // Metric names
    public static final String TASKS_ACTIVE = "pipeline.tasks.active";
    public static final String TASKS_PENDING = "pipeline.tasks.pending";
    public static final String PROJECTS_ACTIVE = "pipeline.projects.active";
    public static final String STAGE_WORKERS = "pipeline.stage.workers";
    public static final String SCHEDULER_PAUSED = "pipeline.scheduler.paused";

    public static final String TASKS_STARTED = "pipeline.tasks.started";
    public static final String TASKS_COMPLETED = "pipeline.tasks.completed";
    public static final String TASKS_FAILED = "pipeline.tasks.failed";
    public static final String TASKS_CANCELLED = "pipeline.tasks.cancelled";
    public static final String TASKS_RETRIED = "pipeline.tasks.retried";

    public static final String DRAINS = "pipeline.drains";
    public static final String PROJECTS_FINISHED = "pipeline.projects.finished";

    private final ConcurrencyBudgetManager budgetManager;
    private final TaskRepository taskRepository;
    private volatile MeterRegistry registry;

    public PipelineMetrics(ConcurrencyBudgetManager budgetManager, TaskRepository taskRepository) {
        this.budgetManager = budgetManager;
        this.taskRepository = taskRepository;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(TASKS_ACTIVE, budgetManager, ConcurrencyBudgetManager::activeWorkers)
            .description("Tasks currently holding a budget slot")
            .register(registry);

        Gauge.builder(PROJECTS_ACTIVE, budgetManager, ConcurrencyBudgetManager::activeProjects)
            .description("Projects with at least one processing task")
            .register(registry);

        Gauge.builder(SCHEDULER_PAUSED, budgetManager, m -> m.isPaused() ? 1 : 0)
            .description("1 while admissions are paused")
            .register(registry);

        Gauge.builder(TASKS_PENDING, taskRepository, r -> r.countByStatus(TaskStatus.PENDING))
            .description("Tasks waiting for dispatch")
            .register(registry);

        for (TaskType type : TaskType.values()) {
            Gauge.builder(STAGE_WORKERS, budgetManager, m -> m.stageWorkers().get(type))
                .tag("stage", type.wireName())
                .description("Processing tasks of the stage")
                .register(registry);
        }
    }

    // ========== Event Callbacks ==========

    @Override
    public void onStatusChange(TaskStatusEvent event) {
        switch (event.status()) {
            case PROCESSING -> increment(TASKS_STARTED, event.taskType(), "Tasks admitted for execution");
            case COMPLETED -> increment(TASKS_COMPLETED, event.taskType(), "Tasks completed");
            case FAILED -> increment(TASKS_FAILED, event.taskType(), "Tasks failed");
            case CANCELLED -> increment(TASKS_CANCELLED, event.taskType(), "Tasks cancelled");
            case PENDING -> {
                if (event.isRetry()) {
                    increment(TASKS_RETRIED, event.taskType(), "Failed tasks put back to pending");
                }
            }
        }
    }

    @Override
    public void onPipelineComplete() {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(DRAINS)
            .description("Times the processing set drained to empty")
            .register(current)
            .increment();
    }

    @Override
    public void onProjectFinished(ProjectFinishedEvent event) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(PROJECTS_FINISHED)
            .tag("status", event.status().wireName())
            .description("Projects whose tasks all finished")
            .register(current)
            .increment();
    }

    private void increment(String name, TaskType type, String description) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(name)
            .tag("stage", type.wireName())
            .description(description)
            .register(current)
            .increment();
    }
}
