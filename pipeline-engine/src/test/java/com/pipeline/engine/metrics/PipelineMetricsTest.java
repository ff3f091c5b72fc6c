package com.pipeline.engine.metrics;

import com.pipeline.core.model.ConcurrencyBudget;
import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProjectStatus;
import com.pipeline.core.model.StageGraph;
import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;
import com.pipeline.core.test.TimeController;
import com.pipeline.engine.budget.ConcurrencyBudgetManager;
import com.pipeline.engine.dispatcher.PipelineDispatcher;
import com.pipeline.engine.event.PipelineEventBus;
import com.pipeline.engine.event.ProjectFinishedEvent;
import com.pipeline.engine.event.TaskStatusEvent;
import com.pipeline.engine.persistence.InMemoryTaskRepository;
import com.pipeline.engine.resolver.DependencyGraphResolver;
import com.pipeline.engine.service.ProjectStagesProvider;
import com.pipeline.engine.test.Conditions;
import com.pipeline.executor.StageExecutorRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private ConcurrencyBudgetManager budgetManager;
    private InMemoryTaskRepository repository;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        budgetManager = new ConcurrencyBudgetManager(ConcurrencyBudget.defaults());
        repository = new InMemoryTaskRepository();
        metrics = new PipelineMetrics(budgetManager, repository);
        metrics.bindTo(registry);
    }

    @Test
    @DisplayName("Gauges follow live budget and queue state")
    void testGauges() {
        repository.saveAll(List.of(PipelineTask.create("p1", TaskType.AUDIO, 0, null, 0, Instant.now())));
        budgetManager.tryReserve(TaskType.IMAGES, "p2");
        budgetManager.pause();

        assertThat(registry.get(PipelineMetrics.TASKS_PENDING).gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(PipelineMetrics.TASKS_ACTIVE).gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(PipelineMetrics.PROJECTS_ACTIVE).gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(PipelineMetrics.SCHEDULER_PAUSED).gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(PipelineMetrics.STAGE_WORKERS).tag("stage", "images").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(PipelineMetrics.STAGE_WORKERS).tag("stage", "audio").gauge().value()).isZero();
    }

    @Test
    @DisplayName("Status events count outcomes per stage")
    void testOutcomeCounters() {
        metrics.onStatusChange(new TaskStatusEvent("t1", "p1", TaskType.AUDIO, TaskStatus.PROCESSING, null));
        metrics.onStatusChange(new TaskStatusEvent("t1", "p1", TaskType.AUDIO, TaskStatus.FAILED, "x"));
        metrics.onStatusChange(new TaskStatusEvent("t2", "p1", TaskType.SUBTITLES, TaskStatus.CANCELLED, "Dependency failed: audio"));
        metrics.onStatusChange(new TaskStatusEvent("t1", "p1", TaskType.AUDIO, TaskStatus.PENDING, null, TaskStatus.FAILED));

        assertThat(registry.get(PipelineMetrics.TASKS_STARTED).tag("stage", "audio").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(PipelineMetrics.TASKS_FAILED).tag("stage", "audio").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(PipelineMetrics.TASKS_CANCELLED).tag("stage", "subtitles").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(PipelineMetrics.TASKS_RETRIED).tag("stage", "audio").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Drains and finished projects are counted")
    void testDrainsAndProjects() {
        metrics.onPipelineComplete();
        metrics.onPipelineComplete();
        metrics.onProjectFinished(new ProjectFinishedEvent("p1", ProjectStatus.COMPLETED));

        assertThat(registry.get(PipelineMetrics.DRAINS).counter().count()).isEqualTo(2.0);
        assertThat(registry.get(PipelineMetrics.PROJECTS_FINISHED).tag("status", "completed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Events before binding are ignored")
    void testUnboundIsNoop() {
        PipelineMetrics unbound = new PipelineMetrics(budgetManager, repository);

        assertThatCode(() -> {
            unbound.onPipelineComplete();
            unbound.onStatusChange(new TaskStatusEvent("t1", "p1", TaskType.AUDIO, TaskStatus.COMPLETED, null));
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Only failed tasks put back to pending count as retries, not newly queued ones")
    void testRetriedCountsOnlyRetries() {
        TimeController time = new TimeController(Instant.parse("2024-05-01T10:00:00Z"));
        PipelineEventBus eventBus = new PipelineEventBus();
        // No executors: every admitted task fails with NO_EXECUTOR.
        PipelineDispatcher dispatcher = new PipelineDispatcher(
            repository,
            new DependencyGraphResolver(StageGraph.defaults(), time),
            budgetManager,
            new StageExecutorRegistry(),
            eventBus,
            ProjectStagesProvider.allStages(),
            time,
            Duration.ofMillis(50)
        );
        eventBus.subscribe(metrics);
        try {
            dispatcher.start();
            dispatcher.pause();
            List<PipelineTask> tasks = dispatcher.generate("p1", EnumSet.allOf(TaskType.class));
            PipelineTask audio = tasks.stream().filter(t -> t.taskType() == TaskType.AUDIO).findFirst().orElseThrow();

            dispatcher.resume();
            Conditions.await(() -> failedCount(TaskType.AUDIO) == 1.0, "audio to fail");
            assertThat(retriedCount()).isZero();

            dispatcher.pause();
            dispatcher.retryTask(audio.id());
            dispatcher.resume();
            Conditions.await(() -> failedCount(TaskType.AUDIO) == 2.0, "retried audio to fail again");
            assertThat(retriedCount()).isEqualTo(1.0);
            assertThat(registry.get(PipelineMetrics.TASKS_RETRIED).tag("stage", "audio").counter().count()).isEqualTo(1.0);
        } finally {
            dispatcher.shutdown(Duration.ofSeconds(1));
            eventBus.close();
        }
    }

    private double failedCount(TaskType type) {
        var counter = registry.find(PipelineMetrics.TASKS_FAILED).tag("stage", type.wireName()).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private double retriedCount() {
        return registry.find(PipelineMetrics.TASKS_RETRIED).counters().stream()
            .mapToDouble(c -> c.count())
            .sum();
    }
}
