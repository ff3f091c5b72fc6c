package com.pipeline.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.core.model.ConcurrencyBudget;
import com.pipeline.core.model.StageGraph;
import com.pipeline.core.repository.TaskRepository;
import com.pipeline.engine.budget.ConcurrencyBudgetManager;
import com.pipeline.engine.dispatcher.PipelineDispatcher;
import com.pipeline.engine.event.PipelineEventBus;
import com.pipeline.engine.persistence.InMemoryTaskRepository;
import com.pipeline.engine.persistence.jdbc.JdbcTaskRepository;
import com.pipeline.engine.resolver.DependencyGraphResolver;
import com.pipeline.engine.service.ProjectStagesProvider;
import com.pipeline.executor.StageExecutor;
import com.pipeline.executor.StageExecutorRegistry;
import com.pipeline.executor.simulated.SimulatedStageExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires the scheduler components from {@link PipelineProperties}.
 *
 * Real stage executors are picked up as {@link StageExecutor} beans; simulated ones
 * fill the stages nothing else covers unless {@code pipeline.executors.simulated=false}.
 */
@Configuration
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StageGraph stageGraph(PipelineProperties properties) {
        return properties.toStageGraph();
    }

    @Bean
    public ConcurrencyBudget concurrencyBudget(PipelineProperties properties) {
        return properties.toBudget();
    }

    @Bean
    public ConcurrencyBudgetManager concurrencyBudgetManager(ConcurrencyBudget budget) {
        return new ConcurrencyBudgetManager(budget);
    }

    @Bean
    public DependencyGraphResolver dependencyGraphResolver(StageGraph stageGraph, Clock clock) {
        return new DependencyGraphResolver(stageGraph, clock);
    }

    @Bean(destroyMethod = "close")
    public PipelineEventBus pipelineEventBus() {
        return new PipelineEventBus();
    }

    // ========== Task Store ==========

    @Bean
    @ConditionalOnProperty(prefix = "pipeline", name = "store", havingValue = "memory", matchIfMissing = true)
    public TaskRepository inMemoryTaskRepository() {
        log.info("Using in-memory task store; tasks do not survive a restart");
        return new InMemoryTaskRepository();
    }

    @Bean
    @ConditionalOnProperty(prefix = "pipeline", name = "store", havingValue = "jdbc")
    public TaskRepository jdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcTaskRepository(jdbcTemplate, objectMapper);
    }

    // ========== Executors ==========

    @Bean
    public StageExecutorRegistry stageExecutorRegistry(
            ObjectProvider<StageExecutor> executors,
            PipelineProperties properties) {

        StageExecutorRegistry registry = new StageExecutorRegistry(executors.orderedStream().toList());

        if (properties.getExecutors().isSimulated()) {
            for (SimulatedStageExecutor simulated : SimulatedStageExecutor.forAllStages(
                    properties.getExecutors().getUnitDelay())) {
                if (registry.find(simulated.type()).isEmpty()) {
                    registry.register(simulated);
                    log.info("No executor for stage {}, using simulated executor", simulated.type());
                }
            }
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectStagesProvider projectStagesProvider() {
        return ProjectStagesProvider.allStages();
    }

    // ========== Dispatcher ==========

    @Bean(initMethod = "start")
    public PipelineDispatcher pipelineDispatcher(
            TaskRepository taskRepository,
            DependencyGraphResolver resolver,
            ConcurrencyBudgetManager budgetManager,
            StageExecutorRegistry executorRegistry,
            PipelineEventBus eventBus,
            ProjectStagesProvider stagesProvider,
            Clock clock,
            PipelineProperties properties) {

        return new PipelineDispatcher(
            taskRepository,
            resolver,
            budgetManager,
            executorRegistry,
            eventBus,
            stagesProvider,
            clock,
            properties.getTickInterval()
        );
    }
}
