package com.pipeline.api.config;

import com.pipeline.core.exception.StageValidationException;
import com.pipeline.core.model.ConcurrencyBudget;
import com.pipeline.core.model.StageGraph;
import com.pipeline.core.model.TaskType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Scheduler configuration under the {@code pipeline} prefix.
 *
 * <p>Stage-keyed maps use stage wire names ({@code prompts}, {@code images},
 * {@code audio}, {@code subtitles}):
 * <pre>
 * pipeline:
 *   max-projects: 3
 *   max-per-stage:
 *     images: 1
 *   stage-timeout:
 *     audio: 10m
 *   dependencies:
 *     images: prompts
 *     subtitles: audio
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Distinct projects allowed to have a task processing at once.
     */
    private int maxProjects = ConcurrencyBudget.DEFAULT_MAX_PROJECTS;

    /**
     * Processing tasks per stage across all projects. Unlisted stages default to 2.
     */
    private Map<String, Integer> maxPerStage = new LinkedHashMap<>();

    /**
     * Intra-task fan-out workers per stage. Unlisted stages use the built-in defaults.
     */
    private Map<String, Integer> maxWorkers = new LinkedHashMap<>();

    /**
     * Optional wall-clock limit for one execution of a stage.
     */
    private Map<String, Duration> stageTimeout = new LinkedHashMap<>();

    /**
     * Period of the background selection pass.
     */
    private Duration tickInterval = Duration.ofSeconds(1);

    /**
     * How long shutdown waits for running executions to return.
     */
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    private StoreType store = StoreType.memory;

    /**
     * Predecessor stage of each stage. Empty means the built-in edges.
     */
    private Map<String, String> dependencies = new LinkedHashMap<>();

    /**
     * Stages that must be requested together with a stage. Empty means the built-in rules.
     */
    private Map<String, List<String>> requires = new LinkedHashMap<>();

    private Executors executors = new Executors();

    public enum StoreType {
        /**
         * Tasks kept in process memory, lost on restart
         */
        memory,

        /**
         * Tasks kept in the {@code pipeline_tasks} table
         */
        jdbc
    }

    public static class Executors {

        /**
         * Register simulated executors for stages no real executor covers.
         */
        private boolean simulated = true;

        /**
         * Time one simulated sub-unit takes.
         */
        private Duration unitDelay = Duration.ofMillis(250);

        public boolean isSimulated() {
            return simulated;
        }

        public void setSimulated(boolean simulated) {
            this.simulated = simulated;
        }

        public Duration getUnitDelay() {
            return unitDelay;
        }

        public void setUnitDelay(Duration unitDelay) {
            this.unitDelay = unitDelay;
        }
    }

    // ========== Conversion ==========

    public ConcurrencyBudget toBudget() {
        return ConcurrencyBudget.builder()
            .maxProjects(maxProjects)
            .maxPerStage(byStage(maxPerStage))
            .maxWorkers(byStage(maxWorkers))
            .stageTimeouts(byStage(stageTimeout))
            .build();
    }

    public StageGraph toStageGraph() {
        StageGraph defaults = StageGraph.defaults();

        Map<TaskType, TaskType> predecessors = dependencies.isEmpty()
            ? defaults.predecessors()
            : byStage(dependencies, TaskType::fromWireName);

        Map<TaskType, Set<TaskType>> requirements = requires.isEmpty()
            ? defaults.requirements()
            : byStage(requires, names -> {
                Set<TaskType> stages = EnumSet.noneOf(TaskType.class);
                names.forEach(name -> stages.add(TaskType.fromWireName(name)));
                return stages;
            });

        return new StageGraph(predecessors, requirements);
    }

    private static <V> Map<TaskType, V> byStage(Map<String, V> source) {
        return byStage(source, value -> value);
    }

    private static <V, R> Map<TaskType, R> byStage(Map<String, V> source, Function<V, R> mapper) {
        Map<TaskType, R> result = new EnumMap<>(TaskType.class);
        source.forEach((name, value) -> {
            if (value == null) {
                throw new StageValidationException(name, "no value configured");
            }
            result.put(TaskType.fromWireName(name), mapper.apply(value));
        });
        return result;
    }

    // Getters and Setters

    public int getMaxProjects() {
        return maxProjects;
    }

    public void setMaxProjects(int maxProjects) {
        this.maxProjects = maxProjects;
    }

    public Map<String, Integer> getMaxPerStage() {
        return maxPerStage;
    }

    public void setMaxPerStage(Map<String, Integer> maxPerStage) {
        this.maxPerStage = maxPerStage;
    }

    public Map<String, Integer> getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(Map<String, Integer> maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public Map<String, Duration> getStageTimeout() {
        return stageTimeout;
    }

    public void setStageTimeout(Map<String, Duration> stageTimeout) {
        this.stageTimeout = stageTimeout;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Map<String, String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(Map<String, String> dependencies) {
        this.dependencies = dependencies;
    }

    public Map<String, List<String>> getRequires() {
        return requires;
    }

    public void setRequires(Map<String, List<String>> requires) {
        this.requires = requires;
    }

    public Executors getExecutors() {
        return executors;
    }

    public void setExecutors(Executors executors) {
        this.executors = executors;
    }
}
