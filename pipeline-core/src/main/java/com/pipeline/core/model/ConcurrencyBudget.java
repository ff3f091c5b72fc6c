package com.pipeline.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ceilings bounding simultaneous work.
 *
 * - maxProjects: distinct projects with any task processing
 * - maxPerStage: processing tasks of one stage type across all projects
 * - maxWorkers: intra-task fan-out for stages that parallelize internally
 * - stageTimeouts: optional wall-clock limit for one stage execution
 */
public record ConcurrencyBudget(
    int maxProjects,
    Map<TaskType, Integer> maxPerStage,
    Map<TaskType, Integer> maxWorkers,
    Map<TaskType, Duration> stageTimeouts
) {
    public static final int DEFAULT_MAX_PROJECTS = 3;
    public static final int DEFAULT_MAX_PER_STAGE = 2;
    public static final int DEFAULT_MAX_WORKERS = 1;

    public ConcurrencyBudget {
        if (maxProjects < 1) {
            throw new IllegalArgumentException("maxProjects must be at least 1: " + maxProjects);
        }
        maxPerStage = copyLimits(maxPerStage, "maxPerStage");
        maxWorkers = copyLimits(maxWorkers, "maxWorkers");

        EnumMap<TaskType, Duration> timeouts = new EnumMap<>(TaskType.class);
        if (stageTimeouts != null) {
            stageTimeouts.forEach((type, timeout) -> {
                if (timeout != null) {
                    if (timeout.isNegative() || timeout.isZero()) {
                        throw new IllegalArgumentException("stage timeout for " + type + " must be positive");
                    }
                    timeouts.put(type, timeout);
                }
            });
        }
        stageTimeouts = Collections.unmodifiableMap(timeouts);
    }

    /**
     * Budget used when nothing is configured: 3 projects, 2 tasks per stage,
     * 4 image workers and 3 prompt workers per task, no timeouts.
     */
    public static ConcurrencyBudget defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Ceiling for concurrently processing tasks of the given stage.
     */
    public int stageLimit(TaskType type) {
        return maxPerStage.getOrDefault(type, DEFAULT_MAX_PER_STAGE);
    }

    /**
     * Intra-task worker ceiling for the given stage.
     */
    public int workerLimit(TaskType type) {
        return maxWorkers.getOrDefault(type, DEFAULT_MAX_WORKERS);
    }

    public Optional<Duration> timeout(TaskType type) {
        return Optional.ofNullable(stageTimeouts.get(type));
    }

    /**
     * Stage ceilings for every stage type, defaults filled in.
     */
    public Map<TaskType, Integer> effectiveStageLimits() {
        EnumMap<TaskType, Integer> limits = new EnumMap<>(TaskType.class);
        for (TaskType type : TaskType.values()) {
            limits.put(type, stageLimit(type));
        }
        return limits;
    }

    private static Map<TaskType, Integer> copyLimits(Map<TaskType, Integer> source, String name) {
        EnumMap<TaskType, Integer> copy = new EnumMap<>(TaskType.class);
        if (source != null) {
            source.forEach((type, limit) -> {
                if (limit == null || limit < 1) {
                    throw new IllegalArgumentException(name + " for " + type + " must be at least 1: " + limit);
                }
                copy.put(type, limit);
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Builder for ConcurrencyBudget.
     */
    public static class Builder {
        private int maxProjects = DEFAULT_MAX_PROJECTS;
        private final Map<TaskType, Integer> maxPerStage = new EnumMap<>(TaskType.class);
        private final Map<TaskType, Integer> maxWorkers = new EnumMap<>(TaskType.class);
        private final Map<TaskType, Duration> stageTimeouts = new EnumMap<>(TaskType.class);

        private Builder() {
            maxWorkers.put(TaskType.IMAGES, 4);
            maxWorkers.put(TaskType.PROMPTS, 3);
        }

        public Builder maxProjects(int value) {
            this.maxProjects = value;
            return this;
        }

        public Builder maxPerStage(TaskType type, int value) {
            this.maxPerStage.put(type, value);
            return this;
        }

        public Builder maxPerStage(Map<TaskType, Integer> values) {
            this.maxPerStage.putAll(values);
            return this;
        }

        public Builder maxWorkers(TaskType type, int value) {
            this.maxWorkers.put(type, value);
            return this;
        }

        public Builder maxWorkers(Map<TaskType, Integer> values) {
            this.maxWorkers.putAll(values);
            return this;
        }

        public Builder stageTimeout(TaskType type, Duration timeout) {
            this.stageTimeouts.put(type, timeout);
            return this;
        }

        public Builder stageTimeouts(Map<TaskType, Duration> values) {
            this.stageTimeouts.putAll(values);
            return this;
        }

        public ConcurrencyBudget build() {
            return new ConcurrencyBudget(maxProjects, maxPerStage, maxWorkers, stageTimeouts);
        }
    }
}
