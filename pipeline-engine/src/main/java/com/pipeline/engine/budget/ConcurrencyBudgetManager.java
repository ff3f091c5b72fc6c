package com.pipeline.engine.budget;

import com.pipeline.core.model.ConcurrencyBudget;
import com.pipeline.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Tracks budget slots held by processing tasks and owns the pause flag.
 *
 * A reservation succeeds only if the scheduler is not paused, the stage is below its
 * ceiling, and either the project already holds a slot or fewer than
 * {@code maxProjects} projects hold one. One instance per dispatcher; all methods are
 * synchronized on the instance.
 */
public class ConcurrencyBudgetManager {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyBudgetManager.class);

    private final ConcurrencyBudget budget;
    private final Map<TaskType, Integer> stageCounts = new EnumMap<>(TaskType.class);
    private final Map<String, Integer> projectCounts = new HashMap<>();
    private boolean paused;

    public ConcurrencyBudgetManager(ConcurrencyBudget budget) {
        this.budget = budget;
    }

    /**
     * Try to take a slot for a task of the given stage and project.
     *
     * @return true if the slot was taken; the caller must {@link #release} it exactly once
     */
    public synchronized boolean tryReserve(TaskType type, String projectId) {
        if (paused) {
            return false;
        }
        int stageCount = stageCounts.getOrDefault(type, 0);
        if (stageCount >= budget.stageLimit(type)) {
            return false;
        }
        if (!projectCounts.containsKey(projectId) && projectCounts.size() >= budget.maxProjects()) {
            return false;
        }
        stageCounts.put(type, stageCount + 1);
        projectCounts.merge(projectId, 1, Integer::sum);
        return true;
    }

    /**
     * Give back a slot taken by {@link #tryReserve}.
     */
    public synchronized void release(TaskType type, String projectId) {
        Integer stageCount = stageCounts.get(type);
        Integer projectCount = projectCounts.get(projectId);
        if (stageCount == null || projectCount == null) {
            log.warn("Release without reservation: stage={} project={}", type, projectId);
            return;
        }
        if (stageCount <= 1) {
            stageCounts.remove(type);
        } else {
            stageCounts.put(type, stageCount - 1);
        }
        if (projectCount <= 1) {
            projectCounts.remove(projectId);
        } else {
            projectCounts.put(projectId, projectCount - 1);
        }
    }

    public synchronized void pause() {
        if (!paused) {
            paused = true;
            log.info("Scheduler paused");
        }
    }

    public synchronized void resume() {
        if (paused) {
            paused = false;
            log.info("Scheduler resumed");
        }
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    /**
     * Number of distinct projects holding a slot.
     */
    public synchronized int activeProjects() {
        return projectCounts.size();
    }

    /**
     * Slots held per stage, every stage present.
     */
    public synchronized Map<TaskType, Integer> stageWorkers() {
        Map<TaskType, Integer> snapshot = new EnumMap<>(TaskType.class);
        for (TaskType type : TaskType.values()) {
            snapshot.put(type, stageCounts.getOrDefault(type, 0));
        }
        return snapshot;
    }

    /**
     * Total slots held across stages.
     */
    public synchronized int activeWorkers() {
        return stageCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int maxWorkers(TaskType type) {
        return budget.workerLimit(type);
    }

    public ConcurrencyBudget getBudget() {
        return budget;
    }
}
