package com.pipeline.core.model;

import java.util.Map;

/**
 * Snapshot of queue depth and concurrency usage.
 * completedLast24h and failedLast24h come from the task store, over a rolling 24 hour
 * window on completedAt; the worker and project counts are live dispatcher state.
 */
public record QueueStats(
    long pending,
    long processing,
    long completedLast24h,
    long failedLast24h,
    long total,
    int activeWorkers,
    int activeProjects,
    Map<TaskType, Integer> stageWorkers,
    int maxProjects,
    Map<TaskType, Integer> maxPerStage
) {
    public QueueStats {
        stageWorkers = Map.copyOf(stageWorkers);
        maxPerStage = Map.copyOf(maxPerStage);
    }
}
