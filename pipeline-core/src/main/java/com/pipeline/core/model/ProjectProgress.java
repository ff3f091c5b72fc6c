package com.pipeline.core.model;

import java.util.Map;

/**
 * Project-level view: per-stage progress (0 for stages not requested),
 * weighted overall percentage and aggregate status.
 */
public record ProjectProgress(
    String projectId,
    Map<TaskType, Integer> stageProgress,
    int overall,
    ProjectStatus status
) {
    public ProjectProgress {
        stageProgress = Map.copyOf(stageProgress);
    }

    public int stage(TaskType type) {
        return stageProgress.getOrDefault(type, 0);
    }
}
