package com.pipeline.engine.progress;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.ProjectProgress;
import com.pipeline.core.model.ProjectStatus;
import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pure functions turning task sub-progress into task and project percentages.
 */
public final class ProgressAggregator {

    private ProgressAggregator() {
    }

    /**
     * Task percentage from reported details.
     * Counts win over a direct percentage; a completed task is always 100.
     */
    public static int taskProgress(ProgressDetails details, TaskStatus status) {
        if (status == TaskStatus.COMPLETED) {
            return 100;
        }
        if (details == null) {
            return 0;
        }
        if (details.total() != null && details.total() > 0 && details.completed() != null) {
            return PipelineTask.clampProgress((int) Math.round(100.0 * details.completed() / details.total()));
        }
        if (details.percentage() != null) {
            return PipelineTask.clampProgress(details.percentage());
        }
        return 0;
    }

    /**
     * Weighted overall percentage. Stages without a task contribute 0.
     */
    public static int overallProgress(Map<TaskType, Integer> stageProgress) {
        double sum = 0;
        for (TaskType type : TaskType.values()) {
            sum += stageProgress.getOrDefault(type, 0) * type.progressWeight();
        }
        return (int) Math.round(sum);
    }

    /**
     * Aggregate status with precedence: any failed, all cancelled, all completed,
     * any processing, otherwise pending. An empty group is pending.
     */
    public static ProjectStatus aggregateStatus(Collection<PipelineTask> tasks) {
        if (tasks.isEmpty()) {
            return ProjectStatus.PENDING;
        }
        boolean allCancelled = true;
        boolean allCompleted = true;
        boolean anyProcessing = false;

        for (PipelineTask task : tasks) {
            TaskStatus status = task.status();
            if (status == TaskStatus.FAILED) {
                return ProjectStatus.FAILED;
            }
            allCancelled &= status == TaskStatus.CANCELLED;
            allCompleted &= status == TaskStatus.COMPLETED;
            anyProcessing |= status == TaskStatus.PROCESSING;
        }

        if (allCancelled) {
            return ProjectStatus.CANCELLED;
        }
        if (allCompleted) {
            return ProjectStatus.COMPLETED;
        }
        if (anyProcessing) {
            return ProjectStatus.PROCESSING;
        }
        return ProjectStatus.PENDING;
    }

    /**
     * Project view over one task group.
     */
    public static ProjectProgress projectProgress(String projectId, Collection<PipelineTask> tasks) {
        Map<TaskType, Integer> stages = new EnumMap<>(TaskType.class);
        for (TaskType type : TaskType.values()) {
            stages.put(type, 0);
        }
        for (PipelineTask task : tasks) {
            int value = task.status() == TaskStatus.COMPLETED ? 100 : task.progress();
            stages.put(task.taskType(), value);
        }
        return new ProjectProgress(projectId, stages, overallProgress(stages), aggregateStatus(tasks));
    }
}
