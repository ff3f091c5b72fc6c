package com.pipeline.engine.event;

import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;

/**
 * A task changed status. error is set for failed and cancelled tasks.
 * previousStatus is null for a newly created task.
 */
public record TaskStatusEvent(
    String taskId,
    String projectId,
    TaskType taskType,
    TaskStatus status,
    String error,
    TaskStatus previousStatus
) {

    public TaskStatusEvent(String taskId, String projectId, TaskType taskType, TaskStatus status, String error) {
        this(taskId, projectId, taskType, status, error, null);
    }

    /**
     * A failed task put back to pending.
     */
    public boolean isRetry() {
        return previousStatus == TaskStatus.FAILED && status == TaskStatus.PENDING;
    }
}
