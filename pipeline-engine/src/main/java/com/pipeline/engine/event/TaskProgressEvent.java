package com.pipeline.engine.event;

import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.TaskType;

/**
 * Sub-progress of a processing task changed.
 */
public record TaskProgressEvent(
    String taskId,
    String projectId,
    TaskType taskType,
    int progress,
    ProgressDetails progressDetails
) {
}
