package com.pipeline.core.exception;

import com.pipeline.core.model.TaskStatus;

/**
 * Thrown when an operator request does not match the task's current state,
 * e.g. retrying a task that has not failed.
 */
public class InvalidStateTransitionException extends PipelineException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(String taskId, TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition task %s from %s to %s",
            taskId, currentStatus, targetStatus
        ));
    }
}
