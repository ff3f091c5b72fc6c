package com.pipeline.executor;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.TaskType;

import java.time.Duration;

/**
 * Context provided to stage executors during execution.
 */
public class StageContext {
    
    private final PipelineTask task;
    private final int maxWorkers;
    private final ProgressReporter progressReporter;
    private final CancellationToken cancellationToken;
    
    public StageContext(
            PipelineTask task,
            int maxWorkers,
            ProgressReporter progressReporter,
            CancellationToken cancellationToken) {
        this.task = task;
        this.maxWorkers = maxWorkers;
        this.progressReporter = progressReporter;
        this.cancellationToken = cancellationToken;
    }
    
    /**
     * Get the task as it was when admitted.
     */
    public PipelineTask getTask() {
        return task;
    }
    
    public String getTaskId() {
        return task.id();
    }
    
    public String getProjectId() {
        return task.projectId();
    }
    
    public TaskType getTaskType() {
        return task.taskType();
    }
    
    /**
     * Get the attempt number, starting at 1.
     */
    public int getAttemptNumber() {
        return task.attempts();
    }
    
    /**
     * Get the intra-task worker ceiling for this stage.
     */
    public int getMaxWorkers() {
        return maxWorkers;
    }
    
    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }
    
    /**
     * Report sub-progress. Reports after the task left PROCESSING are ignored by the dispatcher.
     */
    public void reportProgress(ProgressDetails details) {
        progressReporter.report(details);
    }
    
    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }
    
    /**
     * Throw if cancellation was requested. Call between work units.
     */
    public void throwIfCancelled() throws StageExecutionException {
        if (cancellationToken.isCancelled()) {
            throw StageExecutionException.cancelled(task.id());
        }
    }
    
    /**
     * Wait for the given duration, returning early with an exception if the task is cancelled.
     */
    public void pause(Duration duration) throws StageExecutionException {
        try {
            if (cancellationToken.await(duration)) {
                throw StageExecutionException.cancelled(task.id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StageExecutionException.cancelled(task.id());
        }
    }
}
