package com.pipeline.executor;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.TaskType;

/**
 * Performs the generation work of one stage.
 * One implementation per {@link TaskType}; selected by the dispatcher through
 * {@link StageExecutorRegistry}.
 */
public interface StageExecutor {

    /**
     * The stage this executor handles.
     */
    TaskType type();

    /**
     * Execute the stage for a task.
     * Returns normally on success. Long-running implementations report sub-progress
     * through the context and poll {@link StageContext#isCancelled()} between units.
     *
     * @param context Execution context providing the task, progress reporting and cancellation
     * @throws StageExecutionException if the stage fails
     */
    void execute(StageContext context) throws StageExecutionException;

    /**
     * Hook invoked when an operator cancels a running task, in addition to the
     * cancellation token being signalled. Executors holding external resources
     * (open requests, child processes) release them here.
     */
    default void cancel(PipelineTask task) {
    }
}
