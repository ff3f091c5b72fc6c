package com.pipeline.engine.service;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProjectProgress;
import com.pipeline.core.model.QueueStats;
import com.pipeline.core.model.TaskType;
import com.pipeline.engine.event.PipelineEventListener;
import com.pipeline.engine.event.Subscription;
import com.pipeline.engine.event.TaskProgressEvent;
import com.pipeline.engine.event.TaskStatusEvent;

import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Operator-facing queue operations.
 */
public interface PipelineQueueService {

    // ========== Queries ==========

    /**
     * All tasks, in dispatch order.
     */
    List<PipelineTask> listTasks();

    List<PipelineTask> listProjectTasks(String projectId);

    /**
     * @throws com.pipeline.core.exception.NotFoundException if the task does not exist
     */
    PipelineTask getTask(String taskId);

    QueueStats getStats();

    boolean getPaused();

    ProjectProgress projectProgress(String projectId);

    // ========== Control ==========

    void pause();

    void resume();

    /**
     * Cancel a pending or processing task.
     *
     * @throws com.pipeline.core.exception.InvalidStateTransitionException if the task is already finished
     */
    void cancelTask(String taskId);

    /**
     * Put a failed task back to pending.
     *
     * @throws com.pipeline.core.exception.InvalidStateTransitionException if the task has not failed
     */
    void retryTask(String taskId);

    /**
     * Change a task's priority, clamped to [0, 100].
     */
    PipelineTask reorderTask(String taskId, int priority);

    /**
     * Create the task group for a project from its enabled stages.
     */
    List<PipelineTask> generate(String projectId);

    /**
     * Create the task group for a project from an explicit stage list.
     *
     * @throws com.pipeline.core.exception.StageValidationException if the stage list is invalid
     * @throws com.pipeline.core.exception.DuplicateGenerationException if the project has unfinished tasks
     */
    List<PipelineTask> generate(String projectId, Collection<TaskType> stages);

    /**
     * Stop the project's running tasks and delete all its tasks.
     *
     * @return number of tasks deleted
     */
    int deleteProject(String projectId);

    // ========== Subscriptions ==========

    Subscription subscribe(PipelineEventListener listener);

    Subscription onProgress(Consumer<TaskProgressEvent> callback);

    Subscription onStatusChange(Consumer<TaskStatusEvent> callback);

    Subscription onPipelineComplete(Runnable callback);
}
