package com.pipeline.core.repository;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of pipeline tasks. No business logic: CRUD plus the queries the
 * dispatcher and the stats endpoint need.
 */
public interface TaskRepository {

    /**
     * Save the tasks of one project in a single unit of work.
     *
     * @param tasks The tasks to save
     */
    void saveAll(List<PipelineTask> tasks);

    /**
     * Persist a changed task.
     *
     * @param task The task to update
     */
    void update(PipelineTask task);

    /**
     * Find a task by ID.
     *
     * @param taskId The task ID
     * @return The task if found
     */
    Optional<PipelineTask> findById(String taskId);

    /**
     * Find every task, ordered by priority then creation time.
     *
     * @return All tasks
     */
    List<PipelineTask> findAll();

    /**
     * Find all tasks of a project, ordered by stage group then creation time.
     *
     * @param projectId The project ID
     * @return The project's task group
     */
    List<PipelineTask> findByProject(String projectId);

    /**
     * Find tasks in a status, ordered by priority, creation time, then id.
     *
     * @param status The task status
     * @return Tasks in the given status
     */
    List<PipelineTask> findByStatus(TaskStatus status);

    /**
     * Find tasks whose dependsOnTaskId is the given task.
     *
     * @param taskId The predecessor task ID
     * @return Direct dependents
     */
    List<PipelineTask> findDependents(String taskId);

    /**
     * Count tasks in a status.
     */
    long countByStatus(TaskStatus status);

    /**
     * Count tasks in a status whose completedAt is after the given instant.
     */
    long countFinishedSince(TaskStatus status, Instant since);

    /**
     * Count all tasks.
     */
    long count();

    /**
     * Reset every PROCESSING task to PENDING with progress cleared.
     * Used at startup: no execution survives a restart.
     *
     * @return Number of tasks reset
     */
    int resetProcessingToPending();

    /**
     * Delete all tasks of a project.
     *
     * @return Number of tasks deleted
     */
    int deleteByProject(String projectId);
}
