package com.pipeline.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * The schedulable unit of work for one stage of one project.
 *
 * Primary Key: id
 *
 * Invariants:
 * - progress is within [0, 100]
 * - startedAt set once the task has entered PROCESSING at least once in this attempt
 * - completedAt set iff status is COMPLETED, FAILED or CANCELLED
 * - error/errorStack cleared when a FAILED task is retried
 * - dependsOnTaskId refers to a task of the same project, resolved lazily by id
 */
public record PipelineTask(
    // Identity
    String id,
    String projectId,
    TaskType taskType,

    // State
    TaskStatus status,
    int priority,
    int progress,
    ProgressDetails progressDetails,

    // Attempt accounting
    int attempts,
    int maxAttempts,

    // Ordering
    String dependsOnTaskId,
    int stageGroup,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,

    // Failure detail
    String error,
    String errorStack
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 100;

    /**
     * Create a new task in PENDING state.
     */
    public static PipelineTask create(
            String projectId,
            TaskType taskType,
            int priority,
            String dependsOnTaskId,
            int stageGroup,
            Instant createdAt) {

        return new PipelineTask(
            UUID.randomUUID().toString(),
            projectId,
            taskType,
            TaskStatus.PENDING,
            clampPriority(priority),
            0,
            null,
            0,
            DEFAULT_MAX_ATTEMPTS,
            dependsOnTaskId,
            stageGroup,
            createdAt,
            null,
            null,
            null,
            null
        );
    }

    public boolean hasDependency() {
        return dependsOnTaskId != null;
    }

    /**
     * Create a copy admitted for execution. Each admission counts one attempt.
     */
    public PipelineTask withProcessing(Instant now) {
        return new PipelineTask(
            id, projectId, taskType,
            TaskStatus.PROCESSING, priority, 0, null,
            attempts + 1, maxAttempts,
            dependsOnTaskId, stageGroup,
            createdAt, now, null,
            null, null
        );
    }

    /**
     * Create a copy with updated sub-progress.
     */
    public PipelineTask withProgress(int newProgress, ProgressDetails details) {
        return new PipelineTask(
            id, projectId, taskType,
            status, priority, clampProgress(newProgress), details,
            attempts, maxAttempts,
            dependsOnTaskId, stageGroup,
            createdAt, startedAt, completedAt,
            error, errorStack
        );
    }

    /**
     * Create a copy with the task completed successfully.
     */
    public PipelineTask withCompleted(Instant now) {
        return new PipelineTask(
            id, projectId, taskType,
            TaskStatus.COMPLETED, priority, 100, progressDetails,
            attempts, maxAttempts,
            dependsOnTaskId, stageGroup,
            createdAt, startedAt, now,
            null, null
        );
    }

    /**
     * Create a copy with the task failed.
     */
    public PipelineTask withFailed(String message, String stack, Instant now) {
        return new PipelineTask(
            id, projectId, taskType,
            TaskStatus.FAILED, priority, progress, progressDetails,
            attempts, maxAttempts,
            dependsOnTaskId, stageGroup,
            createdAt, startedAt, now,
            message, stack
        );
    }

    /**
     * Create a copy with the task cancelled. The reason is kept as error detail.
     */
    public PipelineTask withCancelled(String reason, Instant now) {
        return new PipelineTask(
            id, projectId, taskType,
            TaskStatus.CANCELLED, priority, progress, progressDetails,
            attempts, maxAttempts,
            dependsOnTaskId, stageGroup,
            createdAt, startedAt, now,
            reason, null
        );
    }

    /**
     * Create a copy back in PENDING state with progress, failure detail and timing cleared.
     * Used for explicit retry and for startup recovery of orphaned executions.
     */
    public PipelineTask withPending() {
        return new PipelineTask(
            id, projectId, taskType,
            TaskStatus.PENDING, priority, 0, null,
            attempts, maxAttempts,
            dependsOnTaskId, stageGroup,
            createdAt, null, null,
            null, null
        );
    }

    /**
     * Create a copy with a new priority, clamped to [0, 100].
     */
    public PipelineTask withPriority(int newPriority) {
        return new PipelineTask(
            id, projectId, taskType,
            status, clampPriority(newPriority), progress, progressDetails,
            attempts, maxAttempts,
            dependsOnTaskId, stageGroup,
            createdAt, startedAt, completedAt,
            error, errorStack
        );
    }

    public static int clampPriority(int value) {
        return Math.max(MIN_PRIORITY, Math.min(value, MAX_PRIORITY));
    }

    public static int clampProgress(int value) {
        return Math.max(0, Math.min(value, 100));
    }
}
