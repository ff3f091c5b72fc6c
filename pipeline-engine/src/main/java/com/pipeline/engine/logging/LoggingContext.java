package com.pipeline.engine.logging;

import com.pipeline.core.model.PipelineTask;
import org.slf4j.MDC;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Puts the identifiers of the task being executed on every log line written
 * inside the block.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(task)) {
 *     log.info("Executing stage"); // Automatically includes projectId, taskId, taskType, attempt
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String PROJECT_ID = "projectId";
    public static final String TASK_ID = "taskId";
    public static final String TASK_TYPE = "taskType";
    public static final String ATTEMPT = "attempt";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for project-level operations.
     */
    public static LoggingContext forProject(String projectId) {
        LoggingContext ctx = new LoggingContext();
        if (projectId != null) {
            MDC.put(PROJECT_ID, projectId);
        }
        return ctx;
    }

    /**
     * Create a logging context for one task execution.
     */
    public static LoggingContext forTask(PipelineTask task) {
        LoggingContext ctx = forProject(task.projectId());
        MDC.put(TASK_ID, task.id());
        MDC.put(TASK_TYPE, task.taskType().wireName());
        MDC.put(ATTEMPT, String.valueOf(task.attempts()));
        return ctx;
    }

    public static String getProjectId() {
        return MDC.get(PROJECT_ID);
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    @Override
    public void close() {
        MDC.remove(PROJECT_ID);
        MDC.remove(TASK_ID);
        MDC.remove(TASK_TYPE);
        MDC.remove(ATTEMPT);
    }
}
