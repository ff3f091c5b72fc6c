package com.pipeline.core.exception;

/**
 * Thrown when generation is requested for a project that still has unfinished tasks.
 */
public class DuplicateGenerationException extends PipelineException {
    
    public static final String ERROR_CODE = "DUPLICATE_GENERATION";
    
    private final String projectId;
    private final long activeTasks;
    
    public DuplicateGenerationException(String projectId, long activeTasks) {
        super(ERROR_CODE, String.format(
            "Project '%s' already has %d pending or processing task(s)",
            projectId, activeTasks
        ));
        this.projectId = projectId;
        this.activeTasks = activeTasks;
    }
    
    public String getProjectId() {
        return projectId;
    }
    
    public long getActiveTasks() {
        return activeTasks;
    }
}
