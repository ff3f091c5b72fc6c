package com.pipeline.core.exception;

/**
 * Thrown when a task or project is not found.
 */
public class NotFoundException extends PipelineException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
