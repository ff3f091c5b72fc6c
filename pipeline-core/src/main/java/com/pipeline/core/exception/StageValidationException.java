package com.pipeline.core.exception;

/**
 * Thrown when a requested stage combination or stage configuration is invalid.
 * Raised synchronously at enqueue time; no task is created.
 */
public class StageValidationException extends PipelineException {
    
    public static final String ERROR_CODE = "STAGE_VALIDATION_FAILED";
    
    public StageValidationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public StageValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid stage request: %s - %s", field, reason));
    }
}
