package com.pipeline.executor;

/**
 * Exception thrown by stage executors on failure.
 */
public class StageExecutionException extends Exception {
    
    public static final String CANCELLED = "CANCELLED";
    public static final String GENERATION_FAILED = "GENERATION_FAILED";
    
    private final String errorCode;
    
    public StageExecutionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public StageExecutionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public boolean isCancellation() {
        return CANCELLED.equals(errorCode);
    }
    
    /**
     * Create the exception an executor throws when it stops because it was cancelled.
     */
    public static StageExecutionException cancelled(String taskId) {
        return new StageExecutionException(CANCELLED, "Task " + taskId + " was cancelled");
    }
    
    /**
     * Create a generation failure.
     */
    public static StageExecutionException failed(String message) {
        return new StageExecutionException(GENERATION_FAILED, message);
    }
}
