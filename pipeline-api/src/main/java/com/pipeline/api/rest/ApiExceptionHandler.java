package com.pipeline.api.rest;

import com.pipeline.core.exception.DuplicateGenerationException;
import com.pipeline.core.exception.InvalidStateTransitionException;
import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.exception.PipelineException;
import com.pipeline.core.exception.StageValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps scheduler exceptions to HTTP responses with a {@code {errorCode, message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StageValidationException.class)
    public ResponseEntity<ApiError> handleValidation(StageValidationException e) {
        log.warn("[API] Bad request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.debug("[API] Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidStateTransitionException.class, DuplicateGenerationException.class})
    public ResponseEntity<ApiError> handleConflict(PipelineException e) {
        log.warn("[API] Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ApiError> handlePipeline(PipelineException e) {
        log.warn("[API] Rejected: {} - {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("[API] Malformed request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("MALFORMED_REQUEST", "Request body could not be read"));
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, PipelineException e) {
        return ResponseEntity.status(status).body(new ApiError(e.getErrorCode(), e.getMessage()));
    }

    public record ApiError(String errorCode, String message) {}
}
