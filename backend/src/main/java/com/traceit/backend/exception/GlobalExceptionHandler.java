package com.traceit.backend.exception;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps pipeline failures to a stable error body: {"error": {"code", "message"}}
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LineagePipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineFailure(LineagePipelineException ex) {
        ErrorKind kind = ex.getKind();
        log.warn("Pipeline request failed: kind={}, message={}", kind, ex.getMessage());
        return error(kind.getStatus(), kind.getCode(), ex.getMessage());
    }

    // Pipeline executor saturated; the run never started and no quota was spent
    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(RejectedExecutionException ex) {
        log.warn("Pipeline run rejected: {}", ex.getMessage());
        return error(ErrorKind.CANCELLED.getStatus(), ErrorKind.CANCELLED.getCode(),
                "Too many runs in progress, try again later");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("❌ Unexpected error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal error");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", Map.of("code", code, "message", message != null ? message : "")));
    }
}
