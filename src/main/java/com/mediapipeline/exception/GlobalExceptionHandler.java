package com.mediapipeline.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps playback failures to distinct client-facing statuses:
 * 400 invalid parameter, 404 unknown video or blob, 409 not ready yet, 502 upstream failure.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex, WebRequest request) {
        log.warn("Validation error: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid Parameter", ex.getMessage(),
                request.getDescription(false));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(
            ResourceNotFoundException ex, WebRequest request) {
        log.info("Not found: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                request.getDescription(false));
    }

    @ExceptionHandler(ManifestNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleNotReady(
            ManifestNotReadyException ex, WebRequest request) {
        log.info("Not ready: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.CONFLICT, "Not Ready", ex.getMessage(),
                request.getDescription(false));
    }

    @ExceptionHandler(NoSuchKeyException.class)
    public ResponseEntity<Map<String, Object>> handleNoSuchKeyException(
            NoSuchKeyException ex, WebRequest request) {
        log.warn("Blob not found in storage: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.NOT_FOUND, "File Not Found",
                "The requested file does not exist in storage", request.getDescription(false));
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<Map<String, Object>> handleUpstreamFetch(
            UpstreamFetchException ex, WebRequest request) {
        log.error("Upstream fetch failed: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.BAD_GATEWAY, "Upstream Error", ex.getMessage(),
                request.getDescription(false));
    }

    @ExceptionHandler(S3Exception.class)
    public ResponseEntity<Map<String, Object>> handleS3Exception(
            S3Exception ex, WebRequest request) {
        log.error("Storage error: {}", ex.getMessage(), ex);
        String errorMsg = ex.awsErrorDetails() != null
                ? ex.awsErrorDetails().errorMessage()
                : ex.getMessage();
        return buildErrorResponse(HttpStatus.BAD_GATEWAY, "Storage Service Error",
                "Storage error: " + errorMsg, request.getDescription(false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGlobalException(
            Exception ex, WebRequest request) {
        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request.getDescription(false));
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status,
            String error,
            String message,
            String path) {

        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("path", path.replace("uri=", ""));

        return new ResponseEntity<>(errorResponse, status);
    }
}
