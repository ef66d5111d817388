package com.mediapipeline.exception;

/**
 * Upload message that can never succeed (malformed JSON, missing required field).
 * The job consumer dead-letters it without retrying.
 */
public class InvalidUploadEventException extends RuntimeException {

    public InvalidUploadEventException(String message) {
        super(message);
    }

    public InvalidUploadEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
