package com.mediapipeline.exception;

/**
 * Encoder process failed, timed out or could not be started.
 */
public class EncodeException extends Exception {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
