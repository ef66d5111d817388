package com.mediapipeline.exception;

/**
 * Object store or public origin could not serve a playback resource.
 */
public class UpstreamFetchException extends RuntimeException {

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
