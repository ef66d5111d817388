package com.mediapipeline.exception;

public class ManifestNotReadyException extends RuntimeException {

    public ManifestNotReadyException(String uploadId) {
        super("Master manifest not ready for video: " + uploadId);
    }
}
