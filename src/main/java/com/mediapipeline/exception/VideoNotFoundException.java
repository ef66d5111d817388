package com.mediapipeline.exception;

public class VideoNotFoundException extends ResourceNotFoundException {

    public VideoNotFoundException(String uploadId) {
        super("Video not found: " + uploadId);
    }
}
