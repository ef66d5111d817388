package com.mediapipeline.playback;

import com.mediapipeline.model.VideoDescriptor;

import java.util.Optional;

/**
 * Read-only access to the catalog's view of a video.
 */
public interface VideoCatalog {

    Optional<VideoDescriptor> findByUploadId(String uploadId);
}
