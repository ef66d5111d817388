package com.mediapipeline.service;

import com.mediapipeline.cache.SegmentCache;
import com.mediapipeline.config.StorageConfig;
import com.mediapipeline.model.VideoDeletedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Removes everything the pipeline produced for a deleted video. Each step is best-effort:
 * a failure is logged and the remaining steps still run. Cache entries are purged last so
 * a concurrent read cannot repopulate them from blobs that are still present.
 */
@Service
@Slf4j
public class MediaPurgeService {

    private final ObjectStore objectStore;
    private final SegmentCache segmentCache;
    private final String rawBucket;
    private final String processedBucket;

    public MediaPurgeService(ObjectStore objectStore, SegmentCache segmentCache, StorageConfig storageConfig) {
        this.objectStore = objectStore;
        this.segmentCache = segmentCache;
        this.rawBucket = storageConfig.getRawBucket();
        this.processedBucket = storageConfig.getProcessedBucket();
    }

    public void purge(VideoDeletedEvent event) {
        String uploadId = event.getUploadId();
        String userId = event.getUserId();
        log.info("Purging media for upload {} (user {})", uploadId, userId);

        if (event.getRawVideoPath() != null && !event.getRawVideoPath().isBlank()) {
            try {
                objectStore.delete(rawBucket, event.getRawVideoPath());
                log.info("Deleted raw video: {}", event.getRawVideoPath());
            } catch (RuntimeException e) {
                log.warn("Failed to delete raw video {} (continuing): {}", event.getRawVideoPath(), e.getMessage());
            }
        }

        String hlsPrefix = StorageLayout.hlsPrefix(userId, uploadId) + "/";
        try {
            objectStore.deletePrefix(processedBucket, hlsPrefix);
        } catch (RuntimeException e) {
            log.warn("Failed to delete HLS files under {} (continuing): {}", hlsPrefix, e.getMessage());
        }

        String thumbnailKey = StorageLayout.thumbnailKey(userId, uploadId);
        try {
            objectStore.delete(processedBucket, thumbnailKey);
        } catch (RuntimeException e) {
            log.warn("Failed to delete thumbnail {} (continuing): {}", thumbnailKey, e.getMessage());
        }

        try {
            segmentCache.evictUpload(uploadId);
        } catch (RuntimeException e) {
            log.warn("Failed to evict cache entries for upload {}: {}", uploadId, e.getMessage());
        }
    }
}
