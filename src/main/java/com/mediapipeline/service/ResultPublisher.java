package com.mediapipeline.service;

import com.mediapipeline.config.StorageConfig;
import com.mediapipeline.exception.EncodeException;
import com.mediapipeline.model.CompletionEvent;
import com.mediapipeline.model.UploadEvent;
import com.mediapipeline.queue.CompletionEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Uploads a finished workspace and announces it. The HLS tree goes first; the thumbnail
 * is optional; the completion event is sent last so the catalog never sees a master URL
 * whose renditions are missing.
 */
@Service
@Slf4j
public class ResultPublisher {

    private final ObjectStore objectStore;
    private final VideoEncoder encoder;
    private final CompletionEventPublisher completionEventPublisher;
    private final PlaybackUrlBuilder urlBuilder;
    private final String processedBucket;

    public ResultPublisher(ObjectStore objectStore,
                           VideoEncoder encoder,
                           CompletionEventPublisher completionEventPublisher,
                           PlaybackUrlBuilder urlBuilder,
                           StorageConfig storageConfig) {
        this.objectStore = objectStore;
        this.encoder = encoder;
        this.completionEventPublisher = completionEventPublisher;
        this.urlBuilder = urlBuilder;
        this.processedBucket = storageConfig.getProcessedBucket();
    }

    public CompletionEvent publish(UploadEvent event, TranscodeWorkspace workspace) throws IOException {
        String hlsPrefix = StorageLayout.hlsPrefix(event.getUserId(), event.getUploadId());
        log.info("Uploading HLS files with prefix: {}", hlsPrefix);
        objectStore.uploadDirectory(workspace.getHlsRoot(), processedBucket, hlsPrefix);

        String thumbnailUrl = uploadThumbnail(event, workspace);

        CompletionEvent completion = CompletionEvent.builder()
                .uploadId(event.getUploadId())
                .userId(event.getUserId())
                .title(event.getTitle())
                .description(event.getDescription())
                .tags(event.getTags())
                .category(event.getCategory())
                .privateVideo(event.isPrivateVideo())
                .originalFilename(event.getOriginalFilename())
                .rawVideoPath(event.getRawVideoPath())
                .hls(new CompletionEvent.Hls(urlBuilder.urlFor(
                        StorageLayout.masterKey(event.getUserId(), event.getUploadId()))))
                .thumbnailUrl(thumbnailUrl)
                .build();

        completionEventPublisher.publish(completion);
        return completion;
    }

    /**
     * @return the thumbnail URL, or an empty string when extraction or upload failed
     */
    private String uploadThumbnail(UploadEvent event, TranscodeWorkspace workspace) {
        String thumbnailKey = StorageLayout.thumbnailKey(event.getUserId(), event.getUploadId());
        try {
            encoder.extractThumbnail(workspace.getInput(), workspace.getThumbnail());
            objectStore.upload(workspace.getThumbnail(), processedBucket, thumbnailKey, MediaContentTypes.JPEG);
            return urlBuilder.urlFor(thumbnailKey);
        } catch (EncodeException | RuntimeException e) {
            log.warn("Thumbnail generation failed for upload {}, continuing without it: {}",
                    event.getUploadId(), e.getMessage());
            return "";
        }
    }
}
