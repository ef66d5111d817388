package com.mediapipeline.playback;

import com.mediapipeline.cache.CacheKind;
import com.mediapipeline.cache.SegmentCache;
import com.mediapipeline.exception.ResourceNotFoundException;
import com.mediapipeline.exception.UpstreamFetchException;
import com.mediapipeline.model.BlobLocator;
import com.mediapipeline.model.VideoDescriptor;
import com.mediapipeline.service.MediaContentTypes;
import com.mediapipeline.service.ObjectStore;
import com.mediapipeline.service.StorageLayout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Reads blobs through the storage client. Segments and thumbnails go through the segment cache.
 */
@Slf4j
public class PrivateStorageSource implements PlaybackSource {

    private final ObjectStore objectStore;
    private final BlobPathExtractor pathExtractor;
    private final SegmentCache segmentCache;

    public PrivateStorageSource(ObjectStore objectStore, BlobPathExtractor pathExtractor, SegmentCache segmentCache) {
        this.objectStore = objectStore;
        this.pathExtractor = pathExtractor;
        this.segmentCache = segmentCache;
    }

    @Override
    public String mode() {
        return "private";
    }

    @Override
    public String fetchMaster(VideoDescriptor video) {
        BlobLocator master = pathExtractor.locate(video.getHlsMasterUrl());
        return new String(download(master), StandardCharsets.UTF_8);
    }

    @Override
    public String fetchVariant(VideoDescriptor video, String rendition) {
        BlobLocator variant = pathExtractor.locate(video.getHlsMasterUrl()).resolveSibling(rendition + "/index.m3u8");
        return new String(download(variant), StandardCharsets.UTF_8);
    }

    @Override
    public ResponseEntity<byte[]> fetchSegment(VideoDescriptor video, String rendition, String segment) {
        BlobLocator locator = pathExtractor.locate(video.getHlsMasterUrl()).resolveSibling(rendition + "/" + segment);
        byte[] data = segmentCache.getOrLoad(CacheKind.SEGMENT, video.getUploadId(), locator.getPath(),
                () -> download(locator));

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(MediaContentTypes.forKey(segment)))
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePublic())
                .body(data);
    }

    @Override
    public ResponseEntity<byte[]> fetchThumbnail(VideoDescriptor video) {
        String thumbnailPath = video.getUserId() != null && !video.getUserId().isBlank()
                ? StorageLayout.thumbnailKey(video.getUserId(), video.getUploadId())
                : pathExtractor.extractBlobPath(video.getThumbnailUrl());
        BlobLocator locator = pathExtractor.locate(thumbnailPath);
        byte[] data = segmentCache.getOrLoad(CacheKind.THUMBNAIL, video.getUploadId(), locator.getPath(),
                () -> download(locator));

        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_JPEG)
                .cacheControl(CacheControl.maxAge(3600, TimeUnit.SECONDS).cachePublic())
                .body(data);
    }

    private byte[] download(BlobLocator locator) {
        try {
            return objectStore.getBytes(locator.getBucket(), locator.getPath());
        } catch (NoSuchKeyException e) {
            throw new ResourceNotFoundException("Blob not found: " + locator.getPath());
        } catch (SdkException e) {
            log.error("Blob download failed for {}/{}", locator.getBucket(), locator.getPath(), e);
            throw new UpstreamFetchException("Blob error", e);
        }
    }
}
