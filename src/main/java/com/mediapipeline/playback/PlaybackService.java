package com.mediapipeline.playback;

import com.mediapipeline.exception.ManifestNotReadyException;
import com.mediapipeline.exception.ResourceNotFoundException;
import com.mediapipeline.exception.VideoNotFoundException;
import com.mediapipeline.model.VideoDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Playback operations. Parameters are validated before the catalog or storage is touched.
 */
@Service
@Slf4j
public class PlaybackService {

    public static final Set<String> ALLOWED_RENDITIONS = Set.of("1080p", "720p", "480p", "360p");

    private static final Pattern SEGMENT_NAME = Pattern.compile("^[A-Za-z0-9_\\-.]+\\.(ts|m4s)$");

    private final VideoCatalog catalog;
    private final PlaybackSource source;
    private final ManifestRewriter manifestRewriter;

    public PlaybackService(VideoCatalog catalog, PlaybackSource source, ManifestRewriter manifestRewriter) {
        this.catalog = catalog;
        this.source = source;
        this.manifestRewriter = manifestRewriter;
        log.info("Playback service using {} source", source.mode());
    }

    public Map<String, Object> getDescriptor(String uploadId) {
        VideoDescriptor video = findVideo(uploadId);
        String base = "/playback/videos/" + video.getUploadId();

        Map<String, Object> hls = new LinkedHashMap<>();
        hls.put("master", base + "/master.m3u8");

        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("uploadId", video.getUploadId());
        descriptor.put("title", video.getTitle());
        descriptor.put("description", video.getDescription());
        descriptor.put("tags", video.getTags());
        descriptor.put("category", video.getCategory());
        descriptor.put("duration", video.getDuration());
        descriptor.put("status", video.getStatus());
        descriptor.put("ready", video.isReady());
        descriptor.put("hls", hls);
        descriptor.put("thumbnail", hasText(video.getThumbnailUrl()) ? base + "/thumbnail.jpg" : null);
        return descriptor;
    }

    public String getMaster(String uploadId) {
        VideoDescriptor video = findReadyVideo(uploadId);
        return manifestRewriter.rewriteMaster(source.fetchMaster(video));
    }

    public String getVariant(String uploadId, String rendition) {
        validateRendition(rendition);
        VideoDescriptor video = findReadyVideo(uploadId);
        return source.fetchVariant(video, rendition);
    }

    public ResponseEntity<byte[]> getSegment(String uploadId, String rendition, String segment) {
        validateRendition(rendition);
        if (segment == null || !SEGMENT_NAME.matcher(segment).matches()) {
            throw new IllegalArgumentException("Invalid segment: " + segment);
        }
        VideoDescriptor video = findReadyVideo(uploadId);
        return source.fetchSegment(video, rendition, segment);
    }

    public ResponseEntity<byte[]> getThumbnail(String uploadId) {
        VideoDescriptor video = findReadyVideo(uploadId);
        if (!hasText(video.getThumbnailUrl())) {
            throw new ResourceNotFoundException("Thumbnail not available for video: " + uploadId);
        }
        return source.fetchThumbnail(video);
    }

    private void validateRendition(String rendition) {
        if (!ALLOWED_RENDITIONS.contains(rendition)) {
            throw new IllegalArgumentException("Invalid rendition: " + rendition);
        }
    }

    private VideoDescriptor findVideo(String uploadId) {
        return catalog.findByUploadId(uploadId).orElseThrow(() -> new VideoNotFoundException(uploadId));
    }

    private VideoDescriptor findReadyVideo(String uploadId) {
        VideoDescriptor video = findVideo(uploadId);
        if (!video.isReady()) {
            throw new ManifestNotReadyException(uploadId);
        }
        return video;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
