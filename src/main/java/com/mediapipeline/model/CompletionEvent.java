package com.mediapipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Published once per successful job so the catalog can mark the video ready.
 */
@Value
@Builder
public class CompletionEvent {

    String uploadId;
    String userId;
    String title;
    String description;
    List<String> tags;
    String category;

    @JsonProperty("isPrivate")
    boolean privateVideo;

    String originalFilename;
    String rawVideoPath;
    Hls hls;

    // Empty when thumbnail extraction or upload failed
    String thumbnailUrl;

    @Builder.Default
    boolean ready = true;

    @Value
    public static class Hls {
        String masterUrl;
    }
}
