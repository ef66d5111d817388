package com.mediapipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * "Video uploaded" message produced by the ingestion service.
 * Required: uploadId, userId, rawVideoPath. Everything else is optional metadata
 * that is forwarded to the catalog in the completion event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UploadEvent {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private String uploadId;
    private String userId;
    private String username;
    private String originalFilename;
    private String title;
    private String description;
    private List<String> tags;
    private String category;

    @JsonProperty("isPrivate")
    private boolean privateVideo;

    private String rawVideoPath;
    private String containerName;
    private String blobUrl;

    // Ladder order; empty means RenditionSpec.DEFAULT_LADDER
    private List<String> resolutions;
}
