package com.mediapipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Catalog view of a video. Owned by the catalog service; playback only reads it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VideoDescriptor {
    private String uploadId;
    private String userId;
    private String title;
    private String description;
    private List<String> tags;
    private String category;
    private double duration;
    private String hlsMasterUrl;
    private String thumbnailUrl;
    private String status;

    public boolean isReady() {
        return hlsMasterUrl != null && !hlsMasterUrl.isBlank();
    }
}
