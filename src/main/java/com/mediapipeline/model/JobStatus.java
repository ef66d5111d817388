package com.mediapipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobStatus {
    private String uploadId;
    private JobState state;
    private int attempt; // 1-based delivery attempt of the last transition
    private String message;
    private String masterUrl;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
