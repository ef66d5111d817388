package com.mediapipeline.service;

import com.mediapipeline.exception.EncodeException;
import com.mediapipeline.model.RenditionSpec;

import java.nio.file.Path;

/**
 * Opaque encoding capability. Calls are synchronous and blocking.
 */
public interface VideoEncoder {

    /**
     * Writes {@code index.m3u8} plus its media segments into {@code outputDir}.
     */
    void encode(Path input, Path outputDir, RenditionSpec rendition) throws EncodeException;

    /**
     * Extracts a single JPEG frame near the start of {@code input}.
     */
    void extractThumbnail(Path input, Path output) throws EncodeException;
}
