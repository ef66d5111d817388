package com.mediapipeline.service;

import com.mediapipeline.exception.EncodeException;
import com.mediapipeline.model.RenditionSpec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a tiny variant playlist and one segment per rendition instead of running ffmpeg.
 */
public class StubVideoEncoder implements VideoEncoder {

    private final List<String> encoded = new ArrayList<>();
    private String failingRendition;
    private boolean thumbnailFails;

    public StubVideoEncoder failOn(String label) {
        this.failingRendition = label;
        return this;
    }

    public StubVideoEncoder failThumbnail() {
        this.thumbnailFails = true;
        return this;
    }

    public List<String> encoded() {
        return encoded;
    }

    @Override
    public void encode(Path input, Path outputDir, RenditionSpec rendition) throws EncodeException {
        encoded.add(rendition.getLabel());
        if (rendition.getLabel().equals(failingRendition)) {
            throw new EncodeException("FFmpeg process failed with exit code 1");
        }
        try {
            Files.writeString(outputDir.resolve("index.m3u8"),
                    "#EXTM3U\n#EXTINF:6.0,\nsegment_000.ts\n#EXT-X-ENDLIST\n", StandardCharsets.UTF_8);
            Files.write(outputDir.resolve("segment_000.ts"), new byte[]{0x47, 0x40, 0x00});
        } catch (IOException e) {
            throw new EncodeException("stub write failed", e);
        }
    }

    @Override
    public void extractThumbnail(Path input, Path output) throws EncodeException {
        if (thumbnailFails) {
            throw new EncodeException("no frame at 1s");
        }
        try {
            Files.write(output, new byte[]{(byte) 0xFF, (byte) 0xD8});
        } catch (IOException e) {
            throw new EncodeException("stub write failed", e);
        }
    }
}
