package com.mediapipeline.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StorageLayoutTest {

    @Test
    void keysFollowUserAndUpload() {
        assertThat(StorageLayout.hlsPrefix("u1", "abc123")).isEqualTo("hls/u1/abc123");
        assertThat(StorageLayout.masterKey("u1", "abc123")).isEqualTo("hls/u1/abc123/master.m3u8");
        assertThat(StorageLayout.thumbnailKey("u1", "abc123")).isEqualTo("thumbnails/u1/abc123.jpg");
    }

    @Test
    void contentTypesByExtension() {
        assertThat(MediaContentTypes.forKey("hls/u1/abc123/master.m3u8")).isEqualTo(MediaContentTypes.HLS_PLAYLIST);
        assertThat(MediaContentTypes.forKey("hls/u1/abc123/720p/segment_000.ts")).isEqualTo(MediaContentTypes.MPEG_TS);
        assertThat(MediaContentTypes.forKey("thumbnails/u1/abc123.jpg")).isEqualTo(MediaContentTypes.JPEG);
        assertThat(MediaContentTypes.forKey("notes.bin")).isEqualTo("application/octet-stream");
    }
}
