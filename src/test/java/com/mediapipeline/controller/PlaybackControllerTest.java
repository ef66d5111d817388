package com.mediapipeline.controller;

import com.mediapipeline.exception.ManifestNotReadyException;
import com.mediapipeline.exception.UpstreamFetchException;
import com.mediapipeline.exception.VideoNotFoundException;
import com.mediapipeline.playback.PlaybackService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlaybackController.class)
class PlaybackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlaybackService playbackService;

    @Test
    void servesMasterAsHlsPlaylist() throws Exception {
        when(playbackService.getMaster("abc123")).thenReturn("#EXTM3U\n720p/index.m3u8\n");

        mockMvc.perform(get("/playback/videos/abc123/master.m3u8"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/vnd.apple.mpegurl"))
                .andExpect(content().string("#EXTM3U\n720p/index.m3u8\n"));
    }

    @Test
    void servesVariantPlaylist() throws Exception {
        when(playbackService.getVariant("abc123", "720p")).thenReturn("#EXTM3U\nsegment_000.ts\n");

        mockMvc.perform(get("/playback/videos/abc123/720p/index.m3u8"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/vnd.apple.mpegurl"));
    }

    @Test
    void servesSegmentBytes() throws Exception {
        when(playbackService.getSegment("abc123", "720p", "segment_000.ts")).thenReturn(ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("video/MP2T"))
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePublic())
                .body(new byte[]{0x47, 0x40}));

        mockMvc.perform(get("/playback/videos/abc123/720p/segment_000.ts"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "max-age=60, public"))
                .andExpect(content().bytes(new byte[]{0x47, 0x40}));
    }

    @Test
    void descriptorIsJson() throws Exception {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("uploadId", "abc123");
        descriptor.put("ready", true);
        descriptor.put("hls", Map.of("master", "/playback/videos/abc123/master.m3u8"));
        when(playbackService.getDescriptor("abc123")).thenReturn(descriptor);

        mockMvc.perform(get("/playback/videos/abc123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ready").value(true))
                .andExpect(jsonPath("$.hls.master").value("/playback/videos/abc123/master.m3u8"));
    }

    @Test
    void invalidRenditionIsBadRequest() throws Exception {
        when(playbackService.getVariant("abc123", "4k")).thenThrow(new IllegalArgumentException("Invalid rendition: 4k"));

        mockMvc.perform(get("/playback/videos/abc123/4k/index.m3u8"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Invalid rendition: 4k"));
    }

    @Test
    void unknownVideoIsNotFound() throws Exception {
        when(playbackService.getMaster("missing")).thenThrow(new VideoNotFoundException("missing"));

        mockMvc.perform(get("/playback/videos/missing/master.m3u8"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.path").value("/playback/videos/missing/master.m3u8"));
    }

    @Test
    void unprocessedVideoIsConflict() throws Exception {
        when(playbackService.getMaster("abc123")).thenThrow(new ManifestNotReadyException("abc123"));

        mockMvc.perform(get("/playback/videos/abc123/master.m3u8"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Not Ready"));
    }

    @Test
    void thumbnailOfUnprocessedVideoIsConflict() throws Exception {
        when(playbackService.getThumbnail("abc123")).thenThrow(new ManifestNotReadyException("abc123"));

        mockMvc.perform(get("/playback/videos/abc123/thumbnail.jpg"))
                .andExpect(status().isConflict());
    }

    @Test
    void storageFailureIsBadGateway() throws Exception {
        when(playbackService.getThumbnail("abc123")).thenThrow(new UpstreamFetchException("Blob error", null));

        mockMvc.perform(get("/playback/videos/abc123/thumbnail.jpg"))
                .andExpect(status().isBadGateway());
    }
}
