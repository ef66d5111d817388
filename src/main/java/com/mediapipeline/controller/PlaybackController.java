package com.mediapipeline.controller;

import com.mediapipeline.playback.PlaybackService;
import com.mediapipeline.service.MediaContentTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/playback/videos")
@Slf4j
public class PlaybackController {

    private static final MediaType HLS_PLAYLIST = MediaType.parseMediaType(MediaContentTypes.HLS_PLAYLIST);

    private final PlaybackService playbackService;

    public PlaybackController(PlaybackService playbackService) {
        this.playbackService = playbackService;
    }

    @GetMapping("/{uploadId}")
    public ResponseEntity<Map<String, Object>> getDescriptor(@PathVariable String uploadId) {
        return ResponseEntity.ok(playbackService.getDescriptor(uploadId));
    }

    @GetMapping("/{uploadId}/master.m3u8")
    public ResponseEntity<String> getMaster(@PathVariable String uploadId) {
        log.debug("Master manifest requested for {}", uploadId);
        return ResponseEntity.ok()
                .contentType(HLS_PLAYLIST)
                .body(playbackService.getMaster(uploadId));
    }

    @GetMapping("/{uploadId}/thumbnail.jpg")
    public ResponseEntity<byte[]> getThumbnail(@PathVariable String uploadId) {
        return playbackService.getThumbnail(uploadId);
    }

    @GetMapping("/{uploadId}/{rendition}/index.m3u8")
    public ResponseEntity<String> getVariant(@PathVariable String uploadId, @PathVariable String rendition) {
        return ResponseEntity.ok()
                .contentType(HLS_PLAYLIST)
                .body(playbackService.getVariant(uploadId, rendition));
    }

    @GetMapping("/{uploadId}/{rendition}/{segment}")
    public ResponseEntity<byte[]> getSegment(@PathVariable String uploadId,
                                             @PathVariable String rendition,
                                             @PathVariable String segment) {
        return playbackService.getSegment(uploadId, rendition, segment);
    }
}
