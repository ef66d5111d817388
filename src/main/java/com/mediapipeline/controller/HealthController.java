package com.mediapipeline.controller;

import com.mediapipeline.cache.CacheStore;
import com.mediapipeline.playback.PlaybackSource;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Health check endpoint for monitoring and load balancers
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final PlaybackSource playbackSource;
    private final CacheStore cacheStore;

    public HealthController(PlaybackSource playbackSource, CacheStore cacheStore) {
        this.playbackSource = playbackSource;
        this.cacheStore = cacheStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", LocalDateTime.now().toString());
        health.put("service", "mediapipeline");
        health.put("playbackMode", playbackSource.mode());
        health.put("cache", cacheStore.isAvailable() ? "UP" : "DISABLED");

        return ResponseEntity.ok(health);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("pong");
    }
}
