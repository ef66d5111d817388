package com.mediapipeline.cache;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed {@link CacheStore}. Keys look like {@code media:<kind>:<uploadId>:<blobPath>}.
 * A failed ping at startup disables the cache for the lifetime of the process.
 */
@Component
@Slf4j
public class RedisCacheStore implements CacheStore {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;
    private volatile boolean available;

    public RedisCacheStore(RedisTemplate<String, byte[]> mediaCacheTemplate,
                           @Value("${media.cache.enabled:true}") boolean enabled,
                           @Value("${media.cache.ttl:PT30M}") Duration ttl) {
        this.redisTemplate = mediaCacheTemplate;
        this.enabled = enabled;
        this.ttl = ttl;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            log.info("Segment cache disabled by configuration");
            return;
        }
        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            connection.ping();
            available = true;
            log.info("Segment cache connected (ttl {})", ttl);
        } catch (RuntimeException e) {
            log.error("Failed to initialize segment cache, playback continues without caching: {}", e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, byte[] value) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public long evictUpload(String uploadId) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(CacheKind.KEY_PREFIX + "*:" + uploadId + ":*").count(500).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        if (keys.isEmpty()) {
            return 0;
        }
        Long removed = redisTemplate.delete(keys);
        return removed == null ? 0 : removed;
    }
}
