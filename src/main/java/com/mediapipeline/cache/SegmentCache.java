package com.mediapipeline.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-through cache for segments and thumbnails. A hit never touches storage; a miss
 * loads, stores best-effort and returns. Cache errors are logged and never reach the caller.
 * Entries of a deleted video stay servable until they expire unless {@link #evictUpload}
 * is called.
 */
@Component
@Slf4j
public class SegmentCache {

    private final CacheStore store;

    public SegmentCache(CacheStore store) {
        this.store = store;
    }

    public byte[] getOrLoad(CacheKind kind, String uploadId, String blobPath, Supplier<byte[]> loader) {
        if (!store.isAvailable()) {
            return loader.get();
        }

        String key = kind.key(uploadId, blobPath);
        Optional<byte[]> cached = lookup(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            return cached.get();
        }

        byte[] data = loader.get();
        if (data != null) {
            try {
                store.set(key, data);
            } catch (RuntimeException e) {
                log.warn("Cache set error for {}: {}", key, e.getMessage());
            }
        }
        return data;
    }

    public long evictUpload(String uploadId) {
        if (!store.isAvailable()) {
            return 0;
        }
        long removed = store.evictUpload(uploadId);
        log.info("Evicted {} cache entries for upload {}", removed, uploadId);
        return removed;
    }

    private Optional<byte[]> lookup(String key) {
        try {
            return store.get(key);
        } catch (RuntimeException e) {
            log.warn("Cache get error for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
