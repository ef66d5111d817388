package com.mediapipeline.cache;

import java.util.Optional;

/**
 * Process-wide byte cache. Entries expire by the store's TTL; there is no per-entry invalidation
 * besides {@link #evictUpload(String)}.
 */
public interface CacheStore {

    /**
     * False when the store could not be reached at startup; callers then bypass the cache.
     */
    boolean isAvailable();

    Optional<byte[]> get(String key);

    void set(String key, byte[] value);

    /**
     * @return number of removed entries
     */
    long evictUpload(String uploadId);
}
