package com.mediapipeline.cache;

public enum CacheKind {
    SEGMENT("segment"),
    THUMBNAIL("thumbnail");

    static final String KEY_PREFIX = "media:";

    private final String prefix;

    CacheKind(String prefix) {
        this.prefix = prefix;
    }

    /** {@code media:<kind>:<uploadId>:<blobPath>} */
    public String key(String uploadId, String blobPath) {
        return KEY_PREFIX + prefix + ":" + uploadId + ":" + blobPath;
    }
}
