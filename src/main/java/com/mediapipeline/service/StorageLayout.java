package com.mediapipeline.service;

/**
 * Deterministic object keys. A re-run for the same upload writes exactly the same keys.
 */
public final class StorageLayout {

    private StorageLayout() {
    }

    public static String hlsPrefix(String userId, String uploadId) {
        return "hls/" + userId + "/" + uploadId;
    }

    public static String masterKey(String userId, String uploadId) {
        return hlsPrefix(userId, uploadId) + "/" + MasterManifestSynthesizer.MASTER_FILE;
    }

    public static String thumbnailKey(String userId, String uploadId) {
        return "thumbnails/" + userId + "/" + uploadId + ".jpg";
    }
}
