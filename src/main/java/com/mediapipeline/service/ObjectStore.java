package com.mediapipeline.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Blob storage by bucket and key. Implementations must be safe for concurrent use.
 */
public interface ObjectStore {

    void download(String bucket, String key, Path target) throws IOException;

    byte[] getBytes(String bucket, String key);

    void upload(Path file, String bucket, String key, String contentType);

    /**
     * Uploads every regular file under {@code directory} to {@code prefix/<relative path>}.
     */
    void uploadDirectory(Path directory, String bucket, String prefix) throws IOException;

    void delete(String bucket, String key);

    /**
     * Best-effort: objects created while the listing is paged may survive.
     *
     * @return number of deleted objects
     */
    int deletePrefix(String bucket, String prefix);
}
