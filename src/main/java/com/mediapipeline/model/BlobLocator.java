package com.mediapipeline.model;

import lombok.Value;

@Value
public class BlobLocator {
    String bucket;
    String path;

    /** Sibling key in the same directory, e.g. master.m3u8 -> 720p/index.m3u8. */
    public BlobLocator resolveSibling(String relative) {
        int slash = path.lastIndexOf('/');
        String base = slash < 0 ? "" : path.substring(0, slash + 1);
        return new BlobLocator(bucket, base + relative);
    }
}
