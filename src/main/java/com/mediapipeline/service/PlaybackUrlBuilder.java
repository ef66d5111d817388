package com.mediapipeline.service;

import com.mediapipeline.config.StorageConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds the URLs stored in the catalog for a blob in the processed bucket:
 * the public base when configured, else the path-style storage URL, else a relative path.
 */
@Component
@Slf4j
public class PlaybackUrlBuilder {

    private final String publicBaseUrl;
    private final String endpoint;
    private final String bucket;

    @Autowired
    public PlaybackUrlBuilder(StorageConfig storageConfig) {
        this(storageConfig.getPublicBaseUrl(), storageConfig.getEndpoint(), storageConfig.getProcessedBucket());
    }

    PlaybackUrlBuilder(String publicBaseUrl, String endpoint, String bucket) {
        this.publicBaseUrl = trimTrailingSlashes(publicBaseUrl);
        this.endpoint = trimTrailingSlashes(endpoint);
        this.bucket = bucket;
        if (this.publicBaseUrl.isEmpty() && this.endpoint.isEmpty()) {
            log.warn("Neither public base URL nor storage endpoint set, playback URLs will be relative");
        }
    }

    public String urlFor(String blobPath) {
        if (!publicBaseUrl.isEmpty()) {
            return publicBaseUrl + "/" + blobPath;
        }
        if (!endpoint.isEmpty()) {
            return endpoint + "/" + bucket + "/" + blobPath;
        }
        return "/" + blobPath;
    }

    private static String trimTrailingSlashes(String value) {
        return value == null ? "" : value.trim().replaceAll("/+$", "");
    }
}
