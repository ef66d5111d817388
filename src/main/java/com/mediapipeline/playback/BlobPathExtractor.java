package com.mediapipeline.playback;

import com.mediapipeline.config.StorageConfig;
import com.mediapipeline.model.BlobLocator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a stored manifest or thumbnail URL into a key inside the processed bucket.
 * Three shapes are accepted, tried in this order:
 * <ol>
 *   <li>cloud provider URL, host ending in a known storage suffix</li>
 *   <li>generic {@code http(s)://host[:port]/bucket/path}</li>
 *   <li>relative path, with or without a leading slash</li>
 * </ol>
 * The provider check must run first because provider URLs are also valid generic URLs.
 */
@Component
public class BlobPathExtractor {

    private final String bucket;
    private final List<String> providerHostSuffixes;

    @Autowired
    public BlobPathExtractor(StorageConfig storageConfig) {
        this(storageConfig.getProcessedBucket(), storageConfig.getProviderHostSuffixes());
    }

    BlobPathExtractor(String bucket, List<String> providerHostSuffixes) {
        this.bucket = bucket;
        this.providerHostSuffixes = providerHostSuffixes.stream()
                .map(String::trim)
                .filter(suffix -> !suffix.isEmpty())
                .map(suffix -> suffix.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    public BlobLocator locate(String url) {
        return new BlobLocator(bucket, extractBlobPath(url));
    }

    public String extractBlobPath(String url) {
        String value = url == null ? "" : url.trim();

        String providerPath = pathAfterProviderHost(value);
        if (providerPath != null) {
            return stripBucket(providerPath);
        }

        if (value.startsWith("http://") || value.startsWith("https://")) {
            // scheme, "", host[:port], rest
            String[] parts = value.split("/", 4);
            if (parts.length >= 4) {
                return stripBucket(parts[3]);
            }
            return "";
        }

        return stripLeadingSlashes(value);
    }

    private String pathAfterProviderHost(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        int hostStart;
        if (lower.startsWith("https://")) {
            hostStart = "https://".length();
        } else if (lower.startsWith("http://")) {
            hostStart = "http://".length();
        } else {
            return null;
        }
        int pathStart = lower.indexOf('/', hostStart);
        if (pathStart < 0) {
            return null;
        }

        // host only: drop userinfo and port
        String host = lower.substring(hostStart, pathStart);
        host = host.substring(host.lastIndexOf('@') + 1);
        int port = host.indexOf(':');
        if (port >= 0) {
            host = host.substring(0, port);
        }

        for (String suffix : providerHostSuffixes) {
            if (host.endsWith(suffix)) {
                return url.substring(pathStart + 1);
            }
        }
        return null;
    }

    private String stripBucket(String path) {
        String stripped = stripLeadingSlashes(path);
        if (bucket != null && !bucket.isEmpty() && stripped.startsWith(bucket + "/")) {
            stripped = stripped.substring(bucket.length() + 1);
        }
        return stripLeadingSlashes(stripped);
    }

    private static String stripLeadingSlashes(String path) {
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return path.substring(start);
    }
}
