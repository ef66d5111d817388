package com.mediapipeline.playback;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes variant references in a master manifest to {@code <label>/index.m3u8}, which the
 * proxy serves under {@code /playback/videos/{uploadId}/{label}/index.m3u8}.
 */
@Component
public class ManifestRewriter {

    private static final Pattern VARIANT_LINE =
            Pattern.compile("(?m)^(1080p|720p|480p|360p)[/\\\\]+index\\.m3u8[ \\t]*(\\r?)$");

    public String rewriteMaster(String manifest) {
        Matcher matcher = VARIANT_LINE.matcher(manifest);
        StringBuilder rewritten = new StringBuilder(manifest.length());
        while (matcher.find()) {
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement(matcher.group(1) + "/index.m3u8" + matcher.group(2)));
        }
        matcher.appendTail(rewritten);
        return rewritten.toString();
    }
}
