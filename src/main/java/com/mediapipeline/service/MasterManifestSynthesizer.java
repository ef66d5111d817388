package com.mediapipeline.service;

import com.mediapipeline.model.RenditionSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class MasterManifestSynthesizer {

    public static final String MASTER_FILE = "master.m3u8";
    public static final String VARIANT_FILE = "index.m3u8";

    /**
     * Entries follow ladder order, not bandwidth order. Labels missing from the
     * rendition table get BANDWIDTH=0 and an empty RESOLUTION.
     */
    public String synthesize(List<String> labels) {
        StringBuilder masterPlaylist = new StringBuilder();
        masterPlaylist.append("#EXTM3U\n");

        for (String label : labels) {
            Optional<RenditionSpec> spec = RenditionSpec.forLabel(label);
            int bandwidth = spec.map(RenditionSpec::bandwidth).orElse(0);
            String resolution = spec.map(RenditionSpec::resolution).orElse("");

            masterPlaylist.append(String.format("#EXT-X-STREAM-INF:BANDWIDTH=%d,RESOLUTION=%s\n", bandwidth, resolution));
            masterPlaylist.append(label).append('/').append(VARIANT_FILE).append('\n');
        }
        return masterPlaylist.toString();
    }

    public Path write(Path hlsRoot, List<String> labels) throws IOException {
        log.info("Creating master playlist with {} quality levels", labels.size());
        Path master = hlsRoot.resolve(MASTER_FILE);
        Files.writeString(master, synthesize(labels), StandardCharsets.UTF_8);
        return master;
    }
}
