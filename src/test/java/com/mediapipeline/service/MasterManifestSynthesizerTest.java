package com.mediapipeline.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MasterManifestSynthesizerTest {

    private final MasterManifestSynthesizer synthesizer = new MasterManifestSynthesizer();

    @Test
    void synthesizesEntriesInLadderOrder() {
        String master = synthesizer.synthesize(List.of("720p", "360p"));

        assertThat(master).isEqualTo("#EXTM3U\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=2928000,RESOLUTION=1280x720\n"
                + "720p/index.m3u8\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=864000,RESOLUTION=640x360\n"
                + "360p/index.m3u8\n");
    }

    @Test
    void keepsRequestedOrderEvenWhenNotSortedByBandwidth() {
        String master = synthesizer.synthesize(List.of("360p", "1080p"));

        assertThat(master.indexOf("360p/index.m3u8")).isLessThan(master.indexOf("1080p/index.m3u8"));
        assertThat(master).contains("BANDWIDTH=5192000,RESOLUTION=1920x1080");
    }

    @Test
    void unknownLabelGetsZeroBandwidthAndEmptyResolution() {
        String master = synthesizer.synthesize(List.of("240p"));

        assertThat(master).contains("#EXT-X-STREAM-INF:BANDWIDTH=0,RESOLUTION=\n240p/index.m3u8\n");
    }

    @Test
    void emptyLadderProducesHeaderOnly() {
        assertThat(synthesizer.synthesize(List.of())).isEqualTo("#EXTM3U\n");
    }

    @Test
    void writesMasterIntoHlsRoot(@TempDir Path hlsRoot) throws Exception {
        Path master = synthesizer.write(hlsRoot, List.of("480p"));

        assertThat(master).isEqualTo(hlsRoot.resolve("master.m3u8"));
        assertThat(Files.readString(master, StandardCharsets.UTF_8))
                .contains("BANDWIDTH=1496000,RESOLUTION=854x480");
    }
}
