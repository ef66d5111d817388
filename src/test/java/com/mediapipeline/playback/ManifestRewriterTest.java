package com.mediapipeline.playback;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestRewriterTest {

    private final ManifestRewriter rewriter = new ManifestRewriter();

    @Test
    void normalizesBackslashAndRepeatedSeparators() {
        String master = "#EXTM3U\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=2928000,RESOLUTION=1280x720\n"
                + "720p\\index.m3u8\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=864000,RESOLUTION=640x360\n"
                + "360p//index.m3u8  \n";

        assertThat(rewriter.rewriteMaster(master)).isEqualTo("#EXTM3U\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=2928000,RESOLUTION=1280x720\n"
                + "720p/index.m3u8\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=864000,RESOLUTION=640x360\n"
                + "360p/index.m3u8\n");
    }

    @Test
    void keepsCrlfLineEndings() {
        assertThat(rewriter.rewriteMaster("#EXTM3U\r\n1080p\\index.m3u8\r\n"))
                .isEqualTo("#EXTM3U\r\n1080p/index.m3u8\r\n");
    }

    @Test
    void leavesWellFormedAndUnknownLinesAlone() {
        String master = "#EXTM3U\n720p/index.m3u8\n240p\\index.m3u8\nhttps://cdn/720p/index.m3u8\n";

        assertThat(rewriter.rewriteMaster(master)).isEqualTo(master);
    }
}
