package com.mediapipeline.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Scratch directory owned by exactly one job attempt:
 * <pre>
 *   input.&lt;ext&gt;
 *   hls/master.m3u8
 *   hls/&lt;label&gt;/index.m3u8, segment_000.ts ...
 *   thumb.jpg
 * </pre>
 * Closing deletes the whole tree.
 */
@Slf4j
@Getter
public class TranscodeWorkspace implements AutoCloseable {

    private final Path root;
    private final Path input;
    private final Path hlsRoot;
    private final Path thumbnail;

    private TranscodeWorkspace(Path root, String rawVideoPath) {
        this.root = root;
        String extension = FilenameUtils.getExtension(rawVideoPath);
        this.input = root.resolve(extension.isEmpty() ? "input.mp4" : "input." + extension);
        this.hlsRoot = root.resolve("hls");
        this.thumbnail = root.resolve("thumb.jpg");
    }

    /**
     * @param baseDir parent directory, or {@code null} for the system temp directory
     */
    public static TranscodeWorkspace create(Path baseDir, String uploadId, String rawVideoPath) throws IOException {
        String prefix = "transcoder-" + uploadId + "-";
        Path root = baseDir == null
                ? Files.createTempDirectory(prefix)
                : Files.createTempDirectory(Files.createDirectories(baseDir), prefix);
        TranscodeWorkspace workspace = new TranscodeWorkspace(root, rawVideoPath);
        Files.createDirectories(workspace.hlsRoot);
        log.debug("Workspace created: {}", root);
        return workspace;
    }

    public Path renditionDir(String label) throws IOException {
        return Files.createDirectories(hlsRoot.resolve(label));
    }

    @Override
    public void close() {
        try {
            FileUtils.deleteDirectory(root.toFile());
            log.debug("Workspace deleted: {}", root);
        } catch (IOException e) {
            log.warn("Error cleaning up workspace {}", root, e);
        }
    }
}
