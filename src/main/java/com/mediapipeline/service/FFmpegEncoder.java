package com.mediapipeline.service;

import com.mediapipeline.exception.EncodeException;
import com.mediapipeline.model.RenditionSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
@Slf4j
public class FFmpegEncoder implements VideoEncoder {

    private static final int OUTPUT_TAIL_CHARS = 2000;

    private final String ffmpegPath;
    private final int segmentSeconds;
    private final Duration timeout;

    public FFmpegEncoder(
            @Value("${media.encoder.ffmpeg-path:ffmpeg}") String ffmpegPath,
            @Value("${media.encoder.segment-seconds:6}") int segmentSeconds,
            @Value("${media.encoder.timeout:PT2H}") Duration timeout) {
        this.ffmpegPath = ffmpegPath;
        this.segmentSeconds = segmentSeconds;
        this.timeout = timeout;
    }

    @Override
    public void encode(Path input, Path outputDir, RenditionSpec rendition) throws EncodeException {
        log.info("Creating {} variant ({} Kbps video, {} Kbps audio)",
                rendition.getLabel(), rendition.getVideoBitrateKbps(), rendition.getAudioBitrateKbps());
        executeCommand(buildHlsCommand(input, outputDir, rendition));
    }

    @Override
    public void extractThumbnail(Path input, Path output) throws EncodeException {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-y");
        command.add("-ss");
        command.add("1");
        command.add("-i");
        command.add(input.toAbsolutePath().toString());
        command.add("-frames:v");
        command.add("1");
        command.add(output.toAbsolutePath().toString());

        executeCommand(command);
    }

    List<String> buildHlsCommand(Path input, Path outputDir, RenditionSpec rendition) {
        int videoKbps = rendition.getVideoBitrateKbps();

        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-y");
        command.add("-i");
        command.add(input.toAbsolutePath().toString());
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("0:a:0?"); // First audio stream (if exists)
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-vf");
        command.add(String.format("scale=%d:%d:force_original_aspect_ratio=decrease,pad=%d:%d:(ow-iw)/2:(oh-ih)/2",
                rendition.getWidth(), rendition.getHeight(), rendition.getWidth(), rendition.getHeight()));
        command.add("-b:v");
        command.add(videoKbps + "k");
        command.add("-maxrate");
        command.add((int) (videoKbps * 1.1) + "k");
        command.add("-bufsize");
        command.add((videoKbps * 2) + "k");
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add(rendition.getAudioBitrateKbps() + "k");
        command.add("-hls_time");
        command.add(String.valueOf(segmentSeconds));
        command.add("-hls_playlist_type");
        command.add("vod");
        command.add("-hls_list_size");
        command.add("0");
        command.add("-hls_segment_filename");
        command.add(outputDir.resolve("segment_%03d.ts").toAbsolutePath().toString());
        command.add(outputDir.resolve("index.m3u8").toAbsolutePath().toString());
        return command;
    }

    /**
     * Runs the command with stdout and stderr captured to a temp file so the
     * timeout is not blocked by a reader.
     */
    private void executeCommand(List<String> command) throws EncodeException {
        log.debug("Executing FFmpeg command: {}", String.join(" ", command));

        Path outputLog = null;
        try {
            outputLog = Files.createTempFile("ffmpeg-", ".log");
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(outputLog.toFile());

            Process process = processBuilder.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new EncodeException("FFmpeg timed out after " + timeout);
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String output = tail(outputLog);
                log.error("FFmpeg process failed with exit code {}: {}", exitCode, output);
                throw new EncodeException("FFmpeg process exited with code " + exitCode + "\nOutput: " + output);
            }
        } catch (IOException e) {
            throw new EncodeException("Could not run FFmpeg: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EncodeException("FFmpeg process interrupted", e);
        } finally {
            deleteQuietly(outputLog);
        }
    }

    private static String tail(Path file) throws IOException {
        String output = Files.readString(file, StandardCharsets.UTF_8);
        return output.length() <= OUTPUT_TAIL_CHARS ? output : output.substring(output.length() - OUTPUT_TAIL_CHARS);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete FFmpeg log {}", file, e);
        }
    }
}
