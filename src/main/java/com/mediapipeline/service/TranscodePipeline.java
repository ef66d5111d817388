package com.mediapipeline.service;

import com.mediapipeline.config.StorageConfig;
import com.mediapipeline.exception.EncodeException;
import com.mediapipeline.model.CompletionEvent;
import com.mediapipeline.model.RenditionSpec;
import com.mediapipeline.model.UploadEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One job attempt: download the raw upload, encode the ladder, write the master
 * manifest and publish. Every attempt re-encodes from scratch; the workspace is
 * deleted whatever the outcome.
 */
@Service
@Slf4j
public class TranscodePipeline {

    private final UploadEventValidator validator;
    private final ObjectStore objectStore;
    private final RenditionLadderBuilder ladderBuilder;
    private final MasterManifestSynthesizer manifestSynthesizer;
    private final ResultPublisher resultPublisher;
    private final String rawBucket;
    private final Path workDir;

    public TranscodePipeline(UploadEventValidator validator,
                             ObjectStore objectStore,
                             RenditionLadderBuilder ladderBuilder,
                             MasterManifestSynthesizer manifestSynthesizer,
                             ResultPublisher resultPublisher,
                             StorageConfig storageConfig,
                             @Value("${media.encoder.work-dir:}") String workDir) {
        this.validator = validator;
        this.objectStore = objectStore;
        this.ladderBuilder = ladderBuilder;
        this.manifestSynthesizer = manifestSynthesizer;
        this.resultPublisher = resultPublisher;
        this.rawBucket = storageConfig.getRawBucket();
        this.workDir = workDir == null || workDir.isBlank() ? null : Path.of(workDir);
    }

    /**
     * @throws com.mediapipeline.exception.InvalidUploadEventException if the event can never succeed
     * @throws IOException on storage or filesystem failure (retryable)
     * @throws EncodeException on encoder failure (retryable)
     */
    public CompletionEvent process(UploadEvent event) throws IOException, EncodeException {
        validator.validate(event);
        List<RenditionSpec> ladder = validator.resolveLadder(event);

        log.info("Starting transcode for upload {} (user {}, source {})",
                event.getUploadId(), event.getUserId(), event.getRawVideoPath());

        try (TranscodeWorkspace workspace = TranscodeWorkspace.create(workDir, event.getUploadId(), event.getRawVideoPath())) {
            objectStore.download(rawBucket, event.getRawVideoPath(), workspace.getInput());

            List<RenditionSpec> built = ladderBuilder.build(workspace, ladder);
            List<String> labels = built.stream().map(RenditionSpec::getLabel).collect(Collectors.toList());
            manifestSynthesizer.write(workspace.getHlsRoot(), labels);

            CompletionEvent completion = resultPublisher.publish(event, workspace);
            log.info("Transcode completed for upload {}. Master HLS manifest: {}",
                    event.getUploadId(), completion.getHls().getMasterUrl());
            return completion;
        }
    }
}
