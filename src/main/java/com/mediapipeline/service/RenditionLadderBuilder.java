package com.mediapipeline.service;

import com.mediapipeline.exception.EncodeException;
import com.mediapipeline.model.RenditionSpec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Encodes the ladder one rendition at a time, in ladder order. The first failure aborts
 * the whole ladder so a master manifest is never written over a partial set.
 */
@Service
@Slf4j
public class RenditionLadderBuilder {

    static final String ENCODE_TIMER = "media.rendition.encode";

    private final VideoEncoder encoder;
    private final MeterRegistry meterRegistry;

    public RenditionLadderBuilder(VideoEncoder encoder, MeterRegistry meterRegistry) {
        this.encoder = encoder;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return the renditions that were built, in ladder order
     */
    public List<RenditionSpec> build(TranscodeWorkspace workspace, List<RenditionSpec> ladder)
            throws EncodeException, IOException {
        log.info("Building ladder {} from {}", ladder.stream().map(RenditionSpec::getLabel).toList(),
                workspace.getInput().getFileName());

        for (RenditionSpec rendition : ladder) {
            Path outputDir = workspace.renditionDir(rendition.getLabel());

            long start = System.nanoTime();
            try {
                encoder.encode(workspace.getInput(), outputDir, rendition);
            } catch (EncodeException e) {
                throw new EncodeException("Rendition " + rendition.getLabel() + " failed: " + e.getMessage(), e);
            }
            long elapsed = System.nanoTime() - start;

            Timer.builder(ENCODE_TIMER)
                    .tag("rendition", rendition.getLabel())
                    .register(meterRegistry)
                    .record(elapsed, TimeUnit.NANOSECONDS);
            log.info("Rendition {} done in {} ms", rendition.getLabel(), TimeUnit.NANOSECONDS.toMillis(elapsed));
        }
        return ladder;
    }
}
