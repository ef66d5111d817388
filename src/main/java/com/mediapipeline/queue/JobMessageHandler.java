package com.mediapipeline.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediapipeline.exception.InvalidUploadEventException;
import com.mediapipeline.model.CompletionEvent;
import com.mediapipeline.model.JobState;
import com.mediapipeline.model.UploadEvent;
import com.mediapipeline.service.TranscodePipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * Broker-independent handling of one delivery:
 * <pre>
 *   Received -> Processing -> Succeeded                      (ack)
 *                          -> transient failure, attempt &lt; max -> Retrying (requeue with backoff)
 *                          -> permanent failure or attempts exhausted -> DeadLettered
 * </pre>
 */
@Component
@Slf4j
public class JobMessageHandler {

    private final ObjectMapper objectMapper;
    private final TranscodePipeline pipeline;
    private final RetryPolicy retryPolicy;
    private final JobTracker jobTracker;

    public JobMessageHandler(ObjectMapper objectMapper,
                             TranscodePipeline pipeline,
                             RetryPolicy retryPolicy,
                             JobTracker jobTracker) {
        this.objectMapper = objectMapper;
        this.pipeline = pipeline;
        this.retryPolicy = retryPolicy;
        this.jobTracker = jobTracker;
    }

    public JobOutcome handle(byte[] body, int attempt) {
        UploadEvent event;
        try {
            event = parse(body);
        } catch (InvalidUploadEventException e) {
            log.error("Rejecting malformed upload message: {}", e.getMessage());
            return JobOutcome.deadLetter(attempt, e.getMessage());
        }

        String uploadId = event.getUploadId();
        jobTracker.transition(uploadId, JobState.RECEIVED, attempt, "Message received");

        try {
            jobTracker.transition(uploadId, JobState.PROCESSING, attempt, "Transcoding in progress");
            CompletionEvent completion = pipeline.process(event);
            jobTracker.transition(uploadId, JobState.SUCCEEDED, attempt, "Transcoding completed",
                    completion.getHls().getMasterUrl());
            return JobOutcome.succeeded(attempt);

        } catch (InvalidUploadEventException e) {
            log.error("Rejecting upload {} without retry: {}", uploadId, e.getMessage());
            jobTracker.transition(uploadId, JobState.DEAD_LETTERED, attempt, "Invalid event: " + e.getMessage());
            return JobOutcome.deadLetter(attempt, e.getMessage());

        } catch (Exception e) {
            String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
            if (!retryPolicy.canRetry(attempt)) {
                log.error("Upload {} failed on attempt {}/{}, giving up", uploadId, attempt,
                        retryPolicy.getMaxAttempts(), e);
                jobTracker.transition(uploadId, JobState.DEAD_LETTERED, attempt, "Retries exhausted: " + reason);
                return JobOutcome.deadLetter(attempt, reason);
            }
            Duration delay = retryPolicy.backoffAfter(attempt);
            log.warn("Upload {} failed on attempt {}/{}, retrying in {}", uploadId, attempt,
                    retryPolicy.getMaxAttempts(), delay, e);
            jobTracker.transition(uploadId, JobState.RETRYING, attempt, "Retrying after: " + reason);
            return JobOutcome.retry(attempt, delay, reason);
        }
    }

    private UploadEvent parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new InvalidUploadEventException("Empty message body");
        }
        try {
            UploadEvent event = objectMapper.readValue(body, UploadEvent.class);
            if (event == null) {
                throw new InvalidUploadEventException("Message body is null");
            }
            return event;
        } catch (IOException e) {
            throw new InvalidUploadEventException("Malformed upload event: " + e.getMessage(), e);
        }
    }
}
