package com.mediapipeline.queue;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff for transient job failures: initial, 2x, 4x ... capped at maxBackoff.
 * Attempts are 1-based; after maxAttempts failed attempts the job is dead-lettered.
 */
@Component
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(
            @Value("${media.transcoder.retry.max-attempts:5}") int maxAttempts,
            @Value("${media.transcoder.retry.initial-backoff:PT10S}") Duration initialBackoff,
            @Value("${media.transcoder.retry.max-backoff:PT5M}") Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public boolean canRetry(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    public Duration backoffAfter(int failedAttempt) {
        int exponent = Math.min(Math.max(failedAttempt - 1, 0), 30);
        long millis = initialBackoff.toMillis() << exponent;
        if (millis <= 0 || millis > maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(millis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
