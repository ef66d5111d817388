package com.mediapipeline.queue;

import com.mediapipeline.model.JobState;
import lombok.Value;

import java.time.Duration;

/**
 * What the listener must do with the delivery once the handler returns.
 */
@Value
public class JobOutcome {
    JobState state;
    int attempt;
    Duration retryDelay;
    String reason;

    static JobOutcome succeeded(int attempt) {
        return new JobOutcome(JobState.SUCCEEDED, attempt, Duration.ZERO, null);
    }

    static JobOutcome retry(int attempt, Duration delay, String reason) {
        return new JobOutcome(JobState.RETRYING, attempt, delay, reason);
    }

    static JobOutcome deadLetter(int attempt, String reason) {
        return new JobOutcome(JobState.DEAD_LETTERED, attempt, Duration.ZERO, reason);
    }
}
