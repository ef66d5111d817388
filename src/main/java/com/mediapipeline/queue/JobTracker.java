package com.mediapipeline.queue;

import com.mediapipeline.model.JobState;
import com.mediapipeline.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process view of the latest attempt per upload. Lost on restart; the broker
 * remains the source of truth for pending work. Finished jobs are forgotten once
 * they are older than the retention window.
 */
@Component
@Slf4j
public class JobTracker {

    private final ConcurrentMap<String, JobStatus> statusByUpload = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public JobTracker(@Value("${media.transcoder.job-status-retention:PT24H}") Duration retention) {
        this(retention, Clock.systemDefaultZone());
    }

    JobTracker(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    public void transition(String uploadId, JobState state, int attempt, String message) {
        transition(uploadId, state, attempt, message, null);
    }

    public void transition(String uploadId, JobState state, int attempt, String message, String masterUrl) {
        if (uploadId == null) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        statusByUpload.compute(uploadId, (id, current) -> {
            JobStatus status = current != null ? current : new JobStatus(id, state, attempt, message, null, now, now);
            status.setState(state);
            status.setAttempt(attempt);
            status.setMessage(message);
            status.setUpdatedAt(now);
            if (masterUrl != null) {
                status.setMasterUrl(masterUrl);
            }
            return status;
        });
        log.debug("Job {} -> {} (attempt {})", uploadId, state, attempt);
        pruneFinished(now);
    }

    public Optional<JobStatus> get(String uploadId) {
        return Optional.ofNullable(statusByUpload.get(uploadId));
    }

    public List<JobStatus> all() {
        return new ArrayList<>(statusByUpload.values());
    }

    private void pruneFinished(LocalDateTime now) {
        LocalDateTime cutoff = now.minus(retention);
        statusByUpload.values().removeIf(status -> isFinished(status.getState())
                && status.getUpdatedAt().isBefore(cutoff));
    }

    private static boolean isFinished(JobState state) {
        return state == JobState.SUCCEEDED || state == JobState.DEAD_LETTERED;
    }
}
