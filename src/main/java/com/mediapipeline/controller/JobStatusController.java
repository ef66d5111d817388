package com.mediapipeline.controller;

import com.mediapipeline.model.JobStatus;
import com.mediapipeline.queue.JobTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
@Slf4j
public class JobStatusController {

    private final JobTracker jobTracker;

    public JobStatusController(JobTracker jobTracker) {
        this.jobTracker = jobTracker;
    }

    /**
     * Latest attempt of a transcode job, as seen by this instance
     */
    @GetMapping("/{uploadId}")
    public ResponseEntity<JobStatus> getJobStatus(@PathVariable String uploadId) {
        if (!uploadId.matches("[a-zA-Z0-9_\\-.@]+")) {
            log.warn("Invalid uploadId format requested: {}", uploadId);
            return ResponseEntity.badRequest().build();
        }
        return jobTracker.get(uploadId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<JobStatus>> getJobs() {
        return ResponseEntity.ok(jobTracker.all());
    }
}
