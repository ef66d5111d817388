package com.mediapipeline.controller;

import com.mediapipeline.model.JobState;
import com.mediapipeline.model.JobStatus;
import com.mediapipeline.queue.JobTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(JobStatusController.class)
class JobStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobTracker jobTracker;

    @Test
    void returnsLatestStatus() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        when(jobTracker.get("abc123")).thenReturn(Optional.of(
                new JobStatus("abc123", JobState.RETRYING, 2, "Retrying after: EncodeException", null, now, now)));

        mockMvc.perform(get("/api/jobs/abc123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("RETRYING"))
                .andExpect(jsonPath("$.attempt").value(2));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(jobTracker.get("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/jobs/nope")).andExpect(status().isNotFound());
    }

    @Test
    void rejectsMalformedId() throws Exception {
        mockMvc.perform(get("/api/jobs/bad$id")).andExpect(status().isBadRequest());

        verifyNoInteractions(jobTracker);
    }

    @Test
    void listsAllJobs() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        when(jobTracker.all()).thenReturn(List.of(
                new JobStatus("a", JobState.SUCCEEDED, 1, "Transcoding completed", "/hls/u1/a/master.m3u8", now, now)));

        mockMvc.perform(get("/api/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].masterUrl").value("/hls/u1/a/master.m3u8"));
    }
}
