package com.mediapipeline.playback;

import com.mediapipeline.exception.UpstreamFetchException;
import com.mediapipeline.model.VideoDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestVideoCatalogTest {

    private MockRestServiceServer server;
    private RestVideoCatalog catalog;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        catalog = new RestVideoCatalog(restTemplate, "http://catalog:8080/");
    }

    @Test
    void readsDescriptor() {
        server.expect(requestTo("http://catalog:8080/internal/videos/abc123"))
                .andRespond(withSuccess("{\"uploadId\":\"abc123\",\"userId\":\"u1\",\"duration\":12.5,"
                        + "\"hlsMasterUrl\":\"/hls/u1/abc123/master.m3u8\",\"views\":7}", MediaType.APPLICATION_JSON));

        Optional<VideoDescriptor> video = catalog.findByUploadId("abc123");

        assertThat(video).hasValueSatisfying(v -> {
            assertThat(v.getUserId()).isEqualTo("u1");
            assertThat(v.getDuration()).isEqualTo(12.5);
            assertThat(v.isReady()).isTrue();
        });
    }

    @Test
    void unknownVideoIsEmpty() {
        server.expect(requestTo("http://catalog:8080/internal/videos/nope")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(catalog.findByUploadId("nope")).isEmpty();
    }

    @Test
    void catalogFailureIsUpstreamError() {
        server.expect(requestTo("http://catalog:8080/internal/videos/abc123")).andRespond(withServerError());

        assertThatThrownBy(() -> catalog.findByUploadId("abc123")).isInstanceOf(UpstreamFetchException.class);
    }
}
