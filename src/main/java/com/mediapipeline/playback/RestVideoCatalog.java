package com.mediapipeline.playback;

import com.mediapipeline.exception.UpstreamFetchException;
import com.mediapipeline.model.VideoDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Reads video descriptors from the catalog service REST API
 * ({@code GET <base>/internal/videos/{uploadId}}).
 */
@Service
@Slf4j
public class RestVideoCatalog implements VideoCatalog {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RestVideoCatalog(@Qualifier("playbackRestTemplate") RestTemplate restTemplate,
                            @Value("${media.catalog.base-url}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
    }

    @Override
    public Optional<VideoDescriptor> findByUploadId(String uploadId) {
        try {
            VideoDescriptor descriptor = restTemplate.getForObject(
                    baseUrl + "/internal/videos/{uploadId}", VideoDescriptor.class, uploadId);
            return Optional.ofNullable(descriptor);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Catalog lookup failed for upload {}: {}", uploadId, e.getMessage());
            throw new UpstreamFetchException("Catalog unavailable", e);
        }
    }
}
