package com.mediapipeline.playback;

import com.mediapipeline.exception.ResourceNotFoundException;
import com.mediapipeline.exception.UpstreamFetchException;
import com.mediapipeline.model.VideoDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Stored URLs are fetched over plain HTTP, no storage credentials involved.
 */
@Slf4j
public class PublicPassthroughSource implements PlaybackSource {

    private static final String MASTER_SUFFIX = "/master.m3u8";

    // Hop-by-hop or recomputed by the servlet container
    private static final Set<String> SKIPPED_HEADERS = Set.of(
            HttpHeaders.CONNECTION.toLowerCase(),
            HttpHeaders.TRANSFER_ENCODING.toLowerCase(),
            HttpHeaders.CONTENT_LENGTH.toLowerCase(),
            HttpHeaders.CACHE_CONTROL.toLowerCase(),
            "keep-alive");

    private final RestTemplate restTemplate;

    public PublicPassthroughSource(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public String mode() {
        return "public";
    }

    @Override
    public String fetchMaster(VideoDescriptor video) {
        return new String(get(video.getHlsMasterUrl()).getBody(), StandardCharsets.UTF_8);
    }

    @Override
    public String fetchVariant(VideoDescriptor video, String rendition) {
        String url = baseUrl(video.getHlsMasterUrl()) + "/" + rendition + "/index.m3u8";
        return new String(get(url).getBody(), StandardCharsets.UTF_8);
    }

    @Override
    public ResponseEntity<byte[]> fetchSegment(VideoDescriptor video, String rendition, String segment) {
        String url = baseUrl(video.getHlsMasterUrl()) + "/" + rendition + "/" + segment;
        ResponseEntity<byte[]> upstream = get(url);

        HttpHeaders headers = new HttpHeaders();
        upstream.getHeaders().forEach((name, values) -> {
            if (!values.isEmpty() && !SKIPPED_HEADERS.contains(name.toLowerCase())) {
                headers.set(name, values.get(0));
            }
        });
        headers.setCacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePublic());
        return new ResponseEntity<>(upstream.getBody(), headers, upstream.getStatusCode());
    }

    @Override
    public ResponseEntity<byte[]> fetchThumbnail(VideoDescriptor video) {
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(video.getThumbnailUrl()))
                .build();
    }

    static String baseUrl(String masterUrl) {
        return masterUrl.endsWith(MASTER_SUFFIX)
                ? masterUrl.substring(0, masterUrl.length() - MASTER_SUFFIX.length())
                : masterUrl;
    }

    private ResponseEntity<byte[]> get(String url) {
        try {
            ResponseEntity<byte[]> response = restTemplate.getForEntity(URI.create(url), byte[].class);
            if (response.getBody() == null) {
                return new ResponseEntity<>(new byte[0], response.getHeaders(), response.getStatusCode());
            }
            return response;
        } catch (HttpClientErrorException.NotFound e) {
            throw new ResourceNotFoundException("Upstream resource not found: " + url);
        } catch (RestClientException | IllegalArgumentException e) {
            log.error("Fetch failed for {}: {}", url, e.getMessage());
            throw new UpstreamFetchException("Upstream error", e);
        }
    }
}
