package com.mediapipeline.config;

import com.mediapipeline.cache.SegmentCache;
import com.mediapipeline.playback.BlobPathExtractor;
import com.mediapipeline.playback.PlaybackSource;
import com.mediapipeline.playback.PrivateStorageSource;
import com.mediapipeline.playback.PublicPassthroughSource;
import com.mediapipeline.service.ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
@Slf4j
public class PlaybackConfig {

    /**
     * Shared by the catalog client and the public passthrough. Explicit timeouts so a
     * stalled origin cannot pin a request thread.
     */
    @Bean
    public RestTemplate playbackRestTemplate(
            @Value("${media.http.connect-timeout:PT5S}") Duration connectTimeout,
            @Value("${media.http.read-timeout:PT30S}") Duration readTimeout) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.of(connectTimeout))
                .setResponseTimeout(Timeout.of(readTimeout))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .disableRedirectHandling()
                .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        return new RestTemplate(requestFactory);
    }

    @Bean
    public PlaybackSource playbackSource(StorageConfig storageConfig,
                                         ObjectStore objectStore,
                                         BlobPathExtractor pathExtractor,
                                         SegmentCache segmentCache,
                                         @Qualifier("playbackRestTemplate") RestTemplate restTemplate) {
        if (storageConfig.hasStaticCredentials()) {
            log.info("Playback in private mode: blobs served from bucket {}", storageConfig.getProcessedBucket());
            return new PrivateStorageSource(objectStore, pathExtractor, segmentCache);
        }
        log.warn("Storage credentials not configured; playback will proxy public URLs");
        return new PublicPassthroughSource(restTemplate);
    }
}
