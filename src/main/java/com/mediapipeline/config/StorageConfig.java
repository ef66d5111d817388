package com.mediapipeline.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * S3 compatible storage (MinIO, R2, S3). Raw uploads are read from one bucket,
 * HLS output and thumbnails are written to another.
 */
@Configuration
@Slf4j
@Getter
public class StorageConfig {

    @Value("${media.storage.endpoint:}")
    private String endpoint;

    @Value("${media.storage.access-key:}")
    private String accessKey;

    @Value("${media.storage.secret-key:}")
    private String secretKey;

    @Value("${media.storage.region:us-east-1}")
    private String region;

    @Value("${media.storage.raw-bucket:raw-videos}")
    private String rawBucket;

    @Value("${media.storage.processed-bucket:processed-videos}")
    private String processedBucket;

    @Value("${media.storage.public-base-url:}")
    private String publicBaseUrl;

    @Value("${media.storage.api-call-timeout:PT60S}")
    private Duration apiCallTimeout;

    @Value("${media.storage.provider-host-suffixes:.blob.core.windows.net}")
    private List<String> providerHostSuffixes;

    /**
     * Static credentials switch playback into private mode: blobs are read through
     * the storage client instead of being fetched from their public URL.
     */
    public boolean hasStaticCredentials() {
        return !endpoint.isBlank() && !accessKey.isBlank() && !secretKey.isBlank();
    }

    @Bean
    public S3Client s3Client() {
        AwsCredentialsProvider credentials = hasStaticCredentials()
                ? StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey))
                : DefaultCredentialsProvider.create();

        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(credentials)
                .region(Region.of(region))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiCallTimeout)
                        .build())
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(true) // Required for MinIO
                        .checksumValidationEnabled(false)
                        .build());

        if (!endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }

        log.info("Initialized storage client (endpoint: {}, raw bucket: {}, processed bucket: {})",
                endpoint.isBlank() ? "default" : endpoint, rawBucket, processedBucket);
        return builder.build();
    }
}
