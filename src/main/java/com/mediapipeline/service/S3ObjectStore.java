package com.mediapipeline.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;

    public S3ObjectStore(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public void download(String bucket, String key, Path target) throws IOException {
        log.info("Downloading {}/{} to {}", bucket, key, target);

        GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        Files.createDirectories(target.toAbsolutePath().getParent());
        try (ResponseInputStream<GetObjectResponse> s3Object = s3Client.getObject(getObjectRequest);
             OutputStream outputStream = Files.newOutputStream(target)) {
            s3Object.transferTo(outputStream);
        }

        log.info("Downloaded {} bytes to: {}", Files.size(target), target);
    }

    @Override
    public byte[] getBytes(String bucket, String key) {
        log.debug("Reading {}/{}", bucket, key);
        GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        return s3Client.getObjectAsBytes(getObjectRequest).asByteArray();
    }

    @Override
    public void upload(Path file, String bucket, String key, String contentType) {
        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .build();

        s3Client.putObject(putObjectRequest, RequestBody.fromFile(file));
        log.debug("Uploaded: {}/{}", bucket, key);
    }

    @Override
    public void uploadDirectory(Path directory, String bucket, String prefix) throws IOException {
        log.info("Uploading directory: {} -> {}/{}", directory, bucket, prefix);

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        for (Path filePath : files) {
            String relativePath = directory.relativize(filePath).toString();
            String objectKey = prefix + "/" + relativePath.replace("\\", "/");
            upload(filePath, bucket, objectKey, MediaContentTypes.forKey(objectKey));
        }

        log.info("Directory uploaded successfully ({} files)", files.size());
    }

    @Override
    public void delete(String bucket, String key) {
        s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        log.debug("Deleted: {}/{}", bucket, key);
    }

    @Override
    public int deletePrefix(String bucket, String prefix) {
        int deleted = 0;
        ListObjectsV2Request listRequest = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .build();

        for (ListObjectsV2Response page : s3Client.listObjectsV2Paginator(listRequest)) {
            List<ObjectIdentifier> keys = page.contents().stream()
                    .map(object -> ObjectIdentifier.builder().key(object.key()).build())
                    .collect(Collectors.toList());
            if (keys.isEmpty()) {
                continue;
            }
            s3Client.deleteObjects(DeleteObjectsRequest.builder()
                    .bucket(bucket)
                    .delete(Delete.builder().objects(keys).quiet(true).build())
                    .build());
            deleted += keys.size();
        }

        log.info("Deleted {} objects under {}/{}", deleted, bucket, prefix);
        return deleted;
    }
}
