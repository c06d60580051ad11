package com.collectvoice.recording.adapter;

import com.collectvoice.config.AppProperties;
import com.collectvoice.recording.service.ObjectStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Service
@ConditionalOnProperty(value = "app.storage.enabled", havingValue = "true")
public class S3ObjectStorageService implements ObjectStorageService {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorageService.class);

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final AppProperties.Storage storage;

    public S3ObjectStorageService(S3Client s3Client, S3Presigner presigner, AppProperties properties) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.storage = properties.storage();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void upload(Path localPath, String remoteKey) {
        log.info("Uploading {} to s3://{}/{}", localPath, storage.bucket(), remoteKey);
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(storage.bucket())
                .key(remoteKey)
                .contentType("video/mp4")
                .metadata(Map.of("uploaded-at", Instant.now().toString()))
                .build();
        s3Client.putObject(request, RequestBody.fromFile(localPath));
    }

    @Override
    public String presignedUrl(String remoteKey, Duration ttl) {
        GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(GetObjectRequest.builder()
                        .bucket(storage.bucket())
                        .key(remoteKey)
                        .build())
                .build();
        return presigner.presignGetObject(request).url().toString();
    }

    @Override
    public String publicUrl(String remoteKey) {
        return "https://%s.s3.%s.amazonaws.com/%s".formatted(storage.bucket(), storage.region(), remoteKey);
    }
}
