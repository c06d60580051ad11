package com.collectvoice.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
@ConditionalOnProperty(value = "app.storage.enabled", havingValue = "true")
public class StorageConfig {

    @Bean(destroyMethod = "close")
    S3Client s3Client(AppProperties properties) {
        AppProperties.Storage storage = requireCredentials(properties);
        return S3Client.builder()
                .region(Region.of(storage.region()))
                .credentialsProvider(credentials(storage))
                .build();
    }

    @Bean(destroyMethod = "close")
    S3Presigner s3Presigner(AppProperties properties) {
        AppProperties.Storage storage = requireCredentials(properties);
        return S3Presigner.builder()
                .region(Region.of(storage.region()))
                .credentialsProvider(credentials(storage))
                .build();
    }

    private AppProperties.Storage requireCredentials(AppProperties properties) {
        AppProperties.Storage storage = properties.storage();
        if (!storage.hasCredentials()) {
            throw new IllegalStateException("app.storage.enabled requires bucket, access-key and secret-key");
        }
        return storage;
    }

    private StaticCredentialsProvider credentials(AppProperties.Storage storage) {
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(storage.accessKey(), storage.secretKey()));
    }
}
