package com.nevis.dossier.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

@Configuration
@RequiredArgsConstructor
public class StorageConfig {

    private final StorageProperties storageProperties;

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        var builder = S3Client.builder()
            .region(Region.of(storageProperties.region()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .serviceConfiguration(s3Configuration());

        if (hasCustomEndpoint()) {
            builder.endpointOverride(URI.create(storageProperties.endpoint()));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner() {
        var builder = S3Presigner.builder()
            .region(Region.of(storageProperties.region()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .serviceConfiguration(s3Configuration());

        if (hasCustomEndpoint()) {
            builder.endpointOverride(URI.create(storageProperties.endpoint()));
        }
        return builder.build();
    }

    private S3Configuration s3Configuration() {
        return S3Configuration.builder()
            .pathStyleAccessEnabled(storageProperties.pathStyleAccess())
            .build();
    }

    private boolean hasCustomEndpoint() {
        return storageProperties.endpoint() != null && !storageProperties.endpoint().isBlank();
    }
}
