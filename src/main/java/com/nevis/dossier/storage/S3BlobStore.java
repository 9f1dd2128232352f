package com.nevis.dossier.storage;

import com.nevis.dossier.config.StorageProperties;
import com.nevis.dossier.exception.BlobNotFoundException;
import com.nevis.dossier.exception.BlobStoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class S3BlobStore implements BlobStore {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucket;

    public S3BlobStore(S3Client s3Client, S3Presigner s3Presigner, StorageProperties storageProperties) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucket = storageProperties.bucket();
    }

    @Override
    public String put(String key, byte[] content, String contentType, Map<String, String> metadata) {
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(contentType)
            .metadata(metadata != null ? metadata : Map.of())
            .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.debug("Stored blob {} ({} bytes)", key, content.length);
            return key;
        } catch (SdkException e) {
            throw new BlobStoreUnavailableException(key, e);
        }
    }

    @Override
    @Retryable(
        retryFor = BlobStoreUnavailableException.class,
        maxAttemptsExpression = "${app.storage.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.storage.retry.initial-delay-ms:500}", multiplier = 2.0)
    )
    public byte[] get(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build();
        try {
            byte[] content = s3Client.getObjectAsBytes(request).asByteArray();
            log.debug("Fetched blob {} ({} bytes)", key, content.length);
            return content;
        } catch (NoSuchKeyException e) {
            throw new BlobNotFoundException(key, e);
        } catch (SdkException e) {
            log.warn("Blob store call failed for {}: {}", key, e.getMessage());
            throw new BlobStoreUnavailableException(key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                throw new BlobStoreUnavailableException(key, e);
            }
            log.debug("Blob {} already absent", key);
            return false;
        } catch (SdkException e) {
            throw new BlobStoreUnavailableException(key, e);
        }

        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            log.debug("Deleted blob {}", key);
            return true;
        } catch (SdkException e) {
            throw new BlobStoreUnavailableException(key, e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
            .bucket(bucket)
            .prefix(prefix)
            .build();
        try {
            return s3Client.listObjectsV2Paginator(request).contents().stream()
                .map(S3Object::key)
                .toList();
        } catch (SdkException e) {
            throw new BlobStoreUnavailableException(prefix, e);
        }
    }

    @Override
    public String sign(String key, Duration ttl) {
        GetObjectRequest getRequest = GetObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build();
        try {
            PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(builder -> builder
                .signatureDuration(ttl)
                .getObjectRequest(getRequest));
            log.debug("Signed blob {} for {} minutes", key, ttl.toMinutes());
            return presigned.url().toString();
        } catch (SdkException e) {
            throw new BlobStoreUnavailableException(key, e);
        }
    }
}
