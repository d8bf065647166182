package org.qbitspark.filevaultbackend.storage_service.service.impl;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.errors.ErrorResponseException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.qbitspark.filevaultbackend.globeadvice.exceptions.StorageException;
import org.qbitspark.filevaultbackend.storage_service.config.StorageProperties;
import org.qbitspark.filevaultbackend.storage_service.service.StorageBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;

@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "app.storage", name = "backend", havingValue = "minio")
public class MinioStorageBackend implements StorageBackend {

    private static final String CONTENT_TYPE = "application/octet-stream";

    private final MinioClient minioClient;
    private final StorageProperties storageProperties;

    @PostConstruct
    public void ensureBucket() {
        String bucketName = bucket();
        try {
            boolean exists = minioClient.bucketExists(
                    BucketExistsArgs.builder()
                            .bucket(bucketName)
                            .build()
            );
            if (!exists) {
                minioClient.makeBucket(
                        MakeBucketArgs.builder()
                                .bucket(bucketName)
                                .build()
                );
                log.info("Created bucket: {}", bucketName);
            }
        } catch (Exception e) {
            log.error("Error preparing bucket: {}", bucketName, e);
            throw new StorageException("Failed to prepare storage bucket", e);
        }
    }

    @Override
    public void put(String key, byte[] content) {
        try {
            minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(bucket())
                            .object(key)
                            .stream(new ByteArrayInputStream(content), content.length, -1)
                            .contentType(CONTENT_TYPE)
                            .build()
            );
            log.info("Uploaded object: {} to bucket: {}", key, bucket());
        } catch (Exception e) {
            log.error("Error uploading object: {}", key, e);
            throw new StorageException("Failed to upload object to MinIO", e);
        }
    }

    @Override
    public byte[] get(String key) {
        try (GetObjectResponse response = minioClient.getObject(
                GetObjectArgs.builder()
                        .bucket(bucket())
                        .object(key)
                        .build())) {
            return response.readAllBytes();
        } catch (ErrorResponseException e) {
            if ("NoSuchKey".equals(e.errorResponse().code())) {
                throw new StorageException.ObjectNotFoundException(key);
            }
            log.error("Error downloading object: {}", key, e);
            throw new StorageException("Failed to download object from MinIO", e);
        } catch (Exception e) {
            log.error("Error downloading object: {}", key, e);
            throw new StorageException("Failed to download object from MinIO", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            minioClient.removeObject(
                    RemoveObjectArgs.builder()
                            .bucket(bucket())
                            .object(key)
                            .build()
            );
            log.info("Deleted object: {} from bucket: {}", key, bucket());
        } catch (Exception e) {
            log.error("Error deleting object: {}", key, e);
            throw new StorageException("Failed to delete object from MinIO", e);
        }
    }

    @Override
    public String name() {
        return "minio";
    }

    private String bucket() {
        return storageProperties.getMinio().getBucket();
    }
}
