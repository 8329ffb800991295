package com.richcorabbithole.pipeline.shared.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;

/**
 * Blob store for pipeline artifacts, bound to one bucket.
 */
public class S3Service {

    private static final Logger logger = LoggerFactory.getLogger(S3Service.class);

    private final S3Client s3Client;
    private final String bucketName;

    public S3Service(S3Client s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    /**
     * Writes string content under the key, replacing any existing object.
     *
     * @return the key written
     */
    public String uploadString(String key, String content, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .build();

        s3Client.putObject(request, RequestBody.fromString(content, StandardCharsets.UTF_8));
        logger.info("Uploaded s3://{}/{} ({} chars)", bucketName, key, content.length());

        return key;
    }
}
