package com.richcorabbithole.pipeline.shared;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * Factory for creating AWS clients with consistent configuration.
 */
public class AwsClientFactory {

    private AwsClientFactory() {
    }

    public static S3Client createS3Client(String region) {
        return S3Client.builder()
                .region(Region.of(region))
                .build();
    }

    public static SqsClient createSqsClient(String region) {
        return SqsClient.builder()
                .region(Region.of(region))
                .build();
    }

    public static DynamoDbClient createDynamoDbClient(String region) {
        return DynamoDbClient.builder()
                .region(Region.of(region))
                .build();
    }

    public static SecretsManagerClient createSecretsManagerClient(String region) {
        return SecretsManagerClient.builder()
                .region(Region.of(region))
                .build();
    }
}
