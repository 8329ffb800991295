package com.richcorabbithole.pipeline.shared.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

/**
 * Reads plain string secrets from Secrets Manager.
 */
public class SecretsService {

    private static final Logger logger = LoggerFactory.getLogger(SecretsService.class);

    private final SecretsManagerClient secretsClient;

    public SecretsService(SecretsManagerClient secretsClient) {
        this.secretsClient = secretsClient;
    }

    public String getSecretString(String secretId) {
        GetSecretValueRequest request = GetSecretValueRequest.builder()
                .secretId(secretId)
                .build();

        GetSecretValueResponse response = secretsClient.getSecretValue(request);
        String secret = response.secretString();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Secret has no string value: " + secretId);
        }
        logger.debug("Fetched secret {}", secretId);
        return secret;
    }
}
