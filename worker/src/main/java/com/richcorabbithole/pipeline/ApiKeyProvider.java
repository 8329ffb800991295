package com.richcorabbithole.pipeline;

import com.richcorabbithole.pipeline.shared.service.SecretsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Provider API key, fetched from Secrets Manager on first use and then held for the life
 * of the worker process. Two threads racing on the first call may both fetch; the first
 * value stored is the one every caller sees from then on.
 */
public class ApiKeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyProvider.class);

    private final SecretsService secretsService;
    private final String secretId;
    private final AtomicReference<String> cachedKey = new AtomicReference<>();

    public ApiKeyProvider(SecretsService secretsService, String secretId) {
        this.secretsService = secretsService;
        this.secretId = secretId;
    }

    public String getApiKey() {
        String key = cachedKey.get();
        if (key != null) {
            return key;
        }
        String fetched = secretsService.getSecretString(secretId);
        if (cachedKey.compareAndSet(null, fetched)) {
            logger.info("Loaded provider API key from secret {}", secretId);
        }
        return cachedKey.get();
    }
}
