package com.richcorabbithole.pipeline.shared;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Map;
import java.util.function.Function;

/**
 * Configuration lookup shared by the accept API and the worker.
 * Values come from the process environment first and fall back to a .env file,
 * so the same keys work on Lambda/EC2 and on a developer machine.
 */
public class AppConfig {

    public static final String AWS_REGION = "AWS_REGION";
    public static final String TABLE_NAME = "TABLE_NAME";
    public static final String RESEARCH_QUEUE_URL = "RESEARCH_QUEUE_URL";
    public static final String BUCKET_NAME = "BUCKET_NAME";
    public static final String SECRET_ID = "SECRET_ID";

    private final Function<String, String> lookup;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        this.lookup = key -> {
            String value = System.getenv(key);
            if (value != null && !value.isEmpty()) {
                return value;
            }
            return dotenv.get(key);
        };
    }

    private AppConfig(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    /**
     * Builds a config backed only by the given map. Used by tests and embedded callers.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values::get);
    }

    /**
     * Returns the value for key, failing fast when it is absent.
     */
    public String getString(String key) {
        String value = get(key);
        if (value == null) {
            throw new IllegalStateException("Missing required environment variable: " + key);
        }
        return value;
    }

    public String getOptional(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns an int value, or the default when the key is absent.
     * A present but malformed value is a configuration error, not a silent default.
     */
    public int getIntOptional(String key, int defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + key + ", value: " + value);
        }
    }

    private String get(String key) {
        String value = lookup.apply(key);
        return value == null || value.isBlank() ? null : value;
    }
}
