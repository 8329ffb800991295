package com.richcorabbithole.pipeline.research;

/**
 * The research provider failed or broke its response contract.
 */
public class ResearchProviderException extends RuntimeException {

    private final int statusCode;

    public ResearchProviderException(String message) {
        this(message, -1, null);
    }

    public ResearchProviderException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ResearchProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
