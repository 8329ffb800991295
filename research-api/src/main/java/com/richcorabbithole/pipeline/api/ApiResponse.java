package com.richcorabbithole.pipeline.api;

import java.util.Map;

/**
 * Status code and JSON body returned to whatever invokes the accept handler
 * (API Gateway proxy integration, a test, an embedded HTTP front end).
 */
public class ApiResponse {

    public static final Map<String, String> JSON_HEADERS = Map.of("Content-Type", "application/json");

    private final int statusCode;
    private final String body;

    public ApiResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return JSON_HEADERS;
    }

    @Override
    public String toString() {
        return "ApiResponse{" +
                "statusCode=" + statusCode +
                ", body='" + body + '\'' +
                '}';
    }
}
