package com.richcorabbithole.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of 4xx and 5xx responses.
 */
public class ErrorResponse {

    @JsonProperty("error")
    private final String error;

    public ErrorResponse(String error) {
        this.error = error;
    }

    public String getError() {
        return error;
    }
}
