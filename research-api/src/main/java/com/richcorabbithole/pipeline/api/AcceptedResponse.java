package com.richcorabbithole.pipeline.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a 202 response.
 */
public class AcceptedResponse {

    public static final String QUEUED_MESSAGE = "Research task queued for processing";

    @JsonProperty("taskId")
    private final String taskId;

    @JsonProperty("status")
    private final String status;

    @JsonProperty("message")
    private final String message;

    public AcceptedResponse(String taskId, String status, String message) {
        this.taskId = taskId;
        this.status = status;
        this.message = message;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
