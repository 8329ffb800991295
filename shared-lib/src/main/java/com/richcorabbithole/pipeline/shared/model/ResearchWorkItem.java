package com.richcorabbithole.pipeline.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message sent from the accept API to the research worker.
 */
public class ResearchWorkItem {

    @JsonProperty("taskId")
    private final String taskId;

    @JsonProperty("topic")
    private final String topic;

    @JsonCreator
    public ResearchWorkItem(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("topic") String topic) {
        this.taskId = taskId;
        this.topic = topic;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTopic() {
        return topic;
    }

    @Override
    public String toString() {
        return "ResearchWorkItem{" +
                "taskId='" + taskId + '\'' +
                ", topic='" + topic + '\'' +
                '}';
    }
}
