package com.richcorabbithole.pipeline.shared.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A row of the task table.
 */
public class TaskRecord {

    private final String taskId;
    private final TaskStatus status;
    private final String topic;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String s3Key;
    private final String error;

    public TaskRecord(String taskId, TaskStatus status, String topic, Instant createdAt, Instant updatedAt,
            String s3Key, String error) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.status = Objects.requireNonNull(status, "status");
        this.topic = topic;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.s3Key = s3Key;
        this.error = error;
    }

    /**
     * A freshly accepted task: pending, both timestamps set to now.
     */
    public static TaskRecord createPending(String taskId, String topic, Instant now) {
        return new TaskRecord(taskId, TaskStatus.PENDING, topic, now, now, null, null);
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public String getTopic() {
        return topic;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getS3Key() {
        return s3Key;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "TaskRecord{" +
                "taskId='" + taskId + '\'' +
                ", status=" + status +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                ", s3Key='" + s3Key + '\'' +
                ", error='" + error + '\'' +
                '}';
    }
}
