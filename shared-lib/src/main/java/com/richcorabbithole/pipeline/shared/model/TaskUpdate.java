package com.richcorabbithole.pipeline.shared.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Field-level patch applied to an existing task. Only the named fields are written;
 * topic and createdAt are never touched. updatedAt is always rewritten by the store.
 */
public final class TaskUpdate {

    static final int MAX_ERROR_LENGTH = 1000;

    private final TaskStatus status;
    private final String s3Key;
    private final String error;

    private TaskUpdate(TaskStatus status, String s3Key, String error) {
        this.status = Objects.requireNonNull(status, "status");
        this.s3Key = s3Key;
        this.error = error;
    }

    public static TaskUpdate researching() {
        return new TaskUpdate(TaskStatus.RESEARCHING, null, null);
    }

    public static TaskUpdate researched(String s3Key) {
        return new TaskUpdate(TaskStatus.RESEARCHED, Objects.requireNonNull(s3Key, "s3Key"), null);
    }

    public static TaskUpdate failed(String error) {
        return new TaskUpdate(TaskStatus.FAILED, null, truncate(Objects.requireNonNull(error, "error")));
    }

    public TaskStatus getStatus() {
        return status;
    }

    public Optional<String> getS3Key() {
        return Optional.ofNullable(s3Key);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    private static String truncate(String error) {
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }

    @Override
    public String toString() {
        return "TaskUpdate{" +
                "status=" + status +
                ", s3Key='" + s3Key + '\'' +
                ", error='" + error + '\'' +
                '}';
    }
}
