package com.richcorabbithole.pipeline;

import com.richcorabbithole.pipeline.shared.model.TaskStatus;

/**
 * Result of one delivery that the worker handled without escalating. Every outcome
 * means the message can be deleted from the queue.
 */
public class WorkerOutcome {

    public static final String ALREADY_RESEARCHED = "already_researched";

    private final String taskId;
    private final String s3Key;
    private final String status;
    private final String error;

    private WorkerOutcome(String taskId, String s3Key, String status, String error) {
        this.taskId = taskId;
        this.s3Key = s3Key;
        this.status = status;
        this.error = error;
    }

    public static WorkerOutcome researched(String taskId, String s3Key) {
        return new WorkerOutcome(taskId, s3Key, TaskStatus.RESEARCHED.value(), null);
    }

    /**
     * A redelivery of a task whose research is already stored.
     */
    public static WorkerOutcome alreadyResearched(String taskId, String s3Key) {
        return new WorkerOutcome(taskId, s3Key, ALREADY_RESEARCHED, null);
    }

    /**
     * A payload that redelivery cannot repair; the task was marked failed.
     */
    public static WorkerOutcome failed(String taskId, String error) {
        return new WorkerOutcome(taskId, null, TaskStatus.FAILED.value(), error);
    }

    public String getTaskId() {
        return taskId;
    }

    public String getS3Key() {
        return s3Key;
    }

    public String getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "WorkerOutcome{" +
                "taskId='" + taskId + '\'' +
                ", s3Key='" + s3Key + '\'' +
                ", status='" + status + '\'' +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
