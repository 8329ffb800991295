package com.richcorabbithole.pipeline.shared.service;

/**
 * Task table failure that is not already an AWS SDK exception.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
