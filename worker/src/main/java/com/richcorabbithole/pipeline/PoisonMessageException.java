package com.richcorabbithole.pipeline;

/**
 * A work item that cannot be tied to a task record. Escalated without any task table
 * write so the queue's redrive policy moves it to the dead-letter queue for inspection.
 */
public class PoisonMessageException extends RuntimeException {

    public PoisonMessageException(String message) {
        super(message);
    }

    public PoisonMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
