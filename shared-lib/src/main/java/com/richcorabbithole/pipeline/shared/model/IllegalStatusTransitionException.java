package com.richcorabbithole.pipeline.shared.model;

/**
 * Thrown when code attempts to move a task between two statuses the lifecycle does not connect.
 */
public class IllegalStatusTransitionException extends RuntimeException {

    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalStatusTransitionException(TaskStatus from, TaskStatus to) {
        super("Illegal task status transition: " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
