package com.richcorabbithole.pipeline.shared.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a research task.
 *
 * <pre>
 * pending      -> researching | failed
 * researching  -> researching | researched | failed
 * failed       -> researching
 * researched   -> (terminal)
 * </pre>
 *
 * researching -> researching covers a redelivered message whose earlier attempt died
 * mid-flight. failed -> researching covers a queue redelivery after an escalated failure.
 */
public enum TaskStatus {

    PENDING("pending"),
    RESEARCHING("researching"),
    RESEARCHED("researched"),
    FAILED("failed");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    /**
     * The value stored in the task table and returned to clients.
     */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == RESEARCHED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedNext().contains(next);
    }

    /**
     * Validates a transition and returns the target status.
     *
     * @throws IllegalStatusTransitionException if the transition is not part of the lifecycle
     */
    public TaskStatus transitionTo(TaskStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStatusTransitionException(this, next);
        }
        return next;
    }

    private Set<TaskStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RESEARCHING, FAILED);
            case RESEARCHING:
                return EnumSet.of(RESEARCHING, RESEARCHED, FAILED);
            case FAILED:
                return EnumSet.of(RESEARCHING);
            default:
                return Collections.emptySet();
        }
    }

    public static TaskStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
