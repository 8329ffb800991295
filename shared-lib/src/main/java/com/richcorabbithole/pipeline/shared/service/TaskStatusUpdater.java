package com.richcorabbithole.pipeline.shared.service;

import com.richcorabbithole.pipeline.shared.model.TaskUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort failure recording. Used as the compensation step after a primary
 * failure, so it never throws: the outcome is returned and logged, and the caller keeps
 * escalating its own original error.
 */
public class TaskStatusUpdater {

    private static final Logger logger = LoggerFactory.getLogger(TaskStatusUpdater.class);

    private final TaskTableService taskTable;

    public TaskStatusUpdater(TaskTableService taskTable) {
        this.taskTable = taskTable;
    }

    public MarkFailedResult markFailed(String taskId, String error) {
        try {
            if (taskTable.updateTask(taskId, TaskUpdate.failed(error))) {
                return MarkFailedResult.recorded();
            }
            logger.warn("Task {} not marked failed: missing or already researched", taskId);
            return MarkFailedResult.skipped();
        } catch (RuntimeException e) {
            logger.error("Failed to mark task {} as failed", taskId, e);
            return MarkFailedResult.error(e);
        }
    }

    /**
     * Turns an exception into the short diagnostic stored on a failed task.
     */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    /**
     * Outcome of {@link #markFailed}.
     */
    public static final class MarkFailedResult {

        public enum Outcome {
            RECORDED,
            SKIPPED,
            ERROR
        }

        private final Outcome outcome;
        private final RuntimeException cause;

        private MarkFailedResult(Outcome outcome, RuntimeException cause) {
            this.outcome = outcome;
            this.cause = cause;
        }

        static MarkFailedResult recorded() {
            return new MarkFailedResult(Outcome.RECORDED, null);
        }

        static MarkFailedResult skipped() {
            return new MarkFailedResult(Outcome.SKIPPED, null);
        }

        static MarkFailedResult error(RuntimeException cause) {
            return new MarkFailedResult(Outcome.ERROR, cause);
        }

        public Outcome getOutcome() {
            return outcome;
        }

        public boolean isRecorded() {
            return outcome == Outcome.RECORDED;
        }

        /**
         * The secondary failure, present only for {@link Outcome#ERROR}.
         */
        public RuntimeException getCause() {
            return cause;
        }

        @Override
        public String toString() {
            return cause == null ? outcome.name() : outcome + "(" + cause.getMessage() + ")";
        }
    }
}
