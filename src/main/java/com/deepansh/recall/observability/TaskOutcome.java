package com.deepansh.recall.observability;

/**
 * What a pipeline reports back to the task runner: final status, how many
 * dependency attempts it spent, and a short operator-facing detail string.
 */
public record TaskOutcome(TaskStatus status, int attempts, String detail) {

    public static TaskOutcome completed(int attempts, String detail) {
        return new TaskOutcome(TaskStatus.COMPLETED, attempts, detail);
    }

    public static TaskOutcome skipped(String reason) {
        return new TaskOutcome(TaskStatus.SKIPPED, 0, reason);
    }
}
