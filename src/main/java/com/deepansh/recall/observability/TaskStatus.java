package com.deepansh.recall.observability;

/**
 * Terminal state of one background memory task.
 */
public enum TaskStatus {
    /** All steps succeeded */
    COMPLETED,
    /** Summarizer gave up; the slice went back into the buffer */
    RESTORED,
    /** Embed or persist gave up after the slice was evicted. Turns are lost. */
    DROPPED,
    /** Unexpected exception inside the task */
    FAILED,
    /** Worker pool saturated, task never ran */
    REJECTED,
    /** Nothing to do (gated message, undersized slice) */
    SKIPPED
}
