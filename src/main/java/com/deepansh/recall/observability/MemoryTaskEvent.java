package com.deepansh.recall.observability;

import java.time.Instant;

/**
 * Published once per background task when it reaches a terminal state.
 * Tests await the task's future; operators read the persisted traces.
 */
public record MemoryTaskEvent(
        TaskType type,
        String userId,
        TaskStatus status,
        int attempts,
        long latencyMs,
        String detail,
        Instant occurredAt) {

    public boolean isFailure() {
        return status == TaskStatus.DROPPED || status == TaskStatus.FAILED || status == TaskStatus.REJECTED;
    }
}
