package com.deepansh.recall.orchestrator;

import com.deepansh.recall.observability.MemoryTaskEvent;
import com.deepansh.recall.observability.TaskOutcome;
import com.deepansh.recall.observability.TaskStatus;
import com.deepansh.recall.observability.TaskType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Submits compaction and extraction work to the bounded memory worker pool.
 *
 * Every submission ends in exactly one {@link MemoryTaskEvent}: published to the
 * application context (persisted by TraceService) and returned as the future's value,
 * so callers and tests can await completion deterministically.
 * The returned future never completes exceptionally.
 */
@Component
@Slf4j
public class BackgroundTaskRunner {

    private final Executor executor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BackgroundTaskRunner(@Qualifier("memoryTaskExecutor") Executor executor,
                                ApplicationEventPublisher eventPublisher) {
        this(executor, eventPublisher, Clock.systemUTC());
    }

    BackgroundTaskRunner(Executor executor, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.executor = executor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public CompletableFuture<MemoryTaskEvent> submit(TaskType type, String userId, Supplier<TaskOutcome> task) {
        Instant submittedAt = clock.instant();
        try {
            return CompletableFuture.supplyAsync(() -> run(type, userId, task), executor);
        } catch (RejectedExecutionException e) {
            log.error("Memory worker pool saturated, {} task rejected for user={}", type, userId);
            MemoryTaskEvent event = new MemoryTaskEvent(type, userId, TaskStatus.REJECTED, 0, 0,
                    "worker pool saturated", submittedAt);
            publish(event);
            return CompletableFuture.completedFuture(event);
        }
    }

    private MemoryTaskEvent run(TaskType type, String userId, Supplier<TaskOutcome> task) {
        long start = System.currentTimeMillis();
        MemoryTaskEvent event;
        try {
            TaskOutcome outcome = task.get();
            event = new MemoryTaskEvent(type, userId, outcome.status(), outcome.attempts(),
                    System.currentTimeMillis() - start, outcome.detail(), clock.instant());
        } catch (Exception e) {
            log.error("{} task failed for user={}", type, userId, e);
            event = new MemoryTaskEvent(type, userId, TaskStatus.FAILED, 0,
                    System.currentTimeMillis() - start, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    clock.instant());
        }
        publish(event);
        return event;
    }

    private void publish(MemoryTaskEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (Exception e) {
            log.warn("Failed to publish {} event for user={}: {}", event.type(), event.userId(), e.getMessage());
        }
    }
}
