package com.deepansh.recall.compaction;

import com.deepansh.recall.buffer.CompactionSlice;
import com.deepansh.recall.buffer.SessionBuffer;
import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.embedding.Embedder;
import com.deepansh.recall.episode.Episode;
import com.deepansh.recall.episode.EpisodicStore;
import com.deepansh.recall.episode.VectorMath;
import com.deepansh.recall.exception.TransientDependencyException;
import com.deepansh.recall.observability.TaskOutcome;
import com.deepansh.recall.observability.TaskStatus;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Moves aged turns out of the session buffer into one durable episode:
 * take slice → summarize → embed → persist.
 *
 * Runs on the memory worker pool. The caller has already claimed the user's
 * compaction slot via {@link SessionBuffer#tryBeginCompaction}; this class always
 * releases it, whatever the outcome.
 *
 * Failure semantics per step (each step has its own retry budget):
 * - summarize exhausted: slice goes back into the buffer. RESTORED, nothing lost.
 * - embed / persist exhausted: the slice was already evicted, the turns are gone.
 *   DROPPED, logged at ERROR with the turn range for operators.
 */
@Service
@Slf4j
public class CompactionPipeline {

    private final SessionBuffer sessionBuffer;
    private final Summarizer summarizer;
    private final Embedder embedder;
    private final EpisodicStore episodicStore;
    private final MemoryProperties.Compaction config;
    private final Retry retry;

    public CompactionPipeline(SessionBuffer sessionBuffer,
                              Summarizer summarizer,
                              Embedder embedder,
                              EpisodicStore episodicStore,
                              MemoryProperties properties,
                              RetryRegistry retryRegistry) {
        this.sessionBuffer = sessionBuffer;
        this.summarizer = summarizer;
        this.embedder = embedder;
        this.episodicStore = episodicStore;
        this.config = properties.getCompaction();
        this.retry = retryRegistry.retry("compaction", RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .waitDuration(Duration.ofMillis(config.getBackoffMs()))
                .retryOnException(CompactionPipeline::isRetryable)
                .build());
    }

    /** Dependency blips, including the episode store being briefly unreachable */
    static boolean isRetryable(Throwable e) {
        return e instanceof TransientDependencyException
                || e instanceof TransientDataAccessException
                || e instanceof DataAccessResourceFailureException;
    }

    public TaskOutcome compact(String userId) {
        try {
            return runCompaction(userId);
        } finally {
            sessionBuffer.endCompaction(userId);
        }
    }

    private TaskOutcome runCompaction(String userId) {
        CompactionSlice split = sessionBuffer.takeCompactionSlice(userId);
        if (split.isEmpty()) {
            return TaskOutcome.skipped("nothing to compact");
        }
        if (split.slice().size() < config.getMinTurns()) {
            sessionBuffer.restoreSlice(userId, split.slice());
            return TaskOutcome.skipped("slice below min turns: " + split.slice().size());
        }

        String range = "turns " + split.turnStart() + "-" + split.turnEnd();
        log.info("Compacting {} for user={} ({} turns, {} retained)",
                range, userId, split.slice().size(), split.retained().size());

        AtomicInteger attempts = new AtomicInteger();

        // 1. summarize: fails open, the slice goes back to the buffer
        String summary;
        try {
            summary = withRetry(attempts, () -> {
                String s = summarizer.summarize(split.slice());
                if (s == null || s.strip().length() < config.getMinSummaryLength()) {
                    throw new TransientDependencyException("Summary too short: '" + s + "'");
                }
                return s.strip();
            });
        } catch (RuntimeException e) {
            log.warn("Summarization failed for user={} {} after {} attempts, restoring slice: {}",
                    userId, range, attempts.get(), e.getMessage());
            sessionBuffer.restoreSlice(userId, split.slice());
            return new TaskOutcome(TaskStatus.RESTORED, attempts.get(), range + " restored: " + e.getMessage());
        }

        // 2 + 3. embed and persist: the slice is retired from here on
        try {
            float[] embedding = withRetry(attempts, () -> embedder.embed(summary));

            Episode episode = withRetry(attempts, () -> episodicStore.append(Episode.builder()
                    .userId(userId)
                    .turnStart(split.turnStart())
                    .turnEnd(split.turnEnd())
                    .summary(summary)
                    .embedding(VectorMath.toDoubleList(embedding))
                    .build()));

            log.info("Compaction completed for user={} {} -> episode={}", userId, range, episode.getId());
            return TaskOutcome.completed(attempts.get(), range + " episode=" + episode.getId());

        } catch (RuntimeException e) {
            log.error("Compaction DROPPED for user={} {} after {} attempts, turns are lost: {}",
                    userId, range, attempts.get(), e.getMessage());
            return new TaskOutcome(TaskStatus.DROPPED, attempts.get(), range + " dropped: " + e.getMessage());
        }
    }

    private <T> T withRetry(AtomicInteger attempts, Supplier<T> step) {
        return Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            return step.get();
        }).get();
    }
}
