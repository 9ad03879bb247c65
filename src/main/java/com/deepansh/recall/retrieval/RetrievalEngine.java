package com.deepansh.recall.retrieval;

import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.embedding.Embedder;
import com.deepansh.recall.episode.Episode;
import com.deepansh.recall.episode.EpisodeMatch;
import com.deepansh.recall.episode.EpisodicStore;
import com.deepansh.recall.fact.Fact;
import com.deepansh.recall.fact.FactStore;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Builds the context bundle for one query. Sits on the latency-critical path.
 *
 * Stage 1 (deterministic): active facts above the importance floor. Exact filter,
 * zero false positives.
 *
 * Stage 2 (semantic): embed the query, nearest episodes strictly under the distance
 * threshold, closest first. Never padded. An error or timeout skips the stage and
 * Stage 1 is still returned.
 *
 * Both stages run on the retrieval executor and share one hard deadline measured from
 * the start of the call. A stage that misses it is dropped from the bundle: a late
 * profile comes back empty with profileTimedOut set.
 *
 * Stage 3 (merge): sections side by side, no cross-stage re-ranking.
 */
@Service
@Slf4j
public class RetrievalEngine {

    private static final String ELLIPSIS = "...";

    private final FactStore factStore;
    private final EpisodicStore episodicStore;
    private final Embedder embedder;
    private final Executor retrievalExecutor;
    private final MemoryProperties.Retrieval config;
    private final TimeLimiter timeLimiter;

    public RetrievalEngine(FactStore factStore,
                           EpisodicStore episodicStore,
                           Embedder embedder,
                           @Qualifier("retrievalExecutor") Executor retrievalExecutor,
                           MemoryProperties properties) {
        this.factStore = factStore;
        this.episodicStore = episodicStore;
        this.embedder = embedder;
        this.retrievalExecutor = retrievalExecutor;
        this.config = properties.getRetrieval();
        this.timeLimiter = TimeLimiter.of("retrieval", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(config.getTimeoutMs()))
                .cancelRunningFuture(true)
                .build());
    }

    public ContextBundle retrieve(String userId, String query) {
        return retrieve(userId, query, config.getTopKEpisodes(), config.getMinFactImportance(), config.getMaxDistance());
    }

    public ContextBundle retrieve(String userId, String query, int topKEpisodes,
                                  double minFactImportance, double maxDistance) {
        long start = System.currentTimeMillis();

        // Both stages start together and share one deadline measured from here
        CompletableFuture<List<Fact>> profileStage = submit(userId,
                () -> deterministicStage(userId, minFactImportance));
        CompletableFuture<List<EpisodeSnippet>> semanticStage = query == null || query.isBlank()
                ? null
                : submit(userId, () -> semanticStage(userId, query, topKEpisodes, maxDistance));

        CompletableFuture<Void> stages = semanticStage == null
                ? CompletableFuture.allOf(profileStage)
                : CompletableFuture.allOf(profileStage, semanticStage);
        try {
            timeLimiter.executeFutureSupplier(() -> stages);
        } catch (TimeoutException e) {
            log.warn("Retrieval deadline of {}ms reached for user={} [profileDone={}, semanticDone={}]",
                    config.getTimeoutMs(), userId, profileStage.isDone(),
                    semanticStage == null || semanticStage.isDone());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retrieval interrupted for user={}", userId);
        } catch (Exception e) {
            // a failed stage is resolved on its own below
            log.debug("Retrieval stage failed for user={}: {}", userId, e.getMessage());
        }

        boolean profileTimedOut = !profileStage.isDone();
        List<Fact> profile = List.of();
        if (profileTimedOut) {
            profileStage.cancel(true);
            log.warn("Profile retrieval missed the deadline for user={}, continuing without facts", userId);
        } else if (!profileStage.isCompletedExceptionally()) {
            profile = profileStage.join();
        }

        List<EpisodeSnippet> recent = List.of();
        SemanticStatus status;
        if (semanticStage == null) {
            status = SemanticStatus.DISABLED;
        } else if (!semanticStage.isDone()) {
            semanticStage.cancel(true);
            log.warn("Semantic retrieval timed out for user={}, returning profile only", userId);
            status = SemanticStatus.SKIPPED_TIMEOUT;
        } else if (semanticStage.isCompletedExceptionally()) {
            log.warn("Semantic retrieval failed for user={}, returning profile only: {}",
                    userId, failureMessage(semanticStage));
            status = SemanticStatus.SKIPPED_ERROR;
        } else {
            recent = semanticStage.join();
            status = SemanticStatus.OK;
        }

        log.debug("Retrieved bundle for user={} [facts={}, episodes={}, semantic={}, profileTimedOut={}, latency={}ms]",
                userId, profile.size(), recent.size(), status, profileTimedOut, System.currentTimeMillis() - start);
        return new ContextBundle(profile, recent, status, profileTimedOut);
    }

    private <T> CompletableFuture<T> submit(String userId, Supplier<T> stage) {
        try {
            return CompletableFuture.supplyAsync(stage, retrievalExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Retrieval executor saturated, skipping stage for user={}", userId);
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String failureMessage(CompletableFuture<?> future) {
        try {
            future.join();
            return "";
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return cause.getMessage();
        }
    }

    private List<Fact> deterministicStage(String userId, double minFactImportance) {
        try {
            return factStore.listActive(userId, minFactImportance);
        } catch (RuntimeException e) {
            log.error("Profile retrieval failed for user={}, continuing without facts: {}", userId, e.getMessage());
            return List.of();
        }
    }

    private List<EpisodeSnippet> semanticStage(String userId, String query, int topK, double maxDistance) {
        float[] queryEmbedding = embedder.embed(query);
        // threshold and order re-applied: they hold for any store implementation
        return episodicStore.findNearest(userId, queryEmbedding, topK, maxDistance).stream()
                .filter(m -> m.distance() < maxDistance)
                .sorted(Comparator.comparingDouble(EpisodeMatch::distance))
                .limit(topK)
                .map(this::toSnippet)
                .toList();
    }

    private EpisodeSnippet toSnippet(EpisodeMatch match) {
        Episode episode = match.episode();
        return new EpisodeSnippet(episode.turnRange(), episode.getTurnStart(), episode.getTurnEnd(),
                preview(episode.getSummary()), match.distance());
    }

    private String preview(String summary) {
        if (summary == null) return "";
        int limit = config.getPreviewLength();
        return summary.length() <= limit ? summary : summary.substring(0, limit) + ELLIPSIS;
    }
}
