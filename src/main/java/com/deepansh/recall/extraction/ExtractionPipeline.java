package com.deepansh.recall.extraction;

import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.exception.ConcurrencyConflictException;
import com.deepansh.recall.exception.TransientDependencyException;
import com.deepansh.recall.fact.FactStore;
import com.deepansh.recall.model.FactCandidate;
import com.deepansh.recall.model.FactCategory;
import com.deepansh.recall.model.UpsertResult;
import com.deepansh.recall.observability.TaskOutcome;
import com.deepansh.recall.observability.TaskStatus;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Derives durable facts from one inbound user message. Write-only: the outcome
 * becomes visible on the next retrieval, never to the caller.
 *
 * Filter order matters and is fixed:
 * 1. confidence / importance thresholds
 * 2. unknown categories
 * 3. batch dedupe by (category, key), highest confidence wins
 * 4. conditional upsert per survivor
 *
 * Keys are normalized before step 3 so aliases collapse onto one candidate.
 */
@Service
@Slf4j
public class ExtractionPipeline {

    static final double DEFAULT_CONFIDENCE = 1.0;
    static final double DEFAULT_IMPORTANCE = 0.5;

    private final Extractor extractor;
    private final FactStore factStore;
    private final KeyNormalizer keyNormalizer;
    private final MemoryProperties.Extraction config;
    private final Retry retry;

    public ExtractionPipeline(Extractor extractor,
                              FactStore factStore,
                              KeyNormalizer keyNormalizer,
                              MemoryProperties properties,
                              RetryRegistry retryRegistry) {
        this.extractor = extractor;
        this.factStore = factStore;
        this.keyNormalizer = keyNormalizer;
        this.config = properties.getExtraction();
        this.retry = retryRegistry.retry("extraction", RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .waitDuration(Duration.ofMillis(config.getBackoffMs()))
                .retryOnException(e -> e instanceof TransientDependencyException)
                .build());
    }

    public TaskOutcome process(String userId, String message) {
        String skipReason = skipReason(message);
        if (skipReason != null) {
            log.debug("Skipping extraction for user={}: {}", userId, skipReason);
            return TaskOutcome.skipped(skipReason);
        }

        AtomicInteger attempts = new AtomicInteger();
        List<ExtractedFact> raw;
        try {
            raw = Retry.decorateSupplier(retry, () -> {
                attempts.incrementAndGet();
                return extractor.extract(message);
            }).get();
        } catch (TransientDependencyException e) {
            log.error("Extraction dropped for user={} after {} attempts: {}",
                    userId, attempts.get(), e.getMessage());
            return new TaskOutcome(TaskStatus.DROPPED, attempts.get(), "extractor unavailable: " + e.getMessage());
        }

        List<FactCandidate> candidates = filter(raw);
        if (candidates.isEmpty()) {
            log.debug("No fact candidates survived filtering for user={} ({} raw)", userId, raw.size());
            return TaskOutcome.completed(attempts.get(), "raw=" + raw.size() + " kept=0");
        }

        Map<UpsertResult, Integer> counts = new EnumMap<>(UpsertResult.class);
        int conflicts = 0;
        for (FactCandidate candidate : candidates) {
            try {
                counts.merge(factStore.upsertCandidate(userId, candidate), 1, Integer::sum);
            } catch (ConcurrencyConflictException e) {
                conflicts++;
                log.warn("Fact upsert abandoned after repeated conflicts [user={}, key={}]",
                        userId, candidate.key());
            }
        }

        log.info("Extraction finished for user={}: raw={} kept={} inserted={} updated={} rejected={}",
                userId, raw.size(), candidates.size(),
                counts.getOrDefault(UpsertResult.INSERTED, 0),
                counts.getOrDefault(UpsertResult.UPDATED, 0),
                counts.getOrDefault(UpsertResult.REJECTED, 0));

        String detail = "raw=" + raw.size()
                + " kept=" + candidates.size()
                + " inserted=" + counts.getOrDefault(UpsertResult.INSERTED, 0)
                + " updated=" + counts.getOrDefault(UpsertResult.UPDATED, 0)
                + " rejected=" + counts.getOrDefault(UpsertResult.REJECTED, 0)
                + (conflicts > 0 ? " conflicts=" + conflicts : "");
        return TaskOutcome.completed(attempts.get(), detail);
    }

    /**
     * Steps 1 to 3. Returns the survivors in first-seen order of their (category, key).
     */
    List<FactCandidate> filter(List<ExtractedFact> raw) {
        Map<String, FactCandidate> best = new LinkedHashMap<>();

        for (ExtractedFact fact : raw) {
            if (isBlank(fact.key()) || isBlank(fact.value())) {
                log.debug("Dropping candidate with blank key or value: {}", fact);
                continue;
            }
            double confidence = fact.confidence() != null ? fact.confidence() : DEFAULT_CONFIDENCE;
            double importance = fact.importance() != null ? fact.importance() : DEFAULT_IMPORTANCE;

            // 1. thresholds
            if (confidence < config.getMinConfidence() || importance < config.getMinImportance()) {
                log.debug("Dropping low-signal candidate {}={} (confidence={}, importance={})",
                        fact.key(), fact.value(), confidence, importance);
                continue;
            }

            // 2. closed category set
            if (!FactCategory.isKnown(fact.category())) {
                log.debug("Dropping candidate with unknown category '{}'", fact.category());
                continue;
            }
            FactCategory category = FactCategory.parse(fact.category());
            String key = keyNormalizer.normalize(fact.key());

            // 3. dedupe within the batch
            FactCandidate candidate = new FactCandidate(category, key, fact.value().strip(), confidence, importance);
            best.merge(category.label() + "|" + key, candidate,
                    (kept, incoming) -> incoming.confidence() > kept.confidence() ? incoming : kept);
        }
        return new ArrayList<>(best.values());
    }

    private String skipReason(String message) {
        if (message == null || message.isBlank()) {
            return "empty message";
        }
        String trimmed = message.strip();
        if (config.isSkipQuestions() && trimmed.endsWith("?")) {
            return "question";
        }
        if (trimmed.split("\\s+").length < config.getMinWords()) {
            return "too short";
        }
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
