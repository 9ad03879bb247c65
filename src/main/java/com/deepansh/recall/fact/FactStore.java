package com.deepansh.recall.fact;

import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.exception.ConcurrencyConflictException;
import com.deepansh.recall.exception.ValidationException;
import com.deepansh.recall.model.FactCandidate;
import com.deepansh.recall.model.FactCategory;
import com.deepansh.recall.model.UpsertResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Structured-fact tier: durable key/value facts with exact recall.
 *
 * Conflict policy is monotonic confidence. A candidate replaces the active
 * fact only if its confidence is higher, or equal while changing the value.
 * A genuine correction stated with less certainty than the original is
 * therefore dropped; the stored fact keeps winning until something at least
 * as confident contradicts it. Known precision/recall trade-off, kept as is.
 *
 * Facts are never hard-deleted. {@link #deactivate} flips the active flag,
 * leaving the old version as audit trail.
 */
@Service
@Slf4j
public class FactStore {

    private final FactStorage storage;
    private final int maxConflictRetries;

    public FactStore(FactStorage storage, MemoryProperties properties) {
        this.storage = storage;
        this.maxConflictRetries = properties.getFacts().getMaxConflictRetries();
    }

    /**
     * Boundary entry point for raw input: the category is still a string here.
     * Invalid input is reported as REJECTED without touching storage.
     */
    public UpsertResult upsertCandidate(String userId, String category, String key, String value,
                                        double confidence, double importance) {
        try {
            FactCategory parsed = FactCategory.parse(category);
            return upsertCandidate(userId, new FactCandidate(parsed, key, value, confidence, importance));
        } catch (ValidationException e) {
            log.warn("Rejected invalid fact candidate [user={}, category={}, key={}]: {}",
                    userId, category, key, e.getMessage());
            return UpsertResult.REJECTED;
        }
    }

    public UpsertResult upsertCandidate(String userId, FactCandidate candidate) {
        try {
            validate(userId, candidate);
        } catch (ValidationException e) {
            log.warn("Rejected invalid fact candidate [user={}, key={}]: {}",
                    userId, candidate.key(), e.getMessage());
            return UpsertResult.REJECTED;
        }

        for (int attempt = 1; ; attempt++) {
            try {
                UpsertResult result = storage.compareAndUpsert(userId, candidate);
                logResult(userId, candidate, result);
                return result;
            } catch (ConcurrencyConflictException e) {
                if (attempt >= maxConflictRetries) {
                    log.error("Fact upsert lost the race {} times, giving up [user={}, key={}]",
                            attempt, userId, candidate.key());
                    throw e;
                }
                log.debug("Fact upsert conflict, retrying [user={}, key={}, attempt={}]",
                        userId, candidate.key(), attempt);
            }
        }
    }

    public List<Fact> listActive(String userId, double minImportance) {
        List<Fact> facts = storage.findActive(userId, minImportance);
        log.debug("Loaded {} active facts for user={} (minImportance={})",
                facts.size(), userId, minImportance);
        return facts;
    }

    public List<Fact> findByKeys(String userId, Collection<String> keys) {
        if (keys == null || keys.isEmpty()) return List.of();
        return storage.findActiveByKeys(userId, keys);
    }

    public boolean deactivate(String userId, FactCategory category, String key) {
        boolean deactivated = storage.deactivate(userId, category, key);
        if (deactivated) {
            log.info("Deactivated fact [user={}, category={}, key={}]", userId, category.label(), key);
        } else {
            log.warn("No active fact to deactivate [user={}, category={}, key={}]",
                    userId, category.label(), key);
        }
        return deactivated;
    }

    private void validate(String userId, FactCandidate candidate) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId must not be blank");
        }
        if (candidate.category() == null) {
            throw new ValidationException("Fact category must not be null");
        }
        if (candidate.key() == null || candidate.key().isBlank()) {
            throw new ValidationException("Fact key must not be blank");
        }
        if (candidate.value() == null || candidate.value().isBlank()) {
            throw new ValidationException("Fact value must not be blank");
        }
        if (!inUnitRange(candidate.confidence())) {
            throw new ValidationException("confidence must be in [0, 1], got " + candidate.confidence());
        }
        if (!inUnitRange(candidate.importance())) {
            throw new ValidationException("importance must be in [0, 1], got " + candidate.importance());
        }
    }

    private static boolean inUnitRange(double v) {
        return v >= 0.0 && v <= 1.0;
    }

    private void logResult(String userId, FactCandidate c, UpsertResult result) {
        switch (result) {
            case INSERTED -> log.info("Inserted fact [user={}] [{}] {} = {} (confidence={})",
                    userId, c.category().label(), c.key(), c.value(), c.confidence());
            case UPDATED -> log.info("Updated fact [user={}] [{}] {} = {} (confidence={})",
                    userId, c.category().label(), c.key(), c.value(), c.confidence());
            case REJECTED -> log.debug("Rejected fact candidate [user={}] [{}] {} = {} (confidence={})",
                    userId, c.category().label(), c.key(), c.value(), c.confidence());
        }
    }
}
