package com.deepansh.recall.fact;

import com.deepansh.recall.model.FactCandidate;
import com.deepansh.recall.model.FactCategory;
import com.deepansh.recall.model.UpsertResult;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for structured facts.
 *
 * {@link #compareAndUpsert} is the only write path for values: the confidence
 * comparison and the write happen in one atomic step inside the store, so
 * callers never read-then-write.
 */
public interface FactStorage {

    /**
     * Atomically apply the conflict rule for the candidate's (user, category, key):
     * <ul>
     *   <li>no active fact: insert it active, {@link UpsertResult#INSERTED}</li>
     *   <li>stored confidence lower, or equal with a different value: overwrite
     *       value, confidence, importance, updatedAt, {@link UpsertResult#UPDATED}</li>
     *   <li>otherwise leave the stored fact untouched, {@link UpsertResult#REJECTED}</li>
     * </ul>
     *
     * @throws com.deepansh.recall.exception.ConcurrencyConflictException when a
     *         concurrent writer won the race and the outcome must be re-evaluated
     */
    UpsertResult compareAndUpsert(String userId, FactCandidate candidate);

    Optional<Fact> findActive(String userId, FactCategory category, String key);

    /** Active facts with importance >= minImportance, importance desc then updatedAt desc */
    List<Fact> findActive(String userId, double minImportance);

    /** Same ordering as {@link #findActive(String, double)}, restricted to the given keys */
    List<Fact> findActiveByKeys(String userId, Collection<String> keys);

    /** Soft delete. Returns false when there was no active fact to deactivate */
    boolean deactivate(String userId, FactCategory category, String key);

    /** Preferred ordering for every listing */
    static int compareForListing(Fact a, Fact b) {
        int byImportance = Double.compare(b.getImportance(), a.getImportance());
        if (byImportance != 0) return byImportance;
        return b.getUpdatedAt().compareTo(a.getUpdatedAt());
    }

    /** True when the candidate should replace the stored version */
    static boolean wins(FactCandidate candidate, Fact stored) {
        if (candidate.confidence() > stored.getConfidence()) return true;
        return candidate.confidence() == stored.getConfidence()
                && !candidate.value().equals(stored.getValue());
    }
}
