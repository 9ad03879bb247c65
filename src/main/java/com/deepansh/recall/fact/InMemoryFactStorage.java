package com.deepansh.recall.fact;

import com.deepansh.recall.model.FactCandidate;
import com.deepansh.recall.model.FactCategory;
import com.deepansh.recall.model.UpsertResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local fact storage for local development and tests.
 *
 * Each (user, category, key) triple maps to its active version; ConcurrentHashMap.compute
 * locks the triple's bin for the duration of the comparison, which gives the same
 * one-step compare-and-write guarantee as the Mongo conditional upsert.
 * Superseded and deactivated versions are kept in an append-only history list.
 */
@Component
@ConditionalOnProperty(prefix = "memory.storage", name = "type", havingValue = "in-memory")
public class InMemoryFactStorage implements FactStorage {

    private final Map<TripleKey, Fact> active = new ConcurrentHashMap<>();
    private final List<Fact> history = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryFactStorage() {
        this(Clock.systemUTC());
    }

    public InMemoryFactStorage(Clock clock) {
        this.clock = clock;
    }

    @Override
    public UpsertResult compareAndUpsert(String userId, FactCandidate candidate) {
        TripleKey triple = new TripleKey(userId, candidate.category(), candidate.key());
        AtomicReference<UpsertResult> result = new AtomicReference<>();

        active.compute(triple, (k, stored) -> {
            Instant now = clock.instant();
            if (stored == null) {
                result.set(UpsertResult.INSERTED);
                return Fact.builder()
                        .id(UUID.randomUUID().toString())
                        .userId(userId)
                        .category(candidate.category())
                        .key(candidate.key())
                        .value(candidate.value())
                        .confidence(candidate.confidence())
                        .importance(candidate.importance())
                        .active(true)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
            }
            if (!FactStorage.wins(candidate, stored)) {
                result.set(UpsertResult.REJECTED);
                return stored;
            }
            result.set(UpsertResult.UPDATED);
            return stored.toBuilder()
                    .value(candidate.value())
                    .confidence(candidate.confidence())
                    .importance(candidate.importance())
                    .updatedAt(now)
                    .build();
        });
        return result.get();
    }

    @Override
    public Optional<Fact> findActive(String userId, FactCategory category, String key) {
        return Optional.ofNullable(active.get(new TripleKey(userId, category, key)));
    }

    @Override
    public List<Fact> findActive(String userId, double minImportance) {
        return active.values().stream()
                .filter(f -> f.getUserId().equals(userId))
                .filter(f -> f.getImportance() >= minImportance)
                .sorted(FactStorage::compareForListing)
                .toList();
    }

    @Override
    public List<Fact> findActiveByKeys(String userId, Collection<String> keys) {
        Set<String> wanted = Set.copyOf(keys);
        return active.values().stream()
                .filter(f -> f.getUserId().equals(userId))
                .filter(f -> wanted.contains(f.getKey()))
                .sorted(FactStorage::compareForListing)
                .toList();
    }

    @Override
    public boolean deactivate(String userId, FactCategory category, String key) {
        Fact removed = active.remove(new TripleKey(userId, category, key));
        if (removed == null) return false;
        history.add(removed.toBuilder().active(false).updatedAt(clock.instant()).build());
        return true;
    }

    /** Inactive versions for a user, oldest first */
    public List<Fact> inactiveVersions(String userId) {
        List<Fact> result = new ArrayList<>();
        for (Fact f : history) {
            if (f.getUserId().equals(userId)) result.add(f);
        }
        return result;
    }

    private record TripleKey(String userId, FactCategory category, String key) {}
}
