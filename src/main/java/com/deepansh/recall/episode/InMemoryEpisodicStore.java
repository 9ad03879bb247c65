package com.deepansh.recall.episode;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local episodic store for local development and tests.
 */
@Component
@ConditionalOnProperty(prefix = "memory.storage", name = "type", havingValue = "in-memory")
public class InMemoryEpisodicStore implements EpisodicStore {

    private final List<Episode> episodes = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryEpisodicStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEpisodicStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Episode append(Episode episode) {
        Episode stored = Episode.builder()
                .id(UUID.randomUUID().toString())
                .userId(episode.getUserId())
                .turnStart(episode.getTurnStart())
                .turnEnd(episode.getTurnEnd())
                .summary(episode.getSummary())
                .embedding(episode.getEmbedding() == null ? null : List.copyOf(episode.getEmbedding()))
                .createdAt(episode.getCreatedAt() != null ? episode.getCreatedAt() : clock.instant())
                .build();
        episodes.add(stored);
        return stored;
    }

    @Override
    public List<EpisodeMatch> findNearest(String userId, float[] queryEmbedding, int topK, double maxDistance) {
        return episodes.stream()
                .filter(e -> e.getUserId().equals(userId))
                .filter(e -> e.getEmbedding() != null && !e.getEmbedding().isEmpty())
                .map(e -> new EpisodeMatch(e, VectorMath.cosineDistance(queryEmbedding, e.getEmbedding())))
                .filter(m -> m.distance() < maxDistance)
                .sorted(Comparator.comparingDouble(EpisodeMatch::distance))
                .limit(topK)
                .toList();
    }

    @Override
    public List<Episode> findRecent(String userId, int limit) {
        return episodes.stream()
                .filter(e -> e.getUserId().equals(userId))
                .sorted(Comparator.comparing(Episode::getCreatedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public long count(String userId) {
        return episodes.stream().filter(e -> e.getUserId().equals(userId)).count();
    }

    /** All episodes for a user in append order */
    public List<Episode> all(String userId) {
        return episodes.stream().filter(e -> e.getUserId().equals(userId)).toList();
    }
}
