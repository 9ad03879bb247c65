package com.deepansh.recall.episode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Episodic memory backed by MongoDB.
 *
 * Similarity runs in-process: the user's episodes are loaded with their embeddings
 * and scored with cosine distance in Java. Works with any MongoDB; one summary per
 * compaction keeps the per-user candidate set small.
 *
 * For Atlas Vector Search, replace findNearest with:
 *   mongoTemplate.aggregate(Aggregation.newAggregation(
 *       Aggregation.stage("{ $vectorSearch: { index: 'episode_embedding_index',
 *           path: 'embedding', queryVector: [...], numCandidates: 100, limit: topK,
 *           filter: { userId: ... } } }"))
 *   , Episode.class, Episode.class).getMappedResults();
 * then apply the same distance filter to the returned scores.
 */
@Component
@ConditionalOnProperty(prefix = "memory.storage", name = "type", havingValue = "mongo", matchIfMissing = true)
@Slf4j
@RequiredArgsConstructor
public class MongoEpisodicStore implements EpisodicStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public Episode append(Episode episode) {
        Episode saved = mongoTemplate.insert(episode);
        log.info("Stored episode for user={}: {}", saved.getUserId(), saved.turnRange());
        return saved;
    }

    @Override
    public List<EpisodeMatch> findNearest(String userId, float[] queryEmbedding, int topK, double maxDistance) {
        Query query = new Query(Criteria.where("userId").is(userId)
                .and("embedding").exists(true));
        List<Episode> candidates = mongoTemplate.find(query, Episode.class);

        List<EpisodeMatch> matches = candidates.stream()
                .filter(e -> e.getEmbedding() != null && !e.getEmbedding().isEmpty())
                .map(e -> new EpisodeMatch(e, VectorMath.cosineDistance(queryEmbedding, e.getEmbedding())))
                .filter(m -> m.distance() < maxDistance)
                .sorted(Comparator.comparingDouble(EpisodeMatch::distance))
                .limit(topK)
                .toList();

        log.debug("Similarity search for user={}: {} candidates, {} under distance {}",
                userId, candidates.size(), matches.size(), maxDistance);
        return matches;
    }

    @Override
    public List<Episode> findRecent(String userId, int limit) {
        Query query = new Query(Criteria.where("userId").is(userId))
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .limit(limit);
        return mongoTemplate.find(query, Episode.class);
    }

    @Override
    public long count(String userId) {
        return mongoTemplate.count(new Query(Criteria.where("userId").is(userId)), Episode.class);
    }
}
