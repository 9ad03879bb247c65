package com.deepansh.recall.episode;

import java.util.List;

/**
 * Persistence boundary for episodic memory: append plus query-by-similarity.
 * Writes are commutative; each append is atomic on its own.
 */
public interface EpisodicStore {

    Episode append(Episode episode);

    /**
     * Up to topK episodes for the user whose cosine distance to the query is
     * strictly below maxDistance, closest first. Never padded.
     */
    List<EpisodeMatch> findNearest(String userId, float[] queryEmbedding, int topK, double maxDistance);

    /** Most recently created first */
    List<Episode> findRecent(String userId, int limit);

    long count(String userId);
}
