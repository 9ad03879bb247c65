package com.deepansh.recall.episode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Compressed summary of a contiguous run of turns, with its embedding.
 *
 * Collection: episodic_memory
 *
 * Append-only. There is no update path: a stale summary is never fixed,
 * later compactions only add new episodes.
 *
 * For Atlas Vector Search: create a vectorSearch index on 'embedding'
 * (cosine similarity, same dimension as the configured embedder).
 */
@Document(collection = "episodic_memory")
@CompoundIndexes({
    @CompoundIndex(name = "idx_user_date", def = "{'userId': 1, 'createdAt': -1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Episode {

    @Id
    private String id;

    private String userId;

    /** Sequence number of the first compacted turn, inclusive */
    private long turnStart;

    /** Sequence number of the last compacted turn, inclusive */
    private long turnEnd;

    private String summary;

    private List<Double> embedding;

    @CreatedDate
    private Instant createdAt;

    public String turnRange() {
        return "turns " + turnStart + "-" + turnEnd;
    }
}
