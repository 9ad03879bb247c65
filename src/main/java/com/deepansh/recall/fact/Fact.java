package com.deepansh.recall.fact;

import com.deepansh.recall.model.FactCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Durable key/value assertion about a user.
 *
 * Collection: structured_facts
 *
 * Indexes:
 * - (userId, category, key) unique, partial on active=true: at most one active
 *   version per triple. Inactive versions are the audit trail and may repeat.
 * - (userId, active, importance desc): backs the profile listing.
 *
 * Facts carry no embedding; they are recalled by exact filter only.
 */
@Document(collection = "structured_facts")
@CompoundIndexes({
    @CompoundIndex(name = "uq_active_fact", def = "{'userId': 1, 'category': 1, 'key': 1}",
            unique = true, partialFilter = "{'active': true}"),
    @CompoundIndex(name = "idx_user_active_importance", def = "{'userId': 1, 'active': 1, 'importance': -1}")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Fact {

    @Id
    private String id;

    private String userId;

    private FactCategory category;

    private String key;

    private String value;

    private double confidence;

    private double importance;

    private boolean active;

    private Instant createdAt;

    private Instant updatedAt;
}
