package com.deepansh.recall.fact;

import com.deepansh.recall.exception.ConcurrencyConflictException;
import com.deepansh.recall.model.FactCandidate;
import com.deepansh.recall.model.FactCategory;
import com.deepansh.recall.model.UpsertResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB-backed fact storage.
 *
 * The conditional upsert is one findAndModify:
 *   filter  = {userId, category, key, active: true,
 *              $or: [{confidence < c}, {confidence == c, value != v}]}
 *   update  = $set value/confidence/importance/updatedAt, $setOnInsert createdAt
 *   upsert  = true, returnNew = false
 *
 * - Filter matches an active fact the candidate beats: updated in place, old doc returned.
 * - No active fact at all: upsert inserts; equality fields of the filter
 *   (userId, category, key, active) seed the new document, null returned.
 * - Active fact the candidate does NOT beat: the upsert tries to insert a second
 *   active version and the partial unique index rejects it with a duplicate key.
 *
 * The duplicate key path is re-checked against the stored version: if the stored
 * fact still beats the candidate the result is REJECTED, otherwise another writer
 * changed the row between our filter and the insert and the caller retries.
 */
@Component
@ConditionalOnProperty(prefix = "memory.storage", name = "type", havingValue = "mongo", matchIfMissing = true)
@Slf4j
@RequiredArgsConstructor
public class MongoFactStorage implements FactStorage {

    private final MongoTemplate mongoTemplate;

    @Override
    public UpsertResult compareAndUpsert(String userId, FactCandidate candidate) {
        Query query = new Query(activeTriple(userId, candidate.category(), candidate.key())
                .orOperator(
                        Criteria.where("confidence").lt(candidate.confidence()),
                        new Criteria().andOperator(
                                Criteria.where("confidence").is(candidate.confidence()),
                                Criteria.where("value").ne(candidate.value()))));

        Instant now = Instant.now();
        Update update = new Update()
                .set("value", candidate.value())
                .set("confidence", candidate.confidence())
                .set("importance", candidate.importance())
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);

        FindAndModifyOptions options = FindAndModifyOptions.options()
                .upsert(true)
                .returnNew(false);

        try {
            Fact previous = mongoTemplate.findAndModify(query, update, options, Fact.class);
            return previous == null ? UpsertResult.INSERTED : UpsertResult.UPDATED;
        } catch (DuplicateKeyException e) {
            Optional<Fact> stored = findActive(userId, candidate.category(), candidate.key());
            if (stored.isPresent() && !FactStorage.wins(candidate, stored.get())) {
                return UpsertResult.REJECTED;
            }
            throw new ConcurrencyConflictException("Concurrent write on fact [user=" + userId
                    + ", category=" + candidate.category().label() + ", key=" + candidate.key() + "]", e);
        }
    }

    @Override
    public Optional<Fact> findActive(String userId, FactCategory category, String key) {
        return Optional.ofNullable(mongoTemplate.findOne(
                new Query(activeTriple(userId, category, key)), Fact.class));
    }

    @Override
    public List<Fact> findActive(String userId, double minImportance) {
        Query query = new Query(Criteria.where("userId").is(userId)
                .and("active").is(true)
                .and("importance").gte(minImportance))
                .with(listingSort());
        return mongoTemplate.find(query, Fact.class);
    }

    @Override
    public List<Fact> findActiveByKeys(String userId, Collection<String> keys) {
        if (keys.isEmpty()) return List.of();
        Query query = new Query(Criteria.where("userId").is(userId)
                .and("active").is(true)
                .and("key").in(keys))
                .with(listingSort());
        return mongoTemplate.find(query, Fact.class);
    }

    @Override
    public boolean deactivate(String userId, FactCategory category, String key) {
        Update update = new Update()
                .set("active", false)
                .set("updatedAt", Instant.now());
        long modified = mongoTemplate.updateFirst(
                new Query(activeTriple(userId, category, key)), update, Fact.class).getModifiedCount();
        return modified > 0;
    }

    private Criteria activeTriple(String userId, FactCategory category, String key) {
        return Criteria.where("userId").is(userId)
                .and("category").is(category)
                .and("key").is(key)
                .and("active").is(true);
    }

    private Sort listingSort() {
        return Sort.by(Sort.Order.desc("importance"), Sort.Order.desc("updatedAt"));
    }
}
