package com.deepansh.recall.fact;

import com.deepansh.recall.exception.ConcurrencyConflictException;
import com.deepansh.recall.model.FactCandidate;
import com.deepansh.recall.model.FactCategory;
import com.deepansh.recall.model.UpsertResult;
import com.mongodb.client.result.UpdateResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoFactStorageTest {

    @Mock MongoTemplate mongoTemplate;

    @InjectMocks
    MongoFactStorage storage;

    private final FactCandidate al = new FactCandidate(FactCategory.IDENTITY, "name", "Al", 0.6, 0.9);

    @Test
    void compareAndUpsert_noPreviousDocument_inserted() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(Fact.class))).thenReturn(null);

        assertThat(storage.compareAndUpsert("u1", al)).isEqualTo(UpsertResult.INSERTED);
    }

    @Test
    void compareAndUpsert_previousDocumentReturned_updated() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(Fact.class)))
                .thenReturn(stored("Alex", 0.5));

        assertThat(storage.compareAndUpsert("u1", al)).isEqualTo(UpsertResult.UPDATED);
    }

    @Test
    void compareAndUpsert_isOneGuardedUpsert() {
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<FindAndModifyOptions> options = ArgumentCaptor.forClass(FindAndModifyOptions.class);
        when(mongoTemplate.findAndModify(query.capture(), any(Update.class),
                options.capture(), eq(Fact.class))).thenReturn(null);

        storage.compareAndUpsert("u1", al);

        assertThat(query.getValue().getQueryObject())
                .containsKeys("userId", "category", "key", "active", "$or");
        assertThat(options.getValue().isUpsert()).isTrue();
        assertThat(options.getValue().isReturnNew()).isFalse();
    }

    @Test
    void compareAndUpsert_duplicateKeyAndStoredStillWins_rejected() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(Fact.class)))
                .thenThrow(new DuplicateKeyException("E11000 uq_active_fact"));
        when(mongoTemplate.findOne(any(Query.class), eq(Fact.class))).thenReturn(stored("Alex", 1.0));

        assertThat(storage.compareAndUpsert("u1", al)).isEqualTo(UpsertResult.REJECTED);
    }

    @Test
    void compareAndUpsert_duplicateKeyButCandidateWouldWin_conflict() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(Fact.class)))
                .thenThrow(new DuplicateKeyException("E11000 uq_active_fact"));
        when(mongoTemplate.findOne(any(Query.class), eq(Fact.class))).thenReturn(stored("Alex", 0.2));

        assertThatThrownBy(() -> storage.compareAndUpsert("u1", al))
                .isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void compareAndUpsert_duplicateKeyAndFactVanished_conflict() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(Fact.class)))
                .thenThrow(new DuplicateKeyException("E11000 uq_active_fact"));
        when(mongoTemplate.findOne(any(Query.class), eq(Fact.class))).thenReturn(null);

        assertThatThrownBy(() -> storage.compareAndUpsert("u1", al))
                .isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void deactivate_reportsWhetherAFactWasModified() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(Fact.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(storage.deactivate("u1", FactCategory.IDENTITY, "name")).isTrue();
        assertThat(storage.deactivate("u1", FactCategory.IDENTITY, "name")).isFalse();
        verify(mongoTemplate, times(2))
                .updateFirst(any(Query.class), any(Update.class), eq(Fact.class));
    }

    private static Fact stored(String value, double confidence) {
        return Fact.builder()
                .userId("u1")
                .category(FactCategory.IDENTITY)
                .key("name")
                .value(value)
                .confidence(confidence)
                .importance(0.9)
                .active(true)
                .build();
    }
}
