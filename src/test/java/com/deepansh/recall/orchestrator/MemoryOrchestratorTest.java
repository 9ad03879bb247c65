package com.deepansh.recall.orchestrator;

import com.deepansh.recall.buffer.SessionBuffer;
import com.deepansh.recall.compaction.CompactionPipeline;
import com.deepansh.recall.compaction.Summarizer;
import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.embedding.Embedder;
import com.deepansh.recall.episode.InMemoryEpisodicStore;
import com.deepansh.recall.exception.ValidationException;
import com.deepansh.recall.extraction.ExtractedFact;
import com.deepansh.recall.extraction.ExtractionPipeline;
import com.deepansh.recall.extraction.Extractor;
import com.deepansh.recall.extraction.KeyNormalizer;
import com.deepansh.recall.fact.Fact;
import com.deepansh.recall.fact.FactStore;
import com.deepansh.recall.fact.InMemoryFactStorage;
import com.deepansh.recall.model.Turn;
import com.deepansh.recall.observability.MemoryTaskEvent;
import com.deepansh.recall.observability.TaskStatus;
import com.deepansh.recall.observability.TaskType;
import com.deepansh.recall.retrieval.BundleFormatter;
import com.deepansh.recall.retrieval.RetrievalEngine;
import com.deepansh.recall.retrieval.RetrievalPolicy;
import com.deepansh.recall.retrieval.SemanticStatus;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * End-to-end turn handling with real buffer, pipelines and stores. Background work
 * runs on the calling thread so every task has finished when onMessage returns.
 */
@ExtendWith(MockitoExtension.class)
class MemoryOrchestratorTest {

    private static final Executor DIRECT = Runnable::run;

    @Mock Summarizer summarizer;
    @Mock Embedder embedder;
    @Mock Extractor extractor;
    @Mock ReplyGenerator replyGenerator;
    @Mock ApplicationEventPublisher publisher;

    MemoryProperties properties;
    SessionBuffer buffer;
    FactStore factStore;
    InMemoryEpisodicStore episodes;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        properties.getCompaction().setBackoffMs(1);
        properties.getExtraction().setBackoffMs(1);
        buffer = new SessionBuffer(properties);
        factStore = new FactStore(new InMemoryFactStorage(), properties);
        episodes = new InMemoryEpisodicStore();

        lenient().when(embedder.embed(anyString())).thenReturn(new float[]{1f, 0f});
        lenient().when(summarizer.summarize(anyList()))
                .thenReturn("User walked through their build setup and test habits.");
        lenient().when(replyGenerator.generate(anyString(), anyList())).thenReturn("Got it.");
    }

    @Test
    void onMessage_extractedFactVisibleOnNextTurn() {
        when(extractor.extract("My name is Alex and I write Java"))
                .thenReturn(List.of(new ExtractedFact("identity", "full_name", "Alex", 0.95, 0.9)));
        MemoryOrchestrator orchestrator = orchestrator(DIRECT);

        TurnResult first = orchestrator.onMessage("u1", "My name is Alex and I write Java");
        assertThat(first.getBundle().profile()).isEmpty();
        assertThat(events(first)).extracting(MemoryTaskEvent::type).containsExactly(TaskType.EXTRACTION);
        assertThat(events(first).get(0).status()).isEqualTo(TaskStatus.COMPLETED);

        TurnResult second = orchestrator.onMessage("u1", "What do you know about me?");

        assertThat(second.getBundle().profile()).extracting(Fact::getKey, Fact::getValue)
                .containsExactly(tuple("name", "Alex"));
        assertThat(second.getMemoryContext()).contains("- name: Alex");
        assertThat(second.getReply()).isEqualTo("Got it.");
    }

    @Test
    void onMessage_tenExchanges_compactsOldestTenTurns() {
        MemoryOrchestrator orchestrator = orchestrator(DIRECT);

        TurnResult last = null;
        for (int i = 1; i <= 10; i++) {
            last = orchestrator.onMessage("u1", "Telling you about step " + i + " of my build");
        }

        assertThat(episodes.all("u1")).singleElement().satisfies(e -> {
            assertThat(e.getTurnStart()).isEqualTo(1);
            assertThat(e.getTurnEnd()).isEqualTo(10);
        });
        assertThat(buffer.size("u1")).isEqualTo(10);
        assertThat(buffer.snapshot("u1").get(0).getSequenceNumber()).isEqualTo(11);
        assertThat(buffer.isCompactionInFlight("u1")).isFalse();
        assertThat(events(last)).extracting(MemoryTaskEvent::type)
                .containsExactly(TaskType.COMPACTION, TaskType.EXTRACTION);
    }

    @Test
    void onMessage_compactedEpisodeRetrievedOnLaterTurn() {
        MemoryOrchestrator orchestrator = orchestrator(DIRECT);
        for (int i = 1; i <= 10; i++) {
            orchestrator.onMessage("u1", "Telling you about step " + i + " of my build");
        }

        TurnResult next = orchestrator.onMessage("u1", "What did we discuss about my build?");

        assertThat(next.getBundle().semanticStatus()).isEqualTo(SemanticStatus.OK);
        assertThat(next.getBundle().recentContext()).singleElement()
                .satisfies(s -> assertThat(s.turnRange()).isEqualTo("turns 1-10"));
        assertThat(next.getMemoryContext()).contains("- turns 1-10: User walked through");
    }

    @Test
    void onMessage_greeting_skipsRetrieval() {
        TurnResult result = orchestrator(DIRECT).onMessage("u1", "hi");

        assertThat(result.getBundle().semanticStatus()).isEqualTo(SemanticStatus.DISABLED);
        assertThat(result.getMemoryContext()).isEqualTo("No relevant memory found.");
        verifyNoInteractions(embedder);
    }

    @Test
    void onMessage_appendsUserThenAssistantTurnsInSequence() {
        MemoryOrchestrator orchestrator = orchestrator(DIRECT);
        orchestrator.onMessage("u1", "hello");
        orchestrator.onMessage("u1", "thanks");

        List<Turn> resident = buffer.snapshot("u1");
        assertThat(resident).extracting(Turn::getRole).containsExactly(
                Turn.Role.user, Turn.Role.assistant, Turn.Role.user, Turn.Role.assistant);
        assertThat(resident).extracting(Turn::getSequenceNumber).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    void onMessage_blankInput_rejectedBeforeBuffering() {
        MemoryOrchestrator orchestrator = orchestrator(DIRECT);

        assertThatThrownBy(() -> orchestrator.onMessage("u1", "   "))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> orchestrator.onMessage(" ", "hello"))
                .isInstanceOf(ValidationException.class);
        assertThat(buffer.size("u1")).isZero();
    }

    @Test
    void onMessage_compactionRejected_slotReleasedAndTurnsKept() {
        Executor full = r -> {
            throw new RejectedExecutionException("queue full");
        };
        MemoryOrchestrator orchestrator = orchestrator(full);

        TurnResult last = null;
        for (int i = 1; i <= 10; i++) {
            last = orchestrator.onMessage("u1", "Telling you about step " + i + " of my build");
        }

        assertThat(events(last)).extracting(MemoryTaskEvent::status)
                .containsExactly(TaskStatus.REJECTED, TaskStatus.REJECTED);
        assertThat(buffer.isCompactionInFlight("u1")).isFalse();
        assertThat(buffer.size("u1")).isEqualTo(20);
        assertThat(episodes.count("u1")).isZero();
    }

    private MemoryOrchestrator orchestrator(Executor memoryExecutor) {
        RetryRegistry retryRegistry = RetryRegistry.ofDefaults();
        return new MemoryOrchestrator(
                buffer,
                new CompactionPipeline(buffer, summarizer, embedder, episodes, properties, retryRegistry),
                new ExtractionPipeline(extractor, factStore, new KeyNormalizer(), properties, retryRegistry),
                new RetrievalEngine(factStore, episodes, embedder, DIRECT, properties),
                new RetrievalPolicy(),
                new BundleFormatter(properties),
                replyGenerator,
                new BackgroundTaskRunner(memoryExecutor, publisher));
    }

    private static List<MemoryTaskEvent> events(TurnResult result) {
        return result.getBackgroundTasks().stream().map(CompletableFuture::join).toList();
    }
}
