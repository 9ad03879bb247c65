package com.deepansh.recall.buffer;

import com.deepansh.recall.MutableClock;
import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;

class SessionBufferTest {

    MutableClock clock;
    SessionBuffer buffer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
        buffer = new SessionBuffer(new MemoryProperties(), clock);
    }

    @Test
    void append_assignsSequenceNumbersFromOne() {
        assertThat(buffer.append("u1", Turn.Role.user, "hello there")).isEqualTo(1);
        assertThat(buffer.append("u1", Turn.Role.assistant, "hi!")).isEqualTo(2);

        assertThat(buffer.snapshot("u1"))
                .extracting(Turn::getSequenceNumber)
                .containsExactly(1L, 2L);
        assertThat(buffer.baseSequence("u1")).isEqualTo(1);
    }

    @Test
    void append_usersAreIndependent() {
        buffer.append("u1", Turn.Role.user, "a");
        buffer.append("u2", Turn.Role.user, "b");

        assertThat(buffer.snapshot("u2")).extracting(Turn::getSequenceNumber).containsExactly(1L);
        assertThat(buffer.activeUsers()).isEqualTo(2);
    }

    @Test
    void twentyOneTurns_triggerFiresOnce_sliceIsFirstElevenTurns() {
        int triggers = 0;
        for (int i = 1; i <= 21; i++) {
            buffer.append("u1", i % 2 == 1 ? Turn.Role.user : Turn.Role.assistant, "turn " + i);
            if (buffer.shouldCompact("u1")) {
                triggers++;
                assertThat(buffer.tryBeginCompaction("u1")).isTrue();
            }
        }
        assertThat(triggers).isEqualTo(1);

        CompactionSlice split = buffer.takeCompactionSlice("u1");

        assertThat(split.slice()).extracting(Turn::getSequenceNumber)
                .containsExactlyElementsOf(range(1, 11));
        assertThat(split.retained()).extracting(Turn::getSequenceNumber)
                .containsExactlyElementsOf(range(12, 21));
        assertThat(buffer.snapshot("u1")).extracting(Turn::getSequenceNumber)
                .containsExactlyElementsOf(range(12, 21));
        assertThat(buffer.baseSequence("u1")).isEqualTo(12);
    }

    @Test
    void tryBeginCompaction_belowTrigger_returnsFalse() {
        for (int i = 0; i < 19; i++) buffer.append("u1", Turn.Role.user, "x");

        assertThat(buffer.shouldCompact("u1")).isFalse();
        assertThat(buffer.tryBeginCompaction("u1")).isFalse();
    }

    @Test
    void tryBeginCompaction_secondClaimWhileInFlight_isCoalesced() {
        for (int i = 0; i < 25; i++) buffer.append("u1", Turn.Role.user, "x");

        assertThat(buffer.tryBeginCompaction("u1")).isTrue();
        assertThat(buffer.tryBeginCompaction("u1")).isFalse();
        assertThat(buffer.shouldCompact("u1")).isFalse();

        buffer.endCompaction("u1");
        assertThat(buffer.shouldCompact("u1")).isTrue();
    }

    @Test
    void takeCompactionSlice_atOrBelowRetainSize_returnsEmptySlice() {
        for (int i = 0; i < 10; i++) buffer.append("u1", Turn.Role.user, "x");

        CompactionSlice split = buffer.takeCompactionSlice("u1");

        assertThat(split.isEmpty()).isTrue();
        assertThat(buffer.size("u1")).isEqualTo(10);
    }

    @Test
    void restoreSlice_mergesBackInSequenceOrder() {
        for (int i = 0; i < 20; i++) buffer.append("u1", Turn.Role.user, "x");
        CompactionSlice split = buffer.takeCompactionSlice("u1");
        buffer.append("u1", Turn.Role.user, "arrived during compaction");

        buffer.restoreSlice("u1", split.slice());

        assertThat(buffer.snapshot("u1")).extracting(Turn::getSequenceNumber)
                .containsExactlyElementsOf(range(1, 21));
    }

    @Test
    void restoreSlice_afterEviction_recreatesWindow() {
        for (int i = 0; i < 20; i++) buffer.append("u1", Turn.Role.user, "x");
        assertThat(buffer.tryBeginCompaction("u1")).isTrue();
        CompactionSlice split = buffer.takeCompactionSlice("u1");
        buffer.endCompaction("u1");
        clock.advance(Duration.ofMinutes(61));
        buffer.evictIdle();

        buffer.restoreSlice("u1", split.slice());
        buffer.append("u1", Turn.Role.user, "next");

        assertThat(buffer.snapshot("u1")).extracting(Turn::getSequenceNumber)
                .containsExactlyElementsOf(range(1, 11));
    }

    @Test
    void concurrentAppendsAndSlices_noTurnLostOrDuplicated() throws Exception {
        int writers = 4;
        int perWriter = 250;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        List<Turn> compacted = Collections.synchronizedList(new ArrayList<>());

        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    buffer.append("u1", Turn.Role.user, "m");
                }
                return null;
            }));
        }
        Future<?> compactor = pool.submit(() -> {
            start.await();
            while (writing.get()) {
                if (buffer.tryBeginCompaction("u1")) {
                    compacted.addAll(buffer.takeCompactionSlice("u1").slice());
                    buffer.endCompaction("u1");
                }
            }
            return null;
        });

        start.countDown();
        for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        writing.set(false);
        compactor.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        List<Long> all = new ArrayList<>();
        compacted.forEach(t -> all.add(t.getSequenceNumber()));
        buffer.snapshot("u1").forEach(t -> all.add(t.getSequenceNumber()));

        Set<Long> unique = new HashSet<>(all);
        assertThat(all).hasSize(writers * perWriter);
        assertThat(unique).containsExactlyInAnyOrderElementsOf(range(1, writers * perWriter));
    }

    @Test
    void evictIdle_removesOnlyIdleWindows() {
        buffer.append("idle", Turn.Role.user, "x");
        clock.advance(Duration.ofMinutes(30));
        buffer.append("active", Turn.Role.user, "y");
        clock.advance(Duration.ofMinutes(31));

        buffer.evictIdle();

        assertThat(buffer.size("idle")).isZero();
        assertThat(buffer.size("active")).isEqualTo(1);
        assertThat(buffer.activeUsers()).isEqualTo(1);
    }

    @Test
    void evictIdle_neverEvictsWhileCompactionInFlight() {
        for (int i = 0; i < 20; i++) buffer.append("u1", Turn.Role.user, "x");
        assertThat(buffer.tryBeginCompaction("u1")).isTrue();
        clock.advance(Duration.ofHours(3));

        buffer.evictIdle();

        assertThat(buffer.size("u1")).isEqualTo(20);
    }

    @Test
    void evictIdle_thenAppend_startsFreshWindow() {
        buffer.append("u1", Turn.Role.user, "x");
        clock.advance(Duration.ofMinutes(61));
        buffer.evictIdle();

        buffer.append("u1", Turn.Role.user, "back again");

        assertThat(buffer.snapshot("u1")).extracting(Turn::getSequenceNumber).containsExactly(1L);
    }

    @Test
    void clear_dropsEverything() {
        buffer.append("u1", Turn.Role.user, "x");
        buffer.clear();
        assertThat(buffer.activeUsers()).isZero();
    }

    private static List<Long> range(long from, long toInclusive) {
        return LongStream.rangeClosed(from, toInclusive).boxed().toList();
    }
}
