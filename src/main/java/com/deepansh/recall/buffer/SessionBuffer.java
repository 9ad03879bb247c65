package com.deepansh.recall.buffer;

import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.model.Turn;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Short-term tier: per-user window of verbatim turns.
 *
 * Lifecycle:
 * - A window is created on the user's first append.
 * - It is evicted by the idle sweep after memory.buffer.idle-timeout-minutes without
 *   activity (never while a compaction is in flight), and cleared on shutdown.
 *
 * Every operation on one user's window runs under that window's monitor, so append
 * and the compaction split are linearized per user. Different users never contend.
 *
 * The window is allowed to grow past the trigger size between the trigger firing and
 * the background compaction taking its slice. At most one compaction per user is in
 * flight; while it is, shouldCompact() reports false so further triggers coalesce.
 */
@Component
@Slf4j
public class SessionBuffer {

    private final Map<String, UserWindow> windows = new ConcurrentHashMap<>();
    private final int triggerSize;
    private final int retainSize;
    private final Duration idleTimeout;
    private final Clock clock;

    @Autowired
    public SessionBuffer(MemoryProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public SessionBuffer(MemoryProperties properties, Clock clock) {
        this.triggerSize = properties.getBuffer().getTriggerSize();
        this.retainSize = properties.getBuffer().getRetainSize();
        this.idleTimeout = Duration.ofMinutes(properties.getBuffer().getIdleTimeoutMinutes());
        this.clock = clock;
    }

    /**
     * Append a turn, assigning the next sequence number for the user.
     *
     * @return resident length after the append
     */
    public int append(String userId, Turn.Role role, String content) {
        if (role == null) throw new IllegalArgumentException("role must not be null");
        if (content == null) throw new IllegalArgumentException("content must not be null");

        while (true) {
            UserWindow window = windows.computeIfAbsent(userId, id -> new UserWindow(clock.instant()));
            synchronized (window) {
                if (window.evicted) {
                    continue; // lost a race with the idle sweep, pick up the fresh window
                }
                Turn turn = Turn.builder()
                        .role(role)
                        .content(content)
                        .sequenceNumber(window.nextSequence++)
                        .build();
                window.turns.add(turn);
                window.lastActivity = clock.instant();
                return window.turns.size();
            }
        }
    }

    public boolean shouldCompact(String userId) {
        UserWindow window = windows.get(userId);
        if (window == null) return false;
        synchronized (window) {
            return !window.compactionInFlight && window.turns.size() >= triggerSize;
        }
    }

    /**
     * Claim the user's single compaction slot if the trigger condition holds.
     * Returns false when the buffer is below the trigger or a compaction is already
     * in flight; the caller must then not dispatch.
     */
    public boolean tryBeginCompaction(String userId) {
        UserWindow window = windows.get(userId);
        if (window == null) return false;
        synchronized (window) {
            if (window.compactionInFlight || window.turns.size() < triggerSize) {
                return false;
            }
            window.compactionInFlight = true;
            return true;
        }
    }

    /**
     * Split the window into all-but-the-newest retain-size turns and the retained tail,
     * replacing the resident turns with the tail in the same critical section.
     * A turn appended concurrently lands either before the split (and in exactly one
     * of the two halves) or after it (in the new resident window).
     */
    public CompactionSlice takeCompactionSlice(String userId) {
        UserWindow window = windows.get(userId);
        if (window == null) return new CompactionSlice(List.of(), List.of());
        synchronized (window) {
            int size = window.turns.size();
            if (size <= retainSize) {
                return new CompactionSlice(List.of(), List.copyOf(window.turns));
            }
            int cut = size - retainSize;
            List<Turn> slice = List.copyOf(window.turns.subList(0, cut));
            List<Turn> retained = List.copyOf(window.turns.subList(cut, size));
            window.turns = new ArrayList<>(retained);
            log.debug("Split buffer for user={}: {} turns to compact, {} retained",
                    userId, slice.size(), retained.size());
            return new CompactionSlice(slice, retained);
        }
    }

    /**
     * Put a slice that could not be summarized back into the window, in sequence
     * order, so no turn is lost. Recreates the window if it was evicted meanwhile.
     */
    public void restoreSlice(String userId, List<Turn> slice) {
        if (slice.isEmpty()) return;
        UserWindow window = windows.computeIfAbsent(userId, id -> {
            UserWindow fresh = new UserWindow(clock.instant());
            fresh.nextSequence = slice.get(slice.size() - 1).getSequenceNumber() + 1;
            return fresh;
        });
        synchronized (window) {
            List<Turn> merged = new ArrayList<>(slice.size() + window.turns.size());
            merged.addAll(slice);
            merged.addAll(window.turns);
            merged.sort(Comparator.comparingLong(Turn::getSequenceNumber));
            window.turns = merged;
            log.warn("Restored {} turns to buffer for user={} (now {} resident)",
                    slice.size(), userId, merged.size());
        }
    }

    /** Release the user's compaction slot */
    public void endCompaction(String userId) {
        UserWindow window = windows.get(userId);
        if (window == null) return;
        synchronized (window) {
            window.compactionInFlight = false;
        }
    }

    public boolean isCompactionInFlight(String userId) {
        UserWindow window = windows.get(userId);
        if (window == null) return false;
        synchronized (window) {
            return window.compactionInFlight;
        }
    }

    /** Resident turns, oldest first */
    public List<Turn> snapshot(String userId) {
        UserWindow window = windows.get(userId);
        if (window == null) return List.of();
        synchronized (window) {
            return List.copyOf(window.turns);
        }
    }

    /** Sequence number of the oldest resident turn, or the next one to be assigned when empty */
    public long baseSequence(String userId) {
        UserWindow window = windows.get(userId);
        if (window == null) return 1;
        synchronized (window) {
            return window.turns.isEmpty() ? window.nextSequence : window.turns.get(0).getSequenceNumber();
        }
    }

    public int size(String userId) {
        UserWindow window = windows.get(userId);
        if (window == null) return 0;
        synchronized (window) {
            return window.turns.size();
        }
    }

    public int activeUsers() {
        return windows.size();
    }

    @Scheduled(fixedDelayString = "${memory.buffer.eviction-interval-ms:60000}")
    public void evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        AtomicInteger evicted = new AtomicInteger();
        for (String userId : windows.keySet()) {
            windows.computeIfPresent(userId, (id, window) -> {
                synchronized (window) {
                    if (window.compactionInFlight || window.lastActivity.isAfter(cutoff)) {
                        return window;
                    }
                    window.evicted = true;
                    evicted.incrementAndGet();
                    log.info("Evicted idle buffer for user={} ({} resident turns)", id, window.turns.size());
                    return null;
                }
            });
        }
        if (evicted.get() > 0) {
            log.debug("Idle sweep evicted {} buffers, {} remain", evicted.get(), windows.size());
        }
    }

    @PreDestroy
    public void clear() {
        log.info("Clearing {} session buffers", windows.size());
        windows.clear();
    }

    private static final class UserWindow {
        private List<Turn> turns = new ArrayList<>();
        private long nextSequence = 1;
        private boolean compactionInFlight;
        private boolean evicted;
        private Instant lastActivity;

        private UserWindow(Instant createdAt) {
            this.lastActivity = createdAt;
        }
    }
}
