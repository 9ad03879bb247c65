package com.deepansh.recall.api;

import com.deepansh.recall.buffer.SessionBuffer;
import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.episode.Episode;
import com.deepansh.recall.episode.EpisodicStore;
import com.deepansh.recall.fact.Fact;
import com.deepansh.recall.fact.FactStore;
import com.deepansh.recall.model.FactCategory;
import com.deepansh.recall.model.RetrieveRequest;
import com.deepansh.recall.model.Turn;
import com.deepansh.recall.retrieval.ContextBundle;
import com.deepansh.recall.retrieval.RetrievalEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final FactStore factStore;
    private final EpisodicStore episodicStore;
    private final SessionBuffer sessionBuffer;
    private final RetrievalEngine retrievalEngine;
    private final MemoryProperties properties;

    // ─── Structured facts ────────────────────────────────────────────────────

    @GetMapping("/{userId}/facts")
    public ResponseEntity<List<Fact>> getFacts(
            @PathVariable String userId,
            @RequestParam(defaultValue = "0.0") double minImportance) {
        return ResponseEntity.ok(factStore.listActive(userId, minImportance));
    }

    /** Soft delete: the fact is deactivated, its row stays as audit trail */
    @DeleteMapping("/{userId}/facts/{category}/{key}")
    public ResponseEntity<Map<String, Object>> deactivateFact(
            @PathVariable String userId,
            @PathVariable String category,
            @PathVariable String key) {
        boolean deactivated = factStore.deactivate(userId, FactCategory.parse(category), key);
        if (!deactivated) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("message", "Deactivated", "category", category, "key", key));
    }

    // ─── Episodes ────────────────────────────────────────────────────────────

    @GetMapping("/{userId}/episodes")
    public ResponseEntity<Map<String, Object>> getEpisodes(
            @PathVariable String userId,
            @RequestParam(defaultValue = "10") int limit) {
        List<Episode> recent = episodicStore.findRecent(userId, Math.max(1, limit));
        return ResponseEntity.ok(Map.of(
                "count", episodicStore.count(userId),
                "episodes", recent));
    }

    // ─── Session buffer ──────────────────────────────────────────────────────

    @GetMapping("/{userId}/buffer")
    public ResponseEntity<Map<String, Object>> getBuffer(@PathVariable String userId) {
        List<Turn> turns = sessionBuffer.snapshot(userId);
        return ResponseEntity.ok(Map.of(
                "baseSequence", sessionBuffer.baseSequence(userId),
                "size", turns.size(),
                "compactionInFlight", sessionBuffer.isCompactionInFlight(userId),
                "turns", turns));
    }

    // ─── Retrieval ───────────────────────────────────────────────────────────

    @PostMapping("/{userId}/retrieve")
    public ResponseEntity<ContextBundle> retrieve(
            @PathVariable String userId,
            @Valid @RequestBody RetrieveRequest request) {
        MemoryProperties.Retrieval defaults = properties.getRetrieval();
        ContextBundle bundle = retrievalEngine.retrieve(userId, request.getQuery(),
                request.getTopKEpisodes() != null ? request.getTopKEpisodes() : defaults.getTopKEpisodes(),
                request.getMinFactImportance() != null ? request.getMinFactImportance() : defaults.getMinFactImportance(),
                request.getMaxDistance() != null ? request.getMaxDistance() : defaults.getMaxDistance());
        return ResponseEntity.ok(bundle);
    }
}
