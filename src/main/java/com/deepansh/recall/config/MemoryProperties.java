package com.deepansh.recall.config;

import com.deepansh.recall.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for every memory tier.
 * Bound from application.yml under the "memory" prefix.
 *
 * Validated once at startup: a bad threshold is a deployment error,
 * not something to discover on the first request.
 */
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private Buffer buffer = new Buffer();
    private Compaction compaction = new Compaction();
    private Extraction extraction = new Extraction();
    private Facts facts = new Facts();
    private Retrieval retrieval = new Retrieval();
    private Storage storage = new Storage();
    private Executor executor = new Executor();

    @Data
    public static class Buffer {
        /** Resident length at which compaction fires */
        private int triggerSize = 20;
        /** Most recent turns kept verbatim after a compaction split */
        private int retainSize = 10;
        private long idleTimeoutMinutes = 60;
        private long evictionIntervalMs = 60_000;
    }

    @Data
    public static class Compaction {
        private int maxAttempts = 3;
        private long backoffMs = 500;
        private int minTurns = 5;
        private int minSummaryLength = 10;
        private int maxCharsPerTurn = 100;
    }

    @Data
    public static class Extraction {
        private double minConfidence = 0.4;
        private double minImportance = 0.2;
        private boolean skipQuestions = true;
        private int minWords = 3;
        private int maxAttempts = 2;
        private long backoffMs = 200;
    }

    @Data
    public static class Facts {
        private int maxConflictRetries = 3;
    }

    @Data
    public static class Retrieval {
        private int topKEpisodes = 3;
        private double minFactImportance = 0.5;
        private double maxDistance = 0.4;
        private long timeoutMs = 300;
        private int previewLength = 150;
        private int charBudget = 1600;
    }

    @Data
    public static class Storage {
        /** mongo | in-memory */
        private String type = "mongo";
    }

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 5;
        private int queueCapacity = 100;
    }

    @PostConstruct
    public void validate() {
        requirePositive("memory.buffer.trigger-size", buffer.getTriggerSize());
        requirePositive("memory.buffer.retain-size", buffer.getRetainSize());
        if (buffer.getRetainSize() >= buffer.getTriggerSize()) {
            throw new ConfigurationException("memory.buffer.retain-size (" + buffer.getRetainSize()
                    + ") must be smaller than memory.buffer.trigger-size (" + buffer.getTriggerSize() + ")");
        }
        requirePositive("memory.buffer.idle-timeout-minutes", buffer.getIdleTimeoutMinutes());

        requirePositive("memory.compaction.max-attempts", compaction.getMaxAttempts());
        requirePositive("memory.compaction.min-turns", compaction.getMinTurns());
        requirePositive("memory.compaction.max-chars-per-turn", compaction.getMaxCharsPerTurn());
        if (compaction.getBackoffMs() < 0) {
            throw new ConfigurationException("memory.compaction.backoff-ms must not be negative");
        }

        requireUnit("memory.extraction.min-confidence", extraction.getMinConfidence());
        requireUnit("memory.extraction.min-importance", extraction.getMinImportance());
        requirePositive("memory.extraction.max-attempts", extraction.getMaxAttempts());
        if (extraction.getBackoffMs() < 0) {
            throw new ConfigurationException("memory.extraction.backoff-ms must not be negative");
        }

        requirePositive("memory.facts.max-conflict-retries", facts.getMaxConflictRetries());

        requirePositive("memory.retrieval.top-k-episodes", retrieval.getTopKEpisodes());
        requireUnit("memory.retrieval.min-fact-importance", retrieval.getMinFactImportance());
        // cosine distance spans [0, 2]
        if (retrieval.getMaxDistance() <= 0 || retrieval.getMaxDistance() > 2) {
            throw new ConfigurationException("memory.retrieval.max-distance must be in (0, 2], got "
                    + retrieval.getMaxDistance());
        }
        requirePositive("memory.retrieval.timeout-ms", retrieval.getTimeoutMs());
        requirePositive("memory.retrieval.preview-length", retrieval.getPreviewLength());
        requirePositive("memory.retrieval.char-budget", retrieval.getCharBudget());

        if (!"mongo".equals(storage.getType()) && !"in-memory".equals(storage.getType())) {
            throw new ConfigurationException("memory.storage.type must be 'mongo' or 'in-memory', got '"
                    + storage.getType() + "'");
        }

        requirePositive("memory.executor.core-pool-size", executor.getCorePoolSize());
        if (executor.getMaxPoolSize() < executor.getCorePoolSize()) {
            throw new ConfigurationException("memory.executor.max-pool-size must be >= core-pool-size");
        }
        requirePositive("memory.executor.queue-capacity", executor.getQueueCapacity());
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
    }

    private static void requireUnit(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be in [0, 1], got " + value);
        }
    }
}
