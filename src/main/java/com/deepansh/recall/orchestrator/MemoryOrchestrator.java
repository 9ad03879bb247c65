package com.deepansh.recall.orchestrator;

import com.deepansh.recall.buffer.SessionBuffer;
import com.deepansh.recall.compaction.CompactionPipeline;
import com.deepansh.recall.exception.ValidationException;
import com.deepansh.recall.extraction.ExtractionPipeline;
import com.deepansh.recall.model.Turn;
import com.deepansh.recall.observability.MemoryTaskEvent;
import com.deepansh.recall.observability.TaskStatus;
import com.deepansh.recall.observability.TaskType;
import com.deepansh.recall.retrieval.BundleFormatter;
import com.deepansh.recall.retrieval.ContextBundle;
import com.deepansh.recall.retrieval.RetrievalEngine;
import com.deepansh.recall.retrieval.RetrievalPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Per-turn control flow:
 *
 *   append user turn → [compaction, async] → retrieve (sync, deadline) → reply
 *   → append assistant turn → [compaction, async] → [extraction, async]
 *
 * Only the append, retrieval and reply sit on the request path. Memory failures
 * degrade the context the reply is built from; they never fail the reply itself.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MemoryOrchestrator {

    private final SessionBuffer sessionBuffer;
    private final CompactionPipeline compactionPipeline;
    private final ExtractionPipeline extractionPipeline;
    private final RetrievalEngine retrievalEngine;
    private final RetrievalPolicy retrievalPolicy;
    private final BundleFormatter bundleFormatter;
    private final ReplyGenerator replyGenerator;
    private final BackgroundTaskRunner taskRunner;

    public TurnResult onMessage(String userId, String text) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId must not be blank");
        }
        if (text == null || text.isBlank()) {
            throw new ValidationException("message must not be blank");
        }

        long start = System.currentTimeMillis();
        List<CompletableFuture<MemoryTaskEvent>> tasks = new ArrayList<>();

        // 1. Append and maybe compact
        sessionBuffer.append(userId, Turn.Role.user, text);
        maybeCompact(userId, tasks);

        // 2. Retrieve on the critical path
        ContextBundle bundle = retrieve(userId, text);
        String memoryContext = bundleFormatter.format(bundle);

        // 3. Reply from memory context + resident turns
        String reply = replyGenerator.generate(memoryContext, sessionBuffer.snapshot(userId));

        sessionBuffer.append(userId, Turn.Role.assistant, reply);
        maybeCompact(userId, tasks);

        // 4. Extraction, off the critical path
        tasks.add(taskRunner.submit(TaskType.EXTRACTION, userId,
                () -> extractionPipeline.process(userId, text)));

        log.info("Turn handled for user={} [facts={}, episodes={}, semantic={}, buffer={}, latency={}ms]",
                userId, bundle.profile().size(), bundle.recentContext().size(), bundle.semanticStatus(),
                sessionBuffer.size(userId), System.currentTimeMillis() - start);

        return TurnResult.builder()
                .reply(reply)
                .bundle(bundle)
                .memoryContext(memoryContext)
                .backgroundTasks(List.copyOf(tasks))
                .build();
    }

    private ContextBundle retrieve(String userId, String text) {
        if (!retrievalPolicy.shouldRetrieve(text)) {
            log.debug("Retrieval skipped for user={} (small talk)", userId);
            return ContextBundle.disabled();
        }
        try {
            return retrievalEngine.retrieve(userId, text);
        } catch (RuntimeException e) {
            log.error("Retrieval failed for user={}, replying without memory: {}", userId, e.getMessage());
            return ContextBundle.disabled();
        }
    }

    private void maybeCompact(String userId, List<CompletableFuture<MemoryTaskEvent>> tasks) {
        if (!sessionBuffer.tryBeginCompaction(userId)) {
            return;
        }
        log.debug("Compaction triggered for user={} ({} resident turns)", userId, sessionBuffer.size(userId));

        CompletableFuture<MemoryTaskEvent> future = taskRunner.submit(TaskType.COMPACTION, userId,
                () -> compactionPipeline.compact(userId));
        // a rejected task never ran, so the pipeline never released the slot
        tasks.add(future.whenComplete((event, error) -> {
            if (event != null && event.status() == TaskStatus.REJECTED) {
                sessionBuffer.endCompaction(userId);
            }
        }));
    }
}
