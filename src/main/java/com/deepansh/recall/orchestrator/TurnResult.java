package com.deepansh.recall.orchestrator;

import com.deepansh.recall.observability.MemoryTaskEvent;
import com.deepansh.recall.retrieval.ContextBundle;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of one inbound message. The reply is final; the background tasks may
 * still be running when this is returned.
 */
@Value
@Builder
public class TurnResult {

    String reply;

    /** Retrieval result for this turn, {@link ContextBundle#disabled()} when retrieval did not run */
    ContextBundle bundle;

    /** The text block the reply was generated with */
    String memoryContext;

    List<CompletableFuture<MemoryTaskEvent>> backgroundTasks;
}
