package com.deepansh.recall.orchestrator;

import com.deepansh.recall.model.Turn;

import java.util.List;

/**
 * Produces the assistant reply from the formatted memory context and the
 * resident short-term turns (oldest first, the current user turn last).
 * Must not throw: on failure an implementation returns a fallback reply.
 */
public interface ReplyGenerator {

    String generate(String memoryContext, List<Turn> recentTurns);
}
