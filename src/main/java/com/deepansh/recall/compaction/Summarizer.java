package com.deepansh.recall.compaction;

import com.deepansh.recall.model.Turn;

import java.util.List;

/**
 * External summarizer. Must not invent facts that are not in the turns;
 * any failure is treated as retryable by the compaction pipeline.
 */
public interface Summarizer {

    String summarize(List<Turn> turns);
}
