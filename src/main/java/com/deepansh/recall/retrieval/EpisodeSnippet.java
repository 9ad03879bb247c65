package com.deepansh.recall.retrieval;

/**
 * An episode as it appears in a bundle: its turn range and a truncated summary.
 */
public record EpisodeSnippet(String turnRange, long turnStart, long turnEnd, String preview, double distance) {}
