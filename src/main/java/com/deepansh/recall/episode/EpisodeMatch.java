package com.deepansh.recall.episode;

/**
 * An episode returned by similarity search, with its cosine distance to the query
 * (0 = same direction, 1 = orthogonal, 2 = opposite).
 */
public record EpisodeMatch(Episode episode, double distance) {}
