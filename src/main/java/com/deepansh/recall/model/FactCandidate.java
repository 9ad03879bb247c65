package com.deepansh.recall.model;

/**
 * A proposed fact, as produced by the extractor or an operator, before
 * conflict resolution against the stored version.
 */
public record FactCandidate(
        FactCategory category,
        String key,
        String value,
        double confidence,
        double importance
) {}
