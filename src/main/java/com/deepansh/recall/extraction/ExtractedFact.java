package com.deepansh.recall.extraction;

/**
 * Raw extractor output. Category is still free text here and confidence/importance
 * may be missing; the pipeline validates and normalizes.
 */
public record ExtractedFact(
        String category,
        String key,
        String value,
        Double confidence,
        Double importance
) {}
